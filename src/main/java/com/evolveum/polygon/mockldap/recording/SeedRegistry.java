/*
 * Copyright (c) 2026 Evolveum
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.evolveum.polygon.mockldap.recording;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.identityconnectors.common.logging.Log;

import com.evolveum.polygon.mockldap.MockLdapConstants;

/**
 * Canned responses registered by the test, keyed by operation name and exact arguments.
 * <p>
 * A seeded response is either the value the operation returns or an exception the operation throws.
 * Only searches consult the registry, both {@code search} and {@code searchImmediate} look up seeds
 * registered under {@value MockLdapConstants#OPERATION_SEARCH}.
 */
public class SeedRegistry {

    private static final Log LOG = Log.getLog(SeedRegistry.class);

    private final Map<RecordedCall, Object> seeds = new HashMap<>();

    /**
     * Registers a response for the exact search arguments
     * {@code (base, scope, filter, attributes, attrsOnly)}.
     *
     * @throws IllegalArgumentException for any operation other than {@value MockLdapConstants#OPERATION_SEARCH}
     */
    public void seed(String operation, List<?> arguments, Object response) {
        if (!MockLdapConstants.OPERATION_SEARCH.equals(operation)) {
            throw new IllegalArgumentException("Only " + MockLdapConstants.OPERATION_SEARCH
                    + " responses can be seeded, got " + operation);
        }
        RecordedCall key = new RecordedCall(operation, arguments);
        LOG.ok("Seeding {0} -> {1}", key, response);
        seeds.put(key, response);
    }

    public boolean isSeeded(String operation, Object... arguments) {
        return seeds.containsKey(new RecordedCall(operation, Arrays.asList(arguments)));
    }

    public Object getSeededResponse(String operation, Object... arguments) {
        return seeds.get(new RecordedCall(operation, Arrays.asList(arguments)));
    }

    public void clear() {
        seeds.clear();
    }
}
