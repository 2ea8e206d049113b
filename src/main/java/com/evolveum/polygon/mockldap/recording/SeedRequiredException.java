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

import org.identityconnectors.framework.common.exceptions.ConnectorException;

/**
 * The emulator cannot answer the request by itself (typically an unsupported filter form)
 * and no response was seeded for it.
 */
public class SeedRequiredException extends ConnectorException {

    private static final long serialVersionUID = 1L;

    private final RecordedCall call;

    public SeedRequiredException(String message, RecordedCall call) {
        super(message + " (seed a response for " + call + ")");
        this.call = call;
    }

    public RecordedCall getCall() {
        return call;
    }
}
