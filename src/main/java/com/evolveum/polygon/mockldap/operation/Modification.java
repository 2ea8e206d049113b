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
package com.evolveum.polygon.mockldap.operation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.directory.api.ldap.model.entry.ModificationOperation;

import com.evolveum.polygon.mockldap.LdapUtil;

/**
 * One {@code (operation, attribute, values)} item of a modify request.
 * <p>
 * The value argument is normalized the way the client API accepts it: null means no values,
 * a single value is wrapped in a list and a collection or array is copied.
 * Items are type-checked only when the modification is applied, so a list holding something
 * else than byte arrays can be constructed and fails at modify time.
 */
public final class Modification {

    private final ModificationOperation operation;
    private final String attribute;
    private final List<Object> values;

    public Modification(ModificationOperation operation, String attribute, Object value) {
        this.operation = operation;
        this.attribute = attribute;
        this.values = Collections.unmodifiableList(LdapUtil.normalizeValues(value));
    }

    public static Modification add(String attribute, byte[]... values) {
        return new Modification(ModificationOperation.ADD_ATTRIBUTE, attribute, Arrays.asList((Object[]) values));
    }

    public static Modification delete(String attribute, byte[]... values) {
        return new Modification(ModificationOperation.REMOVE_ATTRIBUTE, attribute, Arrays.asList((Object[]) values));
    }

    public static Modification replace(String attribute, byte[]... values) {
        return new Modification(ModificationOperation.REPLACE_ATTRIBUTE, attribute, Arrays.asList((Object[]) values));
    }

    public ModificationOperation getOperation() {
        return operation;
    }

    public String getAttribute() {
        return attribute;
    }

    public List<Object> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "Modification(" + operation + " " + attribute + ": " + values.size() + " values)";
    }
}
