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
package com.evolveum.polygon.mockldap.search;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.evolveum.polygon.mockldap.LdapUtil;

/**
 * One {@code (dn, attributes)} pair of a search result.
 * The attribute map is a private copy, already projected. With attrs-only searches every value list is empty.
 */
public final class ResultEntry {

    private final String dn;
    private final Map<String, List<byte[]>> attributes;

    public ResultEntry(String dn, Map<String, List<byte[]>> attributes) {
        this.dn = dn;
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public String getDn() {
        return dn;
    }

    public Map<String, List<byte[]>> getAttributes() {
        return attributes;
    }

    public boolean hasAttribute(String attrName) {
        return findKey(attrName) != null;
    }

    /**
     * Values of the attribute (name matched case-insensitively), empty list if absent.
     */
    public List<byte[]> getValues(String attrName) {
        String key = findKey(attrName);
        if (key == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(attributes.get(key));
    }

    public List<String> getStringValues(String attrName) {
        return LdapUtil.decodeAll(getValues(attrName));
    }

    private String findKey(String attrName) {
        for (String key : attributes.keySet()) {
            if (key.equalsIgnoreCase(attrName)) {
                return key;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ResultEntry(").append(dn);
        for (Map.Entry<String, List<byte[]>> attribute : attributes.entrySet()) {
            sb.append(", ").append(attribute.getKey()).append('=').append(LdapUtil.toShortString(attribute.getValue()));
        }
        return sb.append(')').toString();
    }
}
