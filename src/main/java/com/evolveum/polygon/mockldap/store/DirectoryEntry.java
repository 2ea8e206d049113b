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
package com.evolveum.polygon.mockldap.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.evolveum.polygon.mockldap.LdapUtil;

/**
 * Attribute data stored at one DN.
 * <p>
 * Attribute names are matched case-insensitively, the spelling used when the attribute
 * was first created is kept. Values are ordered byte arrays, compared by content.
 * An attribute never exists with an empty value list.
 */
public class DirectoryEntry {

    private final Map<String, EntryAttribute> attributes = new LinkedHashMap<>();

    public boolean hasAttribute(String attrName) {
        return attributes.containsKey(key(attrName));
    }

    /**
     * Returns a read-only view of the values, empty list if the attribute is absent.
     */
    public List<byte[]> getValues(String attrName) {
        EntryAttribute attribute = attributes.get(key(attrName));
        if (attribute == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(attribute.values);
    }

    public List<String> getStringValues(String attrName) {
        return LdapUtil.decodeAll(getValues(attrName));
    }

    public Collection<String> getAttributeNames() {
        List<String> names = new ArrayList<>(attributes.size());
        for (EntryAttribute attribute : attributes.values()) {
            names.add(attribute.name);
        }
        return names;
    }

    public boolean containsValue(String attrName, byte[] value) {
        return LdapUtil.containsValue(getValues(attrName), value);
    }

    /**
     * Set-union: creates the attribute if needed, appends only values not present yet.
     */
    public void addValues(String attrName, List<byte[]> values) {
        if (values.isEmpty()) {
            return;
        }
        EntryAttribute attribute = attributes.get(key(attrName));
        if (attribute == null) {
            attribute = new EntryAttribute(attrName);
            attributes.put(key(attrName), attribute);
        }
        for (byte[] value : values) {
            if (!LdapUtil.containsValue(attribute.values, value)) {
                attribute.values.add(value.clone());
            }
        }
    }

    /**
     * Removes the listed values. The attribute disappears when its last value is gone.
     */
    public void removeValues(String attrName, List<byte[]> values) {
        EntryAttribute attribute = attributes.get(key(attrName));
        if (attribute == null) {
            return;
        }
        attribute.values.removeIf(existing -> LdapUtil.containsValue(values, existing));
        if (attribute.values.isEmpty()) {
            attributes.remove(key(attrName));
        }
    }

    /**
     * Overwrites the values, keeping the first occurrence of repeated ones.
     * Empty list removes the attribute.
     */
    public void replaceValues(String attrName, List<byte[]> values) {
        if (values.isEmpty()) {
            removeAttribute(attrName);
            return;
        }
        EntryAttribute attribute = attributes.get(key(attrName));
        if (attribute == null) {
            attribute = new EntryAttribute(attrName);
            attributes.put(key(attrName), attribute);
        }
        attribute.values.clear();
        for (byte[] value : values) {
            if (!LdapUtil.containsValue(attribute.values, value)) {
                attribute.values.add(value.clone());
            }
        }
    }

    public void removeAttribute(String attrName) {
        attributes.remove(key(attrName));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    /**
     * Deep copy as a plain map, in attribute creation order.
     */
    public Map<String, List<byte[]>> toAttributeMap() {
        Map<String, List<byte[]>> map = new LinkedHashMap<>();
        for (EntryAttribute attribute : attributes.values()) {
            map.put(attribute.name, LdapUtil.copyValues(attribute.values));
        }
        return map;
    }

    private static String key(String attrName) {
        return attrName.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DirectoryEntry)) {
            return false;
        }
        Map<String, EntryAttribute> other = ((DirectoryEntry) o).attributes;
        if (!attributes.keySet().equals(other.keySet())) {
            return false;
        }
        for (Map.Entry<String, EntryAttribute> mapEntry : attributes.entrySet()) {
            List<byte[]> ours = mapEntry.getValue().values;
            List<byte[]> theirs = other.get(mapEntry.getKey()).values;
            if (ours.size() != theirs.size()) {
                return false;
            }
            for (int i = 0; i < ours.size(); i++) {
                if (!Arrays.equals(ours.get(i), theirs.get(i))) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return attributes.keySet().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DirectoryEntry(");
        boolean isFirst = true;
        for (EntryAttribute attribute : attributes.values()) {
            if (isFirst) {
                isFirst = false;
            } else {
                sb.append(", ");
            }
            sb.append(attribute.name).append('=').append(LdapUtil.toShortString(attribute.values));
        }
        return sb.append(')').toString();
    }

    private static class EntryAttribute {
        private final String name;
        private final List<byte[]> values = new ArrayList<>();

        EntryAttribute(String name) {
            this.name = name;
        }
    }
}
