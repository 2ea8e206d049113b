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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.ConfigurationException;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;

import com.evolveum.polygon.mockldap.LdapUtil;
import com.evolveum.polygon.mockldap.dn.DistinguishedName;
import com.evolveum.polygon.mockldap.operation.Outcome;

/**
 * The emulated directory tree: normalized DN to entry.
 * <p>
 * Keys are {@link DistinguishedName#getNormName()}, so DN uniqueness is case-insensitive.
 * The store never replaces an entry implicitly, callers check {@link #contains(DistinguishedName)} first.
 * Iteration order is insertion order, but nothing should rely on it.
 */
public class DirectoryStore {

    private static final Log LOG = Log.getLog(DirectoryStore.class);

    private final Map<String, StoredEntry> entries = new LinkedHashMap<>();

    /**
     * Builds a store from caller-owned seed data ({@code dn -> attribute -> values}).
     * Everything is deep-copied, the seed is never aliased.
     */
    public static DirectoryStore copyOf(Map<String, ? extends Map<String, ?>> seed) {
        DirectoryStore store = new DirectoryStore();
        if (seed == null) {
            return store;
        }
        for (Map.Entry<String, ? extends Map<String, ?>> seedEntry : seed.entrySet()) {
            Outcome<DistinguishedName> dnOutcome = LdapUtil.parseDn(seedEntry.getKey());
            if (dnOutcome.isFailure()) {
                throw new ConfigurationException("Invalid seed directory: " + dnOutcome.getMessage());
            }
            DistinguishedName dn = dnOutcome.getValue();
            if (store.contains(dn)) {
                throw new ConfigurationException("Invalid seed directory: duplicate DN '" + dn + "'");
            }
            DirectoryEntry entry = new DirectoryEntry();
            if (seedEntry.getValue() != null) {
                for (Map.Entry<String, ?> seedAttribute : seedEntry.getValue().entrySet()) {
                    Outcome<List<byte[]>> values = LdapUtil.checkByteValues(seedAttribute.getKey(),
                            LdapUtil.normalizeValues(seedAttribute.getValue()));
                    if (values.isFailure()) {
                        throw new InvalidAttributeValueException("Invalid seed entry " + dn + ": " + values.getMessage());
                    }
                    entry.addValues(seedAttribute.getKey(), values.getValue());
                }
            }
            store.put(dn, entry);
        }
        LOG.ok("Seeded directory with {0} entries", store.size());
        return store;
    }

    public boolean contains(DistinguishedName dn) {
        return entries.containsKey(dn.getNormName());
    }

    /**
     * Live entry, null if absent. Mutations of the returned entry change the store.
     */
    public DirectoryEntry get(DistinguishedName dn) {
        StoredEntry stored = entries.get(dn.getNormName());
        return stored == null ? null : stored.entry;
    }

    public void put(DistinguishedName dn, DirectoryEntry entry) {
        entries.put(dn.getNormName(), new StoredEntry(dn, entry));
    }

    public DirectoryEntry remove(DistinguishedName dn) {
        StoredEntry removed = entries.remove(dn.getNormName());
        return removed == null ? null : removed.entry;
    }

    /**
     * Snapshot of the stored DNs, safe to iterate while the store changes.
     */
    public List<DistinguishedName> keys() {
        List<DistinguishedName> keys = new ArrayList<>(entries.size());
        for (StoredEntry stored : entries.values()) {
            keys.add(stored.dn);
        }
        return keys;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Deep copy of the whole tree keyed by DN in the spelling it was stored with.
     */
    public Map<String, Map<String, List<byte[]>>> toMap() {
        Map<String, Map<String, List<byte[]>>> map = new LinkedHashMap<>();
        for (StoredEntry stored : entries.values()) {
            map.put(stored.dn.getName(), stored.entry.toAttributeMap());
        }
        return map;
    }

    private static class StoredEntry {
        private final DistinguishedName dn;
        private final DirectoryEntry entry;

        StoredEntry(DistinguishedName dn, DirectoryEntry entry) {
            this.dn = dn;
            this.entry = entry;
        }
    }
}
