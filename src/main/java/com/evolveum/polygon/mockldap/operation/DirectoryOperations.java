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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.identityconnectors.common.logging.Log;

import com.evolveum.polygon.mockldap.LdapUtil;
import com.evolveum.polygon.mockldap.dn.DistinguishedName;
import com.evolveum.polygon.mockldap.password.PasswordVerifier;
import com.evolveum.polygon.mockldap.store.DirectoryEntry;
import com.evolveum.polygon.mockldap.store.DirectoryStore;

/**
 * Update, compare and authentication semantics on top of the {@link DirectoryStore}.
 * <p>
 * Every method returns an {@link Outcome}. Nothing here throws for protocol-level failures.
 * Modifications are applied one by one, a failing modification does not roll back the ones
 * that were already applied.
 */
public class DirectoryOperations {

    private static final Log LOG = Log.getLog(DirectoryOperations.class);

    private final DirectoryStore store;
    private final String passwordAttribute;
    private final PasswordVerifier passwordVerifier;

    public DirectoryOperations(DirectoryStore store, String passwordAttribute, PasswordVerifier passwordVerifier) {
        this.store = store;
        this.passwordAttribute = passwordAttribute;
        this.passwordVerifier = passwordVerifier;
    }

    public Outcome<DistinguishedName> add(String stringDn, Map<String, ?> attributes) {
        Outcome<DistinguishedName> dnOutcome = LdapUtil.parseDn(stringDn);
        if (dnOutcome.isFailure()) {
            return dnOutcome;
        }
        DistinguishedName dn = dnOutcome.getValue();
        if (attributes == null) {
            return Outcome.failure(ErrorKind.INVALID_ARGUMENT, "No attributes for new entry " + dn);
        }
        // Existence is checked on the normalized DN, the same key the entry is stored under.
        if (store.contains(dn)) {
            return Outcome.failure(ErrorKind.ALREADY_EXISTS, "Entry " + dn + " already exists");
        }
        DirectoryEntry entry = new DirectoryEntry();
        for (Map.Entry<String, ?> attribute : attributes.entrySet()) {
            Outcome<List<byte[]>> values = LdapUtil.checkByteValues(attribute.getKey(),
                    LdapUtil.normalizeValues(attribute.getValue()));
            if (values.isFailure()) {
                return values.propagate();
            }
            // Names differing only in case land in the same attribute.
            entry.addValues(attribute.getKey(), values.getValue());
        }
        store.put(dn, entry);
        LOG.ok("Added {0}: {1}", dn, entry);
        return Outcome.success(dn);
    }

    public Outcome<DistinguishedName> delete(String stringDn) {
        Outcome<DistinguishedName> dnOutcome = LdapUtil.parseDn(stringDn);
        if (dnOutcome.isFailure()) {
            return dnOutcome;
        }
        DistinguishedName dn = dnOutcome.getValue();
        if (store.remove(dn) == null) {
            return noSuchObject(dn);
        }
        LOG.ok("Deleted {0}", dn);
        return Outcome.success(dn);
    }

    public Outcome<DistinguishedName> modify(String stringDn, List<Modification> modifications) {
        Outcome<DistinguishedName> dnOutcome = LdapUtil.parseDn(stringDn);
        if (dnOutcome.isFailure()) {
            return dnOutcome;
        }
        DistinguishedName dn = dnOutcome.getValue();
        DirectoryEntry entry = store.get(dn);
        if (entry == null) {
            return noSuchObject(dn);
        }
        if (modifications == null) {
            return Outcome.failure(ErrorKind.INVALID_ARGUMENT, "No modifications for " + dn);
        }
        for (Modification modification : modifications) {
            Outcome<Void> applied = apply(entry, modification);
            if (applied.isFailure()) {
                LOG.ok("Modification {0} of {1} failed, earlier modifications stay applied", modification, dn);
                return applied.propagate();
            }
        }
        LOG.ok("Modified {0}: {1}", dn, entry);
        return Outcome.success(dn);
    }

    private Outcome<Void> apply(DirectoryEntry entry, Modification modification) {
        if (modification == null || modification.getOperation() == null || modification.getAttribute() == null) {
            return Outcome.failure(ErrorKind.INVALID_ARGUMENT, "Incomplete modification " + modification);
        }
        String attrName = modification.getAttribute();
        List<Object> values = modification.getValues();
        Outcome<List<byte[]>> byteValues;
        switch (modification.getOperation()) {
            case ADD_ATTRIBUTE:
                if (values.isEmpty()) {
                    return Outcome.failure(ErrorKind.PROTOCOL_ERROR, "Cannot add empty value list to attribute " + attrName);
                }
                byteValues = LdapUtil.checkByteValues(attrName, values);
                if (byteValues.isFailure()) {
                    return byteValues.propagate();
                }
                entry.addValues(attrName, byteValues.getValue());
                return Outcome.success(null);

            case REMOVE_ATTRIBUTE:
                if (!entry.hasAttribute(attrName)) {
                    return Outcome.success(null);
                }
                if (values.isEmpty()) {
                    entry.removeAttribute(attrName);
                    return Outcome.success(null);
                }
                byteValues = LdapUtil.checkByteValues(attrName, values);
                if (byteValues.isFailure()) {
                    return byteValues.propagate();
                }
                entry.removeValues(attrName, byteValues.getValue());
                return Outcome.success(null);

            case REPLACE_ATTRIBUTE:
                if (values.isEmpty()) {
                    entry.removeAttribute(attrName);
                    return Outcome.success(null);
                }
                byteValues = LdapUtil.checkByteValues(attrName, values);
                if (byteValues.isFailure()) {
                    return byteValues.propagate();
                }
                entry.replaceValues(attrName, byteValues.getValue());
                return Outcome.success(null);

            default:
                return Outcome.failure(ErrorKind.INVALID_ARGUMENT, "Unsupported modification operation "
                        + modification.getOperation());
        }
    }

    /**
     * Modify DN. The new DN is the new RDN on top of the new superior, or of the old parent if no superior is given.
     * The old RDN value is taken out of the entry and the new one is put in.
     */
    public Outcome<DistinguishedName> rename(String stringDn, String newRdn, String newSuperior) {
        Outcome<DistinguishedName> dnOutcome = LdapUtil.parseDn(stringDn);
        if (dnOutcome.isFailure()) {
            return dnOutcome;
        }
        Outcome<DistinguishedName> rdnOutcome = LdapUtil.parseDn(newRdn);
        if (rdnOutcome.isFailure()) {
            return rdnOutcome;
        }
        DistinguishedName dn = dnOutcome.getValue();
        DistinguishedName rdn = rdnOutcome.getValue();
        if (dn.isRoot()) {
            return Outcome.failure(ErrorKind.INVALID_ARGUMENT, "Root DSE cannot be renamed");
        }
        if (rdn.size() != 1) {
            return Outcome.failure(ErrorKind.INVALID_DN_SYNTAX, "New RDN '" + newRdn + "' must have exactly one component");
        }
        String superior;
        if (newSuperior != null && !newSuperior.isEmpty()) {
            Outcome<DistinguishedName> superiorOutcome = LdapUtil.parseDn(newSuperior);
            if (superiorOutcome.isFailure()) {
                return superiorOutcome;
            }
            superior = newSuperior;
        } else {
            superior = dn.getParentName();
        }

        DirectoryEntry entry = store.get(dn);
        if (entry == null) {
            return noSuchObject(dn);
        }

        String newStringDn = superior == null || superior.isEmpty() ? newRdn : newRdn + "," + superior;
        Outcome<DistinguishedName> newDnOutcome = LdapUtil.parseDn(newStringDn);
        if (newDnOutcome.isFailure()) {
            return newDnOutcome;
        }
        DistinguishedName newDn = newDnOutcome.getValue();
        if (store.contains(newDn)) {
            return Outcome.failure(ErrorKind.ALREADY_EXISTS, "Entry " + newDn + " already exists");
        }

        String oldAttr = dn.getRdnType();
        String oldValue = dn.getRdnValue();
        String newAttr = rdn.getRdnType();
        String newValue = rdn.getRdnValue();

        if (oldAttr.equalsIgnoreCase(newAttr) || entry.getValues(oldAttr).size() > 1) {
            entry.removeValues(oldAttr, findValuesIgnoreCase(entry, oldAttr, oldValue));
        } else {
            entry.removeAttribute(oldAttr);
        }
        entry.addValues(newAttr, Collections.singletonList(LdapUtil.encode(newValue)));

        store.remove(dn);
        store.put(newDn, entry);
        LOG.ok("Renamed {0} to {1}: {2}", dn, newDn, entry);
        return Outcome.success(newDn);
    }

    private List<byte[]> findValuesIgnoreCase(DirectoryEntry entry, String attrName, String value) {
        List<byte[]> found = new ArrayList<>();
        for (byte[] stored : entry.getValues(attrName)) {
            if (value.equalsIgnoreCase(LdapUtil.decode(stored))) {
                found.add(stored);
            }
        }
        return found;
    }

    public Outcome<Boolean> compare(String stringDn, String attrName, String value) {
        Outcome<DistinguishedName> dnOutcome = LdapUtil.parseDn(stringDn);
        if (dnOutcome.isFailure()) {
            return dnOutcome.propagate();
        }
        DistinguishedName dn = dnOutcome.getValue();
        DirectoryEntry entry = store.get(dn);
        if (entry == null) {
            return noSuchObject(dn).propagate();
        }
        if (attrName == null) {
            return Outcome.failure(ErrorKind.INVALID_ARGUMENT, "No attribute to compare in " + dn);
        }
        List<String> storedValues = entry.getStringValues(attrName);
        if (attrName.equalsIgnoreCase(passwordAttribute)) {
            for (String storedValue : storedValues) {
                if (passwordVerifier.verify(value, storedValue)) {
                    return Outcome.success(true);
                }
            }
            return Outcome.success(false);
        }
        return Outcome.success(storedValues.contains(value));
    }

    /**
     * Simple bind. Returns the identity the session is bound as.
     * Empty identity with empty credential is an anonymous bind and always succeeds.
     * A missing entry is reported as invalid credentials, not as a missing object.
     */
    public Outcome<String> bind(String identity, String credential) {
        String who = identity == null ? "" : identity;
        String cred = credential == null ? "" : credential;
        if (who.isEmpty() && cred.isEmpty()) {
            return Outcome.success(who);
        }
        Outcome<Boolean> compared = compare(who, passwordAttribute, cred);
        if (compared.isFailure() && compared.getErrorKind() != ErrorKind.NO_SUCH_OBJECT) {
            return compared.propagate();
        }
        if (compared.isSuccess() && compared.getValue()) {
            return Outcome.success(who);
        }
        return Outcome.failure(ErrorKind.INVALID_CREDENTIALS, who + ":" + cred);
    }

    /**
     * Password modify. The old password, if given, is compared literally with the first stored credential
     * value, hashed values are not verified through their scheme here.
     * Returns whether the credential was replaced.
     */
    public Outcome<Boolean> changePassword(String stringDn, String oldPassword, String newPassword) {
        Outcome<DistinguishedName> dnOutcome = LdapUtil.parseDn(stringDn);
        if (dnOutcome.isFailure()) {
            return dnOutcome.propagate();
        }
        DistinguishedName dn = dnOutcome.getValue();
        DirectoryEntry entry = store.get(dn);
        if (entry == null) {
            return noSuchObject(dn).propagate();
        }
        if (newPassword == null) {
            return Outcome.failure(ErrorKind.INVALID_ARGUMENT, "No new password for " + dn);
        }
        if (oldPassword != null) {
            List<String> stored = entry.getStringValues(passwordAttribute);
            if (stored.isEmpty() || !stored.get(0).equals(oldPassword)) {
                LOG.ok("Old password does not match for {0}, password not changed", dn);
                return Outcome.success(false);
            }
        }
        entry.replaceValues(passwordAttribute, Collections.singletonList(LdapUtil.encode(newPassword)));
        LOG.ok("Password of {0} replaced", dn);
        return Outcome.success(true);
    }

    private static Outcome<DistinguishedName> noSuchObject(DistinguishedName dn) {
        return Outcome.failure(ErrorKind.NO_SUCH_OBJECT, "No such object: " + dn);
    }
}
