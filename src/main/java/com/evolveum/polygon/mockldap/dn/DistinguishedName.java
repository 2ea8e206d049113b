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
package com.evolveum.polygon.mockldap.dn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.directory.api.ldap.model.exception.LdapInvalidDnException;
import org.apache.directory.api.ldap.model.message.ResultCodeEnum;
import org.apache.directory.api.ldap.model.name.Ava;
import org.apache.directory.api.ldap.model.name.Dn;
import org.apache.directory.api.ldap.model.name.Rdn;

import com.evolveum.polygon.mockldap.LdapUtil;

/**
 * Parsed distinguished name.
 * <p>
 * Parsing is delegated to the (non-schema-aware) Apache Directory API {@link Dn} parser.
 * Components are kept leftmost first and compared by their lower-cased type and value,
 * which is all the structure the emulator needs for equality and scope decisions.
 * There is no schema here, so "case-insensitive" is the only matching rule we apply.
 */
public final class DistinguishedName {

    private final String name;
    private final List<String> normRdns;
    private final String rdnType;
    private final String rdnValue;

    private DistinguishedName(String name, List<String> normRdns, String rdnType, String rdnValue) {
        this.name = name;
        this.normRdns = normRdns;
        this.rdnType = rdnType;
        this.rdnValue = rdnValue;
    }

    public static DistinguishedName parse(String stringDn) throws LdapInvalidDnException {
        if (stringDn == null) {
            throw new LdapInvalidDnException(ResultCodeEnum.INVALID_DN_SYNTAX, "DN must not be null");
        }
        Dn dn = new Dn(stringDn);
        List<Rdn> rdns = dn.getRdns();
        List<String> normRdns = new ArrayList<>(rdns.size());
        for (Rdn rdn : rdns) {
            normRdns.add(normalizeRdn(rdn));
        }
        String rdnType = null;
        String rdnValue = null;
        if (!rdns.isEmpty()) {
            Ava firstAva = rdns.get(0).getAva();
            rdnType = firstAva.getType().trim();
            rdnValue = firstAva.getValue().getString();
        }
        return new DistinguishedName(stringDn, Collections.unmodifiableList(normRdns), rdnType, rdnValue);
    }

    private static String normalizeRdn(Rdn rdn) {
        StringBuilder sb = new StringBuilder();
        for (Ava ava : rdn) {
            if (sb.length() > 0) {
                sb.append('+');
            }
            sb.append(ava.getType().trim().toLowerCase(Locale.ROOT));
            sb.append('=');
            sb.append(LdapUtil.escapeDnValue(ava.getValue().getString()).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * DN string exactly as the caller supplied it.
     */
    public String getName() {
        return name;
    }

    /**
     * Lower-cased canonical form, used as the store key.
     */
    public String getNormName() {
        return String.join(",", normRdns);
    }

    public int size() {
        return normRdns.size();
    }

    public boolean isRoot() {
        return normRdns.isEmpty();
    }

    /**
     * Attribute type of the leading RDN, as supplied. Null for the root DN.
     */
    public String getRdnType() {
        return rdnType;
    }

    /**
     * Unescaped value of the leading RDN. Null for the root DN.
     */
    public String getRdnValue() {
        return rdnValue;
    }

    /**
     * Everything after the leading RDN, in the caller's spelling.
     * The parent of a single-RDN name is the root (empty string).
     */
    public String getParentName() {
        if (isRoot()) {
            return null;
        }
        int comma = indexOfUnescapedComma(name);
        if (comma < 0) {
            return "";
        }
        return name.substring(comma + 1).trim();
    }

    private static int indexOfUnescapedComma(String s) {
        boolean escaped = false;
        boolean quoted = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                quoted = !quoted;
            } else if ((c == ',' || c == ';') && !quoted) {
                return i;
            }
        }
        return -1;
    }

    public boolean equalsIgnoreCase(DistinguishedName other) {
        return other != null && normRdns.equals(other.normRdns);
    }

    /**
     * Subtree scope: this DN is the base itself or lies anywhere below it.
     */
    public boolean isDescendantOrSelfOf(DistinguishedName base) {
        int baseSize = base.normRdns.size();
        if (normRdns.size() < baseSize) {
            return false;
        }
        return normRdns.subList(normRdns.size() - baseSize, normRdns.size()).equals(base.normRdns);
    }

    /**
     * One-level scope: this DN minus its leading RDN equals the base.
     */
    public boolean isChildOf(DistinguishedName base) {
        if (normRdns.size() != base.normRdns.size() + 1) {
            return false;
        }
        return normRdns.subList(1, normRdns.size()).equals(base.normRdns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DistinguishedName)) {
            return false;
        }
        return normRdns.equals(((DistinguishedName) o).normRdns);
    }

    @Override
    public int hashCode() {
        return normRdns.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
