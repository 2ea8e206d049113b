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
package com.evolveum.polygon.mockldap.filter;

import org.apache.directory.api.ldap.model.filter.AndNode;
import org.apache.directory.api.ldap.model.filter.EqualityNode;
import org.apache.directory.api.ldap.model.filter.ExprNode;
import org.apache.directory.api.ldap.model.filter.NotNode;
import org.apache.directory.api.ldap.model.filter.OrNode;
import org.apache.directory.api.ldap.model.filter.PresenceNode;

import com.evolveum.polygon.mockldap.LdapUtil;
import com.evolveum.polygon.mockldap.password.PasswordVerifier;
import com.evolveum.polygon.mockldap.store.DirectoryEntry;

/**
 * Evaluates a parsed filter tree against one entry.
 * <p>
 * Equality is a literal, case-sensitive comparison of the UTF-8 decoded values,
 * except for the credential attribute where every stored value goes through the
 * {@link PasswordVerifier}. A missing attribute simply does not match.
 * Only trees accepted by {@link LdapUtil#parseSearchFilter(String)} can be evaluated.
 */
public class EntryMatcher {

    private final DirectoryEntry entry;
    private final String passwordAttribute;
    private final PasswordVerifier passwordVerifier;

    public EntryMatcher(DirectoryEntry entry, String passwordAttribute, PasswordVerifier passwordVerifier) {
        this.entry = entry;
        this.passwordAttribute = passwordAttribute;
        this.passwordVerifier = passwordVerifier;
    }

    public boolean matches(ExprNode filterNode) {
        if (filterNode instanceof EqualityNode<?>) {
            EqualityNode<?> equalityNode = (EqualityNode<?>) filterNode;
            return matchesEquality(equalityNode.getAttribute(), LdapUtil.decode(equalityNode.getValue().getBytes()));
        } else if (filterNode instanceof PresenceNode) {
            return entry.hasAttribute(((PresenceNode) filterNode).getAttribute());
        } else if (filterNode instanceof AndNode) {
            for (ExprNode subfilter : ((AndNode) filterNode).getChildren()) {
                if (!matches(subfilter)) {
                    return false;
                }
            }
            return true;
        } else if (filterNode instanceof OrNode) {
            for (ExprNode subfilter : ((OrNode) filterNode).getChildren()) {
                if (matches(subfilter)) {
                    return true;
                }
            }
            return false;
        } else if (filterNode instanceof NotNode) {
            return !matches(((NotNode) filterNode).getFirstChild());
        } else {
            throw new IllegalArgumentException("Cannot evaluate filter node " + filterNode);
        }
    }

    private boolean matchesEquality(String attrName, String assertionValue) {
        if (attrName.equalsIgnoreCase(passwordAttribute)) {
            for (String storedValue : entry.getStringValues(attrName)) {
                if (passwordVerifier.verify(assertionValue, storedValue)) {
                    return true;
                }
            }
            return false;
        }
        return entry.getStringValues(attrName).contains(assertionValue);
    }
}
