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

import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.directory.api.ldap.model.filter.ExprNode;
import org.apache.directory.api.ldap.model.message.SearchScope;
import org.identityconnectors.common.logging.Log;

import com.evolveum.polygon.mockldap.LdapUtil;
import com.evolveum.polygon.mockldap.dn.DistinguishedName;
import com.evolveum.polygon.mockldap.filter.EntryMatcher;
import com.evolveum.polygon.mockldap.filter.UnsupportedFilterException;
import com.evolveum.polygon.mockldap.operation.ErrorKind;
import com.evolveum.polygon.mockldap.operation.Outcome;
import com.evolveum.polygon.mockldap.password.PasswordVerifier;
import com.evolveum.polygon.mockldap.store.DirectoryEntry;
import com.evolveum.polygon.mockldap.store.DirectoryStore;

/**
 * Evaluates one search request against the store.
 * <p>
 * The base entry has to exist, this is checked before the filter is even parsed.
 * Entries in scope are matched against the filter tree, then projected to the requested
 * attributes and, for attrs-only searches, stripped of their values.
 * Result order follows the store iteration order and carries no meaning.
 */
public class SearchProcessor {

    private static final Log LOG = Log.getLog(SearchProcessor.class);

    private final DirectoryStore store;
    private final String passwordAttribute;
    private final PasswordVerifier passwordVerifier;
    private final String defaultFilter;

    public SearchProcessor(DirectoryStore store, String passwordAttribute, PasswordVerifier passwordVerifier,
            String defaultFilter) {
        this.store = store;
        this.passwordAttribute = passwordAttribute;
        this.passwordVerifier = passwordVerifier;
        this.defaultFilter = defaultFilter;
    }

    public Outcome<List<ResultEntry>> search(String base, SearchScope scope, String filter,
            Collection<String> attributes, boolean attrsOnly) {
        Outcome<DistinguishedName> baseOutcome = LdapUtil.parseDn(base);
        if (baseOutcome.isFailure()) {
            return baseOutcome.propagate();
        }
        DistinguishedName baseDn = baseOutcome.getValue();
        if (!store.contains(baseDn)) {
            return Outcome.failure(ErrorKind.NO_SUCH_OBJECT, "No such object: " + baseDn);
        }
        if (scope == null) {
            return Outcome.failure(ErrorKind.INVALID_ARGUMENT, "No search scope");
        }

        String filterString = filter == null ? defaultFilter : filter;
        ExprNode filterNode;
        try {
            filterNode = LdapUtil.parseSearchFilter(filterString);
        } catch (UnsupportedFilterException e) {
            return Outcome.failure(ErrorKind.UNSUPPORTED_FILTER, e.getMessage());
        } catch (ParseException e) {
            return Outcome.failure(ErrorKind.FILTER_ERROR, e.getMessage());
        }

        List<ResultEntry> results = new ArrayList<>();
        for (DistinguishedName dn : store.keys()) {
            if (!isInScope(dn, baseDn, scope)) {
                continue;
            }
            DirectoryEntry entry = store.get(dn);
            if (!new EntryMatcher(entry, passwordAttribute, passwordVerifier).matches(filterNode)) {
                continue;
            }
            results.add(new ResultEntry(dn.getName(), project(entry, attributes, attrsOnly)));
        }
        LOG.ok("Search {0} {1} {2}: {3} entries", baseDn, scope, filterNode, results.size());
        return Outcome.success(results);
    }

    static boolean isInScope(DistinguishedName dn, DistinguishedName baseDn, SearchScope scope) {
        switch (scope) {
            case OBJECT:
                return dn.equalsIgnoreCase(baseDn);
            case ONELEVEL:
                return dn.isChildOf(baseDn);
            case SUBTREE:
                return dn.isDescendantOrSelfOf(baseDn);
            default:
                throw new IllegalArgumentException("Unknown search scope " + scope);
        }
    }

    private Map<String, List<byte[]>> project(DirectoryEntry entry, Collection<String> attributes, boolean attrsOnly) {
        Map<String, List<byte[]>> projected = new LinkedHashMap<>();
        for (Map.Entry<String, List<byte[]>> attribute : entry.toAttributeMap().entrySet()) {
            if (attributes != null && !containsIgnoreCase(attributes, attribute.getKey())) {
                continue;
            }
            if (attrsOnly) {
                projected.put(attribute.getKey(), Collections.emptyList());
            } else {
                projected.put(attribute.getKey(), attribute.getValue());
            }
        }
        return projected;
    }

    private static boolean containsIgnoreCase(Collection<String> names, String name) {
        for (String candidate : names) {
            if (name.equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }
}
