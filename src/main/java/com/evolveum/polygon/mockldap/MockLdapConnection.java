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
package com.evolveum.polygon.mockldap;

import static com.evolveum.polygon.mockldap.MockLdapConstants.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.message.SearchScope;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.ConfigurationException;
import org.identityconnectors.framework.common.exceptions.ConnectorException;

import com.evolveum.polygon.mockldap.operation.DirectoryOperations;
import com.evolveum.polygon.mockldap.operation.ErrorKind;
import com.evolveum.polygon.mockldap.operation.LdapResponse;
import com.evolveum.polygon.mockldap.operation.Modification;
import com.evolveum.polygon.mockldap.operation.Outcome;
import com.evolveum.polygon.mockldap.operation.ResponseType;
import com.evolveum.polygon.mockldap.password.PasswordVerifier;
import com.evolveum.polygon.mockldap.recording.CallRecorder;
import com.evolveum.polygon.mockldap.recording.RecordedCall;
import com.evolveum.polygon.mockldap.recording.SeedRegistry;
import com.evolveum.polygon.mockldap.recording.SeedRequiredException;
import com.evolveum.polygon.mockldap.search.AsyncResultQueue;
import com.evolveum.polygon.mockldap.search.ResultEntry;
import com.evolveum.polygon.mockldap.search.SearchProcessor;
import com.evolveum.polygon.mockldap.search.SearchResultMessage;
import com.evolveum.polygon.mockldap.store.DirectoryStore;

/**
 * In-memory stand-in for a directory server connection.
 * <p>
 * The directory is a deep copy of the seed passed to the constructor. Every operation is recorded
 * in the {@link CallRecorder} before it executes, so tests can check what the code under test invoked.
 * Failures are thrown as the Apache Directory API exceptions a real connection would throw.
 * <p>
 * Search responses can be seeded in the {@link SeedRegistry} under {@link MockLdapConstants#OPERATION_SEARCH}
 * with the arguments {@code (base, scope, filter, attributes, attrsOnly)}, where attributes is a list or null.
 * The same seed serves {@link #search} and {@link #searchImmediate}. A seeded value is returned as is,
 * a seeded exception is thrown. Seeds are mandatory for filters the emulator does not evaluate.
 * <p>
 * Not thread-safe. One connection is meant to be driven by one test.
 */
public class MockLdapConnection {

    private static final Log LOG = Log.getLog(MockLdapConnection.class);

    private final MockLdapConfiguration configuration;
    private final DirectoryStore store;
    private final DirectoryOperations operations;
    private final SearchProcessor searchProcessor;
    private final AsyncResultQueue asyncResults = new AsyncResultQueue();
    private final CallRecorder recorder = new CallRecorder();
    private final SeedRegistry seedRegistry = new SeedRegistry();
    private final ErrorHandler errorHandler = new ErrorHandler();

    private final Map<String, Object> options = new HashMap<>();
    private boolean tlsEnabled = false;
    private String boundAs = null;

    public MockLdapConnection(Map<String, ? extends Map<String, ?>> directory) {
        this(directory, new MockLdapConfiguration());
    }

    public MockLdapConnection(Map<String, ? extends Map<String, ?>> directory, MockLdapConfiguration configuration) {
        configuration.validate();
        this.configuration = configuration;
        this.store = DirectoryStore.copyOf(directory);
        PasswordVerifier passwordVerifier = new PasswordVerifier(configuration.isCryptSchemeEnabled());
        this.operations = new DirectoryOperations(store, configuration.getPasswordAttribute(), passwordVerifier);
        this.searchProcessor = new SearchProcessor(store, configuration.getPasswordAttribute(), passwordVerifier,
                configuration.getDefaultSearchFilter());
    }

    /**
     * Only recorded, there is nothing to initialize.
     */
    public void initialize(Object... arguments) {
        recorder.record(OPERATION_INITIALIZE, arguments);
    }

    public Object getOption(String option) {
        recorder.record(OPERATION_GET_OPTION, option);
        if (!options.containsKey(option)) {
            throw new ConfigurationException("Option " + option + " was not set");
        }
        return options.get(option);
    }

    public void setOption(String option, Object value) {
        recorder.record(OPERATION_SET_OPTION, option, value);
        options.put(option, value);
    }

    public LdapResponse simpleBind(String identity, String credential) throws LdapException {
        RecordedCall call = record(OPERATION_SIMPLE_BIND, identity, credential);
        OperationLog.logOperationReq("bind {0}", identity);
        String who = errorHandler.processOutcome(call, operations.bind(identity, credential));
        boundAs = who;
        OperationLog.logOperationRes("bind {0} success", who);
        return new LdapResponse(ResponseType.BIND);
    }

    /**
     * Only recorded. Does not change the bound identity.
     */
    public void saslExternalBind() {
        recorder.record(OPERATION_SASL_EXTERNAL_BIND);
    }

    /**
     * Issues a search and returns the ticket (message id) to fetch its results with {@link #result(int)}.
     * The search itself runs right away, failures are thrown from here.
     */
    public int search(String base, SearchScope scope, String filter, String[] attributes, boolean attrsOnly)
            throws LdapException {
        List<ResultEntry> results = executeSearch(OPERATION_SEARCH, base, scope, filter, attributes, attrsOnly);
        int msgId = asyncResults.add(results);
        LOG.ok("Search results held under ticket {0}", msgId);
        return msgId;
    }

    public int search(String base, SearchScope scope, String filter) throws LdapException {
        return search(base, scope, filter, null, false);
    }

    public SearchResultMessage result(int msgId) {
        recorder.record(OPERATION_RESULT, msgId);
        return new SearchResultMessage(msgId, asyncResults.take(msgId));
    }

    /**
     * Timeout is accepted for compatibility and ignored, results are always available immediately.
     */
    public SearchResultMessage result(int msgId, long timeoutMillis) {
        recorder.record(OPERATION_RESULT, msgId, timeoutMillis);
        return new SearchResultMessage(msgId, asyncResults.take(msgId));
    }

    public List<ResultEntry> searchImmediate(String base, SearchScope scope, String filter, String[] attributes,
            boolean attrsOnly) throws LdapException {
        return executeSearch(OPERATION_SEARCH_IMMEDIATE, base, scope, filter, attributes, attrsOnly);
    }

    public List<ResultEntry> searchImmediate(String base, SearchScope scope, String filter) throws LdapException {
        return searchImmediate(base, scope, filter, null, false);
    }

    private List<ResultEntry> executeSearch(String operation, String base, SearchScope scope, String filter,
            String[] attributes, boolean attrsOnly) throws LdapException {
        List<String> attributeList = attributes == null ? null : Arrays.asList(attributes);
        RecordedCall call = record(operation, base, scope, filter, attributeList, attrsOnly);
        OperationLog.logOperationReq("search {0} {1} {2}", base, scope, filter);

        Object[] seedKey = { base, scope, filter, attributeList, attrsOnly };
        if (seedRegistry.isSeeded(OPERATION_SEARCH, seedKey)) {
            List<ResultEntry> seeded = seededSearchResponse(seedRegistry.getSeededResponse(OPERATION_SEARCH, seedKey));
            OperationLog.logOperationRes("search {0} seeded: {1} entries", base, seeded.size());
            return seeded;
        }

        Outcome<List<ResultEntry>> outcome = searchProcessor.search(base, scope, filter, attributeList, attrsOnly);
        if (outcome.isFailure() && outcome.getErrorKind() == ErrorKind.UNSUPPORTED_FILTER) {
            throw new SeedRequiredException(outcome.getMessage(),
                    RecordedCall.of(OPERATION_SEARCH, seedKey));
        }
        List<ResultEntry> results = errorHandler.processOutcome(call, outcome);
        OperationLog.logOperationRes("search {0} success: {1} entries", base, results.size());
        return results;
    }

    @SuppressWarnings("unchecked")
    private List<ResultEntry> seededSearchResponse(Object seeded) throws LdapException {
        if (seeded instanceof LdapException) {
            throw (LdapException) seeded;
        }
        if (seeded instanceof RuntimeException) {
            throw (RuntimeException) seeded;
        }
        if (seeded == null) {
            return Collections.emptyList();
        }
        if (!(seeded instanceof List)) {
            throw new ConnectorException("Seeded search response is not a list of entries: " + seeded.getClass());
        }
        return (List<ResultEntry>) seeded;
    }

    public void startTls() {
        recorder.record(OPERATION_START_TLS);
        tlsEnabled = true;
    }

    public boolean compare(String dn, String attrName, String value) throws LdapException {
        RecordedCall call = record(OPERATION_COMPARE, dn, attrName, value);
        OperationLog.logOperationReq("compare {0} {1}", dn, attrName);
        boolean result = errorHandler.processOutcome(call, operations.compare(dn, attrName, value));
        OperationLog.logOperationRes("compare {0} {1}: {2}", dn, attrName, result);
        return result;
    }

    public LdapResponse modify(String dn, List<Modification> modifications) throws LdapException {
        RecordedCall call = record(OPERATION_MODIFY, dn, modifications);
        OperationLog.logOperationReq("modify {0} {1}", dn, modifications);
        Outcome<LdapResponse> outcome = operations.modify(dn, modifications)
                .map(modified -> new LdapResponse(ResponseType.MODIFY));
        LdapResponse response = errorHandler.processOutcome(call, outcome);
        OperationLog.logOperationRes("modify {0} success", dn);
        return response;
    }

    public LdapResponse modify(String dn, Modification... modifications) throws LdapException {
        return modify(dn, Arrays.asList(modifications));
    }

    /**
     * The response carries a message id: the number of operations recorded on this connection so far.
     */
    public LdapResponse add(String dn, Map<String, ?> attributes) throws LdapException {
        RecordedCall call = record(OPERATION_ADD, dn, attributes);
        OperationLog.logOperationReq("add {0}", dn);
        Outcome<LdapResponse> outcome = operations.add(dn, attributes)
                .map(added -> new LdapResponse(ResponseType.ADD, recorder.size()));
        LdapResponse response = errorHandler.processOutcome(call, outcome);
        OperationLog.logOperationRes("add {0} success", dn);
        return response;
    }

    public LdapResponse rename(String dn, String newRdn) throws LdapException {
        return rename(dn, newRdn, null);
    }

    public LdapResponse rename(String dn, String newRdn, String newSuperior) throws LdapException {
        RecordedCall call = record(OPERATION_RENAME, dn, newRdn, newSuperior);
        OperationLog.logOperationReq("rename {0} to {1} under {2}", dn, newRdn, newSuperior);
        Outcome<LdapResponse> outcome = operations.rename(dn, newRdn, newSuperior)
                .map(newDn -> new LdapResponse(ResponseType.RENAME));
        LdapResponse response = errorHandler.processOutcome(call, outcome);
        OperationLog.logOperationRes("rename {0} success", dn);
        return response;
    }

    public LdapResponse delete(String dn) throws LdapException {
        RecordedCall call = record(OPERATION_DELETE, dn);
        OperationLog.logOperationReq("delete {0}", dn);
        Outcome<LdapResponse> outcome = operations.delete(dn)
                .map(deleted -> new LdapResponse(ResponseType.DELETE));
        LdapResponse response = errorHandler.processOutcome(call, outcome);
        OperationLog.logOperationRes("delete {0} success", dn);
        return response;
    }

    public void unbind() {
        recorder.record(OPERATION_UNBIND);
        boundAs = null;
    }

    /**
     * Authorization identity in the {@code dn:} form, empty string if the connection is not bound.
     */
    public String whoAmI() {
        recorder.record(OPERATION_WHO_AM_I);
        if (boundAs == null) {
            return "";
        }
        return "dn:" + boundAs;
    }

    /**
     * Password modify extended operation. Returns true if the stored password was replaced.
     * An old password that does not match leaves the entry alone, it is not an error.
     */
    public boolean changePassword(String dn, String oldPassword, String newPassword) throws LdapException {
        RecordedCall call = record(OPERATION_CHANGE_PASSWORD, dn, oldPassword, newPassword);
        OperationLog.logOperationReq("changePassword {0}", dn);
        boolean changed = errorHandler.processOutcome(call, operations.changePassword(dn, oldPassword, newPassword));
        OperationLog.logOperationRes("changePassword {0}: {1}", dn, changed ? "changed" : "unchanged");
        return changed;
    }

    private RecordedCall record(String operation, Object... arguments) {
        recorder.record(operation, arguments);
        return RecordedCall.of(operation, arguments);
    }

    public MockLdapConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Bound identity of the last successful bind, null if unbound. Anonymous bind is the empty string.
     */
    public String getBoundAs() {
        return boundAs;
    }

    public boolean isTlsEnabled() {
        return tlsEnabled;
    }

    /**
     * Deep copy of the current directory content.
     */
    public Map<String, Map<String, List<byte[]>>> getDirectory() {
        return store.toMap();
    }

    public CallRecorder getRecorder() {
        return recorder;
    }

    public SeedRegistry getSeedRegistry() {
        return seedRegistry;
    }
}
