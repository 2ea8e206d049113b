/*
 * Copyright (c) 2015-2026 Evolveum
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

import org.apache.directory.api.ldap.model.exception.LdapAuthenticationException;
import org.apache.directory.api.ldap.model.exception.LdapEntryAlreadyExistsException;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapInvalidDnException;
import org.apache.directory.api.ldap.model.exception.LdapInvalidSearchFilterException;
import org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException;
import org.apache.directory.api.ldap.model.exception.LdapProtocolErrorException;
import org.apache.directory.api.ldap.model.message.ResultCodeEnum;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;

import com.evolveum.polygon.mockldap.operation.ErrorKind;
import com.evolveum.polygon.mockldap.operation.Outcome;
import com.evolveum.polygon.mockldap.recording.RecordedCall;
import com.evolveum.polygon.mockldap.recording.SeedRequiredException;

/**
 * Turns failed outcomes into the exceptions a real client connection would throw.
 * <p>
 * Protocol results become the Apache Directory API checked exceptions. Bad arguments
 * become ConnId runtime exceptions, the same as a programming error in the caller would.
 */
public class ErrorHandler {

    public <T> T processOutcome(RecordedCall call, Outcome<T> outcome) throws LdapException {
        if (outcome.isSuccess()) {
            return outcome.getValue();
        }
        // Diagnostic messages may come from arbitrary (binary) data, keep the log readable
        String message = LdapUtil.sanitizeString(outcome.getMessage());
        if (outcome.getErrorKind() == ErrorKind.INVALID_CREDENTIALS) {
            // The diagnostic carries the attempted credential, it goes to the exception only
            OperationLog.logOperationErr("{0} error: {1}", call.getOperation(), outcome.getErrorKind());
        } else {
            OperationLog.logOperationErr("{0} error: {1}: {2}", call.getOperation(), outcome.getErrorKind(), message);
        }
        throw processFailure(call, outcome.getErrorKind() + ": " + message, outcome);
    }

    private LdapException processFailure(RecordedCall call, String message, Outcome<?> outcome) {
        switch (outcome.getErrorKind()) {
            case INVALID_DN_SYNTAX:
                return new LdapInvalidDnException(ResultCodeEnum.INVALID_DN_SYNTAX, message);
            case NO_SUCH_OBJECT:
                return new LdapNoSuchObjectException(message);
            case ALREADY_EXISTS:
                return new LdapEntryAlreadyExistsException(message);
            case PROTOCOL_ERROR:
                return new LdapProtocolErrorException(message);
            case INVALID_CREDENTIALS:
                return new LdapAuthenticationException(message);
            case FILTER_ERROR:
                return new LdapInvalidSearchFilterException(message);
            case UNSUPPORTED_FILTER:
                throw new SeedRequiredException(message, call);
            case INVALID_VALUE_TYPE:
            case INVALID_ARGUMENT:
                throw new InvalidAttributeValueException(message);
            default:
                throw new IllegalStateException("Unhandled error kind " + outcome.getErrorKind() + ": " + message);
        }
    }

}
