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

import org.apache.directory.api.ldap.model.message.ResultCodeEnum;

/**
 * Closed set of failure kinds an emulated operation can end with.
 * Kinds that correspond to a protocol result carry its result code,
 * the argument-shape and seeding kinds do not.
 */
public enum ErrorKind {

    INVALID_DN_SYNTAX(ResultCodeEnum.INVALID_DN_SYNTAX),
    NO_SUCH_OBJECT(ResultCodeEnum.NO_SUCH_OBJECT),
    ALREADY_EXISTS(ResultCodeEnum.ENTRY_ALREADY_EXISTS),
    PROTOCOL_ERROR(ResultCodeEnum.PROTOCOL_ERROR),
    INVALID_CREDENTIALS(ResultCodeEnum.INVALID_CREDENTIALS),
    FILTER_ERROR(ResultCodeEnum.OTHER),

    /**
     * Filter is well-formed but uses a form the evaluator does not implement.
     * The response has to be seeded by the caller.
     */
    UNSUPPORTED_FILTER(null),

    INVALID_VALUE_TYPE(null),
    INVALID_ARGUMENT(null);

    private final ResultCodeEnum resultCode;

    ErrorKind(ResultCodeEnum resultCode) {
        this.resultCode = resultCode;
    }

    public ResultCodeEnum getResultCode() {
        return resultCode;
    }

    public boolean isProtocolResult() {
        return resultCode != null;
    }
}
