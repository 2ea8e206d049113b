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
 * Successful operation response. The emulator never returns controls.
 */
public final class LdapResponse {

    private final ResponseType type;
    private final Integer messageId;

    public LdapResponse(ResponseType type) {
        this(type, null);
    }

    public LdapResponse(ResponseType type, Integer messageId) {
        this.type = type;
        this.messageId = messageId;
    }

    public ResponseType getType() {
        return type;
    }

    public int getTag() {
        return type.getTag();
    }

    public ResultCodeEnum getResultCode() {
        return ResultCodeEnum.SUCCESS;
    }

    /**
     * Only set for add responses, null otherwise.
     */
    public Integer getMessageId() {
        return messageId;
    }

    @Override
    public String toString() {
        if (messageId == null) {
            return "LdapResponse(" + type.getTag() + ")";
        }
        return "LdapResponse(" + type.getTag() + ", msgid=" + messageId + ")";
    }
}
