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

import org.apache.directory.api.ldap.model.constants.SchemaConstants;

public class MockLdapConstants {

    public static final String ATTRIBUTE_USER_PASSWORD_NAME = SchemaConstants.USER_PASSWORD_AT;
    public static final String ATTRIBUTE_OBJECTCLASS_NAME = SchemaConstants.OBJECT_CLASS_AT;

    public static final String DEFAULT_SEARCH_FILTER = "(" + ATTRIBUTE_OBJECTCLASS_NAME + "=*)";

    // Operation names as they appear in the call log and as seed keys
    public static final String OPERATION_INITIALIZE = "initialize";
    public static final String OPERATION_GET_OPTION = "getOption";
    public static final String OPERATION_SET_OPTION = "setOption";
    public static final String OPERATION_SIMPLE_BIND = "simpleBind";
    public static final String OPERATION_SASL_EXTERNAL_BIND = "saslExternalBind";
    public static final String OPERATION_SEARCH = "search";
    public static final String OPERATION_SEARCH_IMMEDIATE = "searchImmediate";
    public static final String OPERATION_RESULT = "result";
    public static final String OPERATION_START_TLS = "startTls";
    public static final String OPERATION_COMPARE = "compare";
    public static final String OPERATION_MODIFY = "modify";
    public static final String OPERATION_ADD = "add";
    public static final String OPERATION_RENAME = "rename";
    public static final String OPERATION_DELETE = "delete";
    public static final String OPERATION_UNBIND = "unbind";
    public static final String OPERATION_WHO_AM_I = "whoAmI";
    public static final String OPERATION_CHANGE_PASSWORD = "changePassword";

}
