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

import org.identityconnectors.common.logging.Log;

/**
 * Terse log of emulated operations: one line per request, response and error.
 */
public class OperationLog {

    static final Log LOG = Log.getLog(OperationLog.class);

    private static final String PREFIX = "MOCK ";

    public static void logOperationReq(String format, Object... params) {
        if (LOG.isInfo()) {
            LOG.info(PREFIX + format, params);
        }
    }

    public static void logOperationRes(String format, Object... params) {
        if (LOG.isInfo()) {
            LOG.info(PREFIX + format, params);
        }
    }

    public static void logOperationErr(String format, Object... params) {
        if (LOG.isError()) {
            LOG.error(PREFIX + format, params);
        }
    }

}
