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
package com.evolveum.polygon.mockldap.password;

import java.util.Locale;

/**
 * Hash schemes recognized in the <code>{SCHEME}</code> prefix of a stored credential.
 */
public enum PasswordScheme {

    /**
     * Unix crypt(3) family: traditional DES, MD5 ($1$), SHA-256 ($5$) and SHA-512 ($6$).
     */
    CRYPT("CRYPT"),

    /**
     * Salted SHA-1: base64 of the 20-byte digest of password followed by salt, with the salt appended.
     */
    SSHA("SSHA");

    private final String tag;

    PasswordScheme(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Null if the tag does not name a supported scheme.
     */
    public static PasswordScheme fromTag(String tag) {
        String upperTag = tag.toUpperCase(Locale.ROOT);
        for (PasswordScheme scheme : values()) {
            if (scheme.tag.equals(upperTag)) {
                return scheme;
            }
        }
        return null;
    }
}
