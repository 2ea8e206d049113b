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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.codec.digest.Crypt;
import org.identityconnectors.common.logging.Log;
import org.identityconnectors.framework.common.exceptions.ConnectorException;

/**
 * Compares a candidate password with a stored, possibly hashed, credential value.
 * <p>
 * Values without a scheme prefix are compared literally. Values with a prefix naming
 * a scheme we do not know never match.
 */
public class PasswordVerifier {

    private static final Log LOG = Log.getLog(PasswordVerifier.class);

    private static final Pattern SCHEME_PATTERN = Pattern.compile("^\\{(.*?)\\}(.*)$", Pattern.DOTALL);
    private static final int SHA1_LENGTH = 20;

    private final boolean cryptEnabled;

    public PasswordVerifier(boolean cryptEnabled) {
        this.cryptEnabled = cryptEnabled;
    }

    public boolean verify(String candidate, String storedValue) {
        if (candidate == null || storedValue == null) {
            return false;
        }
        Matcher matcher = SCHEME_PATTERN.matcher(storedValue);
        if (!matcher.matches()) {
            return storedValue.equals(candidate);
        }
        String tag = matcher.group(1);
        String hashed = matcher.group(2);
        PasswordScheme scheme = PasswordScheme.fromTag(tag);
        if (scheme == null) {
            LOG.ok("Unknown password scheme {0}, value does not match", tag);
            return false;
        }
        switch (scheme) {
            case CRYPT:
                return verifyCrypt(candidate, hashed);
            case SSHA:
                return verifySsha(candidate, hashed);
            default:
                throw new IllegalStateException("Unhandled password scheme " + scheme);
        }
    }

    private boolean verifyCrypt(String candidate, String hashed) {
        if (!cryptEnabled) {
            LOG.ok("CRYPT password scheme is disabled, value does not match");
            return false;
        }
        String derived;
        try {
            // Stored hash doubles as the salt, crypt() takes only the part it needs.
            derived = Crypt.crypt(candidate, hashed);
        } catch (IllegalArgumentException e) {
            LOG.ok("Stored CRYPT value is not usable as salt ({0}), value does not match", e.getMessage());
            return false;
        }
        return derived.equals(hashed);
    }

    private boolean verifySsha(String candidate, String hashed) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(hashed.trim());
        } catch (IllegalArgumentException e) {
            LOG.ok("Stored SSHA value is not valid base64 ({0}), value does not match", e.getMessage());
            return false;
        }
        if (decoded.length < SHA1_LENGTH) {
            return false;
        }
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new ConnectorException("Could not find MessageDigest algorithm: SHA-1", e);
        }
        md.update(candidate.getBytes(StandardCharsets.UTF_8));
        md.update(decoded, SHA1_LENGTH, decoded.length - SHA1_LENGTH);
        byte[] digest = md.digest();
        return MessageDigest.isEqual(digest, Arrays.copyOfRange(decoded, 0, SHA1_LENGTH));
    }
}
