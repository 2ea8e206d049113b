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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.evolveum.polygon.mockldap.store.DirectoryStore;

/**
 * Shared fixture: a small example.com tree with two people and two organizational units.
 */
public abstract class AbstractMockLdapTest {

    protected static final String BASE_CONTEXT = "dc=example,dc=com";
    protected static final String PEOPLE_DN = "ou=people," + BASE_CONTEXT;
    protected static final String GROUPS_DN = "ou=groups," + BASE_CONTEXT;
    protected static final String ALICE_DN = "cn=alice," + PEOPLE_DN;
    protected static final String BOB_DN = "cn=bob," + PEOPLE_DN;

    protected static final String ALICE_PASSWORD = "wonderland";
    protected static final String BOB_PASSWORD = "canwefixit";
    protected static final byte[] ALICE_SALT = { 0x12, 0x34, 0x56, 0x78 };

    protected Map<String, Map<String, Object>> createDirectory() {
        Map<String, Map<String, Object>> directory = new LinkedHashMap<>();
        directory.put(BASE_CONTEXT, attrs(
                "objectClass", values("top", "domain"),
                "dc", values("example")));
        directory.put(PEOPLE_DN, attrs(
                "objectClass", values("top", "organizationalUnit"),
                "ou", values("people")));
        directory.put(GROUPS_DN, attrs(
                "objectClass", values("top", "organizationalUnit"),
                "ou", values("groups")));
        directory.put(ALICE_DN, attrs(
                "objectClass", values("top", "person"),
                "cn", values("alice", "al"),
                "sn", values("Liddell"),
                "userPassword", values(ssha(ALICE_PASSWORD, ALICE_SALT))));
        directory.put(BOB_DN, attrs(
                "objectClass", values("top", "person"),
                "cn", values("bob"),
                "sn", values("Builder"),
                "userPassword", values(BOB_PASSWORD)));
        return directory;
    }

    protected DirectoryStore createStore() {
        return DirectoryStore.copyOf(createDirectory());
    }

    protected static Map<String, Object> attrs(Object... namesAndValues) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            attributes.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return attributes;
    }

    protected static List<byte[]> values(String... values) {
        return new ArrayList<>(LdapUtil.encodeAll(values));
    }

    protected static byte[] bytes(String value) {
        return LdapUtil.encode(value);
    }

    protected static String ssha(String password, byte[] salt) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
        md.update(password.getBytes(StandardCharsets.UTF_8));
        md.update(salt);
        byte[] digest = md.digest();
        byte[] hashAndSalt = new byte[digest.length + salt.length];
        System.arraycopy(digest, 0, hashAndSalt, 0, digest.length);
        System.arraycopy(salt, 0, hashAndSalt, digest.length, salt.length);
        return "{SSHA}" + Base64.getEncoder().encodeToString(hashAndSalt);
    }
}
