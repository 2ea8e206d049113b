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

package com.evolveum.polygon.mockldap.store;

import static org.testng.AssertJUnit.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.identityconnectors.framework.common.exceptions.ConfigurationException;
import org.identityconnectors.framework.common.exceptions.InvalidAttributeValueException;
import org.testng.annotations.Test;

import com.evolveum.polygon.mockldap.AbstractMockLdapTest;
import com.evolveum.polygon.mockldap.dn.DistinguishedName;

public class TestDirectoryStore extends AbstractMockLdapTest {

    @Test
    public void testSeedIsNotAliased() throws Exception {
        Map<String, Map<String, Object>> directory = createDirectory();
        DirectoryStore store = DirectoryStore.copyOf(directory);

        @SuppressWarnings("unchecked")
        List<byte[]> seedSn = (List<byte[]>) directory.get(ALICE_DN).get("sn");
        seedSn.get(0)[0] = 'X';
        seedSn.add(bytes("Pleasance"));
        directory.remove(BOB_DN);

        DirectoryEntry alice = store.get(DistinguishedName.parse(ALICE_DN));
        assertEquals(Arrays.asList("Liddell"), alice.getStringValues("sn"));
        assertTrue(store.contains(DistinguishedName.parse(BOB_DN)));
        assertEquals(5, store.size());
    }

    @Test
    public void testSeedDropsRepeatedValuesAndMergesNameCase() throws Exception {
        Map<String, Map<String, Object>> directory = new LinkedHashMap<>();
        directory.put(BASE_CONTEXT, attrs(
                "dc", values("example"),
                "sn", values("x", "x"),
                "SN", values("y", "x")));
        DirectoryStore store = DirectoryStore.copyOf(directory);

        DirectoryEntry entry = store.get(DistinguishedName.parse(BASE_CONTEXT));
        assertEquals(Arrays.asList("x", "y"), entry.getStringValues("sn"));
        assertEquals(Arrays.asList("dc", "sn"), entry.getAttributeNames());
    }

    @Test
    public void testLookupIgnoresCase() throws Exception {
        DirectoryStore store = createStore();

        assertTrue(store.contains(DistinguishedName.parse("CN=Alice,OU=People,DC=Example,DC=Com")));
        assertNotNull(store.get(DistinguishedName.parse("cn=BOB, ou=people, dc=example, dc=com")));
        assertFalse(store.contains(DistinguishedName.parse("cn=carol,ou=people,dc=example,dc=com")));
    }

    @Test
    public void testToMapIsDeepCopy() throws Exception {
        DirectoryStore store = createStore();

        Map<String, Map<String, List<byte[]>>> map = store.toMap();
        map.get(ALICE_DN).get("cn").get(0)[0] = 'X';
        map.remove(BOB_DN);

        assertEquals(Arrays.asList("alice", "al"), store.get(DistinguishedName.parse(ALICE_DN)).getStringValues("cn"));
        assertEquals(5, store.toMap().size());
    }

    @Test
    public void testRemove() throws Exception {
        DirectoryStore store = createStore();

        assertNotNull(store.remove(DistinguishedName.parse("CN=BOB," + PEOPLE_DN)));
        assertNull(store.remove(DistinguishedName.parse(BOB_DN)));
        assertEquals(4, store.size());
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testSeedWithInvalidDn() {
        Map<String, Map<String, Object>> directory = new LinkedHashMap<>();
        directory.put("not a dn", attrs("cn", values("x")));
        DirectoryStore.copyOf(directory);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testSeedWithCaseDuplicate() {
        Map<String, Map<String, Object>> directory = new LinkedHashMap<>();
        directory.put("cn=alice,dc=example,dc=com", attrs("cn", values("alice")));
        directory.put("CN=Alice,DC=example,DC=com", attrs("cn", values("Alice")));
        DirectoryStore.copyOf(directory);
    }

    @Test(expectedExceptions = InvalidAttributeValueException.class)
    public void testSeedWithStringValue() {
        Map<String, Map<String, Object>> directory = new LinkedHashMap<>();
        directory.put("cn=alice,dc=example,dc=com", attrs("cn", Arrays.asList("alice")));
        DirectoryStore.copyOf(directory);
    }
}
