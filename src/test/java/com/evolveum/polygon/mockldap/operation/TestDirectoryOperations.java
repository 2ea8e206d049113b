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

import static org.testng.AssertJUnit.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.directory.api.ldap.model.entry.ModificationOperation;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.evolveum.polygon.mockldap.AbstractMockLdapTest;
import com.evolveum.polygon.mockldap.dn.DistinguishedName;
import com.evolveum.polygon.mockldap.password.PasswordVerifier;
import com.evolveum.polygon.mockldap.store.DirectoryEntry;
import com.evolveum.polygon.mockldap.store.DirectoryStore;

public class TestDirectoryOperations extends AbstractMockLdapTest {

    private DirectoryStore store;
    private DirectoryOperations operations;

    @BeforeMethod
    public void setUp() {
        store = createStore();
        operations = new DirectoryOperations(store, "userPassword", new PasswordVerifier(true));
    }

    @Test
    public void testAdd() throws Exception {
        String carolDn = "cn=carol," + PEOPLE_DN;
        Outcome<DistinguishedName> outcome = operations.add(carolDn, attrs(
                "objectClass", values("top", "person"),
                "cn", values("carol"),
                "description", Collections.emptyList()));

        assertTrue(outcome.isSuccess());
        DirectoryEntry carol = entry(carolDn);
        assertEquals(Arrays.asList("top", "person"), carol.getStringValues("objectClass"));
        assertFalse(carol.hasAttribute("description"));
    }

    @Test
    public void testAddSingleValue() throws Exception {
        String carolDn = "cn=carol," + PEOPLE_DN;
        assertTrue(operations.add(carolDn, attrs("cn", bytes("carol"))).isSuccess());

        assertEquals(Collections.singletonList("carol"), entry(carolDn).getStringValues("cn"));
    }

    @Test
    public void testAddDropsRepeatedValues() throws Exception {
        String carolDn = "cn=carol," + PEOPLE_DN;
        assertTrue(operations.add(carolDn, attrs("cn", values("carol", "carol"))).isSuccess());

        assertEquals(Collections.singletonList("carol"), entry(carolDn).getStringValues("cn"));
    }

    @Test
    public void testAddMergesAttributeNamesDifferingInCase() throws Exception {
        String carolDn = "cn=carol," + PEOPLE_DN;
        assertTrue(operations.add(carolDn, attrs(
                "cn", values("carol"),
                "CN", values("caroline", "carol"))).isSuccess());

        DirectoryEntry carol = entry(carolDn);
        assertEquals(Collections.singletonList("cn"), carol.getAttributeNames());
        assertEquals(Arrays.asList("carol", "caroline"), carol.getStringValues("cn"));
    }

    @Test
    public void testAddExistingIgnoresCase() {
        Outcome<DistinguishedName> outcome = operations.add("CN=Alice,OU=People,DC=Example,DC=com",
                attrs("cn", values("Alice")));

        assertFailure(ErrorKind.ALREADY_EXISTS, outcome);
        assertEquals(5, store.size());
    }

    @Test
    public void testAddStringValue() {
        Outcome<DistinguishedName> outcome = operations.add("cn=carol," + PEOPLE_DN, attrs("cn", "carol"));

        assertFailure(ErrorKind.INVALID_VALUE_TYPE, outcome);
        assertEquals(5, store.size());
    }

    @Test
    public void testAddInvalidDn() {
        assertFailure(ErrorKind.INVALID_DN_SYNTAX, operations.add("carol", attrs("cn", values("carol"))));
    }

    @Test
    public void testDelete() throws Exception {
        assertTrue(operations.delete("CN=BOB," + PEOPLE_DN).isSuccess());

        assertFalse(store.contains(DistinguishedName.parse(BOB_DN)));
        assertFailure(ErrorKind.NO_SUCH_OBJECT, operations.delete(BOB_DN));
    }

    @Test
    public void testModifyAddIsIdempotent() throws Exception {
        List<Modification> modifications = Collections.singletonList(Modification.add("mail", bytes("alice@example.com")));

        assertTrue(operations.modify(ALICE_DN, modifications).isSuccess());
        assertTrue(operations.modify(ALICE_DN, modifications).isSuccess());

        assertEquals(Collections.singletonList("alice@example.com"), entry(ALICE_DN).getStringValues("mail"));
    }

    @Test
    public void testModifyAddEmptyIsProtocolError() {
        assertFailure(ErrorKind.PROTOCOL_ERROR,
                operations.modify(ALICE_DN, Collections.singletonList(Modification.add("mail"))));
    }

    @Test
    public void testModifyDelete() throws Exception {
        assertTrue(operations.modify(ALICE_DN, Arrays.asList(
                Modification.delete("cn", bytes("al")),
                Modification.delete("sn"),
                Modification.delete("mail", bytes("nobody@example.com")))).isSuccess());

        DirectoryEntry alice = entry(ALICE_DN);
        assertEquals(Collections.singletonList("alice"), alice.getStringValues("cn"));
        assertFalse(alice.hasAttribute("sn"));
        assertFalse(alice.hasAttribute("mail"));
    }

    @Test
    public void testModifyReplace() throws Exception {
        assertTrue(operations.modify(ALICE_DN, Arrays.asList(
                Modification.replace("SN", bytes("Pleasance"), bytes("Liddell")),
                Modification.replace("description"))).isSuccess());

        DirectoryEntry alice = entry(ALICE_DN);
        assertEquals(Arrays.asList("Pleasance", "Liddell"), alice.getStringValues("sn"));
        assertFalse(alice.hasAttribute("description"));
    }

    @Test
    public void testModifyReplaceDropsRepeatedValues() throws Exception {
        assertTrue(operations.modify(ALICE_DN, Collections.singletonList(
                new Modification(ModificationOperation.REPLACE_ATTRIBUTE, "sn", values("Pleasance", "Pleasance")))).isSuccess());

        assertEquals(Collections.singletonList("Pleasance"), entry(ALICE_DN).getStringValues("sn"));
    }

    @Test
    public void testModifyReplaceEmptyRemovesAttribute() throws Exception {
        assertTrue(operations.modify(ALICE_DN, Collections.singletonList(Modification.replace("sn"))).isSuccess());

        assertFalse(entry(ALICE_DN).hasAttribute("sn"));
    }

    @Test
    public void testModifyMissingEntry() {
        assertFailure(ErrorKind.NO_SUCH_OBJECT,
                operations.modify("cn=carol," + PEOPLE_DN, Collections.<Modification>emptyList()));
    }

    @Test
    public void testModifyIsNotRolledBack() throws Exception {
        Outcome<DistinguishedName> outcome = operations.modify(ALICE_DN, Arrays.asList(
                Modification.add("mail", bytes("alice@example.com")),
                new Modification(ModificationOperation.REPLACE_ATTRIBUTE, "sn", "not bytes")));

        assertFailure(ErrorKind.INVALID_VALUE_TYPE, outcome);
        assertEquals(Collections.singletonList("alice@example.com"), entry(ALICE_DN).getStringValues("mail"));
        assertEquals(Collections.singletonList("Liddell"), entry(ALICE_DN).getStringValues("sn"));
    }

    @Test
    public void testModifyIncrementIsRejected() {
        Outcome<DistinguishedName> outcome = operations.modify(ALICE_DN, Collections.singletonList(
                new Modification(ModificationOperation.INCREMENT_ATTRIBUTE, "uidNumber", bytes("1"))));

        assertFailure(ErrorKind.INVALID_ARGUMENT, outcome);
    }

    @Test
    public void testRenameKeepsOtherRdnValues() throws Exception {
        Outcome<DistinguishedName> outcome = operations.rename(ALICE_DN, "cn=al", null);

        assertTrue(outcome.isSuccess());
        assertEquals("cn=al," + PEOPLE_DN, outcome.getValue().getName());
        assertFalse(store.contains(DistinguishedName.parse(ALICE_DN)));
        assertEquals(Collections.singletonList("al"), entry("cn=al," + PEOPLE_DN).getStringValues("cn"));
    }

    @Test
    public void testRenameSingleValuedRdn() throws Exception {
        assertTrue(operations.rename(BOB_DN, "cn=robert", null).isSuccess());

        assertEquals(Collections.singletonList("robert"), entry("cn=robert," + PEOPLE_DN).getStringValues("cn"));
    }

    @Test
    public void testRenameChangesRdnAttribute() throws Exception {
        assertTrue(operations.rename(BOB_DN, "uid=bob", null).isSuccess());

        DirectoryEntry bob = entry("uid=bob," + PEOPLE_DN);
        assertFalse(bob.hasAttribute("cn"));
        assertEquals(Collections.singletonList("bob"), bob.getStringValues("uid"));
    }

    @Test
    public void testRenameToNewSuperior() throws Exception {
        assertTrue(operations.rename(BOB_DN, "cn=bob", GROUPS_DN).isSuccess());

        assertTrue(store.contains(DistinguishedName.parse("cn=bob," + GROUPS_DN)));
        assertFalse(store.contains(DistinguishedName.parse(BOB_DN)));
        assertEquals(Collections.singletonList("bob"), entry("cn=bob," + GROUPS_DN).getStringValues("cn"));
    }

    @Test
    public void testRenameFailures() {
        assertFailure(ErrorKind.NO_SUCH_OBJECT, operations.rename("cn=carol," + PEOPLE_DN, "cn=caroline", null));
        assertFailure(ErrorKind.ALREADY_EXISTS, operations.rename(ALICE_DN, "CN=Bob", null));
        assertFailure(ErrorKind.INVALID_DN_SYNTAX, operations.rename(ALICE_DN, "alice", null));
        assertFailure(ErrorKind.INVALID_DN_SYNTAX, operations.rename(ALICE_DN, "cn=x,ou=y", null));
    }

    @Test
    public void testCompare() {
        assertTrue(operations.compare(ALICE_DN, "sn", "Liddell").getValue());
        assertFalse(operations.compare(ALICE_DN, "sn", "liddell").getValue());
        assertFalse(operations.compare(ALICE_DN, "mail", "alice@example.com").getValue());
        assertFailure(ErrorKind.NO_SUCH_OBJECT, operations.compare("cn=carol," + PEOPLE_DN, "sn", "x"));
    }

    @Test
    public void testComparePassword() {
        assertTrue(operations.compare(ALICE_DN, "userPassword", ALICE_PASSWORD).getValue());
        assertTrue(operations.compare(ALICE_DN, "USERPASSWORD", ALICE_PASSWORD).getValue());
        assertFalse(operations.compare(ALICE_DN, "userPassword", "wrong").getValue());
    }

    @Test
    public void testBind() {
        assertEquals(ALICE_DN, operations.bind(ALICE_DN, ALICE_PASSWORD).getValue());
        assertEquals(BOB_DN, operations.bind(BOB_DN, BOB_PASSWORD).getValue());
        assertEquals("", operations.bind("", "").getValue());
    }

    @Test
    public void testBindFailures() {
        assertFailure(ErrorKind.INVALID_CREDENTIALS, operations.bind(ALICE_DN, "wrong"));
        assertFailure(ErrorKind.INVALID_CREDENTIALS, operations.bind("cn=carol," + PEOPLE_DN, "secret"));
        assertFailure(ErrorKind.INVALID_CREDENTIALS, operations.bind(ALICE_DN, ""));
        assertFailure(ErrorKind.INVALID_DN_SYNTAX, operations.bind("carol", "secret"));
    }

    @Test
    public void testChangePassword() throws Exception {
        assertTrue(operations.changePassword(BOB_DN, BOB_PASSWORD, "newpw").getValue());
        assertEquals(Collections.singletonList("newpw"), entry(BOB_DN).getStringValues("userPassword"));

        assertFalse(operations.changePassword(BOB_DN, "wrong", "other").getValue());
        assertEquals(Collections.singletonList("newpw"), entry(BOB_DN).getStringValues("userPassword"));

        assertTrue(operations.changePassword(BOB_DN, null, "reset").getValue());
        assertEquals(Collections.singletonList("reset"), entry(BOB_DN).getStringValues("userPassword"));
    }

    @Test
    public void testChangePasswordComparesHashLiterally() throws Exception {
        // Plaintext of a hashed credential does not authorize the change, the stored hash itself does
        assertFalse(operations.changePassword(ALICE_DN, ALICE_PASSWORD, "newpw").getValue());
        String storedHash = ssha(ALICE_PASSWORD, ALICE_SALT);
        assertTrue(operations.changePassword(ALICE_DN, storedHash, "newpw").getValue());
        assertTrue(operations.bind(ALICE_DN, "newpw").isSuccess());
    }

    @Test
    public void testChangePasswordMissingEntry() {
        assertFailure(ErrorKind.NO_SUCH_OBJECT, operations.changePassword("cn=carol," + PEOPLE_DN, null, "x"));
    }

    private DirectoryEntry entry(String dn) throws Exception {
        DirectoryEntry entry = store.get(DistinguishedName.parse(dn));
        assertNotNull("No entry " + dn, entry);
        return entry;
    }

    private static void assertFailure(ErrorKind expected, Outcome<?> outcome) {
        assertTrue("Unexpected success: " + outcome, outcome.isFailure());
        assertEquals(expected, outcome.getErrorKind());
    }
}
