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

package com.evolveum.polygon.mockldap.recording;

import static org.testng.AssertJUnit.*;

import java.util.Arrays;
import java.util.Collections;

import org.testng.annotations.Test;

public class TestCallRecorder {

    @Test
    public void testRecordsInOrder() {
        CallRecorder recorder = new CallRecorder();
        recorder.record("simpleBind", "cn=alice,dc=example,dc=com", "secret");
        recorder.record("whoAmI");
        recorder.record("unbind");

        assertEquals(3, recorder.size());
        assertEquals(Arrays.asList("simpleBind", "whoAmI", "unbind"), recorder.getOperationNames());
        assertEquals(RecordedCall.of("simpleBind", "cn=alice,dc=example,dc=com", "secret"), recorder.getCalls().get(0));
        assertEquals(Collections.emptyList(), recorder.getCalls().get(1).getArguments());
    }

    @Test
    public void testFilterByOperation() {
        CallRecorder recorder = new CallRecorder();
        recorder.record("delete", "cn=a,dc=example,dc=com");
        recorder.record("whoAmI");
        recorder.record("delete", "cn=b,dc=example,dc=com");

        assertEquals(Arrays.asList(
                RecordedCall.of("delete", "cn=a,dc=example,dc=com"),
                RecordedCall.of("delete", "cn=b,dc=example,dc=com")), recorder.getCalls("delete"));
        assertTrue(recorder.getCalls("add").isEmpty());
    }

    @Test
    public void testClear() {
        CallRecorder recorder = new CallRecorder();
        recorder.record("unbind");
        recorder.clear();

        assertEquals(0, recorder.size());
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testCallsAreReadOnly() {
        CallRecorder recorder = new CallRecorder();
        recorder.record("unbind");
        recorder.getCalls().clear();
    }
}
