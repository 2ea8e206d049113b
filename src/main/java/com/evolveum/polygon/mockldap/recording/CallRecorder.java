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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered log of the operations invoked on one connection, so tests can assert what the code under test called.
 */
public class CallRecorder {

    private final List<RecordedCall> calls = new ArrayList<>();

    public void record(String operation, Object... arguments) {
        calls.add(RecordedCall.of(operation, arguments));
    }

    public List<RecordedCall> getCalls() {
        return Collections.unmodifiableList(calls);
    }

    public List<RecordedCall> getCalls(String operation) {
        List<RecordedCall> matching = new ArrayList<>();
        for (RecordedCall call : calls) {
            if (call.getOperation().equals(operation)) {
                matching.add(call);
            }
        }
        return matching;
    }

    public List<String> getOperationNames() {
        List<String> names = new ArrayList<>(calls.size());
        for (RecordedCall call : calls) {
            names.add(call.getOperation());
        }
        return names;
    }

    public int size() {
        return calls.size();
    }

    public void clear() {
        calls.clear();
    }
}
