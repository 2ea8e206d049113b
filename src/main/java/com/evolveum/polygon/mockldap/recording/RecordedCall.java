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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One operation invocation: the operation name and its arguments, in call order.
 */
public final class RecordedCall {

    private final String operation;
    private final List<Object> arguments;

    public RecordedCall(String operation, List<?> arguments) {
        this.operation = operation;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static RecordedCall of(String operation, Object... arguments) {
        return new RecordedCall(operation, Arrays.asList(arguments));
    }

    public String getOperation() {
        return operation;
    }

    public List<Object> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordedCall)) {
            return false;
        }
        RecordedCall that = (RecordedCall) o;
        return operation.equals(that.operation) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, arguments);
    }

    @Override
    public String toString() {
        return operation + arguments;
    }
}
