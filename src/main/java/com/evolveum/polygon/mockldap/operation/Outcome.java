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

import java.util.function.Function;

/**
 * Result of an emulated operation: either a value or an error kind with a diagnostic message.
 * Engine code never throws for protocol-level failures, it returns a failed outcome instead.
 */
public final class Outcome<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    private Outcome(T value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null, null);
    }

    public static <T> Outcome<T> failure(ErrorKind errorKind, String message) {
        if (errorKind == null) {
            throw new IllegalArgumentException("Failure without error kind");
        }
        return new Outcome<>(null, errorKind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    public T getValue() {
        if (errorKind != null) {
            throw new IllegalStateException("Value requested from failed outcome (" + errorKind + "): " + message);
        }
        return value;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Re-types a failed outcome so it can be returned from an operation with a different value type.
     */
    public <U> Outcome<U> propagate() {
        if (errorKind == null) {
            throw new IllegalStateException("Cannot propagate successful outcome");
        }
        return new Outcome<>(null, errorKind, message);
    }

    public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
        if (errorKind != null) {
            return propagate();
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        if (errorKind == null) {
            return "Outcome(success: " + value + ")";
        }
        return "Outcome(" + errorKind + ": " + message + ")";
    }
}
