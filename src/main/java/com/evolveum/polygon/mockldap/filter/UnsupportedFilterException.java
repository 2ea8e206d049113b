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
package com.evolveum.polygon.mockldap.filter;

/**
 * Filter is syntactically acceptable but uses a form the evaluator does not implement
 * (substrings, approximate, ordering or extensible match).
 * Not a {@link java.text.ParseException}: the connection falls back to a seeded response
 * instead of reporting a broken filter.
 */
public class UnsupportedFilterException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String filter;

    public UnsupportedFilterException(String message, String filter) {
        super(message);
        this.filter = filter;
    }

    public String getFilter() {
        return filter;
    }
}
