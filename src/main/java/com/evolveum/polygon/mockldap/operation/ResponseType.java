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

/**
 * Response types returned by successful operations, with the numeric protocol tags
 * that client code written against the standard contract compares with.
 */
public enum ResponseType {

    BIND(97),
    SEARCH_RESULT(101),
    MODIFY(103),
    ADD(105),
    DELETE(107),
    RENAME(109);

    private final int tag;

    ResponseType(int tag) {
        this.tag = tag;
    }

    public int getTag() {
        return tag;
    }
}
