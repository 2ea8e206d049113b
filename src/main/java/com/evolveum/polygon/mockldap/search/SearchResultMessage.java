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
package com.evolveum.polygon.mockldap.search;

import java.util.List;

import com.evolveum.polygon.mockldap.operation.ResponseType;

/**
 * What a fetch of a search ticket returns: the search-result response type and,
 * on the first fetch only, the entries.
 */
public final class SearchResultMessage {

    private final int messageId;
    private final List<ResultEntry> entries;

    public SearchResultMessage(int messageId, List<ResultEntry> entries) {
        this.messageId = messageId;
        this.entries = entries;
    }

    public ResponseType getType() {
        return ResponseType.SEARCH_RESULT;
    }

    public int getMessageId() {
        return messageId;
    }

    public boolean hasData() {
        return entries != null;
    }

    /**
     * Null when the ticket was already consumed or never issued.
     */
    public List<ResultEntry> getEntries() {
        return entries;
    }

    @Override
    public String toString() {
        return "SearchResultMessage(" + getType().getTag() + ", msgid=" + messageId + ", "
                + (entries == null ? "no data" : entries.size() + " entries") + ")";
    }
}
