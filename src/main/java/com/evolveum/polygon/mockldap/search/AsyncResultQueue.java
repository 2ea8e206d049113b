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

import java.util.ArrayList;
import java.util.List;

import org.identityconnectors.common.logging.Log;

/**
 * Pending results of issued searches, addressed by ticket (message id).
 * <p>
 * A ticket is the index of its slot. Fetching returns the slot content once and clears it,
 * a second fetch, or a fetch of a ticket that was never issued, yields null.
 * Slots are never reused.
 */
public class AsyncResultQueue {

    private static final Log LOG = Log.getLog(AsyncResultQueue.class);

    private final List<List<ResultEntry>> slots = new ArrayList<>();

    public int add(List<ResultEntry> results) {
        slots.add(results);
        return slots.size() - 1;
    }

    public List<ResultEntry> take(int ticket) {
        if (ticket < 0 || ticket >= slots.size()) {
            LOG.ok("Ticket {0} was never issued", ticket);
            return null;
        }
        List<ResultEntry> results = slots.get(ticket);
        slots.set(ticket, null);
        if (results == null) {
            LOG.ok("Ticket {0} was already consumed", ticket);
        }
        return results;
    }

    public int size() {
        return slots.size();
    }
}
