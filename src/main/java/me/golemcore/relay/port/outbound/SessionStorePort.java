package me.golemcore.relay.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.relay.domain.model.SessionEntry;

import java.util.Map;

/**
 * Whole-store access to the shared session file. Implementations read and
 * rewrite the complete map; callers serialize read-modify-write cycles.
 */
public interface SessionStorePort {

    /**
     * @return a mutable copy of the store, empty when the file is missing or
     *         unreadable
     */
    Map<String, SessionEntry> load();

    /**
     * Atomically replaces the store with {@code sessions}.
     */
    void save(Map<String, SessionEntry> sessions);
}
