package me.golemcore.relay.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory queue of system-originated lines waiting for the next turn of a
 * session. Holds at most {@value #MAX_EVENTS_PER_SESSION} entries per session
 * key, dropping the oldest; a line equal to the previous one is ignored.
 */
@Component
@Slf4j
public class SystemEventQueue {

    static final int MAX_EVENTS_PER_SESSION = 20;

    private final Map<String, Deque<String>> queues = new HashMap<>();

    /**
     * @return false when the text was blank or repeated the last queued line
     */
    public synchronized boolean enqueue(String sessionKey, String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String clean = text.trim();
        Deque<String> queue = queues.computeIfAbsent(sessionKey, key -> new ArrayDeque<>());
        if (clean.equals(queue.peekLast())) {
            return false;
        }
        queue.addLast(clean);
        while (queue.size() > MAX_EVENTS_PER_SESSION) {
            String dropped = queue.removeFirst();
            log.debug("[Sessions] System event queue of {} full, dropped: {}", sessionKey, dropped);
        }
        return true;
    }

    /**
     * Remove and return all queued lines, oldest first.
     */
    public synchronized List<String> drain(String sessionKey) {
        Deque<String> queue = queues.remove(sessionKey);
        return queue != null ? new ArrayList<>(queue) : List.of();
    }

    public synchronized List<String> peek(String sessionKey) {
        Deque<String> queue = queues.get(sessionKey);
        return queue != null ? List.copyOf(queue) : List.of();
    }

    public synchronized int size(String sessionKey) {
        Deque<String> queue = queues.get(sessionKey);
        return queue != null ? queue.size() : 0;
    }
}
