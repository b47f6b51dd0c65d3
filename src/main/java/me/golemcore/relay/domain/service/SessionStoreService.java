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
import me.golemcore.relay.domain.model.ResolvedSession;
import me.golemcore.relay.domain.model.SessionEntry;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.SessionStorePort;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Resolves and updates entries of the shared session store.
 *
 * <p>
 * An entry is fresh while {@code now - updatedAt <= idleMinutes * 60000}. A
 * fresh entry keeps its session id and {@code systemSent} flag; otherwise a new
 * session id is minted and {@code systemSent} resets. Every write is a whole
 * store read-modify-write under one process-wide lock, so different keys never
 * interleave either.
 */
@Service
@Slf4j
public class SessionStoreService {

    private static final long MINUTE_MS = 60_000L;

    private final SessionStorePort sessionStorePort;
    private final RelayProperties properties;
    private final ReentrantLock lock = new ReentrantLock();

    public SessionStoreService(SessionStorePort sessionStorePort, RelayProperties properties) {
        this.sessionStorePort = sessionStorePort;
        this.properties = properties;
    }

    /**
     * Reuse or mint the session for {@code sessionKey} and persist it with
     * {@code updatedAt = nowMs}. Per-session agent settings and the last route
     * carry over even when the session is replaced.
     */
    public ResolvedSession resolveSession(String sessionKey, long nowMs) {
        lock.lock();
        try {
            Map<String, SessionEntry> store = sessionStorePort.load();
            SessionEntry existing = store.get(sessionKey);
            boolean fresh = existing != null && existing.getSessionId() != null
                    && nowMs - existing.getUpdatedAt() <= idleWindowMs();

            boolean systemSent = fresh && Boolean.TRUE.equals(existing.getSystemSent());
            SessionEntry.SessionEntryBuilder builder = existing != null ? existing.toBuilder() : SessionEntry.builder();
            SessionEntry entry = builder
                    .sessionId(fresh ? existing.getSessionId() : UUID.randomUUID().toString())
                    .updatedAt(nowMs)
                    .systemSent(systemSent)
                    .build();

            store.put(sessionKey, entry);
            sessionStorePort.save(store);
            if (!fresh) {
                log.debug("[Sessions] New session {} for key {}", entry.getSessionId(), sessionKey);
            }
            return new ResolvedSession(sessionKey, entry.toBuilder().build(), !fresh, systemSent);
        } finally {
            lock.unlock();
        }
    }

    public Optional<SessionEntry> getEntry(String sessionKey) {
        lock.lock();
        try {
            return Optional.ofNullable(sessionStorePort.load().get(sessionKey));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomic read-modify-write of one entry. The mutator receives a copy (null
     * when absent) and returns the entry to store; returning null leaves the
     * store unchanged.
     */
    public SessionEntry update(String sessionKey, UnaryOperator<SessionEntry> mutator) {
        lock.lock();
        try {
            Map<String, SessionEntry> store = sessionStorePort.load();
            SessionEntry current = store.get(sessionKey);
            SessionEntry updated = mutator.apply(current != null ? current.toBuilder().build() : null);
            if (updated == null) {
                return current;
            }
            store.put(sessionKey, updated);
            sessionStorePort.save(store);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Persist {@code systemSent = true} so a crash mid-run does not resend the
     * session preamble.
     */
    public void markSystemSent(String sessionKey) {
        update(sessionKey, entry -> {
            if (entry == null) {
                return null;
            }
            entry.setSystemSent(true);
            return entry;
        });
    }

    /**
     * Remember the route a session last delivered to.
     */
    public void updateLastRoute(String sessionKey, String channel, String to, long nowMs) {
        update(sessionKey, entry -> {
            SessionEntry target = entry != null ? entry : SessionEntry.builder()
                    .sessionId(UUID.randomUUID().toString())
                    .systemSent(false)
                    .build();
            target.setLastChannel(channel);
            target.setLastTo(to);
            target.setUpdatedAt(nowMs);
            return target;
        });
        log.debug("[Sessions] Last route of {} is now {} -> {}", sessionKey, channel, to);
    }

    long idleWindowMs() {
        return Math.max(properties.getSession().getIdleMinutes(), 1) * MINUTE_MS;
    }
}
