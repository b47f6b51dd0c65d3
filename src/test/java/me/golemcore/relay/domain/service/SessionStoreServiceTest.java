package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ResolvedSession;
import me.golemcore.relay.domain.model.SessionEntry;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.SessionStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStoreServiceTest {

    private static final long NOW = 10_000_000L;
    private static final long IDLE_MS = 60 * 60_000L;

    private InMemorySessionStore store;
    private SessionStoreService service;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        RelayProperties properties = new RelayProperties();
        properties.getSession().setIdleMinutes(60);
        service = new SessionStoreService(store, properties);
    }

    @Test
    void shouldMintSessionForUnknownKey() {
        ResolvedSession session = service.resolveSession("cron:j1", NOW);

        assertTrue(session.isNewSession());
        assertFalse(session.systemSent());
        assertTrue(session.isFirstTurn());
        assertEquals(NOW, store.data.get("cron:j1").getUpdatedAt());
    }

    @Test
    void shouldReuseSessionAtIdleBoundary() {
        ResolvedSession first = service.resolveSession("cron:j1", NOW);
        service.markSystemSent("cron:j1");

        ResolvedSession second = service.resolveSession("cron:j1", NOW + IDLE_MS);

        assertFalse(second.isNewSession());
        assertEquals(first.sessionId(), second.sessionId());
        assertTrue(second.systemSent());
        assertFalse(second.isFirstTurn());
    }

    @Test
    void shouldReplaceSessionOneMillisecondPastIdleWindow() {
        ResolvedSession first = service.resolveSession("cron:j1", NOW);
        service.markSystemSent("cron:j1");

        ResolvedSession second = service.resolveSession("cron:j1", NOW + IDLE_MS + 1);

        assertTrue(second.isNewSession());
        assertNotEquals(first.sessionId(), second.sessionId());
        assertFalse(second.systemSent());
    }

    @Test
    void shouldCarryOverSettingsAndRouteWhenSessionReplaced() {
        store.data.put("main", SessionEntry.builder()
                .sessionId("old")
                .updatedAt(0)
                .thinkingLevel("high")
                .lastChannel("telegram")
                .lastTo("42")
                .build());

        ResolvedSession session = service.resolveSession("main", NOW);

        assertTrue(session.isNewSession());
        assertEquals("high", session.entry().getThinkingLevel());
        assertEquals("telegram", session.entry().getLastChannel());
        assertEquals("42", session.entry().getLastTo());
    }

    @Test
    void shouldRecordLastRouteCreatingEntryWhenMissing() {
        service.updateLastRoute("cron:j1", "whatsapp", "+15550001111", NOW);

        SessionEntry entry = service.getEntry("cron:j1").orElseThrow();
        assertEquals("whatsapp", entry.getLastChannel());
        assertEquals("+15550001111", entry.getLastTo());
        assertEquals(NOW, entry.getUpdatedAt());
        assertFalse(entry.getSystemSent());
    }

    @Test
    void shouldIgnoreMarkSystemSentForMissingEntry() {
        service.markSystemSent("nobody");

        assertTrue(store.data.isEmpty());
        assertEquals(0, store.saves);
    }

    @Test
    void shouldLeaveStoreUntouchedWhenMutatorReturnsNull() {
        assertNull(service.update("main", entry -> null));
        assertEquals(0, store.saves);
    }

    @Test
    void shouldTreatNonPositiveIdleMinutesAsOneMinute() {
        RelayProperties properties = new RelayProperties();
        properties.getSession().setIdleMinutes(0);

        assertEquals(60_000L, new SessionStoreService(store, properties).idleWindowMs());
    }

    private static final class InMemorySessionStore implements SessionStorePort {

        private Map<String, SessionEntry> data = new LinkedHashMap<>();
        private int saves;

        @Override
        public Map<String, SessionEntry> load() {
            Map<String, SessionEntry> copy = new LinkedHashMap<>();
            data.forEach((key, value) -> copy.put(key, value.toBuilder().build()));
            return copy;
        }

        @Override
        public void save(Map<String, SessionEntry> sessions) {
            data = new LinkedHashMap<>(sessions);
            saves++;
        }
    }
}
