package me.golemcore.relay.adapter.outbound.storage;

import me.golemcore.relay.domain.model.SessionEntry;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonSessionStoreAdapterTest {

    @TempDir
    Path tempDir;

    private RelayProperties properties;
    private LocalStorageAdapter storage;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
    }

    private JsonSessionStoreAdapter adapter() {
        return new JsonSessionStoreAdapter(storage, AutoConfiguration.objectMapper(), properties);
    }

    @Test
    void shouldStartEmptyWhenFileMissing() {
        assertTrue(adapter().load().isEmpty());
    }

    @Test
    void shouldRoundTripEntriesInOrder() throws Exception {
        Map<String, SessionEntry> sessions = new LinkedHashMap<>();
        sessions.put("main", SessionEntry.builder().sessionId("s-main").updatedAt(5).systemSent(true)
                .lastChannel("telegram").lastTo("42").build());
        sessions.put("cron:j1", SessionEntry.builder().sessionId("s-cron").updatedAt(7).systemSent(false)
                .thinkingLevel("low").build());

        adapter().save(sessions);
        Map<String, SessionEntry> loaded = adapter().load();

        assertEquals(List.of("main", "cron:j1"), List.copyOf(loaded.keySet()));
        assertEquals(sessions.get("main"), loaded.get("main"));
        assertEquals("low", loaded.get("cron:j1").getThinkingLevel());
        String json = Files.readString(tempDir.resolve("sessions/sessions.json"));
        assertFalse(json.contains("verboseLevel"));
    }

    @Test
    void shouldHonorCustomStoreLocation() {
        properties.getSession().setStore("state/store.json");

        adapter().save(Map.of("main", SessionEntry.builder().sessionId("s").build()));

        assertTrue(Files.exists(tempDir.resolve("state/store.json")));
    }

    @Test
    void shouldTreatCorruptStoreAsEmpty() throws Exception {
        Files.writeString(tempDir.resolve("sessions/sessions.json"), "[broken");

        assertTrue(adapter().load().isEmpty());
    }

    @Test
    void shouldIgnoreUnknownFields() throws Exception {
        Files.writeString(tempDir.resolve("sessions/sessions.json"),
                "{\"main\":{\"sessionId\":\"s\",\"updatedAt\":3,\"legacyFlag\":true}}");

        assertEquals("s", adapter().load().get("main").getSessionId());
    }
}
