package me.golemcore.relay.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.SessionEntry;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.SessionStorePort;
import me.golemcore.relay.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session store kept as one JSON object ({@code sessionKey -> entry}) in the
 * workspace. Every save rewrites the whole file atomically and keeps a
 * {@code .bak} copy of the previous version.
 */
@Component
@Slf4j
public class JsonSessionStoreAdapter implements SessionStorePort {

    private static final TypeReference<LinkedHashMap<String, SessionEntry>> STORE_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String file;

    public JsonSessionStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper, RelayProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        String store = properties.getSession().getStore();
        String normalized = store == null || store.isBlank() ? "sessions/sessions.json" : store.trim();
        int slash = normalized.lastIndexOf('/');
        this.directory = slash > 0 ? normalized.substring(0, slash) : "";
        this.file = slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    @Override
    public Map<String, SessionEntry> load() {
        try {
            String json = storagePort.getText(directory, file).join();
            if (json == null || json.isBlank()) {
                return new LinkedHashMap<>();
            }
            return objectMapper.readValue(json, STORE_TYPE);
        } catch (IOException | RuntimeException e) { // NOSONAR - an unreadable store behaves like an empty one
            log.warn("[Sessions] Session store {}/{} unreadable, starting empty: {}", directory, file,
                    e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    @Override
    public void save(Map<String, SessionEntry> sessions) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(sessions);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize session store", e);
        }
        storagePort.putTextAtomic(directory, file, json, true).join();
    }
}
