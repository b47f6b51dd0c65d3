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

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes user-supplied thinking levels to {@code off}, {@code minimal},
 * {@code low}, {@code medium} or {@code high}.
 */
public final class ThinkLevels {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("off", "off"),
            Map.entry("none", "off"),
            Map.entry("on", "low"),
            Map.entry("enable", "low"),
            Map.entry("enabled", "low"),
            Map.entry("min", "minimal"),
            Map.entry("minimal", "minimal"),
            Map.entry("low", "low"),
            Map.entry("mid", "medium"),
            Map.entry("med", "medium"),
            Map.entry("medium", "medium"),
            Map.entry("high", "high"),
            Map.entry("max", "high"),
            Map.entry("highest", "high"),
            Map.entry("ultra", "high"));

    private ThinkLevels() {
    }

    /**
     * @return the canonical level, or null for blank or unknown input
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return ALIASES.get(raw.trim().toLowerCase(Locale.ROOT));
    }
}
