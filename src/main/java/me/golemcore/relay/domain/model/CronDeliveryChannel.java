package me.golemcore.relay.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Delivery channel requested by an agent-turn job. {@link #LAST} follows the
 * route most recently used by the main session.
 */
public enum CronDeliveryChannel {

    LAST("last", "Last"),
    WHATSAPP("whatsapp", "WhatsApp"),
    TELEGRAM("telegram", "Telegram"),
    DISCORD("discord", "Discord");

    /**
     * Surface that never receives deliveries (browser chat).
     */
    public static final String WEBCHAT = "webchat";

    private final String channelType;
    private final String displayName;

    CronDeliveryChannel(String channelType, String displayName) {
        this.channelType = channelType;
        this.displayName = displayName;
    }

    @JsonValue
    public String getChannelType() {
        return channelType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isSurface() {
        return this != LAST;
    }

    @JsonCreator
    public static CronDeliveryChannel fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown delivery channel: " + value));
    }

    /**
     * Lenient lookup, case-insensitive, trimmed.
     */
    public static Optional<CronDeliveryChannel> find(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CronDeliveryChannel channel : values()) {
            if (channel.channelType.equals(normalized)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
