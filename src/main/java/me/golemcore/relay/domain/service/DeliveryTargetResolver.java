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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CronDeliveryChannel;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.SessionEntry;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Chooses where an isolated job's result goes.
 *
 * <p>
 * An explicit recipient wins over the main session's last recipient. A
 * requested surface wins over the main session's last surface, which in turn
 * wins over WhatsApp; the web chat surface is never a delivery target. WhatsApp
 * recipients are checked against {@code relay.channels.whatsapp.allow-from}:
 * unlisted numbers are replaced by the first allowed one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryTargetResolver {

    private static final String WILDCARD = "*";

    private final SessionStoreService sessionStoreService;
    private final RelayProperties properties;

    public DeliveryTarget resolve(CronDeliveryChannel requestedChannel, String explicitTo) {
        Optional<SessionEntry> main = sessionStoreService.getEntry(properties.getSession().getMainKey());
        String lastChannel = main.map(SessionEntry::getLastChannel)
                .filter(channel -> !CronDeliveryChannel.WEBCHAT.equalsIgnoreCase(channel))
                .orElse(null);
        String lastTo = main.map(SessionEntry::getLastTo).map(String::trim).orElse("");
        return resolve(requestedChannel, explicitTo, lastChannel, lastTo);
    }

    DeliveryTarget resolve(CronDeliveryChannel requestedChannel, String explicitTo, String lastChannel,
            String lastTo) {
        CronDeliveryChannel channel;
        if (requestedChannel != null && requestedChannel.isSurface()) {
            channel = requestedChannel;
        } else {
            channel = CronDeliveryChannel.find(lastChannel)
                    .filter(CronDeliveryChannel::isSurface)
                    .orElse(CronDeliveryChannel.WHATSAPP);
        }

        String to;
        if (explicitTo != null && !explicitTo.isBlank()) {
            to = explicitTo.trim();
        } else {
            to = lastTo != null && !lastTo.isBlank() ? lastTo.trim() : null;
        }

        if (channel == CronDeliveryChannel.WHATSAPP) {
            to = sanitizeWhatsAppRecipient(to);
        }
        return new DeliveryTarget(channel, to);
    }

    private String sanitizeWhatsAppRecipient(String to) {
        List<String> rawAllow = properties.getChannels().getWhatsapp().getAllowFrom();
        if (rawAllow == null || rawAllow.contains(WILDCARD)) {
            return to;
        }
        List<String> allowFrom = rawAllow.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(DeliveryTargetResolver::normalizeE164)
                .filter(value -> value.length() > 1)
                .toList();
        if (allowFrom.isEmpty()) {
            return to;
        }
        if (to == null) {
            return allowFrom.get(0);
        }
        String normalized = normalizeE164(to);
        if (allowFrom.contains(normalized)) {
            return normalized;
        }
        log.info("[Delivery] WhatsApp recipient {} is not allowlisted, using {}", normalized, allowFrom.get(0));
        return allowFrom.get(0);
    }

    /**
     * Normalize a phone number to E.164: a leading {@code +} followed by digits.
     * A {@code whatsapp:} prefix and any punctuation are dropped.
     */
    public static String normalizeE164(String raw) {
        String withoutPrefix = raw.trim().replaceFirst("(?i)^whatsapp:", "").trim();
        String digits = withoutPrefix.replaceAll("\\D", "");
        return "+" + digits;
    }
}
