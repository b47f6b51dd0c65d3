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
import me.golemcore.relay.domain.model.CronDeliveryChannel;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.DeliveryTarget;
import me.golemcore.relay.domain.model.ReplyPayload;
import me.golemcore.relay.port.outbound.ChannelPort;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Sends agent reply payloads to a resolved surface, applying each surface's
 * media and length rules. Payloads without text and media are skipped.
 */
@Service
@Slf4j
public class CronDeliveryService {

    static final int TELEGRAM_CHUNK_LENGTH = 4000;

    private final Map<String, ChannelPort> channels = new HashMap<>();

    public CronDeliveryService(List<ChannelPort> channelPorts) {
        for (ChannelPort port : channelPorts) {
            channels.put(port.getChannelType(), port);
        }
        log.debug("[Delivery] Registered channels: {}", channels.keySet());
    }

    /**
     * Deliver every payload in order. Stops at the first failed send.
     *
     * @throws DeliveryException
     *             when the surface has no adapter or a send fails
     */
    public void deliver(DeliveryTarget target, List<ReplyPayload> payloads) {
        if (!target.hasRecipient()) {
            throw new DeliveryException(target.channel().getChannelType(), missingRecipientError(target.channel()));
        }
        ChannelPort port = channels.get(target.channel().getChannelType());
        if (port == null) {
            throw new DeliveryException(target.channel().getChannelType(),
                    "No adapter configured for " + target.channel().getDisplayName());
        }

        String to = target.to().trim();
        if (target.channel() == CronDeliveryChannel.WHATSAPP) {
            to = DeliveryTargetResolver.normalizeE164(to);
        }

        int sent = 0;
        for (ReplyPayload payload : payloads) {
            if (payload == null) {
                continue;
            }
            List<String> media = payload.mediaList();
            String text = payload.textOrEmpty();
            if (media.isEmpty() && text.isBlank()) {
                continue;
            }
            sent += sendPayload(port, target.channel(), to, text, media);
        }
        log.info("[Delivery] Sent {} message(s) to {} {}", sent, target.channel().getDisplayName(), to);
    }

    private int sendPayload(ChannelPort port, CronDeliveryChannel channel, String to, String text,
            List<String> media) {
        if (media.isEmpty()) {
            List<String> parts = channel == CronDeliveryChannel.TELEGRAM
                    ? TextChunker.chunk(text, TELEGRAM_CHUNK_LENGTH)
                    : List.of(text);
            for (String part : parts) {
                send(port, to, part, null);
            }
            return parts.size();
        }

        boolean first = true;
        for (String mediaUrl : media) {
            send(port, to, first ? text : "", mediaUrl);
            first = false;
        }
        return media.size();
    }

    private void send(ChannelPort port, String to, String text, String mediaUrl) {
        try {
            port.send(to, text, mediaUrl).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(port.getChannelType(), "Delivery interrupted", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DeliveryException deliveryException) {
                throw deliveryException;
            }
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new DeliveryException(port.getChannelType(), message, cause);
        }
    }

    public static String missingRecipientError(CronDeliveryChannel channel) {
        return switch (channel) {
        case TELEGRAM -> "Cron delivery to Telegram requires a recipient (chatId).";
        case DISCORD -> "Cron delivery to Discord requires a recipient (<channelId|user:ID>).";
        default -> "Cron delivery to " + channel.getDisplayName() + " requires a recipient.";
        };
    }

    public static String skippedSummary(CronDeliveryChannel channel) {
        return "Delivery skipped (no " + channel.getDisplayName() + " recipient).";
    }
}
