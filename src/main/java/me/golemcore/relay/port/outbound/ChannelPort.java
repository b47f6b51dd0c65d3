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

import me.golemcore.relay.domain.model.SendResult;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound send on one messaging surface (WhatsApp, Telegram, Discord).
 * Failures complete the future exceptionally with a
 * {@link me.golemcore.relay.domain.model.DeliveryException}.
 */
public interface ChannelPort {

    /**
     * Surface identifier, e.g. {@code "telegram"}.
     */
    String getChannelType();

    /**
     * Send text, optionally with one media attachment given by URL or path.
     *
     * @param to
     *            surface-specific recipient
     * @param text
     *            message text, may be empty when media is present
     * @param mediaUrl
     *            optional media, null for text-only
     */
    CompletableFuture<SendResult> send(String to, String text, String mediaUrl);
}
