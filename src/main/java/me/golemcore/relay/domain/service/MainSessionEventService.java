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
import me.golemcore.relay.domain.lane.CommandLaneService;
import me.golemcore.relay.domain.model.CronWakeMode;
import me.golemcore.relay.domain.model.MainSessionWakeRequestedEvent;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Hands system-originated lines to the live main session.
 *
 * <p>
 * Writes and drains run in the main-session lane so they never interleave with
 * live traffic on the same session. With {@link CronWakeMode#NOW} a
 * {@link MainSessionWakeRequestedEvent} is published after the line is queued.
 */
@Service
@Slf4j
public class MainSessionEventService {

    private final CommandLaneService laneService;
    private final SystemEventQueue systemEventQueue;
    private final ApplicationEventPublisher eventPublisher;
    private final RelayProperties properties;

    public MainSessionEventService(CommandLaneService laneService, SystemEventQueue systemEventQueue,
            ApplicationEventPublisher eventPublisher, RelayProperties properties) {
        this.laneService = laneService;
        this.systemEventQueue = systemEventQueue;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    /**
     * Queue {@code text} on the main session.
     *
     * @param reason
     *            identifies the origin of the line, e.g. {@code cron:<jobId>}
     * @return completes once the line is queued; true unless it was dropped as
     *         a duplicate
     */
    public CompletableFuture<Boolean> enqueueSystemEvent(String text, CronWakeMode wakeMode, String reason) {
        String mainKey = mainKey();
        return laneService.enqueue(properties.getSession().getMainLane(), () -> {
            boolean queued = systemEventQueue.enqueue(mainKey, text);
            log.debug("[Sessions] System event for {} from {} queued={}", mainKey, reason, queued);
            if (wakeMode == CronWakeMode.NOW) {
                eventPublisher.publishEvent(new MainSessionWakeRequestedEvent(mainKey, jobIdOf(reason), reason));
            }
            return queued;
        });
    }

    /**
     * Remove and return the lines queued for {@code sessionKey}; a blank key
     * means the main session.
     */
    public CompletableFuture<List<String>> drain(String sessionKey) {
        String key = sessionKey == null || sessionKey.isBlank() ? mainKey() : sessionKey.trim();
        return laneService.enqueue(properties.getSession().getMainLane(), () -> systemEventQueue.drain(key));
    }

    private String mainKey() {
        String mainKey = properties.getSession().getMainKey();
        return mainKey == null || mainKey.isBlank() ? "main" : mainKey.trim();
    }

    private static String jobIdOf(String reason) {
        if (reason != null && reason.startsWith("cron:")) {
            return reason.substring("cron:".length());
        }
        return null;
    }
}
