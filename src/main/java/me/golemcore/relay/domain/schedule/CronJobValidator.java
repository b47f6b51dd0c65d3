package me.golemcore.relay.domain.schedule;

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
import me.golemcore.relay.domain.model.CronJob;
import me.golemcore.relay.domain.model.CronPayload;
import me.golemcore.relay.domain.model.CronSchedule;
import me.golemcore.relay.domain.model.CronSessionTarget;
import me.golemcore.relay.domain.model.CronValidationException;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Single gate for job definitions. Every create and update passes through
 * {@link #validate(CronJob)} before anything is persisted.
 */
@Component
@RequiredArgsConstructor
public class CronJobValidator {

    /**
     * Longest accepted interval, about 100 years.
     */
    static final long MAX_EVERY_MS = Duration.ofDays(36_525).toMillis();

    private final CronScheduleCalculator calculator;

    /**
     * @throws CronValidationException
     *             describing the first problem found
     */
    public void validate(CronJob job) {
        if (job == null) {
            throw new CronValidationException("Cron job is required");
        }
        validateSchedule(job.getSchedule());
        validateTarget(job);
    }

    void validateSchedule(CronSchedule schedule) {
        if (schedule == null) {
            throw new CronValidationException("schedule is required");
        }
        if (schedule instanceof CronSchedule.At at) {
            if (at.atMs() <= 0) {
                throw new CronValidationException("schedule.atMs must be a positive epoch millisecond value");
            }
        } else if (schedule instanceof CronSchedule.Every every) {
            if (every.everyMs() <= 0) {
                throw new CronValidationException("schedule.everyMs must be positive");
            }
            if (every.everyMs() > MAX_EVERY_MS) {
                throw new CronValidationException("schedule.everyMs must not exceed " + MAX_EVERY_MS + " ms");
            }
            if (every.anchorMs() != null && every.anchorMs() < 0) {
                throw new CronValidationException("schedule.anchorMs must not be negative");
            }
        } else if (schedule instanceof CronSchedule.Cron cron) {
            calculator.validateCron(cron.expr(), cron.tz());
        }
    }

    private void validateTarget(CronJob job) {
        CronSessionTarget target = job.getSessionTarget();
        CronPayload payload = job.getPayload();
        if (target == null) {
            throw new CronValidationException("sessionTarget is required");
        }
        if (payload == null) {
            throw new CronValidationException("payload is required");
        }

        if (target == CronSessionTarget.MAIN) {
            if (!(payload instanceof CronPayload.SystemEvent systemEvent)) {
                throw new CronValidationException("Main jobs require payload.kind=\"systemEvent\"");
            }
            if (isBlank(systemEvent.text())) {
                throw new CronValidationException("systemEvent.text is required");
            }
            if (job.getIsolation() != null) {
                throw new CronValidationException("isolation is only allowed for isolated jobs");
            }
            return;
        }

        if (!(payload instanceof CronPayload.AgentTurn agentTurn)) {
            throw new CronValidationException("Isolated jobs require payload.kind=\"agentTurn\"");
        }
        if (isBlank(agentTurn.message())) {
            throw new CronValidationException("agentTurn.message is required");
        }
        if (agentTurn.timeoutSeconds() != null && agentTurn.timeoutSeconds() < 1) {
            throw new CronValidationException("agentTurn.timeoutSeconds must be at least 1");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
