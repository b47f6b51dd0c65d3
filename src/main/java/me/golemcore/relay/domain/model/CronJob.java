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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scheduled unit of agent work. Persisted in {@code cron/jobs.json} and
 * evaluated by the scheduler tick loop.
 *
 * <p>
 * {@link CronSessionTarget#MAIN} jobs carry a {@link CronPayload.SystemEvent},
 * {@link CronSessionTarget#ISOLATED} jobs a {@link CronPayload.AgentTurn}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CronJob {

    private String id;
    private String name;
    private boolean enabled;
    private long createdAtMs;
    private long updatedAtMs;
    private CronSchedule schedule;
    private CronSessionTarget sessionTarget;

    @Builder.Default
    private CronWakeMode wakeMode = CronWakeMode.NEXT_HEARTBEAT;

    private CronPayload payload;
    private CronIsolation isolation;

    @Builder.Default
    private CronJobState state = new CronJobState();

    /**
     * Detached copy; schedule, payload and isolation are immutable and shared.
     */
    public CronJob copy() {
        return toBuilder()
                .state(state != null ? state.toBuilder().build() : new CronJobState())
                .build();
    }

    /**
     * Display label used in logs and the agent message header.
     */
    public String label() {
        return name != null && !name.isBlank() ? id + " " + name.trim() : id;
    }
}
