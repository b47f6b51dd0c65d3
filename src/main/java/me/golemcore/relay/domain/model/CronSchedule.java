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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * When a cron job fires. Persisted with a {@code kind} discriminator:
 * {@code at}, {@code every} or {@code cron}.
 *
 * @see me.golemcore.relay.domain.schedule.CronScheduleCalculator
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronSchedule.At.class, name = "at"),
        @JsonSubTypes.Type(value = CronSchedule.Every.class, name = "every"),
        @JsonSubTypes.Type(value = CronSchedule.Cron.class, name = "cron")
})
public sealed interface CronSchedule permits CronSchedule.At, CronSchedule.Every, CronSchedule.Cron {

    /**
     * Fires once at an absolute instant.
     */
    record At(long atMs) implements CronSchedule {
    }

    /**
     * Fires every {@code everyMs}. With an anchor, runs align to
     * {@code anchorMs + k * everyMs}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Every(long everyMs, Long anchorMs) implements CronSchedule {
    }

    /**
     * Five-field Unix cron expression, evaluated in {@code tz} or the host zone.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Cron(String expr, String tz) implements CronSchedule {
    }
}
