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

/**
 * Result of executing one job: classified status, optional summary of the
 * agent output and optional error text.
 */
public record CronRunOutcome(CronRunStatus status, String summary, String error) {

    public static CronRunOutcome ok(String summary) {
        return new CronRunOutcome(CronRunStatus.OK, summary, null);
    }

    public static CronRunOutcome error(String error) {
        return new CronRunOutcome(CronRunStatus.ERROR, null, error);
    }

    public static CronRunOutcome error(String summary, String error) {
        return new CronRunOutcome(CronRunStatus.ERROR, summary, error);
    }

    public static CronRunOutcome skipped(String summary) {
        return new CronRunOutcome(CronRunStatus.SKIPPED, summary, null);
    }
}
