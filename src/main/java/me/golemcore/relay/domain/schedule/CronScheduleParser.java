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
import me.golemcore.relay.domain.model.CronSchedule;
import me.golemcore.relay.domain.model.CronValidationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Builds a {@link CronSchedule} from the shorthand accepted by the control API:
 * exactly one of {@code at}, {@code every} or {@code cron}.
 *
 * <p>
 * {@code at} accepts epoch milliseconds, an ISO-8601 instant or offset
 * date-time, a local date-time (read in {@code tz} or the host zone), or a
 * {@code +duration} relative to now.
 */
@Component
@RequiredArgsConstructor
public class CronScheduleParser {

    private final CronScheduleCalculator calculator;
    private final Clock clock;

    public CronSchedule parse(String at, String every, String anchor, String cron, String tz) {
        int provided = count(at) + count(every) + count(cron);
        if (provided != 1) {
            throw new CronValidationException("Exactly one of at, every or cron is required");
        }

        if (hasText(at)) {
            return new CronSchedule.At(parseInstantMs(at, tz));
        }
        if (hasText(every)) {
            long everyMs = DurationParser.parseMillis(every);
            Long anchorMs = hasText(anchor) ? parseInstantMs(anchor, tz) : null;
            return new CronSchedule.Every(everyMs, anchorMs);
        }

        String expr = cron.trim().replaceAll("\\s+", " ");
        String zone = hasText(tz) ? tz.trim() : null;
        calculator.validateCron(expr, zone);
        return new CronSchedule.Cron(expr, zone);
    }

    long parseInstantMs(String value, String tz) {
        String trimmed = value.trim();
        if (trimmed.startsWith("+")) {
            return clock.millis() + DurationParser.parseMillis(trimmed.substring(1));
        }
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                throw new CronValidationException("Invalid timestamp: " + trimmed, e);
            }
        }
        Long absolute = parseAbsoluteOrNull(trimmed);
        if (absolute != null) {
            return absolute;
        }
        try {
            ZoneId zone = hasText(tz) ? ZoneId.of(tz.trim()) : clock.getZone();
            return LocalDateTime.parse(trimmed).atZone(zone).toInstant().toEpochMilli();
        } catch (DateTimeException e) {
            throw new CronValidationException("Invalid time '" + trimmed
                    + "': expected epoch millis, ISO-8601 date-time or +duration", e);
        }
    }

    private static Long parseAbsoluteOrNull(String value) {
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant().toEpochMilli();
            } catch (DateTimeParseException offsetFailure) {
                return null;
            }
        }
    }

    private static int count(String value) {
        return hasText(value) ? 1 : 0;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
