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

import me.golemcore.relay.domain.model.CronSchedule;
import me.golemcore.relay.domain.model.CronValidationException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes the next due time of a {@link CronSchedule}.
 *
 * <p>
 * Cron expressions use the five-field Unix form (minute, hour, day-of-month,
 * month, day-of-week) and are evaluated with Spring's {@link CronExpression}
 * after prepending a zero seconds field. Spring requires day-of-month and
 * day-of-week to match together; Unix cron accepts either one when both are
 * restricted, so such expressions are split in two and the earlier match
 * wins.
 */
@Component
public class CronScheduleCalculator {

    static final int CRON_FIELDS = 5;
    private static final int DAY_OF_MONTH = 2;
    private static final int DAY_OF_WEEK = 4;

    private final Clock clock;
    private final Map<String, CronExpression> expressionCache = new ConcurrentHashMap<>();

    public CronScheduleCalculator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Next due time for the schedule relative to {@code fromMs}.
     *
     * <ul>
     * <li>{@code at}: {@code atMs} while it is still ahead of {@code fromMs}</li>
     * <li>{@code every}: {@code fromMs + everyMs}, or the first anchored slot
     * strictly after {@code fromMs}</li>
     * <li>{@code cron}: the earliest matching minute at or after
     * {@code fromMs}</li>
     * </ul>
     *
     * @return next due epoch millis, or null when the schedule has no future run
     */
    public Long nextRun(CronSchedule schedule, long fromMs) {
        if (schedule instanceof CronSchedule.At at) {
            return at.atMs() > fromMs ? at.atMs() : null;
        }
        if (schedule instanceof CronSchedule.Every every) {
            return nextEvery(every, fromMs);
        }
        if (schedule instanceof CronSchedule.Cron cron) {
            return nextCron(cron, fromMs);
        }
        throw new IllegalArgumentException("Unsupported schedule: " + schedule);
    }

    /**
     * Parses the five-field expression and the optional timezone.
     *
     * @throws CronValidationException
     *             if either is malformed
     */
    public void validateCron(String expr, String tz) {
        resolveZone(tz);
        for (String variant : expand(expr)) {
            parse(variant);
        }
    }

    private Long nextEvery(CronSchedule.Every every, long fromMs) {
        long everyMs = every.everyMs();
        if (everyMs <= 0) {
            return null;
        }
        Long anchorMs = every.anchorMs();
        try {
            if (anchorMs == null) {
                return Math.addExact(fromMs, everyMs);
            }
            if (fromMs < anchorMs) {
                return anchorMs;
            }
            long periods = (fromMs - anchorMs) / everyMs + 1;
            return Math.addExact(anchorMs, Math.multiplyExact(periods, everyMs));
        } catch (ArithmeticException e) {
            // past the end of representable time: no further run
            return null;
        }
    }

    private Long nextCron(CronSchedule.Cron cron, long fromMs) {
        ZoneId zone = resolveZone(cron.tz());
        // CronExpression.next is exclusive; step back so an exact match counts.
        ZonedDateTime from = Instant.ofEpochMilli(fromMs).atZone(zone).minusNanos(1);

        Long best = null;
        for (String variant : expand(cron.expr())) {
            ZonedDateTime next = parse(variant).next(from);
            if (next == null) {
                continue;
            }
            long candidate = next.toInstant().toEpochMilli();
            if (best == null || candidate < best) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Six-field Spring expressions equivalent to the Unix expression, one per
     * alternative when day-of-month and day-of-week are both restricted.
     */
    static String[] expand(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new CronValidationException("Cron expression cannot be empty");
        }
        String[] fields = expr.trim().split("\\s+");
        if (fields.length != CRON_FIELDS) {
            throw new CronValidationException(
                    "Invalid cron expression: expected 5 fields, got " + fields.length);
        }
        if (isWildcard(fields[DAY_OF_MONTH]) || isWildcard(fields[DAY_OF_WEEK])) {
            return new String[] { "0 " + String.join(" ", fields) };
        }
        String[] byDayOfMonth = fields.clone();
        byDayOfMonth[DAY_OF_WEEK] = "*";
        String[] byDayOfWeek = fields.clone();
        byDayOfWeek[DAY_OF_MONTH] = "*";
        return new String[] {
                "0 " + String.join(" ", byDayOfMonth),
                "0 " + String.join(" ", byDayOfWeek)
        };
    }

    private static boolean isWildcard(String field) {
        return field.startsWith("*") || "?".equals(field);
    }

    private CronExpression parse(String sixFieldExpr) {
        CronExpression cached = expressionCache.get(sixFieldExpr);
        if (cached != null) {
            return cached;
        }
        try {
            CronExpression parsed = CronExpression.parse(sixFieldExpr);
            expressionCache.put(sixFieldExpr, parsed);
            return parsed;
        } catch (IllegalArgumentException e) {
            throw new CronValidationException("Invalid cron expression '" + sixFieldExpr.substring(2) + "': "
                    + e.getMessage(), e);
        }
    }

    private ZoneId resolveZone(String tz) {
        if (tz == null || tz.isBlank()) {
            return clock.getZone();
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new CronValidationException("Invalid timezone: " + tz, e);
        }
    }
}
