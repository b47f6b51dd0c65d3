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

import me.golemcore.relay.domain.model.CronValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration strings such as {@code 90s}, {@code 1.5h} or {@code 250ms}
 * into milliseconds.
 */
public final class DurationParser {

    private static final Pattern DURATION_PATTERN = Pattern.compile("^(\\d+(\\.\\d+)?)(ms|s|m|h|d)$",
            Pattern.CASE_INSENSITIVE);

    private DurationParser() {
    }

    /**
     * @return the duration in whole milliseconds, floored
     * @throws CronValidationException
     *             if the value is malformed or not positive
     */
    public static long parseMillis(String value) {
        if (value == null || value.isBlank()) {
            throw new CronValidationException("Duration cannot be empty");
        }
        String trimmed = value.trim();
        Matcher matcher = DURATION_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            throw new CronValidationException("Invalid duration '" + trimmed + "': expected e.g. 10s, 5m, 1.5h, 250ms");
        }

        BigDecimal amount = new BigDecimal(matcher.group(1));
        long unitMs = switch (matcher.group(3).toLowerCase(Locale.ROOT)) {
        case "ms" -> 1L;
        case "s" -> 1_000L;
        case "m" -> 60_000L;
        case "h" -> 3_600_000L;
        case "d" -> 86_400_000L;
        default -> throw new CronValidationException("Unsupported duration unit: " + matcher.group(3));
        };

        long millis;
        try {
            millis = amount.multiply(BigDecimal.valueOf(unitMs)).setScale(0, RoundingMode.FLOOR).longValueExact();
        } catch (ArithmeticException e) {
            throw new CronValidationException("Duration is too large: " + trimmed, e);
        }
        if (millis <= 0) {
            throw new CronValidationException("Duration must be positive: " + trimmed);
        }
        return millis;
    }
}
