package me.golemcore.proxy.infrastructure.config;


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

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration strings in either compact unit form ({@code 500ms},
 * {@code 30s}, {@code 1m30s}, {@code 2h}) or ISO-8601 ({@code PT30S}).
 */
public final class DurationParser {

    private static final Pattern COMPACT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

    private DurationParser() {
    }

    /**
     * @throws IllegalArgumentException
     *             if the value is blank or not a duration
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration cannot be empty");
        }
        String trimmed = value.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + value, e);
            }
        }
        return parseCompact(trimmed, value);
    }

    private static Duration parseCompact(String trimmed, String original) {
        Matcher matcher = COMPACT.matcher(trimmed);
        Duration total = Duration.ZERO;
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                throw new IllegalArgumentException("Invalid duration: " + original);
            }
            total = total.plus(toDuration(Double.parseDouble(matcher.group(1)), matcher.group(2)));
            position = matcher.end();
        }
        if (position == 0 || position != trimmed.length()) {
            throw new IllegalArgumentException("Invalid duration: " + original);
        }
        return total;
    }

    private static Duration toDuration(double amount, String unit) {
        double nanosPerUnit = switch (unit) {
        case "ns" -> 1;
        case "us", "µs" -> 1_000;
        case "ms" -> 1_000_000;
        case "s" -> 1_000_000_000;
        case "m" -> 60_000_000_000d;
        case "h" -> 3_600_000_000_000d;
        default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
        };
        return Duration.ofNanos(Math.round(amount * nanosPerUnit));
    }
}
