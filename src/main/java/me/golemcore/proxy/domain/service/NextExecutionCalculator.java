package me.golemcore.proxy.domain.service;


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

import me.golemcore.proxy.domain.exception.ScheduleValidationException;
import me.golemcore.proxy.domain.model.Schedule;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes the next fire instant of a {@link Schedule}. Pure and
 * deterministic: no I/O and no clock access.
 *
 * <p>
 * Cron expressions use five fields (minute hour day-of-month month
 * day-of-week) and are evaluated as wall-clock time in the schedule's
 * timezone. Internally they are run through Spring's six-field
 * {@link CronExpression} with a fixed {@code 0} seconds field.
 *
 * <p>
 * Recurring schedules with a future {@code scheduledAt} anchor fire first at
 * the anchor itself when it falls on a cron slot, otherwise at the first slot
 * strictly after it.
 */
@Component
public class NextExecutionCalculator {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final long ANCHOR_PROBE_SECONDS = 1;

    /**
     * Compute the next execution of {@code schedule} relative to {@code from}.
     *
     * @return the next fire instant, or empty when the schedule has no future
     *         occurrence
     * @throws ScheduleValidationException
     *             if the cron expression or timezone is malformed
     */
    public Optional<Instant> computeNext(Schedule schedule, Instant from) {
        if (schedule.isRecurring()) {
            CronExpression cron = parseCron(schedule.getCronExpression());
            ZoneId zone = resolveZone(schedule.getTimezone());
            Instant anchor = schedule.getScheduledAt();

            if (anchor != null && from.isBefore(anchor)) {
                Optional<Instant> candidate = nextOccurrence(cron, zone, anchor);
                Optional<Instant> probe = nextOccurrence(cron, zone, anchor.minusSeconds(ANCHOR_PROBE_SECONDS));
                if (probe.isPresent() && !probe.get().isAfter(anchor)) {
                    return Optional.of(anchor);
                }
                return candidate;
            }
            return nextOccurrence(cron, zone, from);
        }

        return Optional.ofNullable(schedule.getScheduledAt());
    }

    /**
     * Check that a cron expression and timezone are usable.
     *
     * @throws ScheduleValidationException
     *             if either is malformed
     */
    public void validate(String cronExpression, String timezone) {
        parseCron(cronExpression);
        resolveZone(timezone);
    }

    /**
     * Convert a five-field cron expression to Spring's six-field format.
     *
     * @throws ScheduleValidationException
     *             if the expression is empty, has a field count other than
     *             five, or does not parse
     */
    static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new ScheduleValidationException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");
        if (parts.length != CRON_FIVE_FIELDS) {
            throw new ScheduleValidationException(
                    "Invalid cron expression '" + trimmed + "': expected 5 fields, got " + parts.length);
        }
        return "0 " + String.join(" ", parts);
    }

    static CronExpression parseCron(String input) {
        String sixFieldCron = normalizeCronExpression(input);
        try {
            return CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new ScheduleValidationException(
                    "Invalid cron expression '" + input.trim() + "': " + e.getMessage(), e);
        }
    }

    /**
     * Resolve an IANA timezone name. Empty means UTC.
     */
    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ScheduleValidationException("Unknown timezone: " + timezone, e);
        }
    }

    /**
     * Earliest instant strictly after {@code after} whose wall-clock time in
     * {@code zone} matches the cron fields.
     */
    private static Optional<Instant> nextOccurrence(CronExpression cron, ZoneId zone, Instant after) {
        ZonedDateTime next = cron.next(after.atZone(zone));
        if (next == null) {
            return Optional.empty();
        }
        return Optional.of(next.toInstant());
    }
}
