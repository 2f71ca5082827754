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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.exception.ScheduleConflictException;
import me.golemcore.proxy.domain.exception.ScheduleNotFoundException;
import me.golemcore.proxy.domain.exception.ScheduleStateException;
import me.golemcore.proxy.domain.exception.ScheduleValidationException;
import me.golemcore.proxy.domain.exception.SessionStartException;
import me.golemcore.proxy.domain.model.ExecutionRecord;
import me.golemcore.proxy.domain.model.Schedule;
import me.golemcore.proxy.domain.model.ScheduleFilter;
import me.golemcore.proxy.domain.model.ScheduleStatus;
import me.golemcore.proxy.domain.model.ScheduleUpdate;
import me.golemcore.proxy.domain.model.SessionTemplate;
import me.golemcore.proxy.domain.model.StartSessionRequest;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.ScheduleStorePort;
import me.golemcore.proxy.port.outbound.SessionManagerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Domain service behind the schedule administration API. Validates input,
 * computes the first execution at creation time and applies user-driven status
 * changes. Every operation is scoped to the caller's owner id; schedules of
 * other owners behave as if they did not exist.
 *
 * <p>
 * Writes are read-modify-write through {@link ScheduleStorePort#update}. A
 * concurrent change surfaces as {@link ScheduleConflictException} so the
 * caller can re-read and resubmit.
 */
@Service
@Slf4j
public class ScheduleService {

    private static final Pattern ENV_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int MAX_TAG_KEY_LENGTH = 63;
    private static final int MAX_NAME_LENGTH = 253;

    private final ScheduleStorePort scheduleStore;
    private final SessionManagerPort sessionManager;
    private final NextExecutionCalculator calculator;
    private final ProxyProperties properties;
    private final Clock clock;

    public ScheduleService(ScheduleStorePort scheduleStore, SessionManagerPort sessionManager,
            NextExecutionCalculator calculator, ProxyProperties properties, Clock clock) {
        this.scheduleStore = scheduleStore;
        this.sessionManager = sessionManager;
        this.calculator = calculator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Create an active schedule from {@code draft}. Only the name, timing and
     * template of the draft are used.
     *
     * @throws ScheduleValidationException
     *             if the draft is malformed
     */
    public Schedule createSchedule(String ownerId, Schedule draft) {
        String timezone = hasText(draft.getTimezone())
                ? draft.getTimezone().trim()
                : properties.getSchedules().getDefaultTimezone();

        Instant now = clock.instant();
        Schedule schedule = Schedule.builder()
                .id(UUID.randomUUID().toString())
                .name(draft.getName() != null ? draft.getName().trim() : null)
                .ownerId(ownerId)
                .status(ScheduleStatus.ACTIVE)
                .cronExpression(hasText(draft.getCronExpression()) ? draft.getCronExpression().trim() : null)
                .timezone(timezone)
                .scheduledAt(draft.getScheduledAt())
                .sessionTemplate(copyTemplate(draft.getSessionTemplate()))
                .executionCount(0)
                .consecutiveFailureCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();

        validate(schedule);
        schedule.setNextExecutionAt(firstExecution(schedule, now));

        Schedule created = scheduleStore.create(schedule);
        log.info("[Schedule] Created schedule {} ({}) for owner {}, next execution at {}",
                created.getId(), created.getName(), ownerId, created.getNextExecutionAt());
        return created;
    }

    /**
     * @throws ScheduleNotFoundException
     *             if the schedule does not exist or belongs to another owner
     */
    public Schedule getSchedule(String ownerId, String id) {
        return scheduleStore.get(id)
                .filter(schedule -> ownerId.equals(schedule.getOwnerId()))
                .orElseThrow(() -> new ScheduleNotFoundException(id));
    }

    /**
     * List the owner's schedules, oldest first, optionally restricted to one
     * status.
     */
    public List<Schedule> listSchedules(String ownerId, ScheduleStatus status) {
        ScheduleFilter filter = ScheduleFilter.builder()
                .ownerId(ownerId)
                .status(status)
                .build();
        return scheduleStore.list(filter).stream()
                .sorted(Comparator.comparing(Schedule::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Apply a partial update. When the timing of an active schedule changes,
     * its next execution is recomputed from now.
     */
    public Schedule updateSchedule(String ownerId, String id, ScheduleUpdate update) {
        return mutate(ownerId, id, schedule -> {
            if (update.getName() != null) {
                schedule.setName(update.getName().trim());
            }
            if (update.getCronExpression() != null) {
                schedule.setCronExpression(hasText(update.getCronExpression())
                        ? update.getCronExpression().trim()
                        : null);
            }
            if (update.getTimezone() != null) {
                schedule.setTimezone(hasText(update.getTimezone())
                        ? update.getTimezone().trim()
                        : properties.getSchedules().getDefaultTimezone());
            }
            if (update.getScheduledAt() != null) {
                schedule.setScheduledAt(update.getScheduledAt());
            }
            if (update.getSessionTemplate() != null) {
                schedule.setSessionTemplate(copyTemplate(update.getSessionTemplate()));
            }

            validate(schedule);
            if (update.changesTiming() && schedule.getStatus() == ScheduleStatus.ACTIVE) {
                schedule.setNextExecutionAt(firstExecution(schedule, clock.instant()));
            }
            return schedule;
        }, "Updated");
    }

    public void deleteSchedule(String ownerId, String id) {
        getSchedule(ownerId, id);
        if (!scheduleStore.delete(id)) {
            throw new ScheduleNotFoundException(id);
        }
        log.info("[Schedule] Deleted schedule {}", id);
    }

    /**
     * Stop an active schedule from firing. Pausing a paused schedule is a no-op.
     */
    public Schedule pauseSchedule(String ownerId, String id) {
        Schedule current = getSchedule(ownerId, id);
        if (current.getStatus() == ScheduleStatus.PAUSED) {
            return current;
        }
        return mutate(ownerId, id, schedule -> {
            requireStatus(schedule, ScheduleStatus.ACTIVE, "pause");
            schedule.setStatus(ScheduleStatus.PAUSED);
            return schedule;
        }, "Paused");
    }

    /**
     * Resume a paused schedule, recomputing its next execution from now so that
     * occurrences missed while paused are skipped. Resuming an active schedule
     * is a no-op.
     */
    public Schedule resumeSchedule(String ownerId, String id) {
        Schedule current = getSchedule(ownerId, id);
        if (current.getStatus() == ScheduleStatus.ACTIVE) {
            return current;
        }
        return mutate(ownerId, id, schedule -> {
            requireStatus(schedule, ScheduleStatus.PAUSED, "resume");
            activate(schedule);
            return schedule;
        }, "Resumed");
    }

    /**
     * Bring a schedule out of {@code error}: clears the failure count and
     * recomputes the next execution from now.
     */
    public Schedule resetSchedule(String ownerId, String id) {
        return mutate(ownerId, id, schedule -> {
            requireStatus(schedule, ScheduleStatus.ERROR, "reset");
            schedule.setConsecutiveFailureCount(0);
            activate(schedule);
            return schedule;
        }, "Reset");
    }

    /**
     * Start a session for the schedule right now, independent of its timing.
     * The execution is recorded; the next execution and failure count are not
     * touched.
     *
     * @return the recorded execution
     * @throws SessionStartException
     *             if the session manager failed; the failure is recorded first
     */
    public ExecutionRecord triggerSchedule(String ownerId, String id) {
        Schedule schedule = getSchedule(ownerId, id);
        StartSessionRequest request = StartSessionRequest.forSchedule(schedule);

        String sessionId;
        try {
            sessionId = sessionManager.startSession(request);
        } catch (SessionStartException e) {
            log.warn("[Schedule] Manual trigger of schedule {} failed: {}", id, e.getMessage());
            recordManualExecution(ownerId, id, ExecutionRecord.failed(clock.instant(), e.getMessage()));
            throw e;
        }

        ExecutionRecord record = ExecutionRecord.success(clock.instant(), sessionId);
        recordManualExecution(ownerId, id, record);
        log.info("[Schedule] Manually triggered schedule {}, started session {}", id, sessionId);
        return record;
    }

    private void recordManualExecution(String ownerId, String id, ExecutionRecord record) {
        UnaryOperator<Schedule> apply = schedule -> {
            schedule.setLastExecution(record);
            if (ExecutionRecord.STATUS_SUCCESS.equals(record.getStatus())) {
                schedule.setLastExecutionAt(record.getExecutedAt());
                schedule.setExecutionCount(schedule.getExecutionCount() + 1);
            }
            return schedule;
        };
        // The session is already running, so a concurrent edit gets one retry
        // before the record is dropped.
        try {
            mutate(ownerId, id, apply, null);
        } catch (ScheduleConflictException first) {
            try {
                mutate(ownerId, id, apply, null);
            } catch (ScheduleConflictException | ScheduleNotFoundException e) {
                log.warn("[Schedule] Could not record manual execution of schedule {}: {}", id, e.getMessage());
            }
        } catch (ScheduleNotFoundException e) {
            log.warn("[Schedule] Schedule {} deleted before its manual execution was recorded", id);
        }
    }

    private Schedule mutate(String ownerId, String id, UnaryOperator<Schedule> change, String action) {
        Schedule current = getSchedule(ownerId, id);
        Schedule changed = change.apply(current.toBuilder().build());
        changed.setUpdatedAt(clock.instant());
        Schedule saved = scheduleStore.update(changed);
        if (action != null) {
            log.info("[Schedule] {} schedule {} (status {})", action, id, saved.getStatus().value());
        }
        return saved;
    }

    private void activate(Schedule schedule) {
        Instant now = clock.instant();
        schedule.setStatus(ScheduleStatus.ACTIVE);
        schedule.setNextExecutionAt(calculator.computeNext(schedule, now).orElse(null));
        if (schedule.getNextExecutionAt() == null) {
            schedule.setStatus(ScheduleStatus.COMPLETED);
        }
    }

    private Instant firstExecution(Schedule schedule, Instant now) {
        return calculator.computeNext(schedule, now)
                .orElseThrow(() -> new ScheduleValidationException(
                        "Schedule has no future execution: cron expression '"
                                + schedule.getCronExpression() + "' never matches"));
    }

    private static void requireStatus(Schedule schedule, ScheduleStatus expected, String action) {
        if (schedule.getStatus() != expected) {
            throw new ScheduleStateException("Cannot " + action + " schedule " + schedule.getId()
                    + " in status " + schedule.getStatus().value());
        }
    }

    /**
     * Check name, timing and template.
     *
     * @throws ScheduleValidationException
     *             on the first problem found
     */
    void validate(Schedule schedule) {
        if (!hasText(schedule.getName())) {
            throw new ScheduleValidationException("name is required");
        }
        if (schedule.getName().length() > MAX_NAME_LENGTH) {
            throw new ScheduleValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (!schedule.isRecurring() && schedule.getScheduledAt() == null) {
            throw new ScheduleValidationException("either scheduledAt or cronExpression must be set");
        }
        if (schedule.isRecurring()) {
            calculator.validate(schedule.getCronExpression(), schedule.getTimezone());
        } else {
            NextExecutionCalculator.resolveZone(schedule.getTimezone());
        }
        validateTemplate(schedule.getSessionTemplate());
    }

    private static void validateTemplate(SessionTemplate template) {
        if (template == null) {
            return;
        }
        if (template.getEnvironment() != null) {
            for (Map.Entry<String, String> entry : template.getEnvironment().entrySet()) {
                if (entry.getKey() == null || !ENV_NAME.matcher(entry.getKey()).matches()) {
                    throw new ScheduleValidationException(
                            "sessionTemplate.environment: invalid variable name '" + entry.getKey() + "'");
                }
                if (entry.getValue() == null) {
                    throw new ScheduleValidationException(
                            "sessionTemplate.environment: value of " + entry.getKey() + " is null");
                }
            }
        }
        if (template.getTags() != null) {
            for (Map.Entry<String, String> entry : template.getTags().entrySet()) {
                String key = entry.getKey();
                if (!hasText(key) || key.length() > MAX_TAG_KEY_LENGTH) {
                    throw new ScheduleValidationException("sessionTemplate.tags: invalid tag key '" + key
                            + "' (must be 1-" + MAX_TAG_KEY_LENGTH + " characters)");
                }
                if (entry.getValue() == null) {
                    throw new ScheduleValidationException("sessionTemplate.tags: value of " + key + " is null");
                }
            }
        }
    }

    private static SessionTemplate copyTemplate(SessionTemplate template) {
        if (template == null) {
            return new SessionTemplate();
        }
        return SessionTemplate.builder()
                .environment(template.getEnvironment() != null
                        ? new LinkedHashMap<>(template.getEnvironment())
                        : new LinkedHashMap<>())
                .tags(template.getTags() != null ? new LinkedHashMap<>(template.getTags()) : new LinkedHashMap<>())
                .params(template.getParams())
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
