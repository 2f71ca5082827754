package me.golemcore.proxy.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user-defined trigger that starts an agent session at a fixed instant
 * (one-time) or on a cron cadence (recurring).
 *
 * <p>
 * A schedule is recurring iff {@link #cronExpression} is non-blank. A one-time
 * schedule requires {@link #scheduledAt}; on a recurring schedule
 * {@code scheduledAt} is a not-before anchor for the first occurrence. All
 * instants are UTC; {@link #timezone} only affects how the cron fields are
 * interpreted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Schedule {

    private String id;
    private String name;
    private String ownerId;
    private ScheduleStatus status;

    private String cronExpression;
    private String timezone;
    private Instant scheduledAt;

    @Builder.Default
    private SessionTemplate sessionTemplate = new SessionTemplate();

    private Instant nextExecutionAt;
    private Instant lastExecutionAt;
    private ExecutionRecord lastExecution;
    private int consecutiveFailureCount;
    private int executionCount;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Store revision this copy was read at. Compared on update.
     */
    private String version;

    @JsonIgnore
    public boolean isRecurring() {
        return cronExpression != null && !cronExpression.isBlank();
    }

    @JsonIgnore
    public boolean isOneTime() {
        return !isRecurring() && scheduledAt != null;
    }

    /**
     * Whether the schedule is active and its next execution is at or before
     * {@code now}.
     */
    @JsonIgnore
    public boolean isDue(Instant now) {
        return status == ScheduleStatus.ACTIVE
                && nextExecutionAt != null
                && !nextExecutionAt.isAfter(now);
    }
}
