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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update of a schedule. {@code null} fields are left unchanged; an
 * empty {@code cronExpression} turns a recurring schedule into a one-time one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleUpdate {
    private String name;
    private String cronExpression;
    private String timezone;
    private Instant scheduledAt;
    private SessionTemplate sessionTemplate;

    public boolean changesTiming() {
        return cronExpression != null || timezone != null || scheduledAt != null;
    }
}
