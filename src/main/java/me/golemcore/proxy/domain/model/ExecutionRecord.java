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
 * Outcome of the most recent attempt to start a session for a schedule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    private Instant executedAt;
    private String sessionId;
    private String status;
    private String error;

    public static ExecutionRecord success(Instant executedAt, String sessionId) {
        return new ExecutionRecord(executedAt, sessionId, STATUS_SUCCESS, null);
    }

    public static ExecutionRecord failed(Instant executedAt, String error) {
        return new ExecutionRecord(executedAt, null, STATUS_FAILED, error);
    }
}
