package me.golemcore.proxy.domain.exception;

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
 * Schedule input is malformed: bad cron expression, unknown timezone, broken
 * session template, or neither/both of recurring and one-time timing given.
 * Rejected at the request boundary and never persisted.
 */
public class ScheduleValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ScheduleValidationException(String message) {
        super(message);
    }

    public ScheduleValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
