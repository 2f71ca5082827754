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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Settings of the reconciliation worker.
 */
@Value
@Builder
public class WorkerConfig {

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_MAX_PARALLEL_TRIGGERS = 4;

    boolean enabled;

    @Builder.Default
    Duration checkInterval = DEFAULT_CHECK_INTERVAL;

    /** Consecutive trigger failures after which a schedule moves to error. */
    @Builder.Default
    int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

    @Builder.Default
    int maxParallelTriggers = DEFAULT_MAX_PARALLEL_TRIGGERS;

    /** Upper bound for a single session manager call. */
    @Builder.Default
    Duration triggerTimeout = LeaderElectionConfig.DEFAULT_CALL_TIMEOUT;
}
