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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.LeaderElectionConfig;
import me.golemcore.proxy.domain.model.WorkerConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Resolves {@code proxy.schedule-worker.*} into validated
 * {@link WorkerConfig} and {@link LeaderElectionConfig} values.
 *
 * <p>
 * A missing or unparsable check interval falls back to its default. Lease
 * timings are stricter: a value that does not parse, or a set of values that
 * breaks {@code retryPeriod < renewDeadline < leaseDuration}, is rejected so
 * that the worker never runs with an unsafe election.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleWorkerSettings {

    static final String DEFAULT_NAMESPACE = "default";

    private final ProxyProperties properties;

    public boolean isEnabled() {
        return properties.getScheduleWorker().isEnabled();
    }

    /**
     * Namespace holding schedules and the lease: the worker's own setting, then
     * the session namespace, then {@code default}.
     */
    public String resolveNamespace() {
        String namespace = properties.getScheduleWorker().getNamespace();
        if (hasText(namespace)) {
            return namespace.trim();
        }
        String sessionNamespace = properties.getKubernetes().getSessionNamespace();
        if (hasText(sessionNamespace)) {
            return sessionNamespace.trim();
        }
        return DEFAULT_NAMESPACE;
    }

    public WorkerConfig workerConfig() {
        ProxyProperties.ScheduleWorkerProperties worker = properties.getScheduleWorker();
        return WorkerConfig.builder()
                .enabled(worker.isEnabled())
                .checkInterval(resolveCheckInterval(worker.getCheckInterval()))
                .failureThreshold(positiveOrDefault("failure-threshold", worker.getFailureThreshold(),
                        WorkerConfig.DEFAULT_FAILURE_THRESHOLD))
                .maxParallelTriggers(positiveOrDefault("max-parallel-triggers", worker.getMaxParallelTriggers(),
                        WorkerConfig.DEFAULT_MAX_PARALLEL_TRIGGERS))
                .triggerTimeout(resolveCallTimeout())
                .build();
    }

    /**
     * @throws IllegalArgumentException
     *             if a lease timing does not parse or the timings are
     *             mis-ordered
     */
    public LeaderElectionConfig leaderElectionConfig() {
        ProxyProperties.ScheduleWorkerProperties worker = properties.getScheduleWorker();
        String leaseName = hasText(worker.getLeaseName())
                ? worker.getLeaseName().trim()
                : LeaderElectionConfig.DEFAULT_LEASE_NAME;

        return LeaderElectionConfig.builder()
                .leaseName(leaseName)
                .namespace(resolveNamespace())
                .leaseDuration(parseStrict("lease-duration", worker.getLeaseDuration(),
                        LeaderElectionConfig.DEFAULT_LEASE_DURATION))
                .renewDeadline(parseStrict("renew-deadline", worker.getRenewDeadline(),
                        LeaderElectionConfig.DEFAULT_RENEW_DEADLINE))
                .retryPeriod(parseStrict("retry-period", worker.getRetryPeriod(),
                        LeaderElectionConfig.DEFAULT_RETRY_PERIOD))
                .callTimeout(resolveCallTimeout())
                .build()
                .validate();
    }

    private Duration resolveCheckInterval(String raw) {
        if (!hasText(raw)) {
            return WorkerConfig.DEFAULT_CHECK_INTERVAL;
        }
        try {
            Duration interval = DurationParser.parse(raw);
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("must be positive");
            }
            return interval;
        } catch (IllegalArgumentException e) {
            log.warn("[ScheduleWorker] Invalid check-interval '{}', using default {}: {}",
                    raw, WorkerConfig.DEFAULT_CHECK_INTERVAL, e.getMessage());
            return WorkerConfig.DEFAULT_CHECK_INTERVAL;
        }
    }

    private Duration resolveCallTimeout() {
        String raw = properties.getScheduleWorker().getCallTimeout();
        if (!hasText(raw)) {
            return LeaderElectionConfig.DEFAULT_CALL_TIMEOUT;
        }
        try {
            Duration timeout = DurationParser.parse(raw);
            if (!timeout.isZero() && !timeout.isNegative()) {
                return timeout;
            }
        } catch (IllegalArgumentException e) {
            log.debug("[ScheduleWorker] Unparsable call-timeout: {}", e.getMessage());
        }
        log.warn("[ScheduleWorker] Invalid call-timeout '{}', using default {}",
                raw, LeaderElectionConfig.DEFAULT_CALL_TIMEOUT);
        return LeaderElectionConfig.DEFAULT_CALL_TIMEOUT;
    }

    private static Duration parseStrict(String key, String raw, Duration defaultValue) {
        if (!hasText(raw)) {
            return defaultValue;
        }
        try {
            return DurationParser.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "proxy.schedule-worker." + key + " is not a valid duration: '" + raw + "'", e);
        }
    }

    private static int positiveOrDefault(String key, int value, int defaultValue) {
        if (value > 0) {
            return value;
        }
        log.warn("[ScheduleWorker] proxy.schedule-worker.{} must be positive, using default {}", key, defaultValue);
        return defaultValue;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
