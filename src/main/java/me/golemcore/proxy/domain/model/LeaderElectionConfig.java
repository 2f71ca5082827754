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
 * Timing of the lease-based leader election.
 *
 * <p>
 * {@code retryPeriod < renewDeadline < leaseDuration} must hold, otherwise a
 * healthy leader could lose the lease before it gets a chance to renew. A
 * renewal reads and then writes the lease, so two lease calls must also fit
 * within {@code renewDeadline}.
 */
@Value
@Builder
public class LeaderElectionConfig {

    public static final String DEFAULT_LEASE_NAME = "agentapi-schedule-worker";
    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(15);
    public static final Duration DEFAULT_RENEW_DEADLINE = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RETRY_PERIOD = Duration.ofSeconds(2);
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(4);

    String leaseName;
    String namespace;
    Duration leaseDuration;
    Duration renewDeadline;
    Duration retryPeriod;
    Duration callTimeout;

    public static LeaderElectionConfig defaults(String namespace) {
        return LeaderElectionConfig.builder()
                .leaseName(DEFAULT_LEASE_NAME)
                .namespace(namespace)
                .leaseDuration(DEFAULT_LEASE_DURATION)
                .renewDeadline(DEFAULT_RENEW_DEADLINE)
                .retryPeriod(DEFAULT_RETRY_PERIOD)
                .callTimeout(DEFAULT_CALL_TIMEOUT)
                .build();
    }

    /**
     * @throws IllegalArgumentException
     *             if a duration is missing or non-positive, or the ordering
     *             invariant is violated
     */
    public LeaderElectionConfig validate() {
        if (leaseName == null || leaseName.isBlank()) {
            throw new IllegalArgumentException("leaseName is required");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        requirePositive("leaseDuration", leaseDuration);
        requirePositive("renewDeadline", renewDeadline);
        requirePositive("retryPeriod", retryPeriod);
        requirePositive("callTimeout", callTimeout);
        if (renewDeadline.compareTo(leaseDuration) >= 0) {
            throw new IllegalArgumentException("renewDeadline (" + renewDeadline
                    + ") must be less than leaseDuration (" + leaseDuration + ")");
        }
        if (retryPeriod.compareTo(renewDeadline) >= 0) {
            throw new IllegalArgumentException("retryPeriod (" + retryPeriod
                    + ") must be less than renewDeadline (" + renewDeadline + ")");
        }
        if (callTimeout.multipliedBy(2).compareTo(renewDeadline) >= 0) {
            throw new IllegalArgumentException("twice the callTimeout (" + callTimeout
                    + ") must be less than renewDeadline (" + renewDeadline + ")");
        }
        return this;
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be a positive duration");
        }
    }
}
