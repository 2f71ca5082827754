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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the session proxy, bound from
 * application.properties under the {@code proxy.*} prefix:
 * <ul>
 * <li>{@link ScheduleWorkerProperties} - leader election and reconciliation
 * worker</li>
 * <li>{@link StorageProperties} - where schedules and the lease live</li>
 * <li>{@link KubernetesProperties} - cluster connection</li>
 * <li>{@link SessionManagerProperties} - the session provisioning service</li>
 * <li>{@link HttpProperties} - outbound HTTP client timeouts</li>
 * <li>{@link SchedulesProperties} - defaults for new schedules</li>
 * </ul>
 *
 * <p>
 * Durations of the schedule worker are kept as raw strings and resolved by
 * {@link ScheduleWorkerSettings}, which accepts both {@code 1m30s} and
 * {@code PT1M30S} and reports bad values instead of failing startup.
 */
@Component
@ConfigurationProperties(prefix = "proxy")
@Data
public class ProxyProperties {

    private ScheduleWorkerProperties scheduleWorker = new ScheduleWorkerProperties();
    private StorageProperties storage = new StorageProperties();
    private KubernetesProperties kubernetes = new KubernetesProperties();
    private SessionManagerProperties sessionManager = new SessionManagerProperties();
    private HttpProperties http = new HttpProperties();
    private SchedulesProperties schedules = new SchedulesProperties();

    @Data
    public static class ScheduleWorkerProperties {
        private boolean enabled = false;
        private String namespace;
        private String checkInterval;
        private String leaseDuration;
        private String renewDeadline;
        private String retryPeriod;
        private String leaseName;
        private String callTimeout;
        private int failureThreshold = 5;
        private int maxParallelTriggers = 4;
    }

    @Data
    public static class StorageProperties {
        /** {@code local} or {@code kubernetes}. */
        private String backend = "local";
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/session-proxy";
    }

    @Data
    public static class KubernetesProperties {
        private String masterUrl;
        private String sessionNamespace;
    }

    @Data
    public static class SessionManagerProperties {
        private String baseUrl = "http://localhost:8081";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class SchedulesProperties {
        private String defaultTimezone = "UTC";
    }
}
