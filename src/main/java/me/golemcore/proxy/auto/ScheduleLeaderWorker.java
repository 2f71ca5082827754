package me.golemcore.proxy.auto;


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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.election.LeaderElector;
import me.golemcore.proxy.domain.model.LeaderElectionConfig;
import me.golemcore.proxy.domain.model.LeaderStatus;
import me.golemcore.proxy.domain.model.WorkerConfig;
import me.golemcore.proxy.domain.service.NextExecutionCalculator;
import me.golemcore.proxy.domain.service.ScheduleReconciler;
import me.golemcore.proxy.infrastructure.config.ScheduleWorkerSettings;
import me.golemcore.proxy.port.outbound.LeasePort;
import me.golemcore.proxy.port.outbound.ScheduleStorePort;
import me.golemcore.proxy.port.outbound.SessionManagerPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Starts the leader election and the reconciliation worker when
 * {@code proxy.schedule-worker.enabled} is set.
 *
 * <p>
 * Invalid lease timings keep the worker from starting; the error is logged and
 * the rest of the proxy keeps serving. On shutdown the worker's context is
 * cancelled first, the in-flight tick is allowed to finish, and only then is the
 * lease released.
 */
@Component
@Slf4j
public class ScheduleLeaderWorker {

    private final ScheduleWorkerSettings settings;
    private final LeasePort leasePort;
    private final ScheduleStorePort scheduleStore;
    private final SessionManagerPort sessionManager;
    private final NextExecutionCalculator calculator;
    private final Clock clock;

    private LeaderElector elector;
    private ScheduleWorker worker;

    public ScheduleLeaderWorker(ScheduleWorkerSettings settings, LeasePort leasePort,
            ScheduleStorePort scheduleStore, SessionManagerPort sessionManager,
            NextExecutionCalculator calculator, Clock clock) {
        this.settings = settings;
        this.leasePort = leasePort;
        this.scheduleStore = scheduleStore;
        this.sessionManager = sessionManager;
        this.calculator = calculator;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("[ScheduleWorker] Schedule worker disabled");
            return;
        }

        LeaderElectionConfig electionConfig;
        try {
            electionConfig = settings.leaderElectionConfig();
        } catch (IllegalArgumentException e) {
            log.error("[ScheduleWorker] Invalid schedule worker configuration, worker not started: {}",
                    e.getMessage());
            return;
        }
        WorkerConfig workerConfig = settings.workerConfig();

        ScheduleReconciler reconciler = new ScheduleReconciler(scheduleStore, sessionManager, calculator, clock,
                workerConfig);
        // Session start, result write and one conflict retry.
        Duration drainTimeout = workerConfig.getTriggerTimeout().multipliedBy(3);
        worker = new ScheduleWorker(reconciler, workerConfig.getCheckInterval(), drainTimeout);
        elector = new LeaderElector(leasePort, electionConfig, LeaderElector.defaultIdentity(), worker, clock);
        elector.start();
    }

    @PreDestroy
    public void shutdown() {
        if (elector != null) {
            elector.stop();
        }
        if (worker != null) {
            worker.shutdown();
        }
        log.info("[ScheduleWorker] Shut down");
    }

    public boolean isStarted() {
        return elector != null;
    }

    /**
     * Election state of this replica.
     */
    public LeaderStatus getStatus() {
        if (elector == null) {
            return LeaderStatus.builder()
                    .workerEnabled(false)
                    .leader(false)
                    .build();
        }
        return elector.status();
    }
}
