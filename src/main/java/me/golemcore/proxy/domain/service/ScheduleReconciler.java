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
import me.golemcore.proxy.domain.election.LeadershipContext;
import me.golemcore.proxy.domain.exception.ScheduleConflictException;
import me.golemcore.proxy.domain.exception.ScheduleNotFoundException;
import me.golemcore.proxy.domain.exception.ScheduleStoreException;
import me.golemcore.proxy.domain.exception.ScheduleValidationException;
import me.golemcore.proxy.domain.exception.SessionStartException;
import me.golemcore.proxy.domain.model.ExecutionRecord;
import me.golemcore.proxy.domain.model.Schedule;
import me.golemcore.proxy.domain.model.ScheduleStatus;
import me.golemcore.proxy.domain.model.StartSessionRequest;
import me.golemcore.proxy.domain.model.WorkerConfig;
import me.golemcore.proxy.port.outbound.ScheduleStorePort;
import me.golemcore.proxy.port.outbound.SessionManagerPort;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one reconciliation tick: lists due schedules, starts a session for
 * each and writes the outcome back.
 *
 * <p>
 * Due schedules are processed independently on a pool bounded by
 * {@link WorkerConfig#getMaxParallelTriggers()}; every session manager call is
 * bounded by {@link WorkerConfig#getTriggerTimeout()}. On success the schedule
 * advances to its next occurrence, or completes when it has none. On failure
 * the schedule stays due and its failure count grows until
 * {@link WorkerConfig#getFailureThreshold()} moves it to {@code error}.
 *
 * <p>
 * Store failures abandon the tick: after the first one no further session is
 * started, and triggers already running only try to record their result.
 * Nothing is carried over to the next tick.
 */
@Slf4j
public class ScheduleReconciler {

    private final ScheduleStorePort scheduleStore;
    private final SessionManagerPort sessionManager;
    private final NextExecutionCalculator calculator;
    private final Clock clock;
    private final WorkerConfig config;

    private final ExecutorService triggerPool;
    private final ExecutorService callExecutor;

    public ScheduleReconciler(ScheduleStorePort scheduleStore, SessionManagerPort sessionManager,
            NextExecutionCalculator calculator, Clock clock, WorkerConfig config) {
        this.scheduleStore = scheduleStore;
        this.sessionManager = sessionManager;
        this.calculator = calculator;
        this.clock = clock;
        this.config = config;
        AtomicInteger triggerThreads = new AtomicInteger();
        this.triggerPool = Executors.newFixedThreadPool(config.getMaxParallelTriggers(), r -> {
            Thread t = new Thread(r, "schedule-trigger-" + triggerThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "session-start-call");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Outcome counts of one tick.
     */
    public record TickResult(int due, int triggered, int failed, int abandoned) {

        static TickResult empty() {
            return new TickResult(0, 0, 0, 0);
        }
    }

    private enum Outcome {
        TRIGGERED, FAILED, ABANDONED
    }

    /**
     * Process every schedule due now. Stops starting new sessions once
     * {@code context} is cancelled.
     */
    public TickResult reconcile(LeadershipContext context) {
        if (context.isCancelled()) {
            return TickResult.empty();
        }

        List<Schedule> due;
        try {
            due = scheduleStore.listDue(clock.instant());
        } catch (ScheduleStoreException e) {
            log.warn("[ScheduleWorker] Failed to list due schedules, abandoning tick: {}", e.getMessage());
            return TickResult.empty();
        }
        if (due.isEmpty()) {
            return TickResult.empty();
        }
        log.info("[ScheduleWorker] Tick: {} due schedules", due.size());

        AtomicBoolean storeFailed = new AtomicBoolean(false);
        List<CompletableFuture<Outcome>> futures = new ArrayList<>(due.size());
        for (Schedule schedule : due) {
            futures.add(CompletableFuture.supplyAsync(() -> process(schedule, context, storeFailed), triggerPool));
        }

        int triggered = 0;
        int failed = 0;
        int abandoned = 0;
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = awaitOutcome(future);
            switch (outcome) {
            case TRIGGERED -> triggered++;
            case FAILED -> failed++;
            default -> abandoned++;
            }
        }
        return new TickResult(due.size(), triggered, failed, abandoned);
    }

    /**
     * Release the worker threads.
     */
    public void shutdown() {
        triggerPool.shutdownNow();
        callExecutor.shutdownNow();
    }

    private Outcome awaitOutcome(CompletableFuture<Outcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.ABANDONED;
        } catch (ExecutionException e) {
            log.error("[ScheduleWorker] Unexpected error while processing schedule", e.getCause());
            return Outcome.ABANDONED;
        }
    }

    private Outcome process(Schedule schedule, LeadershipContext context, AtomicBoolean storeFailed) {
        if (context.isCancelled()) {
            log.debug("[ScheduleWorker] Leadership lost, not triggering schedule {}", schedule.getId());
            return Outcome.ABANDONED;
        }
        if (storeFailed.get()) {
            log.debug("[ScheduleWorker] Store failed earlier in this tick, not triggering schedule {}",
                    schedule.getId());
            return Outcome.ABANDONED;
        }

        ExecutionRecord record = startSession(schedule);
        boolean success = ExecutionRecord.STATUS_SUCCESS.equals(record.getStatus());
        try {
            persist(schedule, record);
        } catch (ScheduleStoreException e) {
            storeFailed.set(true);
            log.warn("[ScheduleWorker] Failed to store result of schedule {}, abandoning tick: {}",
                    schedule.getId(), e.getMessage());
            return Outcome.ABANDONED;
        }
        return success ? Outcome.TRIGGERED : Outcome.FAILED;
    }

    private ExecutionRecord startSession(Schedule schedule) {
        StartSessionRequest request = StartSessionRequest.forSchedule(schedule);
        CompletableFuture<String> call = CompletableFuture.supplyAsync(
                () -> sessionManager.startSession(request), callExecutor);
        try {
            String sessionId = call.get(config.getTriggerTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.info("[ScheduleWorker] Started session {} for schedule {} ({})",
                    sessionId, schedule.getId(), schedule.getName());
            return ExecutionRecord.success(clock.instant(), sessionId);
        } catch (TimeoutException e) {
            call.cancel(true);
            return failure(schedule, "session start timed out after " + config.getTriggerTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(schedule, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            String message = cause instanceof SessionStartException
                    ? cause.getMessage()
                    : cause.getClass().getSimpleName() + ": " + cause.getMessage();
            return failure(schedule, message);
        }
    }

    private ExecutionRecord failure(Schedule schedule, String message) {
        log.warn("[ScheduleWorker] Failed to start session for schedule {}: {}", schedule.getId(), message);
        return ExecutionRecord.failed(clock.instant(), message);
    }

    /**
     * Write the outcome. A conflict is retried once against a fresh copy if
     * that copy is still active and still due at the same instant.
     */
    private void persist(Schedule schedule, ExecutionRecord record) {
        try {
            scheduleStore.update(applyOutcome(schedule, record));
        } catch (ScheduleConflictException e) {
            Optional<Schedule> fresh = scheduleStore.get(schedule.getId());
            if (fresh.isEmpty()
                    || fresh.get().getStatus() != ScheduleStatus.ACTIVE
                    || !Objects.equals(fresh.get().getNextExecutionAt(), schedule.getNextExecutionAt())) {
                log.info("[ScheduleWorker] Schedule {} changed concurrently, dropping result of this tick",
                        schedule.getId());
                return;
            }
            try {
                scheduleStore.update(applyOutcome(fresh.get(), record));
            } catch (ScheduleConflictException | ScheduleNotFoundException retryFailure) {
                log.info("[ScheduleWorker] Schedule {} changed again, dropping result of this tick",
                        schedule.getId());
            }
        } catch (ScheduleNotFoundException e) {
            log.info("[ScheduleWorker] Schedule {} was deleted while it was being triggered", schedule.getId());
        }
    }

    Schedule applyOutcome(Schedule source, ExecutionRecord record) {
        Schedule schedule = source.toBuilder().build();
        Instant now = record.getExecutedAt();
        schedule.setLastExecution(record);
        schedule.setUpdatedAt(now);

        if (!ExecutionRecord.STATUS_SUCCESS.equals(record.getStatus())) {
            int failures = schedule.getConsecutiveFailureCount() + 1;
            schedule.setConsecutiveFailureCount(failures);
            if (failures >= config.getFailureThreshold()) {
                schedule.setStatus(ScheduleStatus.ERROR);
                log.warn("[ScheduleWorker] Schedule {} moved to error after {} consecutive failures",
                        schedule.getId(), failures);
            }
            return schedule;
        }

        schedule.setLastExecutionAt(now);
        schedule.setConsecutiveFailureCount(0);
        schedule.setExecutionCount(schedule.getExecutionCount() + 1);

        if (!schedule.isRecurring()) {
            complete(schedule);
            return schedule;
        }
        try {
            Optional<Instant> next = calculator.computeNext(schedule, now);
            if (next.isPresent()) {
                schedule.setNextExecutionAt(next.get());
                log.debug("[ScheduleWorker] Next execution of schedule {} at {}", schedule.getId(), next.get());
            } else {
                complete(schedule);
            }
        } catch (ScheduleValidationException e) {
            log.error("[ScheduleWorker] Schedule {} has an unusable cron expression, moving to error: {}",
                    schedule.getId(), e.getMessage());
            schedule.setStatus(ScheduleStatus.ERROR);
        }
        return schedule;
    }

    private static void complete(Schedule schedule) {
        schedule.setStatus(ScheduleStatus.COMPLETED);
        schedule.setNextExecutionAt(null);
        log.info("[ScheduleWorker] Schedule {} completed", schedule.getId());
    }
}
