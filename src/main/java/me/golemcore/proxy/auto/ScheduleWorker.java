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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.election.LeaderCallbacks;
import me.golemcore.proxy.domain.election.LeadershipContext;
import me.golemcore.proxy.domain.service.ScheduleReconciler;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tick loop of the reconciliation worker. Runs only between
 * {@link #onStartedLeading(LeadershipContext)} and the cancellation of that
 * context: the first tick runs immediately, then every check interval. A tick
 * that is still running when the next one is due causes that one to be skipped.
 *
 * <p>
 * {@link #onStoppedLeading()} returns only once the in-flight tick has finished
 * or {@code drainTimeout} has passed, so that the lease is not released while
 * a started session still waits to be recorded.
 */
@Slf4j
public class ScheduleWorker implements LeaderCallbacks {

    private final ScheduleReconciler reconciler;
    private final Duration checkInterval;
    private final Duration drainTimeout;
    private final ReentrantLock tickLock = new ReentrantLock();
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> tickTask;
    private volatile LeadershipContext context;

    public ScheduleWorker(ScheduleReconciler reconciler, Duration checkInterval, Duration drainTimeout) {
        this.reconciler = reconciler;
        this.checkInterval = checkInterval;
        this.drainTimeout = drainTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "schedule-worker");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void onStartedLeading(LeadershipContext leadership) {
        stopTicking();
        context = leadership;
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, 0, checkInterval.toMillis(),
                TimeUnit.MILLISECONDS);
        leadership.onCancel(this::stopTicking);
        log.info("[ScheduleWorker] Started with check interval {}", checkInterval);
    }

    @Override
    public void onStoppedLeading() {
        stopTicking();
        awaitInFlightTick();
        log.info("[ScheduleWorker] Stopped: leadership ended");
    }

    @Override
    public void onNewLeader(String identity) {
        log.debug("[ScheduleWorker] Schedules are reconciled by {}", identity);
    }

    public boolean isRunning() {
        LeadershipContext current = context;
        return current != null && !current.isCancelled();
    }

    /**
     * Stop ticking and release the worker threads.
     */
    public void shutdown() {
        stopTicking();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        reconciler.shutdown();
    }

    void tick() {
        LeadershipContext current = context;
        if (current == null || current.isCancelled()) {
            return;
        }
        if (!tickLock.tryLock()) {
            log.debug("[ScheduleWorker] Tick skipped: previous tick still in progress");
            return;
        }
        try {
            ScheduleReconciler.TickResult result = reconciler.reconcile(current);
            if (result.due() > 0) {
                log.info("[ScheduleWorker] Tick done: {} due, {} triggered, {} failed, {} abandoned",
                        result.due(), result.triggered(), result.failed(), result.abandoned());
            }
        } catch (RuntimeException e) {
            log.error("[ScheduleWorker] Tick failed", e);
        } finally {
            tickLock.unlock();
        }
    }

    private void awaitInFlightTick() {
        if (tickLock.isHeldByCurrentThread()) {
            return;
        }
        try {
            if (tickLock.tryLock(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                tickLock.unlock();
            } else {
                log.warn("[ScheduleWorker] In-flight tick still running after {}, giving up waiting",
                        drainTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ScheduleWorker] Interrupted while waiting for the in-flight tick");
        }
    }

    private synchronized void stopTicking() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
    }
}
