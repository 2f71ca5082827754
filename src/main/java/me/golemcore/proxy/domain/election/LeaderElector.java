package me.golemcore.proxy.domain.election;


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
import me.golemcore.proxy.domain.exception.LeaseException;
import me.golemcore.proxy.domain.model.LeaderElectionConfig;
import me.golemcore.proxy.domain.model.LeaderStatus;
import me.golemcore.proxy.domain.model.LeaseRecord;
import me.golemcore.proxy.port.outbound.LeasePort;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Lease-based leader election over a {@link LeasePort}, with two states:
 * follower and leader.
 *
 * <p>
 * Every {@code retryPeriod} the elector reads the lease. A follower takes it
 * over when it is free, or when the record has not changed for
 * {@code leaseDuration} as measured on this replica's own clock since it first
 * saw that version. Measuring from local observation instead of the holder's
 * timestamp keeps the decision independent of clock offset between replicas.
 *
 * <p>
 * A leader renews on every step. If no renewal succeeds within
 * {@code renewDeadline} of the last successful one, it cancels the current
 * {@link LeadershipContext}, calls {@link LeaderCallbacks#onStoppedLeading()}
 * and becomes follower. {@code renewDeadline < leaseDuration}, so this happens
 * before any other replica may consider the lease expired.
 *
 * <p>
 * The deadline does not depend on lease calls returning: every call made while
 * renewing is bounded by the time left until the deadline, and a timer armed at
 * the deadline demotes the leader even while a step is still blocked.
 *
 * <p>
 * {@link #step()} runs one iteration and is what the background loop started
 * by {@link #start()} calls; tests drive it directly with a controlled clock.
 */
@Slf4j
public class LeaderElector {

    private static final Duration RELEASED_LEASE_DURATION = Duration.ofSeconds(1);

    private final LeasePort leasePort;
    private final LeaderElectionConfig config;
    private final String identity;
    private final LeaderCallbacks callbacks;
    private final Clock clock;

    private LeaseRecord observedRecord;
    private Instant observedTime;
    private String reportedLeader;

    private volatile boolean leader;
    private volatile LeadershipContext context;
    private volatile Instant lastRenewTime;
    private volatile Instant leaderSince;
    private volatile String observedLeader;

    private final Object stateLock = new Object();

    private ScheduledExecutorService loop;
    private volatile ScheduledExecutorService deadlineTimer;
    private ScheduledFuture<?> deadlineTask;
    private ExecutorService callExecutor;

    public LeaderElector(LeasePort leasePort, LeaderElectionConfig config, String identity,
            LeaderCallbacks callbacks, Clock clock) {
        this.leasePort = leasePort;
        this.config = config.validate();
        this.identity = identity;
        this.callbacks = callbacks;
        this.clock = clock;
    }

    /**
     * Identity of this process: host name plus a random suffix, so that two
     * processes on one host never share an identity.
     */
    public static String defaultIdentity() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = System.getenv("HOSTNAME");
        }
        if (host == null || host.isBlank()) {
            host = "unknown";
        }
        return host + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * Start contending for the lease on a background thread.
     */
    public synchronized void start() {
        if (loop != null) {
            return;
        }
        callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "lease-call");
            t.setDaemon(true);
            return t;
        });
        deadlineTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "leader-renew-deadline");
            t.setDaemon(true);
            return t;
        });
        loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "leader-election");
            t.setDaemon(true);
            return t;
        });
        long retryMillis = config.getRetryPeriod().toMillis();
        loop.scheduleWithFixedDelay(this::safeStep, 0, retryMillis, TimeUnit.MILLISECONDS);
        log.info("[LeaderElection] Started as {} for lease {}/{} (lease {}, renew deadline {}, retry {})",
                identity, config.getNamespace(), config.getLeaseName(),
                config.getLeaseDuration(), config.getRenewDeadline(), config.getRetryPeriod());
    }

    /**
     * Stop the loop. A leader cancels its context, reports
     * {@link LeaderCallbacks#onStoppedLeading()} and then releases the lease.
     */
    public void stop() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = loop;
            loop = null;
        }
        if (current != null) {
            current.shutdown();
            try {
                if (!current.awaitTermination(config.getCallTimeout().toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                    current.shutdownNow();
                }
            } catch (InterruptedException e) {
                current.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        synchronized (this) {
            if (leader) {
                demote("shutting down");
                release();
            }
            if (deadlineTimer != null) {
                deadlineTimer.shutdownNow();
                deadlineTimer = null;
            }
            if (callExecutor != null) {
                callExecutor.shutdownNow();
                callExecutor = null;
            }
        }
        log.info("[LeaderElection] Stopped {}", identity);
    }

    /**
     * Run one election iteration: renew if leader, otherwise try to acquire.
     */
    public synchronized void step() {
        Instant now = clock.instant();
        if (leader) {
            Instant deadline = lastRenewTime.plus(config.getRenewDeadline());
            if (!now.isBefore(deadline)) {
                demote("no successful renewal since " + lastRenewTime);
                return;
            }
            if (tryAcquireOrRenew(now, deadline)) {
                renewed(now);
                return;
            }
            if (observedRecord != null && observedRecord.isHeld() && !observedRecord.isHeldBy(identity)) {
                demote("lease is held by " + observedRecord.getHolderIdentity());
            } else if (!clock.instant().isBefore(deadline)) {
                demote("no successful renewal since " + lastRenewTime);
            }
            return;
        }
        if (tryAcquireOrRenew(now, null)) {
            promote(now);
        }
    }

    public boolean isLeader() {
        return leader;
    }

    public String getIdentity() {
        return identity;
    }

    public LeaderStatus status() {
        return LeaderStatus.builder()
                .workerEnabled(true)
                .identity(identity)
                .leader(leader)
                .observedLeader(observedLeader)
                .leaderSince(leader ? leaderSince : null)
                .lastRenewTime(leader ? lastRenewTime : null)
                .build();
    }

    private void safeStep() {
        try {
            step();
        } catch (RuntimeException e) {
            log.error("[LeaderElection] Election step failed", e);
        }
    }

    /**
     * @param deadline
     *            instant by which every lease call must have returned, or
     *            {@code null} when not renewing
     */
    private boolean tryAcquireOrRenew(Instant now, Instant deadline) {
        Optional<LeaseRecord> existing;
        try {
            existing = call(() -> leasePort.get(config.getNamespace(), config.getLeaseName()), deadline);
        } catch (LeaseException e) {
            log.warn("[LeaderElection] Failed to read lease {}: {}", config.getLeaseName(), e.getMessage());
            return false;
        }

        if (existing.isEmpty()) {
            LeaseRecord fresh = LeaseRecord.builder()
                    .name(config.getLeaseName())
                    .holderIdentity(identity)
                    .leaseDuration(config.getLeaseDuration())
                    .acquireTime(now)
                    .renewTime(now)
                    .leaseTransitions(0)
                    .build();
            return write(() -> leasePort.create(config.getNamespace(), fresh), now, deadline, "create");
        }

        LeaseRecord current = existing.get();
        observe(current, now);

        if (current.isHeld() && !current.isHeldBy(identity) && !isExpired(current, now)) {
            return false;
        }

        LeaseRecord next;
        if (current.isHeldBy(identity)) {
            next = current.toBuilder()
                    .leaseDuration(config.getLeaseDuration())
                    .renewTime(now)
                    .build();
        } else {
            next = current.toBuilder()
                    .holderIdentity(identity)
                    .leaseDuration(config.getLeaseDuration())
                    .acquireTime(now)
                    .renewTime(now)
                    .leaseTransitions(current.getLeaseTransitions() + 1)
                    .build();
        }
        return write(() -> leasePort.update(config.getNamespace(), next), now, deadline, "update");
    }

    private boolean write(Supplier<LeaseRecord> operation, Instant now, Instant deadline, String action) {
        try {
            LeaseRecord written = call(operation, deadline);
            observe(written, now);
            return true;
        } catch (LeaseException e) {
            if (e.isConflict()) {
                log.debug("[LeaderElection] Lost race on lease {} {}", action, config.getLeaseName());
            } else {
                log.warn("[LeaderElection] Failed to {} lease {}: {}", action, config.getLeaseName(),
                        e.getMessage());
            }
            return false;
        }
    }

    private boolean isExpired(LeaseRecord record, Instant now) {
        Duration duration = record.getLeaseDuration() != null
                ? record.getLeaseDuration()
                : config.getLeaseDuration();
        return !observedTime.plus(duration).isAfter(now);
    }

    private void observe(LeaseRecord record, Instant now) {
        if (!record.equals(observedRecord)) {
            observedRecord = record;
            observedTime = now;
        }
        observedLeader = record.isHeld() ? record.getHolderIdentity() : null;
        if (record.isHeld() && !record.isHeldBy(identity) && !record.getHolderIdentity().equals(reportedLeader)) {
            reportedLeader = record.getHolderIdentity();
            log.info("[LeaderElection] Observed new leader {}", reportedLeader);
            try {
                callbacks.onNewLeader(reportedLeader);
            } catch (RuntimeException e) {
                log.warn("[LeaderElection] onNewLeader callback failed", e);
            }
        }
    }

    private void promote(Instant now) {
        LeadershipContext term = new LeadershipContext(identity);
        synchronized (stateLock) {
            leader = true;
            leaderSince = now;
            lastRenewTime = now;
            reportedLeader = identity;
            context = term;
            armDeadline();
        }
        log.info("[LeaderElection] {} became leader of {}/{}", identity, config.getNamespace(),
                config.getLeaseName());
        try {
            callbacks.onStartedLeading(term);
        } catch (RuntimeException e) {
            log.error("[LeaderElection] onStartedLeading callback failed", e);
        }
    }

    private void renewed(Instant now) {
        synchronized (stateLock) {
            // Demoted by the deadline timer while the renewal was in flight.
            if (!leader) {
                return;
            }
            lastRenewTime = now;
            armDeadline();
        }
    }

    private void armDeadline() {
        if (deadlineTask != null) {
            deadlineTask.cancel(false);
            deadlineTask = null;
        }
        ScheduledExecutorService timer = deadlineTimer;
        if (timer == null || timer.isShutdown()) {
            return;
        }
        long delayMillis = Math.max(0, Duration.between(clock.instant(),
                lastRenewTime.plus(config.getRenewDeadline())).toMillis());
        try {
            deadlineTask = timer.schedule(this::checkDeadline, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[LeaderElection] Renew deadline timer already stopped");
        }
    }

    private void checkDeadline() {
        synchronized (stateLock) {
            if (!leader) {
                return;
            }
            if (clock.instant().isBefore(lastRenewTime.plus(config.getRenewDeadline()))) {
                armDeadline();
                return;
            }
            demote("renew deadline passed, last successful renewal at " + lastRenewTime);
        }
    }

    private void demote(String reason) {
        LeadershipContext term;
        synchronized (stateLock) {
            if (!leader) {
                return;
            }
            leader = false;
            term = context;
            context = null;
            if (deadlineTask != null) {
                deadlineTask.cancel(false);
                deadlineTask = null;
            }
            if (term != null) {
                term.cancel();
            }
            log.warn("[LeaderElection] {} stopped leading: {}", identity, reason);
            try {
                callbacks.onStoppedLeading();
            } catch (RuntimeException e) {
                log.error("[LeaderElection] onStoppedLeading callback failed", e);
            }
        }
    }

    private void release() {
        try {
            Optional<LeaseRecord> current = call(() -> leasePort.get(config.getNamespace(), config.getLeaseName()),
                    null);
            if (current.isEmpty() || !current.get().isHeldBy(identity)) {
                return;
            }
            LeaseRecord released = current.get().toBuilder()
                    .holderIdentity("")
                    .leaseDuration(RELEASED_LEASE_DURATION)
                    .renewTime(clock.instant())
                    .build();
            call(() -> leasePort.update(config.getNamespace(), released), null);
            log.info("[LeaderElection] Released lease {}", config.getLeaseName());
        } catch (LeaseException e) {
            log.warn("[LeaderElection] Failed to release lease {}: {}", config.getLeaseName(), e.getMessage());
        }
    }

    /**
     * Run a lease call bounded by the configured call timeout and, when
     * renewing, by the renew deadline. Without a running loop the call runs on
     * the calling thread and a result that arrives after the deadline is
     * discarded.
     */
    private <T> T call(Supplier<T> operation, Instant deadline) {
        long timeoutMillis = config.getCallTimeout().toMillis();
        if (deadline != null) {
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            if (remaining <= 0) {
                throw new LeaseException("Renew deadline passed before lease call", null);
            }
            timeoutMillis = Math.min(timeoutMillis, remaining);
        }
        ExecutorService executor = callExecutor;
        if (executor == null) {
            T result = operation.get();
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                throw new LeaseException("Lease call returned after the renew deadline", null);
            }
            return result;
        }
        CompletableFuture<T> future = CompletableFuture.supplyAsync(operation, executor);
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LeaseException("Lease call timed out after " + timeoutMillis + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LeaseException("Interrupted during lease call", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof LeaseException leaseException) {
                throw leaseException;
            }
            throw new LeaseException("Lease call failed", e.getCause());
        }
    }
}
