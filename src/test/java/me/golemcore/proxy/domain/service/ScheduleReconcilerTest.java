package me.golemcore.proxy.domain.service;

import me.golemcore.proxy.domain.election.LeadershipContext;
import me.golemcore.proxy.domain.exception.ScheduleConflictException;
import me.golemcore.proxy.domain.exception.ScheduleStoreException;
import me.golemcore.proxy.domain.exception.SessionStartException;
import me.golemcore.proxy.domain.model.ExecutionRecord;
import me.golemcore.proxy.domain.model.Schedule;
import me.golemcore.proxy.domain.model.ScheduleStatus;
import me.golemcore.proxy.domain.model.StartSessionRequest;
import me.golemcore.proxy.domain.model.WorkerConfig;
import me.golemcore.proxy.port.outbound.ScheduleStorePort;
import me.golemcore.proxy.port.outbound.SessionManagerPort;
import me.golemcore.proxy.testsupport.InMemoryScheduleStore;
import me.golemcore.proxy.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduleReconcilerTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T09:00:30Z");
    private static final Instant DUE_AT = Instant.parse("2026-02-11T09:00:00Z");
    private static final String CRON_DAILY_9AM = "0 9 * * *";

    private InMemoryScheduleStore store;
    private SessionManagerPort sessionManager;
    private MutableClock clock;
    private LeadershipContext context;
    private ScheduleReconciler reconciler;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        sessionManager = mock(SessionManagerPort.class);
        clock = new MutableClock(FIXED_NOW);
        context = new LeadershipContext("replica-1");
        reconciler = newReconciler(store, WorkerConfig.builder().build());
    }

    @AfterEach
    void tearDown() {
        reconciler.shutdown();
    }

    @Test
    void shouldAdvanceRecurringScheduleAfterSuccessfulTrigger() {
        store.put(recurring("daily"));
        when(sessionManager.startSession(any())).thenReturn("session-1");

        ScheduleReconciler.TickResult result = reconciler.reconcile(context);

        assertEquals(new ScheduleReconciler.TickResult(1, 1, 0, 0), result);
        Schedule stored = store.get("daily").orElseThrow();
        assertEquals(ScheduleStatus.ACTIVE, stored.getStatus());
        assertEquals(Instant.parse("2026-02-12T09:00:00Z"), stored.getNextExecutionAt());
        assertEquals(FIXED_NOW, stored.getLastExecutionAt());
        assertEquals(1, stored.getExecutionCount());
        assertEquals("session-1", stored.getLastExecution().getSessionId());
    }

    @Test
    void shouldCompleteOneTimeScheduleAndNeverTriggerItAgain() {
        store.put(Schedule.builder()
                .id("once")
                .name("once")
                .ownerId("alice")
                .status(ScheduleStatus.ACTIVE)
                .scheduledAt(DUE_AT)
                .nextExecutionAt(DUE_AT)
                .build());
        when(sessionManager.startSession(any())).thenReturn("session-1");

        reconciler.reconcile(context);
        clock.advance(Duration.ofHours(1));
        ScheduleReconciler.TickResult second = reconciler.reconcile(context);

        Schedule stored = store.get("once").orElseThrow();
        assertEquals(ScheduleStatus.COMPLETED, stored.getStatus());
        assertNull(stored.getNextExecutionAt());
        assertEquals(0, second.due());
        assertTrue(store.listDue(clock.instant()).isEmpty());
        verify(sessionManager, times(1)).startSession(any());
    }

    @Test
    void shouldMoveToErrorAfterReachingFailureThresholdKeepingNextExecution() {
        reconciler.shutdown();
        reconciler = newReconciler(store, WorkerConfig.builder().failureThreshold(3).build());
        store.put(recurring("flaky"));
        when(sessionManager.startSession(any())).thenThrow(new SessionStartException("connection refused"));

        for (int i = 0; i < 3; i++) {
            ScheduleReconciler.TickResult result = reconciler.reconcile(context);
            assertEquals(1, result.failed());
            clock.advance(Duration.ofSeconds(30));
        }

        Schedule stored = store.get("flaky").orElseThrow();
        assertEquals(ScheduleStatus.ERROR, stored.getStatus());
        assertEquals(3, stored.getConsecutiveFailureCount());
        assertEquals(DUE_AT, stored.getNextExecutionAt());
        assertEquals(ExecutionRecord.STATUS_FAILED, stored.getLastExecution().getStatus());
        assertEquals("connection refused", stored.getLastExecution().getError());
        assertEquals(0, reconciler.reconcile(context).due());
    }

    @Test
    void shouldStayActiveBelowDefaultFailureThreshold() {
        store.put(recurring("retrying"));
        when(sessionManager.startSession(any())).thenThrow(new SessionStartException("503"));

        for (int i = 0; i < 4; i++) {
            reconciler.reconcile(context);
        }
        assertEquals(ScheduleStatus.ACTIVE, store.get("retrying").orElseThrow().getStatus());

        reconciler.reconcile(context);
        Schedule stored = store.get("retrying").orElseThrow();
        assertEquals(ScheduleStatus.ERROR, stored.getStatus());
        assertEquals(5, stored.getConsecutiveFailureCount());
    }

    @Test
    void shouldResetFailureCountAfterSuccess() {
        store.put(recurring("recovering").toBuilder().consecutiveFailureCount(2).build());
        when(sessionManager.startSession(any())).thenReturn("session-1");

        reconciler.reconcile(context);

        assertEquals(0, store.get("recovering").orElseThrow().getConsecutiveFailureCount());
    }

    @Test
    void shouldRecordTimeoutAsFailure() {
        reconciler.shutdown();
        reconciler = newReconciler(store, WorkerConfig.builder().triggerTimeout(Duration.ofMillis(100)).build());
        store.put(recurring("slow"));
        when(sessionManager.startSession(any())).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return "too-late";
        });

        ScheduleReconciler.TickResult result = reconciler.reconcile(context);

        assertEquals(1, result.failed());
        Schedule stored = store.get("slow").orElseThrow();
        assertEquals(1, stored.getConsecutiveFailureCount());
        assertTrue(stored.getLastExecution().getError().contains("timed out"));
        assertEquals(DUE_AT, stored.getNextExecutionAt());
    }

    @Test
    void shouldRetryOnceOnConflictWhenScheduleIsUnchanged() {
        AtomicBoolean conflictRaised = new AtomicBoolean(false);
        InMemoryScheduleStore conflicting = new InMemoryScheduleStore() {
            @Override
            public synchronized Schedule update(Schedule schedule) {
                if (conflictRaised.compareAndSet(false, true)) {
                    throw new ScheduleConflictException("modified concurrently");
                }
                return super.update(schedule);
            }
        };
        reconciler.shutdown();
        reconciler = newReconciler(conflicting, WorkerConfig.builder().build());
        conflicting.put(recurring("contended"));
        when(sessionManager.startSession(any())).thenReturn("session-1");

        ScheduleReconciler.TickResult result = reconciler.reconcile(context);

        assertEquals(1, result.triggered());
        Schedule stored = conflicting.get("contended").orElseThrow();
        assertEquals(Instant.parse("2026-02-12T09:00:00Z"), stored.getNextExecutionAt());
        assertEquals(1, stored.getExecutionCount());
    }

    @Test
    void shouldDropOutcomeWhenScheduleWasPausedConcurrently() {
        store.put(recurring("paused-meanwhile"));
        when(sessionManager.startSession(any())).thenAnswer(invocation -> {
            Schedule current = store.get("paused-meanwhile").orElseThrow();
            current.setStatus(ScheduleStatus.PAUSED);
            store.update(current);
            return "session-1";
        });

        reconciler.reconcile(context);

        Schedule stored = store.get("paused-meanwhile").orElseThrow();
        assertEquals(ScheduleStatus.PAUSED, stored.getStatus());
        assertEquals(0, stored.getExecutionCount());
        assertEquals(DUE_AT, stored.getNextExecutionAt());
    }

    @Test
    void shouldIgnoreScheduleDeletedWhileTriggering() {
        store.put(recurring("deleted-meanwhile"));
        when(sessionManager.startSession(any())).thenAnswer(invocation -> {
            store.delete("deleted-meanwhile");
            return "session-1";
        });

        ScheduleReconciler.TickResult result = reconciler.reconcile(context);

        assertEquals(1, result.due());
        assertTrue(store.get("deleted-meanwhile").isEmpty());
    }

    @Test
    void shouldAbandonTickWhenStoreIsUnavailable() {
        ScheduleStorePort failingStore = mock(ScheduleStorePort.class);
        when(failingStore.listDue(any())).thenThrow(new ScheduleStoreException("etcd timeout"));
        reconciler.shutdown();
        reconciler = newReconciler(failingStore, WorkerConfig.builder().build());

        ScheduleReconciler.TickResult result = reconciler.reconcile(context);

        assertEquals(0, result.due());
        verify(sessionManager, never()).startSession(any());
    }

    @Test
    void shouldStopTriggeringAfterFirstFailedWrite() {
        InMemoryScheduleStore unwritable = new InMemoryScheduleStore() {
            @Override
            public synchronized Schedule update(Schedule schedule) {
                throw new ScheduleStoreException("etcd leader changed");
            }
        };
        reconciler.shutdown();
        reconciler = newReconciler(unwritable, WorkerConfig.builder().maxParallelTriggers(1).build());
        unwritable.put(recurring("first"));
        unwritable.put(recurring("second"));
        unwritable.put(recurring("third"));
        when(sessionManager.startSession(any())).thenReturn("session-1");

        ScheduleReconciler.TickResult result = reconciler.reconcile(context);

        assertEquals(new ScheduleReconciler.TickResult(3, 0, 0, 3), result);
        verify(sessionManager, times(1)).startSession(any());
    }

    @Test
    void shouldNotTriggerAnythingOnceLeadershipIsCancelled() {
        store.put(recurring("leaderless"));
        context.cancel();

        ScheduleReconciler.TickResult result = reconciler.reconcile(context);

        assertEquals(0, result.due());
        verify(sessionManager, never()).startSession(any());
        assertEquals(DUE_AT, store.get("leaderless").orElseThrow().getNextExecutionAt());
    }

    @Test
    void shouldProcessEveryScheduleIndependently() {
        store.put(recurring("ok"));
        store.put(recurring("broken"));
        when(sessionManager.startSession(any())).thenAnswer(invocation -> {
            StartSessionRequest request = invocation.getArgument(0);
            if ("broken".equals(request.getTags().get("schedule_id"))) {
                throw new SessionStartException("bad template");
            }
            return "session-ok";
        });

        ScheduleReconciler.TickResult result = reconciler.reconcile(context);

        assertEquals(new ScheduleReconciler.TickResult(2, 1, 1, 0), result);
        assertEquals(1, store.get("ok").orElseThrow().getExecutionCount());
        assertEquals(1, store.get("broken").orElseThrow().getConsecutiveFailureCount());
    }

    @Test
    void shouldMoveScheduleWithUnusableCronToError() {
        Schedule broken = recurring("corrupt").toBuilder().cronExpression("not a cron").build();
        ExecutionRecord success = ExecutionRecord.success(FIXED_NOW, "session-1");

        Schedule result = reconciler.applyOutcome(broken, success);

        assertEquals(ScheduleStatus.ERROR, result.getStatus());
    }

    private ScheduleReconciler newReconciler(ScheduleStorePort scheduleStore, WorkerConfig config) {
        return new ScheduleReconciler(scheduleStore, sessionManager, new NextExecutionCalculator(), clock, config);
    }

    private static Schedule recurring(String id) {
        return Schedule.builder()
                .id(id)
                .name(id)
                .ownerId("alice")
                .status(ScheduleStatus.ACTIVE)
                .cronExpression(CRON_DAILY_9AM)
                .timezone("UTC")
                .nextExecutionAt(DUE_AT)
                .createdAt(DUE_AT.minus(Duration.ofDays(1)))
                .build();
    }
}
