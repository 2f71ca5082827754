package me.golemcore.proxy.domain.election;

import me.golemcore.proxy.domain.exception.LeaseException;
import me.golemcore.proxy.domain.model.LeaderElectionConfig;
import me.golemcore.proxy.domain.model.LeaderStatus;
import me.golemcore.proxy.domain.model.LeaseRecord;
import me.golemcore.proxy.port.outbound.LeasePort;
import me.golemcore.proxy.testsupport.InMemoryLeasePort;
import me.golemcore.proxy.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LeaderElectorTest {

    private static final Instant T0 = Instant.parse("2026-02-11T10:00:00Z");
    private static final String NAMESPACE = "agents";
    private static final Duration LEASE_DURATION = Duration.ofSeconds(15);
    private static final Duration RENEW_DEADLINE = Duration.ofSeconds(10);
    private static final Duration RETRY_PERIOD = Duration.ofSeconds(2);

    private InMemoryLeasePort leases;
    private MutableClock clock;
    private LeaderElectionConfig config;

    @BeforeEach
    void setUp() {
        leases = new InMemoryLeasePort();
        clock = new MutableClock(T0);
        config = LeaderElectionConfig.builder()
                .leaseName(LeaderElectionConfig.DEFAULT_LEASE_NAME)
                .namespace(NAMESPACE)
                .leaseDuration(LEASE_DURATION)
                .renewDeadline(RENEW_DEADLINE)
                .retryPeriod(RETRY_PERIOD)
                .callTimeout(Duration.ofSeconds(4))
                .build();
    }

    @Test
    void shouldAcquireFreeLease() {
        RecordingCallbacks callbacks = new RecordingCallbacks();
        LeaderElector elector = new LeaderElector(leases, config, "replica-a", callbacks, clock);

        elector.step();

        assertTrue(elector.isLeader());
        assertEquals(List.of("started"), callbacks.events);
        LeaseRecord lease = currentLease();
        assertEquals("replica-a", lease.getHolderIdentity());
        assertEquals(LEASE_DURATION, lease.getLeaseDuration());
        assertEquals(T0, lease.getAcquireTime());
        assertEquals(0, lease.getLeaseTransitions());
    }

    @Test
    void shouldStayFollowerWhileLeaseIsHeld() {
        RecordingCallbacks followerCallbacks = new RecordingCallbacks();
        LeaderElector leader = new LeaderElector(leases, config, "replica-a", new RecordingCallbacks(), clock);
        LeaderElector follower = new LeaderElector(leases, config, "replica-b", followerCallbacks, clock);

        leader.step();
        follower.step();

        assertTrue(leader.isLeader());
        assertFalse(follower.isLeader());
        assertEquals(List.of("leader:replica-a"), followerCallbacks.events);
        assertEquals("replica-a", follower.status().getObservedLeader());
    }

    @Test
    void shouldRenewOnEveryStepAndKeepFollowerOut() {
        LeaderElector leader = new LeaderElector(leases, config, "replica-a", new RecordingCallbacks(), clock);
        LeaderElector follower = new LeaderElector(leases, config, "replica-b", new RecordingCallbacks(), clock);
        leader.step();

        for (int i = 0; i < 30; i++) {
            clock.advance(RETRY_PERIOD);
            leader.step();
            follower.step();
            assertTrue(leader.isLeader());
            assertFalse(follower.isLeader());
        }

        assertEquals(clock.instant(), currentLease().getRenewTime());
        assertEquals(T0, currentLease().getAcquireTime());
    }

    @Test
    void shouldLetFollowerTakeOverOnlyAfterLeaseDurationSinceLastRenewal() {
        LeaderElector first = new LeaderElector(leases, config, "replica-a", new RecordingCallbacks(), clock);
        RecordingCallbacks secondCallbacks = new RecordingCallbacks();
        LeaderElector second = new LeaderElector(leases, config, "replica-b", secondCallbacks, clock);

        first.step();
        second.step();
        clock.advance(RETRY_PERIOD);
        first.step();
        second.step();
        clock.advance(RETRY_PERIOD);
        first.step();
        second.step();
        Instant lastRenewal = currentLease().getRenewTime();

        // first replica dies here and never steps again
        Instant acquiredAt = null;
        while (acquiredAt == null && clock.instant().isBefore(lastRenewal.plus(Duration.ofMinutes(1)))) {
            clock.advance(RETRY_PERIOD);
            second.step();
            if (second.isLeader()) {
                acquiredAt = clock.instant();
            }
        }

        assertNotNull(acquiredAt);
        assertFalse(acquiredAt.isBefore(lastRenewal.plus(LEASE_DURATION)));
        assertFalse(acquiredAt.isAfter(lastRenewal.plus(LEASE_DURATION).plus(RETRY_PERIOD)));
        assertEquals("replica-b", currentLease().getHolderIdentity());
        assertEquals(1, currentLease().getLeaseTransitions());
        assertEquals(List.of("leader:replica-a", "started"), secondCallbacks.events);
    }

    @Test
    void shouldDemoteWhenRenewalFailsUntilRenewDeadline() {
        PartitionableLeasePort partitionable = new PartitionableLeasePort(leases);
        RecordingCallbacks callbacks = new RecordingCallbacks();
        LeaderElector elector = new LeaderElector(partitionable, config, "replica-a", callbacks, clock);
        elector.step();
        LeadershipContext term = callbacks.contexts.get(0);

        partitionable.partitioned = true;
        for (int i = 0; i < 4; i++) {
            clock.advance(RETRY_PERIOD);
            elector.step();
            assertTrue(elector.isLeader(), "still within renew deadline at " + clock.instant());
        }
        clock.advance(RETRY_PERIOD);
        elector.step();

        assertFalse(elector.isLeader());
        assertTrue(term.isCancelled());
        assertEquals(List.of("started", "stopped"), callbacks.events);
        assertTrue(clock.instant().isBefore(T0.plus(LEASE_DURATION)));
    }

    @Test
    void shouldDemoteImmediatelyWhenAnotherHolderIsObserved() {
        RecordingCallbacks callbacks = new RecordingCallbacks();
        LeaderElector elector = new LeaderElector(leases, config, "replica-a", callbacks, clock);
        elector.step();

        LeaseRecord stolen = currentLease().toBuilder().holderIdentity("intruder").build();
        leases.update(NAMESPACE, stolen);
        clock.advance(RETRY_PERIOD);
        elector.step();

        assertFalse(elector.isLeader());
        assertEquals(List.of("started", "leader:intruder", "stopped"), callbacks.events);
    }

    @Test
    void shouldCancelContextBeforeReportingStoppedLeading() {
        List<Boolean> cancelledWhenStopped = new ArrayList<>();
        List<LeadershipContext> terms = new ArrayList<>();
        LeaderCallbacks callbacks = new LeaderCallbacks() {
            @Override
            public void onStartedLeading(LeadershipContext context) {
                terms.add(context);
            }

            @Override
            public void onStoppedLeading() {
                cancelledWhenStopped.add(terms.get(0).isCancelled());
            }
        };
        LeaderElector elector = new LeaderElector(leases, config, "replica-a", callbacks, clock);
        elector.step();

        elector.stop();

        assertEquals(List.of(true), cancelledWhenStopped);
    }

    @Test
    void shouldReleaseLeaseOnStopSoThatFollowerTakesOverAtOnce() {
        LeaderElector first = new LeaderElector(leases, config, "replica-a", new RecordingCallbacks(), clock);
        LeaderElector second = new LeaderElector(leases, config, "replica-b", new RecordingCallbacks(), clock);
        first.step();
        second.step();

        first.stop();
        LeaseRecord released = currentLease();
        assertFalse(released.isHeld());
        assertEquals(Duration.ofSeconds(1), released.getLeaseDuration());

        clock.advance(RETRY_PERIOD);
        second.step();

        assertTrue(second.isLeader());
        assertFalse(first.isLeader());
    }

    @Test
    void shouldLoseRaceForLeaseWithoutBecomingLeader() {
        LeasePort racing = new LeasePort() {
            @Override
            public Optional<LeaseRecord> get(String namespace, String name) {
                return Optional.empty();
            }

            @Override
            public LeaseRecord create(String namespace, LeaseRecord lease) {
                throw LeaseException.conflict(lease.getName());
            }

            @Override
            public LeaseRecord update(String namespace, LeaseRecord lease) {
                throw LeaseException.conflict(lease.getName());
            }
        };
        RecordingCallbacks callbacks = new RecordingCallbacks();
        LeaderElector elector = new LeaderElector(racing, config, "replica-a", callbacks, clock);

        elector.step();

        assertFalse(elector.isLeader());
        assertTrue(callbacks.events.isEmpty());
    }

    @Test
    void shouldNeverHaveTwoLeadersUnderClockSkewAndPartitions() {
        Duration[] offsets = { Duration.ZERO, Duration.ofSeconds(7), Duration.ofSeconds(-4) };
        List<PartitionableLeasePort> ports = new ArrayList<>();
        List<LeaderElector> electors = new ArrayList<>();
        for (int i = 0; i < offsets.length; i++) {
            PartitionableLeasePort port = new PartitionableLeasePort(leases);
            ports.add(port);
            electors.add(new LeaderElector(port, config, "replica-" + i, new RecordingCallbacks(),
                    Clock.offset(clock, offsets[i])));
        }

        Random random = new Random(42);
        int leaderChanges = 0;
        String lastLeader = null;
        for (int second = 0; second < 600; second++) {
            if (second % 20 == 0) {
                boolean healing = second >= 540;
                for (PartitionableLeasePort port : ports) {
                    port.partitioned = !healing && random.nextInt(4) == 0;
                }
            }
            // replicas step on their own, staggered retry ticks
            for (int i = 0; i < electors.size(); i++) {
                if ((second + i) % RETRY_PERIOD.toSeconds() == 0) {
                    electors.get(i).step();
                }
            }

            List<String> leaders = electors.stream()
                    .filter(LeaderElector::isLeader)
                    .map(LeaderElector::getIdentity)
                    .toList();
            assertTrue(leaders.size() <= 1, "two leaders at second " + second + ": " + leaders);
            if (leaders.size() == 1 && !leaders.get(0).equals(lastLeader)) {
                lastLeader = leaders.get(0);
                leaderChanges++;
            }
            clock.advance(Duration.ofSeconds(1));
        }

        assertTrue(leaderChanges >= 1);
        assertEquals(1, electors.stream().filter(LeaderElector::isLeader).count());
    }

    @Test
    void shouldReportStatus() {
        LeaderElector elector = new LeaderElector(leases, config, "replica-a", new RecordingCallbacks(), clock);
        elector.step();
        clock.advance(RETRY_PERIOD);
        elector.step();

        LeaderStatus status = elector.status();

        assertTrue(status.isWorkerEnabled());
        assertTrue(status.isLeader());
        assertEquals("replica-a", status.getIdentity());
        assertEquals(T0, status.getLeaderSince());
        assertEquals(T0.plus(RETRY_PERIOD), status.getLastRenewTime());
    }

    @Test
    void shouldRejectMisorderedTimings() {
        LeaderElectionConfig invalid = LeaderElectionConfig.builder()
                .leaseName(LeaderElectionConfig.DEFAULT_LEASE_NAME)
                .namespace(NAMESPACE)
                .leaseDuration(LEASE_DURATION)
                .renewDeadline(LEASE_DURATION)
                .retryPeriod(RETRY_PERIOD)
                .callTimeout(Duration.ofSeconds(4))
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> new LeaderElector(leases, invalid, "replica-a", new RecordingCallbacks(), clock));
    }

    @Test
    void shouldRejectCallTimeoutThatDoesNotFitTwiceIntoRenewDeadline() {
        LeaderElectionConfig slowCalls = LeaderElectionConfig.builder()
                .leaseName(LeaderElectionConfig.DEFAULT_LEASE_NAME)
                .namespace(NAMESPACE)
                .leaseDuration(LEASE_DURATION)
                .renewDeadline(RENEW_DEADLINE)
                .retryPeriod(RETRY_PERIOD)
                .callTimeout(Duration.ofSeconds(5))
                .build();
        LeaderElectionConfig missingTimeout = LeaderElectionConfig.builder()
                .leaseName(LeaderElectionConfig.DEFAULT_LEASE_NAME)
                .namespace(NAMESPACE)
                .leaseDuration(LEASE_DURATION)
                .renewDeadline(RENEW_DEADLINE)
                .retryPeriod(RETRY_PERIOD)
                .build();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new LeaderElector(leases, slowCalls, "replica-a", new RecordingCallbacks(), clock));
        assertTrue(ex.getMessage().contains("callTimeout"));
        assertThrows(IllegalArgumentException.class,
                () -> new LeaderElector(leases, missingTimeout, "replica-a", new RecordingCallbacks(), clock));
    }

    @Test
    void shouldDemoteWhenRenewalReturnsAfterRenewDeadline() {
        AtomicBoolean slow = new AtomicBoolean(false);
        LeasePort slowPort = new LeasePort() {
            @Override
            public Optional<LeaseRecord> get(String namespace, String name) {
                if (slow.get()) {
                    clock.advance(Duration.ofSeconds(6));
                }
                return leases.get(namespace, name);
            }

            @Override
            public LeaseRecord create(String namespace, LeaseRecord lease) {
                return leases.create(namespace, lease);
            }

            @Override
            public LeaseRecord update(String namespace, LeaseRecord lease) {
                if (slow.get()) {
                    clock.advance(Duration.ofSeconds(6));
                }
                return leases.update(namespace, lease);
            }
        };
        RecordingCallbacks callbacks = new RecordingCallbacks();
        LeaderElector elector = new LeaderElector(slowPort, config, "replica-a", callbacks, clock);
        elector.step();

        slow.set(true);
        clock.advance(RETRY_PERIOD);
        elector.step();

        assertFalse(elector.isLeader());
        assertTrue(callbacks.contexts.get(0).isCancelled());
        assertEquals(List.of("started", "stopped"), callbacks.events);
    }

    @Test
    void shouldStepDownBeforeFollowerTakesOverWhileLeaseCallsAreSlow() throws InterruptedException {
        LeaderElectionConfig fast = LeaderElectionConfig.builder()
                .leaseName("slow-lease")
                .namespace(NAMESPACE)
                .leaseDuration(Duration.ofMillis(1500))
                .renewDeadline(Duration.ofMillis(1000))
                .retryPeriod(Duration.ofMillis(100))
                .callTimeout(Duration.ofMillis(450))
                .build();
        List<String> timeline = new CopyOnWriteArrayList<>();
        SlowLeasePort slowPort = new SlowLeasePort(leases);
        LeaderElector first = new LeaderElector(slowPort, fast, "replica-a",
                new TimelineCallbacks("replica-a", timeline), Clock.systemUTC());
        LeaderElector second = new LeaderElector(leases, fast, "replica-b",
                new TimelineCallbacks("replica-b", timeline), Clock.systemUTC());
        try {
            first.start();
            awaitCondition(first::isLeader);
            second.start();
            awaitCondition(() -> "replica-a".equals(second.status().getObservedLeader()));

            slowPort.slow = true;
            awaitCondition(second::isLeader);

            assertFalse(first.isLeader());
            int stepDown = timeline.indexOf("replica-a:stopped");
            int takeOver = timeline.indexOf("replica-b:started");
            assertTrue(stepDown >= 0, "first replica never stepped down: " + timeline);
            assertTrue(stepDown < takeOver, "two leaders at the same time: " + timeline);
        } finally {
            first.stop();
            second.stop();
        }
    }

    @Test
    void shouldGenerateDistinctIdentities() {
        String first = LeaderElector.defaultIdentity();
        String second = LeaderElector.defaultIdentity();

        assertTrue(first.matches(".+_[0-9a-f]{8}"), first);
        assertFalse(first.equals(second));
    }

    @Test
    void shouldElectItselfOnBackgroundLoop() throws InterruptedException {
        LeaderElectionConfig fast = LeaderElectionConfig.builder()
                .leaseName("fast-lease")
                .namespace(NAMESPACE)
                .leaseDuration(Duration.ofMillis(900))
                .renewDeadline(Duration.ofMillis(600))
                .retryPeriod(Duration.ofMillis(100))
                .callTimeout(Duration.ofMillis(250))
                .build();
        RecordingCallbacks callbacks = new RecordingCallbacks();
        LeaderElector elector = new LeaderElector(leases, fast, "replica-a", callbacks, Clock.systemUTC());

        elector.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (!elector.isLeader() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(elector.isLeader());
        elector.stop();

        assertFalse(elector.isLeader());
        assertEquals(List.of("started", "stopped"), callbacks.events);
        assertFalse(leases.get(NAMESPACE, "fast-lease").orElseThrow().isHeld());
    }

    private LeaseRecord currentLease() {
        return leases.get(NAMESPACE, LeaderElectionConfig.DEFAULT_LEASE_NAME).orElseThrow();
    }

    private static final class RecordingCallbacks implements LeaderCallbacks {

        private final List<String> events = new CopyOnWriteArrayList<>();
        private final List<LeadershipContext> contexts = new CopyOnWriteArrayList<>();

        @Override
        public void onStartedLeading(LeadershipContext context) {
            contexts.add(context);
            events.add("started");
        }

        @Override
        public void onStoppedLeading() {
            events.add("stopped");
        }

        @Override
        public void onNewLeader(String identity) {
            events.add("leader:" + identity);
        }
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean());
    }

    private static final class TimelineCallbacks implements LeaderCallbacks {

        private final String name;
        private final List<String> timeline;

        private TimelineCallbacks(String name, List<String> timeline) {
            this.name = name;
            this.timeline = timeline;
        }

        @Override
        public void onStartedLeading(LeadershipContext context) {
            timeline.add(name + ":started");
        }

        @Override
        public void onStoppedLeading() {
            timeline.add(name + ":stopped");
        }
    }

    /**
     * Reads answer just within the call timeout and writes never complete.
     */
    private static final class SlowLeasePort implements LeasePort {

        private final LeasePort delegate;
        private volatile boolean slow;

        private SlowLeasePort(LeasePort delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<LeaseRecord> get(String namespace, String name) {
            if (slow) {
                pause(400);
            }
            return delegate.get(namespace, name);
        }

        @Override
        public LeaseRecord create(String namespace, LeaseRecord lease) {
            return delegate.create(namespace, lease);
        }

        @Override
        public LeaseRecord update(String namespace, LeaseRecord lease) {
            if (slow) {
                pause(10_000);
                throw new LeaseException("write never reached the server", null);
            }
            return delegate.update(namespace, lease);
        }

        private static void pause(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LeaseException("interrupted", e);
            }
        }
    }

    private static final class PartitionableLeasePort implements LeasePort {

        private final LeasePort delegate;
        private volatile boolean partitioned;

        private PartitionableLeasePort(LeasePort delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<LeaseRecord> get(String namespace, String name) {
            check();
            return delegate.get(namespace, name);
        }

        @Override
        public LeaseRecord create(String namespace, LeaseRecord lease) {
            check();
            return delegate.create(namespace, lease);
        }

        @Override
        public LeaseRecord update(String namespace, LeaseRecord lease) {
            check();
            return delegate.update(namespace, lease);
        }

        private void check() {
            if (partitioned) {
                throw new LeaseException("connection refused", null);
            }
        }
    }
}
