package world.willfrog.agentrun.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import world.willfrog.agentrun.cache.ControlSubscription;
import world.willfrog.agentrun.cache.local.LocalActiveRunRegistry;
import world.willfrog.agentrun.cache.local.LocalControlSignalBus;
import world.willfrog.agentrun.cache.local.LocalRunLock;
import world.willfrog.agentrun.model.RunKeys;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StopSignalWatcherTest {

    private static final Duration POLL = Duration.ofMillis(20);
    private static final Duration WAIT = Duration.ofSeconds(2);
    private static final Duration LEASE_TTL = Duration.ofMillis(300);

    private LocalControlSignalBus bus;
    private LocalRunLock lock;
    private LocalActiveRunRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        bus = new LocalControlSignalBus();
        lock = new LocalRunLock(Clock.systemUTC());
        registry = new LocalActiveRunRegistry(Clock.systemUTC());
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void run_shouldRequestStopOnStopSignal() throws Exception {
        lock.acquire("r1", "i1", Duration.ofMinutes(1));
        ControlSubscription subscription = bus.subscribe(
                RunKeys.instanceControlChannel("r1", "i1"), RunKeys.globalControlChannel("r1"));
        StopSignalWatcher watcher = watcher(subscription, Duration.ofMinutes(1));
        executor.execute(watcher);

        bus.publish(RunKeys.globalControlChannel("r1"), "STOP");

        assertTrue(watcher.awaitTermination(WAIT));
        assertTrue(watcher.isStopRequested());
        assertEquals("STOP signal", watcher.getStopReason());
    }

    @Test
    void run_shouldIgnoreOtherSignalsUntilCancelled() throws Exception {
        lock.acquire("r1", "i1", Duration.ofMinutes(1));
        ControlSubscription subscription = bus.subscribe(RunKeys.globalControlChannel("r1"));
        StopSignalWatcher watcher = watcher(subscription, Duration.ofMinutes(1));
        executor.execute(watcher);

        bus.publish(RunKeys.globalControlChannel("r1"), "END_STREAM");
        bus.publish(RunKeys.globalControlChannel("r1"), "garbage");
        Thread.sleep(100);
        assertFalse(watcher.isStopRequested());

        watcher.cancel();
        assertTrue(watcher.awaitTermination(WAIT));
        assertFalse(watcher.isStopRequested());
    }

    @Test
    void run_shouldRefreshLockAndMarkerWhileRunning() throws Exception {
        lock.acquire("r1", "i1", LEASE_TTL);
        registry.markActive("i1", "r1", LEASE_TTL);
        ControlSubscription subscription = bus.subscribe(RunKeys.globalControlChannel("r1"));
        StopSignalWatcher watcher = watcher(subscription, Duration.ofMillis(40));
        executor.execute(watcher);

        Thread.sleep(700);

        assertEquals("i1", lock.currentOwner("r1").orElseThrow());
        assertTrue(registry.findInstances("r1").contains("i1"));
        assertFalse(watcher.isStopRequested());
        watcher.cancel();
        assertTrue(watcher.awaitTermination(WAIT));
    }

    @Test
    void run_shouldRequestStopWhenLockTakenOver() throws Exception {
        lock.acquire("r1", "other", Duration.ofMinutes(1));
        ControlSubscription subscription = bus.subscribe(RunKeys.globalControlChannel("r1"));
        StopSignalWatcher watcher = watcher(subscription, Duration.ofMillis(30));
        executor.execute(watcher);

        assertTrue(watcher.awaitTermination(WAIT));
        assertTrue(watcher.isStopRequested());
        assertEquals("lock lost", watcher.getStopReason());
    }

    @Test
    void run_shouldTreatSubscriptionFailureAsStop() throws Exception {
        ControlSubscription broken = new ControlSubscription() {
            @Override
            public Optional<String> receive(Duration timeout) {
                throw new IllegalStateException("connection reset");
            }

            @Override
            public List<String> channels() {
                return List.of();
            }

            @Override
            public void close() {
            }
        };
        StopSignalWatcher watcher = watcher(broken, Duration.ofMinutes(1));
        executor.execute(watcher);

        assertTrue(watcher.awaitTermination(WAIT));
        assertTrue(watcher.isStopRequested());
    }

    private StopSignalWatcher watcher(ControlSubscription subscription, Duration refreshInterval) {
        return new StopSignalWatcher("r1", "i1", subscription, lock, registry, POLL, refreshInterval,
                LEASE_TTL, Clock.systemUTC());
    }
}
