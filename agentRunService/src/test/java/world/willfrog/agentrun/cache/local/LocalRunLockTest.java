package world.willfrog.agentrun.cache.local;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import world.willfrog.agentrun.support.MutableClock;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalRunLockTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private MutableClock clock;
    private LocalRunLock lock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        lock = new LocalRunLock(clock);
    }

    @Test
    void acquire_shouldAdmitOnlyOneOwner() {
        assertTrue(lock.acquire("r1", "a", TTL));
        assertFalse(lock.acquire("r1", "b", TTL));
        assertEquals("a", lock.currentOwner("r1").orElseThrow());
    }

    @Test
    void acquire_shouldSucceedAfterHolderExpires() {
        lock.acquire("r1", "a", TTL);
        clock.advance(TTL);

        assertTrue(lock.currentOwner("r1").isEmpty());
        assertTrue(lock.acquire("r1", "b", TTL));
        assertEquals("b", lock.currentOwner("r1").orElseThrow());
    }

    @Test
    void refresh_shouldExtendOnlyForCurrentOwner() {
        lock.acquire("r1", "a", TTL);
        clock.advance(Duration.ofMinutes(9));

        assertTrue(lock.refresh("r1", "a", TTL));
        assertFalse(lock.refresh("r1", "b", TTL));

        clock.advance(Duration.ofMinutes(9));
        assertEquals("a", lock.currentOwner("r1").orElseThrow());
    }

    @Test
    void refresh_shouldFailOnceLockTakenOver() {
        lock.acquire("r1", "a", TTL);
        clock.advance(TTL);
        lock.acquire("r1", "b", TTL);

        assertFalse(lock.refresh("r1", "a", TTL));
        assertEquals("b", lock.currentOwner("r1").orElseThrow());
    }

    @Test
    void release_shouldDeleteUnconditionally() {
        lock.acquire("r1", "a", TTL);
        lock.release("r1");

        assertTrue(lock.currentOwner("r1").isEmpty());
        assertTrue(lock.acquire("r1", "b", TTL));
    }
}
