package world.willfrog.agentrun.cache.local;

import world.willfrog.agentrun.cache.RunLock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单进程内的执行锁，过期时间按注入的 Clock 判断，行为与 Redis 版一致。
 */
public class LocalRunLock implements RunLock {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalRunLock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean acquire(String runId, String ownerId, Duration ttl) {
        Instant now = clock.instant();
        Entry candidate = new Entry(ownerId, now.plus(ttl));
        Entry result = locks.compute(runId, (key, existing) ->
                existing == null || existing.isExpired(now) ? candidate : existing);
        return result == candidate;
    }

    @Override
    public Optional<String> currentOwner(String runId) {
        Entry entry = locks.get(runId);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.ownerId());
    }

    @Override
    public void release(String runId) {
        locks.remove(runId);
    }

    @Override
    public boolean refresh(String runId, String ownerId, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean refreshed = new AtomicBoolean(false);
        locks.computeIfPresent(runId, (key, existing) -> {
            if (existing.isExpired(now) || !existing.ownerId().equals(ownerId)) {
                return existing;
            }
            refreshed.set(true);
            return new Entry(ownerId, now.plus(ttl));
        });
        return refreshed.get();
    }

    private record Entry(String ownerId, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
