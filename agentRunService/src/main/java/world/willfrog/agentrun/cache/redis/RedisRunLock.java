package world.willfrog.agentrun.cache.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import world.willfrog.agentrun.cache.RunLock;
import world.willfrog.agentrun.model.RunKeys;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@RequiredArgsConstructor
@Slf4j
public class RedisRunLock implements RunLock {

    /**
     * 持有者一致才续期，返回 1 / 0。
     */
    static final RedisScript<Long> REFRESH_IF_OWNER = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('pexpire', KEYS[1], ARGV[2]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean acquire(String runId, String ownerId, Duration ttl) {
        Boolean created = redisTemplate.opsForValue().setIfAbsent(RunKeys.lockKey(runId), ownerId, ttl);
        return Boolean.TRUE.equals(created);
    }

    @Override
    public Optional<String> currentOwner(String runId) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(RunKeys.lockKey(runId)));
    }

    @Override
    public void release(String runId) {
        redisTemplate.delete(RunKeys.lockKey(runId));
    }

    @Override
    public boolean refresh(String runId, String ownerId, Duration ttl) {
        Long result = redisTemplate.execute(REFRESH_IF_OWNER,
                List.of(RunKeys.lockKey(runId)),
                ownerId,
                String.valueOf(ttl.toMillis()));
        boolean refreshed = result != null && result == 1L;
        if (!refreshed) {
            log.debug("Lock refresh rejected: runId={}, owner={}", runId, ownerId);
        }
        return refreshed;
    }
}
