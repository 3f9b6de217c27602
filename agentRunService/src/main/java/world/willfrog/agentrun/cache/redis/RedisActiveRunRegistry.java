package world.willfrog.agentrun.cache.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import world.willfrog.agentrun.cache.ActiveRunRegistry;
import world.willfrog.agentrun.model.RunKeys;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

@RequiredArgsConstructor
public class RedisActiveRunRegistry implements ActiveRunRegistry {

    private static final String RUNNING = "running";

    private final StringRedisTemplate redisTemplate;

    @Override
    public void markActive(String instanceId, String runId, Duration ttl) {
        redisTemplate.opsForValue().set(RunKeys.activeRunKey(instanceId, runId), RUNNING, ttl);
    }

    @Override
    public boolean refresh(String instanceId, String runId, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.expire(RunKeys.activeRunKey(instanceId, runId), ttl));
    }

    @Override
    public void clear(String instanceId, String runId) {
        redisTemplate.delete(RunKeys.activeRunKey(instanceId, runId));
    }

    @Override
    public Set<String> findInstances(String runId) {
        Set<String> keys = redisTemplate.keys(RunKeys.activeRunPattern(runId));
        Set<String> instances = new LinkedHashSet<>();
        if (keys == null) {
            return instances;
        }
        for (String key : keys) {
            String instanceId = RunKeys.instanceIdFromActiveKey(key, runId);
            if (instanceId != null) {
                instances.add(instanceId);
            }
        }
        return instances;
    }
}
