package world.willfrog.agentrun.cache.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import world.willfrog.agentrun.cache.ResponseStreamStore;
import world.willfrog.agentrun.model.RunKeys;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.ResponseEventCodec;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@RequiredArgsConstructor
public class RedisResponseStreamStore implements ResponseStreamStore {

    public static final String NEW_RESPONSE_PAYLOAD = "new";

    private final StringRedisTemplate redisTemplate;
    private final ResponseEventCodec codec;

    @Override
    public void append(String runId, ResponseEvent event) {
        redisTemplate.opsForList().rightPush(RunKeys.responseListKey(runId), codec.encode(event));
        redisTemplate.convertAndSend(RunKeys.responseChannel(runId), NEW_RESPONSE_PAYLOAD);
    }

    @Override
    public List<ResponseEvent> readAll(String runId) {
        return readFrom(runId, 0);
    }

    @Override
    public List<ResponseEvent> readFrom(String runId, long offset) {
        List<String> raw = redisTemplate.opsForList().range(RunKeys.responseListKey(runId), Math.max(0, offset), -1);
        return codec.decodeAll(raw);
    }

    @Override
    public void expire(String runId, Duration ttl) {
        redisTemplate.expire(RunKeys.responseListKey(runId), ttl);
    }

    @Override
    public Optional<Duration> timeToLive(String runId) {
        Long seconds = redisTemplate.getExpire(RunKeys.responseListKey(runId), TimeUnit.SECONDS);
        if (seconds == null || seconds < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofSeconds(seconds));
    }
}
