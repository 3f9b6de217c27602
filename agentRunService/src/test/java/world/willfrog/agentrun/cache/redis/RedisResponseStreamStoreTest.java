package world.willfrog.agentrun.cache.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import world.willfrog.agentrun.model.event.AssistantEvent;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.ResponseEventCodec;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisResponseStreamStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ListOperations<String, String> listOperations;

    private RedisResponseStreamStore store;

    @BeforeEach
    void setUp() {
        store = new RedisResponseStreamStore(redisTemplate, new ResponseEventCodec(new ObjectMapper()));
    }

    @Test
    void append_shouldPushBeforeNotifying() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);

        store.append("r1", AssistantEvent.ofText("hi"));

        InOrder order = inOrder(listOperations, redisTemplate);
        order.verify(listOperations).rightPush("agent_run:r1:responses", "{\"type\":\"assistant\",\"content\":\"hi\"}");
        order.verify(redisTemplate).convertAndSend("agent_run:r1:new_response", "new");
    }

    @Test
    void readFrom_shouldRangeFromOffsetToEnd() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.range("agent_run:r1:responses", 2, -1))
                .thenReturn(List.of("{\"type\":\"assistant\",\"content\":\"c\"}"));

        List<ResponseEvent> events = store.readFrom("r1", 2);

        assertEquals(1, events.size());
        assertEquals("c", events.get(0).payload().path("content").asText());
    }

    @Test
    void expire_shouldSetTtlOnList() {
        store.expire("r1", Duration.ofHours(24));

        verify(redisTemplate).expire("agent_run:r1:responses", Duration.ofHours(24));
    }

    @Test
    void timeToLive_shouldBeEmptyWithoutExpiry() {
        when(redisTemplate.getExpire("agent_run:r1:responses", TimeUnit.SECONDS)).thenReturn(-1L);

        assertTrue(store.timeToLive("r1").isEmpty());
    }
}
