package world.willfrog.agentrun.cache.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import world.willfrog.agentrun.cache.ControlSubscription;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisControlSignalBusTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private RedisMessageListenerContainer listenerContainer;

    private RedisControlSignalBus bus;

    @BeforeEach
    void setUp() {
        bus = new RedisControlSignalBus(redisTemplate, listenerContainer);
    }

    @Test
    @SuppressWarnings("unchecked")
    void subscribe_shouldQueueMessagesForReceive() throws Exception {
        ControlSubscription subscription = bus.subscribe("agent_run:r1:control:i1", "agent_run:r1:control");

        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        ArgumentCaptor<Collection<? extends Topic>> topics = ArgumentCaptor.forClass(Collection.class);
        verify(listenerContainer).addMessageListener(listener.capture(), topics.capture());
        assertEquals(2, topics.getValue().size());
        assertEquals(List.of("agent_run:r1:control:i1", "agent_run:r1:control"), subscription.channels());

        listener.getValue().onMessage(message("agent_run:r1:control", "STOP"), null);

        assertEquals("STOP", subscription.receive(Duration.ofMillis(100)).orElseThrow());
        assertTrue(subscription.receive(Duration.ofMillis(10)).isEmpty());
    }

    @Test
    void close_shouldRemoveListenerAndIgnoreLateMessages() throws Exception {
        ControlSubscription subscription = bus.subscribe("agent_run:r1:control");
        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(listenerContainer).addMessageListener(listener.capture(), anyCollection());

        subscription.close();
        listener.getValue().onMessage(message("agent_run:r1:control", "STOP"), null);

        verify(listenerContainer).removeMessageListener(same(listener.getValue()), anyCollection());
        assertTrue(subscription.receive(Duration.ofMillis(10)).isEmpty());
    }

    @Test
    void publish_shouldConvertAndSend() {
        bus.publish("agent_run:r1:control", "STOP");

        verify(redisTemplate).convertAndSend("agent_run:r1:control", "STOP");
    }

    private DefaultMessage message(String channel, String body) {
        return new DefaultMessage(channel.getBytes(StandardCharsets.UTF_8), body.getBytes(StandardCharsets.UTF_8));
    }
}
