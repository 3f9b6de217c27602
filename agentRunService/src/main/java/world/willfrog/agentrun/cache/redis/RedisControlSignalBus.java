package world.willfrog.agentrun.cache.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import world.willfrog.agentrun.cache.ControlSignalBus;
import world.willfrog.agentrun.cache.ControlSubscription;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 Redis pub/sub 的控制通道。所有订阅共用一个 listener container 连接，
 * 每个订阅把收到的消息放进自己的队列，由调用方按超时拉取。
 */
@RequiredArgsConstructor
@Slf4j
public class RedisControlSignalBus implements ControlSignalBus {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;

    @Override
    public ControlSubscription subscribe(String... channels) {
        List<Topic> topics = new ArrayList<>(channels.length);
        for (String channel : channels) {
            topics.add(new ChannelTopic(channel));
        }
        QueueSubscription subscription = new QueueSubscription(List.of(channels), topics);
        listenerContainer.addMessageListener(subscription, topics);
        log.debug("Subscribed control channels: {}", subscription.channels());
        return subscription;
    }

    @Override
    public void publish(String channel, String payload) {
        redisTemplate.convertAndSend(channel, payload);
    }

    private final class QueueSubscription implements ControlSubscription, MessageListener {

        private final List<String> channels;
        private final List<Topic> topics;
        private final LinkedBlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private QueueSubscription(List<String> channels, List<Topic> topics) {
            this.channels = channels;
            this.topics = topics;
        }

        @Override
        public void onMessage(Message message, byte[] pattern) {
            if (!closed.get()) {
                messages.offer(new String(message.getBody(), StandardCharsets.UTF_8));
            }
        }

        @Override
        public Optional<String> receive(Duration timeout) throws InterruptedException {
            return Optional.ofNullable(messages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        @Override
        public List<String> channels() {
            return channels;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                listenerContainer.removeMessageListener(this, topics);
                messages.clear();
            }
        }
    }
}
