package world.willfrog.agentrun.cache.local;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.agentrun.cache.ControlSignalBus;
import world.willfrog.agentrun.cache.ControlSubscription;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 进程内 pub/sub：发布时投递给当时已订阅该通道的所有订阅，没有订阅者的消息直接丢弃。
 */
@Slf4j
public class LocalControlSignalBus implements ControlSignalBus {

    private final Map<String, Set<LocalSubscription>> subscribers = new ConcurrentHashMap<>();

    @Override
    public ControlSubscription subscribe(String... channels) {
        LocalSubscription subscription = new LocalSubscription(List.of(channels));
        for (String channel : channels) {
            subscribers.computeIfAbsent(channel, key -> new CopyOnWriteArraySet<>()).add(subscription);
        }
        return subscription;
    }

    @Override
    public void publish(String channel, String payload) {
        Set<LocalSubscription> targets = subscribers.get(channel);
        if (targets == null || targets.isEmpty()) {
            log.debug("No local subscriber for channel {}", channel);
            return;
        }
        for (LocalSubscription target : targets) {
            target.messages.offer(payload);
        }
    }

    /**
     * 当前未关闭的订阅数量。
     */
    public int openSubscriptionCount() {
        Set<LocalSubscription> open = new HashSet<>();
        subscribers.values().forEach(open::addAll);
        return open.size();
    }

    private final class LocalSubscription implements ControlSubscription {

        private final List<String> channels;
        private final LinkedBlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private LocalSubscription(List<String> channels) {
            this.channels = channels;
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
                for (String channel : channels) {
                    Set<LocalSubscription> set = subscribers.get(channel);
                    if (set != null) {
                        set.remove(this);
                    }
                }
                messages.clear();
            }
        }
    }
}
