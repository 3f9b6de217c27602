package world.willfrog.agentrun.cache.local;

import world.willfrog.agentrun.cache.ControlSignalBus;
import world.willfrog.agentrun.cache.ResponseStreamStore;
import world.willfrog.agentrun.model.RunKeys;
import world.willfrog.agentrun.model.event.ResponseEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内响应列表，新事件通知走同一进程的 {@link ControlSignalBus}。
 */
public class LocalResponseStreamStore implements ResponseStreamStore {

    private final Map<String, Stream> streams = new ConcurrentHashMap<>();
    private final ControlSignalBus notificationBus;
    private final Clock clock;

    public LocalResponseStreamStore(ControlSignalBus notificationBus, Clock clock) {
        this.notificationBus = notificationBus;
        this.clock = clock;
    }

    @Override
    public void append(String runId, ResponseEvent event) {
        Stream stream = streams.compute(runId, (key, existing) ->
                existing == null || existing.isExpired(clock.instant()) ? new Stream() : existing);
        synchronized (stream) {
            stream.events.add(event);
        }
        notificationBus.publish(RunKeys.responseChannel(runId), "new");
    }

    @Override
    public List<ResponseEvent> readAll(String runId) {
        return readFrom(runId, 0);
    }

    @Override
    public List<ResponseEvent> readFrom(String runId, long offset) {
        Stream stream = live(runId);
        if (stream == null) {
            return List.of();
        }
        synchronized (stream) {
            int from = (int) Math.min(Math.max(0, offset), stream.events.size());
            return new ArrayList<>(stream.events.subList(from, stream.events.size()));
        }
    }

    @Override
    public void expire(String runId, Duration ttl) {
        Stream stream = live(runId);
        if (stream != null) {
            stream.expiresAt = clock.instant().plus(ttl);
        }
    }

    @Override
    public Optional<Duration> timeToLive(String runId) {
        Stream stream = live(runId);
        if (stream == null || stream.expiresAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(clock.instant(), stream.expiresAt));
    }

    private Stream live(String runId) {
        Stream stream = streams.get(runId);
        if (stream != null && stream.isExpired(clock.instant())) {
            streams.remove(runId, stream);
            return null;
        }
        return stream;
    }

    private static final class Stream {
        private final List<ResponseEvent> events = new ArrayList<>();
        private volatile Instant expiresAt;

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
