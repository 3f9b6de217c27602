package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.cache.ControlSignalBus;
import world.willfrog.agentrun.cache.ControlSubscription;
import world.willfrog.agentrun.cache.ResponseStreamStore;
import world.willfrog.agentrun.config.AgentRunProperties;
import world.willfrog.agentrun.model.ControlSignal;
import world.willfrog.agentrun.model.RunKeys;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.StatusEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 供流式接口使用的实时读取：先订阅通知通道与全局控制通道，再读已有事件，
 * 之后每次被唤醒都把列表新增的尾部读出来（多条通知可能合并为一次唤醒）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunStreamReader {

    private final ResponseStreamStore responseStreamStore;
    private final ControlSignalBus controlSignalBus;
    private final AgentRunProperties properties;
    private final Clock clock;

    /**
     * 阻塞直到 run 结束、出现终态 status 事件或空闲超过 idleTimeout。
     *
     * @return 交给 sink 的事件数量
     */
    public int follow(String runId, Consumer<ResponseEvent> sink, Duration idleTimeout) throws InterruptedException {
        try (ControlSubscription subscription = controlSignalBus.subscribe(
                RunKeys.responseChannel(runId), RunKeys.globalControlChannel(runId))) {
            Cursor cursor = new Cursor();
            if (drain(runId, cursor, sink)) {
                return cursor.delivered;
            }
            Instant idleDeadline = clock.instant().plus(idleTimeout);
            while (clock.instant().isBefore(idleDeadline)) {
                Optional<String> message = subscription.receive(properties.getControlPollInterval());
                if (message.isEmpty()) {
                    continue;
                }
                Optional<ControlSignal> signal = ControlSignal.parse(message.get());
                if (signal.isPresent()) {
                    log.debug("Stream reader received {}: runId={}", signal.get(), runId);
                    drain(runId, cursor, sink);
                    return cursor.delivered;
                }
                if (drain(runId, cursor, sink)) {
                    return cursor.delivered;
                }
                idleDeadline = clock.instant().plus(idleTimeout);
            }
            log.info("Stream reader idle timeout: runId={}, delivered={}", runId, cursor.delivered);
            return cursor.delivered;
        }
    }

    /**
     * 读取 offset 之后的新事件。
     *
     * @return 是否读到了结束 run 的 status 事件
     */
    private boolean drain(String runId, Cursor cursor, Consumer<ResponseEvent> sink) {
        List<ResponseEvent> tail = responseStreamStore.readFrom(runId, cursor.offset);
        boolean ended = false;
        for (ResponseEvent event : tail) {
            cursor.offset++;
            cursor.delivered++;
            sink.accept(event);
            if (event instanceof StatusEvent status
                    && (status.terminalStatus().isPresent() || StatusEvent.STATUS_ERROR.equals(status.status()))) {
                ended = true;
            }
        }
        return ended;
    }

    private static final class Cursor {
        private long offset;
        private int delivered;
    }
}
