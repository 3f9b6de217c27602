package world.willfrog.agentrun.producer;

import world.willfrog.agentrun.model.event.ResponseEvent;

import java.util.Iterator;

/**
 * producer 输出的阻塞式事件序列。hasNext / next 可以阻塞直到下一条事件产出；
 * coordinator 在任何结束路径上都会调用 close。
 */
public interface AgentResponseStream extends Iterator<ResponseEvent>, AutoCloseable {

    @Override
    void close();

    static AgentResponseStream of(Iterator<ResponseEvent> events) {
        return of(events, () -> {
        });
    }

    static AgentResponseStream of(Iterator<ResponseEvent> events, Runnable onClose) {
        return new AgentResponseStream() {
            @Override
            public boolean hasNext() {
                return events.hasNext();
            }

            @Override
            public ResponseEvent next() {
                return events.next();
            }

            @Override
            public void close() {
                onClose.run();
            }
        };
    }
}
