package world.willfrog.agentrun.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface ControlSubscription extends AutoCloseable {

    /**
     * 最多等待 timeout 取下一条消息，超时返回 empty。
     */
    Optional<String> receive(Duration timeout) throws InterruptedException;

    List<String> channels();

    @Override
    void close();
}
