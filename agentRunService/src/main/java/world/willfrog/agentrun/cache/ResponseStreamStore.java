package world.willfrog.agentrun.cache;

import world.willfrog.agentrun.model.event.ResponseEvent;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * run 响应事件的追加列表，以及“有新事件”的通知通道。
 */
public interface ResponseStreamStore {

    /**
     * 追加到列表末尾，成功后在通知通道发布 "new"。
     */
    void append(String runId, ResponseEvent event);

    List<ResponseEvent> readAll(String runId);

    /**
     * 从 offset（含）开始读到列表末尾。
     */
    List<ResponseEvent> readFrom(String runId, long offset);

    void expire(String runId, Duration ttl);

    /**
     * 剩余存活时间；没有设置过期或 key 不存在时返回 empty。
     */
    Optional<Duration> timeToLive(String runId);
}
