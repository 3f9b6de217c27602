package world.willfrog.agentrun.cache;

import java.time.Duration;
import java.util.Set;

/**
 * active_run:{instanceId}:{runId} 活跃标记，供停止请求找到执行实例。
 */
public interface ActiveRunRegistry {

    void markActive(String instanceId, String runId, Duration ttl);

    boolean refresh(String instanceId, String runId, Duration ttl);

    void clear(String instanceId, String runId);

    /**
     * 当前标记为正在执行该 run 的实例 ID。
     */
    Set<String> findInstances(String runId);
}
