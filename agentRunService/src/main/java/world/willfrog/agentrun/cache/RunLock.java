package world.willfrog.agentrun.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * 跨实例的 run 执行锁：记录持有者实例 ID，到期自动失效。
 */
public interface RunLock {

    /**
     * 原子地“不存在才写入”并设置过期时间。
     *
     * @return true 表示本次调用取得了锁
     */
    boolean acquire(String runId, String ownerId, Duration ttl);

    Optional<String> currentOwner(String runId);

    /**
     * 无条件删除锁记录。
     */
    void release(String runId);

    /**
     * 仅当 ownerId 仍是持有者时延长过期时间，不会改写持有者。
     *
     * @return false 表示锁已过期或已被其它实例持有
     */
    boolean refresh(String runId, String ownerId, Duration ttl);
}
