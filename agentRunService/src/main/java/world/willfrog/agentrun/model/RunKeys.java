package world.willfrog.agentrun.model;

/**
 * 共享缓存里 run 相关 key 与 channel 的命名约定。
 * <p>
 * 这些名字是跨实例、跨服务的线上契约，外部消费方（API 层、前端流式接口）按同样的名字订阅。
 */
public final class RunKeys {

    private static final String LOCK_PREFIX = "agent_run_lock:";
    private static final String ACTIVE_PREFIX = "active_run:";
    private static final String RUN_PREFIX = "agent_run:";

    private RunKeys() {
    }

    public static String lockKey(String runId) {
        return LOCK_PREFIX + runId;
    }

    public static String activeRunKey(String instanceId, String runId) {
        return ACTIVE_PREFIX + instanceId + ":" + runId;
    }

    /**
     * 匹配任意实例上该 run 的活跃标记。
     */
    public static String activeRunPattern(String runId) {
        return ACTIVE_PREFIX + "*:" + runId;
    }

    public static String responseListKey(String runId) {
        return RUN_PREFIX + runId + ":responses";
    }

    public static String responseChannel(String runId) {
        return RUN_PREFIX + runId + ":new_response";
    }

    public static String instanceControlChannel(String runId, String instanceId) {
        return RUN_PREFIX + runId + ":control:" + instanceId;
    }

    public static String globalControlChannel(String runId) {
        return RUN_PREFIX + runId + ":control";
    }

    /**
     * 从 active_run:{instanceId}:{runId} 中取出实例 ID，格式不符时返回 null。
     */
    public static String instanceIdFromActiveKey(String key, String runId) {
        if (key == null || runId == null) {
            return null;
        }
        String suffix = ":" + runId;
        if (!key.startsWith(ACTIVE_PREFIX) || !key.endsWith(suffix)) {
            return null;
        }
        String instanceId = key.substring(ACTIVE_PREFIX.length(), key.length() - suffix.length());
        return instanceId.isBlank() ? null : instanceId;
    }
}
