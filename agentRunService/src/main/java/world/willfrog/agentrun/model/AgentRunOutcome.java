package world.willfrog.agentrun.model;

/**
 * 一次 coordinator 调用的结果。executed=false 表示锁已被其它实例持有，本次调用未做任何事。
 */
public record AgentRunOutcome(
        String runId,
        boolean executed,
        AgentRunStatus status,
        int relayedEvents,
        String error,
        UsageSummary usage
) {

    public static AgentRunOutcome skipped(String runId) {
        return new AgentRunOutcome(runId, false, null, 0, null, null);
    }
}
