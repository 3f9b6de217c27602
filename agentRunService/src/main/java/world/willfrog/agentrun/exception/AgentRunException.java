package world.willfrog.agentrun.exception;

/**
 * run 协调过程中的失败，携带 run ID 便于日志关联。
 */
public class AgentRunException extends RuntimeException {

    private final String runId;

    public AgentRunException(String runId, String message) {
        super(message);
        this.runId = runId;
    }

    public AgentRunException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
