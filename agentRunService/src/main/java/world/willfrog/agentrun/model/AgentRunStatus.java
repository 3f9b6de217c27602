package world.willfrog.agentrun.model;

import java.util.Locale;
import java.util.Optional;

public enum AgentRunStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    STOPPED("stopped");

    private final String wireName;

    AgentRunStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 写入 agent_runs.status 与 status 事件时使用的小写取值。
     */
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * run 结束时发布到全局控制通道的信号。
     */
    public ControlSignal terminalSignal() {
        return switch (this) {
            case COMPLETED -> ControlSignal.END_STREAM;
            case STOPPED -> ControlSignal.STOP;
            default -> ControlSignal.ERROR;
        };
    }

    public static Optional<AgentRunStatus> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentRunStatus status : values()) {
            if (status.wireName.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
