package world.willfrog.agentrun.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class AgentRun {
    private String id;
    private String threadId;
    private String projectId;
    /** running / completed / failed / stopped */
    private String status;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private String error;

    // JSON array string
    private String responses;

    private String reasoningMode;
    private Double totalTimeMinutes;
    private BigDecimal conversationCredits;
    private BigDecimal toolCredits;
    private BigDecimal totalCredits;
    private OffsetDateTime finalizedAt;
}
