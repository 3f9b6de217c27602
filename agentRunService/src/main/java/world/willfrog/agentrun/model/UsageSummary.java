package world.willfrog.agentrun.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * run 结束后的用量与额度汇总，由 finalizer 生成后只读。
 *
 * @param error 非空表示汇总过程中出现异常、额度按 0 记账
 */
public record UsageSummary(
        String agentRunId,
        double totalTimeMinutes,
        ReasoningMode reasoningMode,
        BigDecimal conversationCredits,
        Map<String, BigDecimal> toolCredits,
        Map<String, BigDecimal> dataProviderCredits,
        int toolUsagesSaved,
        int dataProviderCalls,
        BigDecimal totalCredits,
        OffsetDateTime finalizedAt,
        String error
) {

    public UsageSummary {
        conversationCredits = conversationCredits == null ? BigDecimal.ZERO : conversationCredits;
        toolCredits = toolCredits == null ? Map.of() : Map.copyOf(toolCredits);
        dataProviderCredits = dataProviderCredits == null ? Map.of() : Map.copyOf(dataProviderCredits);
        totalCredits = totalCredits == null ? BigDecimal.ZERO : totalCredits;
    }

    public static UsageSummary degraded(String agentRunId,
                                        double totalTimeMinutes,
                                        ReasoningMode reasoningMode,
                                        OffsetDateTime finalizedAt,
                                        String error) {
        return new UsageSummary(agentRunId, totalTimeMinutes, reasoningMode, BigDecimal.ZERO, Map.of(), Map.of(),
                0, 0, BigDecimal.ZERO, finalizedAt, error == null ? "unknown" : error);
    }

    public boolean isDegraded() {
        return error != null;
    }
}
