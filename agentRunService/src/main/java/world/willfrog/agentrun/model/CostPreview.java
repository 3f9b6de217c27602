package world.willfrog.agentrun.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * run 开始前的额度预估。
 *
 * @param breakdown 每项预估额度，key 为 conversation / 工具名 / {provider}_data_provider
 * @param tiers     conversation / tools / data_providers 三项各自的 low / medium / high 档位
 */
public record CostPreview(
        ReasoningMode reasoningMode,
        double estimatedMinutes,
        BigDecimal conversationCredits,
        BigDecimal toolCredits,
        BigDecimal dataProviderCredits,
        BigDecimal totalEstimatedCredits,
        Map<String, BigDecimal> breakdown,
        Map<String, String> tiers
) {
}
