package world.willfrog.agentrun.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.config.AgentCreditProperties;
import world.willfrog.agentrun.model.ReasoningMode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按配置的费率表计算额度：对话按分钟 × 推理档位费率，工具按次，数据源按服务名。
 */
@Component
@RequiredArgsConstructor
public class CreditCalculator {

    public static final String DATA_PROVIDER_TOOL_SUFFIX = "_data_provider";
    public static final String TIER_LOW = "low";
    public static final String TIER_MEDIUM = "medium";
    public static final String TIER_HIGH = "high";

    private static final int SCALE = 4;

    private final AgentCreditProperties properties;

    public CreditCharge conversationCredits(double totalMinutes, ReasoningMode reasoningMode) {
        ReasoningMode mode = reasoningMode == null ? ReasoningMode.NONE : reasoningMode;
        BigDecimal minutes = BigDecimal.valueOf(Math.max(0D, totalMinutes));
        BigDecimal rate = ratePerMinute(mode);
        BigDecimal credits = minutes.multiply(rate).setScale(SCALE, RoundingMode.HALF_UP);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total_minutes", minutes.setScale(SCALE, RoundingMode.HALF_UP));
        details.put("reasoning_mode", mode.wireName());
        details.put("rate_per_minute", rate);
        details.put("credits", credits);
        return new CreditCharge("conversation", credits, details);
    }

    public CreditCharge toolCredits(String toolName) {
        BigDecimal credits = properties.toolCost(toolName);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tool_name", toolName);
        details.put("cost_per_call", credits);
        return new CreditCharge(toolName, credits, details);
    }

    /**
     * 数据源调用按服务名计价，工具名统一为 {provider}_data_provider。
     */
    public CreditCharge dataProviderCredits(String providerName, String route) {
        BigDecimal credits = properties.dataProviderCost(providerName);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("data_provider", providerName);
        if (route != null) {
            details.put("route", route);
        }
        details.put("cost_per_call", credits);
        return new CreditCharge(providerName + DATA_PROVIDER_TOOL_SUFFIX, credits, details);
    }

    public BigDecimal ratePerMinute(ReasoningMode mode) {
        return switch (mode) {
            case HIGH -> properties.getHighRatePerMinute();
            case MEDIUM -> properties.getMediumRatePerMinute();
            case NONE -> properties.getBaseRatePerMinute();
        };
    }

    /**
     * 预估档位：amount &lt; lowBelow 为 low，&lt; mediumBelow 为 medium，否则 high。
     */
    public static String costTier(BigDecimal amount, double lowBelow, double mediumBelow) {
        if (amount.compareTo(BigDecimal.valueOf(lowBelow)) < 0) {
            return TIER_LOW;
        }
        if (amount.compareTo(BigDecimal.valueOf(mediumBelow)) < 0) {
            return TIER_MEDIUM;
        }
        return TIER_HIGH;
    }

    public record CreditCharge(String toolName, BigDecimal credits, Map<String, Object> details) {
    }
}
