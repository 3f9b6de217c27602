package world.willfrog.agentrun.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 额度计费费率表。
 * <p>
 * toolCosts / dataProviderCosts 中 key 为 default 的条目作为未登记工具 / 数据源的兜底价。
 */
@Data
@ConfigurationProperties(prefix = "agent.credit")
public class AgentCreditProperties {

    public static final String DEFAULT_KEY = "default";

    /**
     * 未开启思考时每分钟额度
     */
    private BigDecimal baseRatePerMinute = new BigDecimal("1.0");

    private BigDecimal mediumRatePerMinute = new BigDecimal("2.5");

    private BigDecimal highRatePerMinute = new BigDecimal("4.0");

    private Map<String, BigDecimal> toolCosts = new LinkedHashMap<>();

    private Map<String, BigDecimal> dataProviderCosts = new LinkedHashMap<>();

    public BigDecimal toolCost(String toolName) {
        return lookup(toolCosts, toolName, new BigDecimal("0.5"));
    }

    public BigDecimal dataProviderCost(String providerName) {
        return lookup(dataProviderCosts, providerName, new BigDecimal("2.0"));
    }

    private static BigDecimal lookup(Map<String, BigDecimal> table, String key, BigDecimal fallback) {
        if (key != null && table.containsKey(key)) {
            return table.get(key);
        }
        return table.getOrDefault(DEFAULT_KEY, fallback);
    }
}
