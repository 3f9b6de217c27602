package world.willfrog.agentrun.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 挂在工具结果上的计费注解（_credit_info），不属于用户可见输出。
 */
public record CreditInfo(
        String toolName,
        BigDecimal credits,
        Map<String, Object> calculationDetails,
        String dataProviderName,
        String usageType
) {

    public CreditInfo {
        credits = credits == null ? BigDecimal.ZERO : credits;
        calculationDetails = calculationDetails == null ? Map.of() : calculationDetails;
        usageType = usageType == null || usageType.isBlank() ? "tool" : usageType;
    }

    public boolean hasDataProvider() {
        return dataProviderName != null && !dataProviderName.isBlank();
    }
}
