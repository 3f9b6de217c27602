package world.willfrog.agentrun.common.pojo.credit;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * 单次 run 的额度消耗明细。
 * <p>
 * 对应表：credit_usage，(agent_run_id, usage_key) 唯一，重复写入会被忽略。
 */
@Data
public class CreditUsage {
    private Long id;
    private String agentRunId;
    /** 同一 run 内的幂等键：conversation / tool:{序号} */
    private String usageKey;
    /** conversation / tool */
    private String usageType;
    private String toolName;
    private String dataProviderName;
    private BigDecimal creditAmount;
    private String calculationDetails; // JSON string
    private OffsetDateTime createdAt;

    public static final String USAGE_TYPE_CONVERSATION = "conversation";

    public static final String USAGE_TYPE_TOOL = "tool";
}
