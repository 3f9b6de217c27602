package world.willfrog.agentrun.common.dao.credit;

import org.apache.ibatis.annotations.*;
import world.willfrog.agentrun.common.pojo.credit.CreditUsage;

import java.math.BigDecimal;
import java.util.List;

@Mapper
public interface CreditUsageDao {

    @Insert("INSERT INTO credit_usage (" +
            "agent_run_id, usage_key, usage_type, tool_name, data_provider_name, credit_amount, calculation_details" +
            ") VALUES (" +
            "#{agentRunId}, #{usageKey}, #{usageType}, #{toolName}, #{dataProviderName}, #{creditAmount}, CAST(#{calculationDetails} AS jsonb)" +
            ") ON CONFLICT (agent_run_id, usage_key) DO NOTHING")
    int insertIgnoreDuplicate(CreditUsage usage);

    @Select("SELECT * FROM credit_usage WHERE agent_run_id = #{agentRunId} ORDER BY id")
    @Results(id = "creditUsageResultMap", value = {
            @Result(property = "id", column = "id"),
            @Result(property = "agentRunId", column = "agent_run_id"),
            @Result(property = "usageKey", column = "usage_key"),
            @Result(property = "usageType", column = "usage_type"),
            @Result(property = "toolName", column = "tool_name"),
            @Result(property = "dataProviderName", column = "data_provider_name"),
            @Result(property = "creditAmount", column = "credit_amount"),
            @Result(property = "calculationDetails", column = "calculation_details"),
            @Result(property = "createdAt", column = "created_at")
    })
    List<CreditUsage> listByRunId(@Param("agentRunId") String agentRunId);

    @Select("SELECT COALESCE(SUM(credit_amount), 0) FROM credit_usage WHERE agent_run_id = #{agentRunId}")
    BigDecimal sumByRunId(@Param("agentRunId") String agentRunId);
}
