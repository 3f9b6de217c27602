package world.willfrog.agentrun.mapper;

import org.apache.ibatis.annotations.*;
import world.willfrog.agentrun.entity.AgentRun;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface AgentRunMapper {

    @Insert("INSERT INTO agent_runs (id, thread_id, project_id, status, started_at, reasoning_mode, responses) " +
            "VALUES (#{id}, #{threadId}, #{projectId}, #{status}, #{startedAt}, #{reasoningMode}, " +
            "CAST(COALESCE(#{responses,jdbcType=VARCHAR}, '[]') AS jsonb))")
    int insert(AgentRun run);

    @Select("SELECT * FROM agent_runs WHERE id = #{id}")
    @Results(id = "agentRunResultMap", value = {
            @Result(property = "id", column = "id", id = true),
            @Result(property = "threadId", column = "thread_id"),
            @Result(property = "projectId", column = "project_id"),
            @Result(property = "status", column = "status"),
            @Result(property = "startedAt", column = "started_at"),
            @Result(property = "completedAt", column = "completed_at"),
            @Result(property = "error", column = "error"),
            @Result(property = "responses", column = "responses"),
            @Result(property = "reasoningMode", column = "reasoning_mode"),
            @Result(property = "totalTimeMinutes", column = "total_time_minutes"),
            @Result(property = "conversationCredits", column = "conversation_credits"),
            @Result(property = "toolCredits", column = "tool_credits"),
            @Result(property = "totalCredits", column = "total_credits"),
            @Result(property = "finalizedAt", column = "finalized_at")
    })
    AgentRun findById(@Param("id") String id);

    /**
     * 写入 run 的终态。responses 为空时保留已有值。
     */
    @Update("UPDATE agent_runs SET status = #{status}, completed_at = #{completedAt}, error = #{error,jdbcType=VARCHAR}, " +
            "responses = COALESCE(CAST(#{responses,jdbcType=VARCHAR} AS jsonb), responses) " +
            "WHERE id = #{id}")
    int updateTerminal(@Param("id") String id,
                       @Param("status") String status,
                       @Param("completedAt") OffsetDateTime completedAt,
                       @Param("error") String error,
                       @Param("responses") String responses);

    /**
     * 回写用量汇总。只在尚未汇总过时生效，不触碰 status / error。
     */
    @Update("UPDATE agent_runs SET total_time_minutes = #{totalTimeMinutes}, reasoning_mode = #{reasoningMode}, " +
            "conversation_credits = #{conversationCredits}, tool_credits = #{toolCredits}, " +
            "total_credits = #{totalCredits}, finalized_at = #{finalizedAt} " +
            "WHERE id = #{id} AND finalized_at IS NULL")
    int updateUsageTotals(@Param("id") String id,
                          @Param("totalTimeMinutes") double totalTimeMinutes,
                          @Param("reasoningMode") String reasoningMode,
                          @Param("conversationCredits") BigDecimal conversationCredits,
                          @Param("toolCredits") BigDecimal toolCredits,
                          @Param("totalCredits") BigDecimal totalCredits,
                          @Param("finalizedAt") OffsetDateTime finalizedAt);

    /**
     * 已结束但还没有用量汇总的 run，供补录任务使用。
     */
    @Select("SELECT * FROM agent_runs " +
            "WHERE status IN ('completed', 'failed', 'stopped') AND completed_at IS NOT NULL " +
            "AND (total_time_minutes IS NULL OR total_time_minutes = 0) AND finalized_at IS NULL " +
            "ORDER BY completed_at LIMIT #{limit}")
    @ResultMap("agentRunResultMap")
    List<AgentRun> listUnfinalized(@Param("limit") int limit);
}
