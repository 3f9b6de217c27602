package world.willfrog.agentrun.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 投递到 agent_run_task 的执行请求。
 * <p>
 * 字段名与提交方约定为 snake_case；instanceId 只作为提交方的提示，
 * 实际持有 run 的实例以消费进程自己的实例 ID 为准。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRunRequest(
        @JsonProperty("agent_run_id") String runId,
        @JsonProperty("thread_id") String threadId,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("model_name") String modelName,
        @JsonProperty("enable_thinking") Boolean enableThinking,
        @JsonProperty("reasoning_effort") String reasoningEffort,
        @JsonProperty("stream") boolean stream,
        @JsonProperty("enable_context_manager") boolean enableContextManager,
        @JsonProperty("agent_config") Map<String, Object> agentConfig,
        @JsonProperty("is_agent_builder") Boolean agentBuilder,
        @JsonProperty("target_agent_id") String targetAgentId,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("user_name") String userName
) {

    public AgentRunRequest {
        agentConfig = agentConfig == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(agentConfig));
    }

    @JsonIgnore
    public ReasoningMode reasoningMode() {
        return ReasoningMode.resolve(enableThinking, reasoningEffort);
    }

    public AgentRunRequest withRunId(String newRunId) {
        return new AgentRunRequest(newRunId, threadId, projectId, instanceId, modelName, enableThinking,
                reasoningEffort, stream, enableContextManager, agentConfig, agentBuilder, targetAgentId,
                requestId, userName);
    }
}
