package world.willfrog.agentrun.producer;

import world.willfrog.agentrun.model.AgentRunRequest;
import world.willfrog.agentrun.trace.RunTrace;

/**
 * 生成 run 响应事件的 agent 循环（推理 / 工具调用）。
 * <p>
 * 实现可以在事件序列里给出 completed / failed / stopped 的 status 事件表示自己结束；
 * 直接结束序列视为正常完成。工具结果事件可携带 _credit_info 计费注解。
 */
public interface AgentResponseProducer {

    AgentResponseStream start(AgentRunRequest request, RunTrace trace);
}
