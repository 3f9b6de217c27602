package world.willfrog.agentrun.producer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import world.willfrog.agentrun.model.AgentRunRequest;
import world.willfrog.agentrun.model.event.AssistantEvent;
import world.willfrog.agentrun.model.event.ResponseEvent;
import world.willfrog.agentrun.model.event.StatusEvent;
import world.willfrog.agentrun.trace.RunTrace;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 未接入真实 agent 时的默认实现：回显请求信息后正常结束。
 */
@RequiredArgsConstructor
public class EchoAgentResponseProducer implements AgentResponseProducer {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public AgentResponseStream start(AgentRunRequest request, RunTrace trace) {
        trace.mark("echo_producer_start");
        ObjectNode received = objectMapper.createObjectNode();
        received.put("agent", "echo");
        received.put("timestamp", Instant.now(clock).toString());
        received.put("thread_id", request.threadId());
        received.put("project_id", request.projectId());
        received.put("model_name", request.modelName());
        received.put("reasoning_mode", request.reasoningMode().wireName());

        List<ResponseEvent> events = List.of(
                StatusEvent.of("running", null),
                AssistantEvent.ofText(received.toString()),
                StatusEvent.of("completed", null)
        );
        return AgentResponseStream.of(events.iterator());
    }
}
