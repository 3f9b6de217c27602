package world.willfrog.agentrun.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;
import world.willfrog.agentrun.model.AgentRunRequest;
import world.willfrog.agentrun.service.AgentRunDispatcher;

/**
 * 消费 agent_run_task，把执行交给异步线程池。
 * 同一个 run 被多个实例消费到时，由执行锁保证只有一个实例真正执行。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunTaskConsumer {

    private final ObjectMapper objectMapper;
    private final AgentRunDispatcher dispatcher;

    @KafkaListener(topics = "${agent.run.task.topic:agent_run_task}",
            groupId = "${agent.run.task.consumer-group:agent-run-consumer}",
            autoStartup = "${agent.run.task.consumer-enabled:true}")
    public void listenAgentRunTask(String message, Acknowledgment acknowledgment) {
        try {
            AgentRunRequest request = objectMapper.readValue(message, AgentRunRequest.class);
            if (StringUtils.isBlank(request.runId())) {
                log.warn("Ignore agent run task without agent_run_id: {}", StringUtils.abbreviate(message, 500));
                return;
            }
            dispatcher.dispatch(request);
        } catch (Exception e) {
            log.error("Failed to handle agent run task: {}", StringUtils.abbreviate(message, 500), e);
        } finally {
            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
        }
    }
}
