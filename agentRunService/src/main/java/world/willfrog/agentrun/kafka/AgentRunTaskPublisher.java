package world.willfrog.agentrun.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import world.willfrog.agentrun.config.AgentRunProperties;
import world.willfrog.agentrun.model.AgentRunRequest;

@Slf4j
@Component
public class AgentRunTaskPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final AgentRunProperties properties;

    public AgentRunTaskPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                 ObjectMapper objectMapper,
                                 AgentRunProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @return false 表示任务投递已关闭，调用方需要自行执行
     */
    public boolean publish(AgentRunRequest request) throws Exception {
        if (!properties.getTask().isProducerEnabled()) {
            log.info("Agent run task producer disabled, skip publish runId={}", request.runId());
            return false;
        }
        String payload = objectMapper.writeValueAsString(request);
        // 以 runId 作为 key，同一个 run 的重复投递落在同一分区
        kafkaTemplate.send(properties.getTask().getTopic(), request.runId(), payload);
        return true;
    }
}
