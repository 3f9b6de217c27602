package world.willfrog.agentrun.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import world.willfrog.agentrun.producer.AgentResponseProducer;
import world.willfrog.agentrun.producer.EchoAgentResponseProducer;

import java.time.Clock;

@Configuration
public class AgentResponseProducerConfig {

    @Bean
    @ConditionalOnMissingBean(AgentResponseProducer.class)
    public AgentResponseProducer agentResponseProducer(ObjectMapper objectMapper, Clock agentRunClock) {
        return new EchoAgentResponseProducer(objectMapper, agentRunClock);
    }
}
