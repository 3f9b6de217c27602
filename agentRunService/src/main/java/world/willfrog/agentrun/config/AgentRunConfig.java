package world.willfrog.agentrun.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({AgentRunProperties.class, AgentCreditProperties.class})
public class AgentRunConfig {

    @Bean
    public Clock agentRunClock() {
        return Clock.systemUTC();
    }
}
