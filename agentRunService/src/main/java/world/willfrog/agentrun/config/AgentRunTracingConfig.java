package world.willfrog.agentrun.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import world.willfrog.agentrun.trace.JsonLinesRunTracer;
import world.willfrog.agentrun.trace.NoOpRunTracer;
import world.willfrog.agentrun.trace.RunTracer;

import java.time.Clock;

@Configuration
public class AgentRunTracingConfig {

    @Bean
    public RunTracer runTracer(AgentRunProperties properties, ObjectMapper objectMapper, Clock agentRunClock) {
        if (!properties.getTracing().isEnabled()) {
            return new NoOpRunTracer();
        }
        JsonLinesRunTracer tracer = JsonLinesRunTracer.prepare(properties.getTracing().getPath(), objectMapper, agentRunClock);
        return tracer == null ? new NoOpRunTracer() : tracer;
    }
}
