package world.willfrog.agentrun.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import world.willfrog.agentrun.cache.ActiveRunRegistry;
import world.willfrog.agentrun.cache.ControlSignalBus;
import world.willfrog.agentrun.cache.ResponseStreamStore;
import world.willfrog.agentrun.cache.RunLock;
import world.willfrog.agentrun.cache.local.LocalActiveRunRegistry;
import world.willfrog.agentrun.cache.local.LocalControlSignalBus;
import world.willfrog.agentrun.cache.local.LocalResponseStreamStore;
import world.willfrog.agentrun.cache.local.LocalRunLock;

import java.time.Clock;

/**
 * 单实例 / 本地开发：不依赖 Redis，只在本进程内互斥。
 */
@Configuration
@ConditionalOnProperty(prefix = "agent.run.cache", name = "mode", havingValue = "local")
@Slf4j
public class LocalCacheModeConfig {

    @Bean
    public RunLock runLock(Clock agentRunClock) {
        log.warn("Agent run cache mode: local, runs are only exclusive within this process");
        return new LocalRunLock(agentRunClock);
    }

    @Bean
    public ActiveRunRegistry activeRunRegistry(Clock agentRunClock) {
        return new LocalActiveRunRegistry(agentRunClock);
    }

    @Bean
    public LocalControlSignalBus controlSignalBus() {
        return new LocalControlSignalBus();
    }

    @Bean
    public ResponseStreamStore responseStreamStore(ControlSignalBus controlSignalBus, Clock agentRunClock) {
        return new LocalResponseStreamStore(controlSignalBus, agentRunClock);
    }
}
