package world.willfrog.agentrun.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import world.willfrog.agentrun.cache.ActiveRunRegistry;
import world.willfrog.agentrun.cache.ControlSignalBus;
import world.willfrog.agentrun.cache.ResponseStreamStore;
import world.willfrog.agentrun.cache.RunLock;
import world.willfrog.agentrun.cache.redis.RedisActiveRunRegistry;
import world.willfrog.agentrun.cache.redis.RedisControlSignalBus;
import world.willfrog.agentrun.cache.redis.RedisResponseStreamStore;
import world.willfrog.agentrun.cache.redis.RedisRunLock;
import world.willfrog.agentrun.model.event.ResponseEventCodec;

/**
 * 多实例部署：锁、控制通道、响应列表都落在共享 Redis 上。
 */
@Configuration
@ConditionalOnProperty(prefix = "agent.run.cache", name = "mode", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisCacheModeConfig {

    @Bean
    public RedisMessageListenerContainer agentRunListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        log.info("Agent run cache mode: redis");
        return container;
    }

    @Bean
    public RunLock runLock(StringRedisTemplate redisTemplate) {
        return new RedisRunLock(redisTemplate);
    }

    @Bean
    public ActiveRunRegistry activeRunRegistry(StringRedisTemplate redisTemplate) {
        return new RedisActiveRunRegistry(redisTemplate);
    }

    @Bean
    public ControlSignalBus controlSignalBus(StringRedisTemplate redisTemplate,
                                             RedisMessageListenerContainer agentRunListenerContainer) {
        return new RedisControlSignalBus(redisTemplate, agentRunListenerContainer);
    }

    @Bean
    public ResponseStreamStore responseStreamStore(StringRedisTemplate redisTemplate, ResponseEventCodec codec) {
        return new RedisResponseStreamStore(redisTemplate, codec);
    }
}
