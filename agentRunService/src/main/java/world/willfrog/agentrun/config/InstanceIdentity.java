package world.willfrog.agentrun.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 当前进程在集群中的实例 ID，用于锁持有者、活跃标记与实例控制通道。
 */
@Component
@Slf4j
public class InstanceIdentity {

    private final String instanceId;

    public InstanceIdentity(AgentRunProperties properties) {
        String configured = StringUtils.trimToEmpty(properties.getInstanceId());
        this.instanceId = configured.isEmpty()
                ? UUID.randomUUID().toString().replace("-", "").substring(0, 8)
                : configured;
        log.info("Agent run instance id: {}", instanceId);
    }

    public String get() {
        return instanceId;
    }
}
