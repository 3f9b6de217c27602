package world.willfrog.agentrun.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Agent run 协调相关配置
 *
 * @see world.willfrog.agentrun.service.AgentRunCoordinator
 * @see world.willfrog.agentrun.service.StopSignalWatcher
 */
@Data
@ConfigurationProperties(prefix = "agent.run")
public class AgentRunProperties {

    /**
     * 当前进程的实例 ID；为空时启动时随机生成 8 位
     */
    private String instanceId = "";

    /**
     * 执行锁与活跃标记的 TTL，watcher 会按 lockRefreshInterval 续期
     */
    private Duration lockTtl = Duration.ofMinutes(10);

    /**
     * watcher 等待控制信号的单次超时
     */
    private Duration controlPollInterval = Duration.ofMillis(500);

    private Duration lockRefreshInterval = Duration.ofMinutes(1);

    /**
     * run 结束后响应列表保留时长
     */
    private Duration responseListTtl = Duration.ofHours(24);

    /**
     * 清理阶段等待未完成写入的上限
     */
    private Duration pendingWriteTimeout = Duration.ofSeconds(30);

    /**
     * 等待 watcher 线程退出的上限
     */
    private Duration watcherStopTimeout = Duration.ofSeconds(5);

    private Db db = new Db();

    private Cache cache = new Cache();

    private Task task = new Task();

    private Tracing tracing = new Tracing();

    private Backfill backfill = new Backfill();

    private Executor executor = new Executor();

    @Data
    public static class Db {
        /**
         * 终态写入的最大尝试次数
         */
        private int maxAttempts = 3;

        /**
         * 首次重试前的等待，之后每次翻倍
         */
        private Duration initialBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Cache {
        /**
         * redis: 多实例共享缓存；local: 单进程内存实现（开发 / 测试）
         */
        private String mode = "redis";
    }

    @Data
    public static class Task {
        private String topic = "agent_run_task";
        private String consumerGroup = "agent-run-consumer";
        private boolean producerEnabled = true;
        private boolean consumerEnabled = true;
    }

    @Data
    public static class Tracing {
        private boolean enabled = false;

        /**
         * JSON lines 追踪文件路径
         */
        private String path = "logs/agent-run-trace.jsonl";
    }

    @Data
    public static class Backfill {
        private boolean enabled = false;
        private int batchSize = 100;
        private long intervalMs = 600000L;
    }

    @Data
    public static class Executor {
        /**
         * 单实例同时执行的 run 上限
         */
        private int maxConcurrentRuns = 8;

        private int ioThreads = 4;
    }
}
