package world.willfrog.agentrun.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AgentRunExecutorConfig {

    /**
     * coordinator 主线程池，@Async("agentRunExecutor") 使用。
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentRunExecutor(AgentRunProperties properties) {
        int size = Math.max(1, properties.getExecutor().getMaxConcurrentRuns());
        return Executors.newFixedThreadPool(size, namedThreads("agent-run-"));
    }

    /**
     * 每个执行中的 run 占用一个 watcher 线程，数量跟随 run 并发。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentRunWatcherExecutor(AgentRunProperties properties) {
        int size = Math.max(1, properties.getExecutor().getMaxConcurrentRuns());
        return Executors.newFixedThreadPool(size, namedThreads("agent-run-watcher-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentRunIoExecutor(AgentRunProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecutor().getIoThreads()),
                namedThreads("agent-run-io-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
