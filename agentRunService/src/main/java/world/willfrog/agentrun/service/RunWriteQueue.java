package world.willfrog.agentrun.service;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.agentrun.cache.ResponseStreamStore;
import world.willfrog.agentrun.context.AgentRunContext;
import world.willfrog.agentrun.model.event.ResponseEvent;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个 run 的响应写入链：事件在 IO 线程池上异步写入，但严格按提交顺序逐条执行。
 * 单条写入失败只记告警，不影响后续写入。
 */
@Slf4j
public class RunWriteQueue {

    private final String runId;
    private final ResponseStreamStore store;
    private final Executor executor;
    private final AtomicInteger pending = new AtomicInteger();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    public RunWriteQueue(String runId, ResponseStreamStore store, Executor executor) {
        this.runId = runId;
        this.store = store;
        this.executor = executor;
    }

    public synchronized void submit(ResponseEvent event) {
        pending.incrementAndGet();
        Runnable write = AgentRunContext.propagate(() -> {
            try {
                store.append(runId, event);
            } catch (Exception e) {
                log.warn("Append response failed: runId={}, type={}", runId, event.typeName(), e);
            } finally {
                pending.decrementAndGet();
            }
        });
        tail = tail.handle((ignored, error) -> (Void) null).thenRunAsync(write, executor);
    }

    /**
     * 等待已提交的写入全部完成。
     *
     * @return false 表示超时或被中断
     */
    public boolean awaitPending(Duration timeout) {
        CompletableFuture<Void> current;
        synchronized (this) {
            current = tail;
        }
        try {
            current.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.warn("Response write chain failed: runId={}", runId, e.getCause());
            return pending.get() == 0;
        }
    }

    public int pendingCount() {
        return pending.get();
    }
}
