package world.willfrog.agentrun.context;

import org.slf4j.MDC;
import world.willfrog.agentrun.model.AgentRunRequest;

import java.util.Map;

/**
 * 当前线程正在协调的 run，以 MDC（run_id / thread_id / request_id）的形式存在，
 * coordinator 线程、watcher 线程和写入线程的日志都带上 run 维度。
 */
public class AgentRunContext {
    public static final String MDC_RUN_ID = "run_id";
    public static final String MDC_THREAD_ID = "thread_id";
    public static final String MDC_REQUEST_ID = "request_id";

    public static void bind(AgentRunRequest request) {
        bind(request.runId(), request.threadId(), request.requestId());
    }

    public static void bind(String runId, String threadId, String requestId) {
        putIfPresent(MDC_RUN_ID, runId);
        putIfPresent(MDC_THREAD_ID, threadId);
        putIfPresent(MDC_REQUEST_ID, requestId);
    }

    /**
     * 把当前线程的 MDC 带到另一个线程执行，结束后清理。
     */
    public static Runnable propagate(Runnable task) {
        Map<String, String> snapshot = MDC.getCopyOfContextMap();
        return () -> {
            if (snapshot != null) {
                MDC.setContextMap(snapshot);
            }
            try {
                task.run();
            } finally {
                clear();
            }
        };
    }

    public static void clear() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_THREAD_ID);
        MDC.remove(MDC_REQUEST_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isBlank()) {
            MDC.put(key, value);
        }
    }
}
