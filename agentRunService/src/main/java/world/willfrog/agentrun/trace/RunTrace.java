package world.willfrog.agentrun.trace;

/**
 * 单个 run 的追踪句柄，producer 也会拿到它记录自己的阶段。
 * 实现不得向调用方抛出异常。
 */
public interface RunTrace {

    void mark(String name, TraceLevel level, String statusMessage);

    default void mark(String name) {
        mark(name, TraceLevel.DEFAULT, null);
    }

    void end(String status);
}
