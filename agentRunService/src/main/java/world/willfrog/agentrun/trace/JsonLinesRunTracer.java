package world.willfrog.agentrun.trace;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import world.willfrog.agentrun.model.AgentRunRequest;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把 run 的追踪事件按行写入本地 JSON 文件。写失败只告警一次，不影响 run。
 */
@Slf4j
public class JsonLinesRunTracer implements RunTracer {

    private final Path output;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object lock = new Object();
    private volatile boolean warned = false;

    public JsonLinesRunTracer(Path output, ObjectMapper objectMapper, Clock clock) {
        this.output = output;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * 准备输出目录，失败时返回 null，由调用方退回 no-op 实现。
     */
    public static JsonLinesRunTracer prepare(String path, ObjectMapper objectMapper, Clock clock) {
        if (path == null || path.isBlank()) {
            log.warn("Agent run trace path is blank, tracing disabled");
            return null;
        }
        Path output = Path.of(path).normalize();
        try {
            Path parent = output.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new JsonLinesRunTracer(output, objectMapper, clock);
        } catch (Exception e) {
            log.warn("Prepare agent run trace file failed, tracing disabled: {}", e.getMessage(), e);
            return null;
        }
    }

    @Override
    public RunTrace start(AgentRunRequest request) {
        String runId = request.runId();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("thread_id", request.threadId());
        fields.put("project_id", request.projectId());
        fields.put("model_name", request.modelName());
        fields.put("reasoning_mode", request.reasoningMode().wireName());
        write(runId, "start", TraceLevel.DEFAULT, null, fields);
        return new RunTrace() {
            @Override
            public void mark(String name, TraceLevel level, String statusMessage) {
                write(runId, name, level, statusMessage, Map.of());
            }

            @Override
            public void end(String status) {
                write(runId, "end", TraceLevel.DEFAULT, status, Map.of());
            }
        };
    }

    private void write(String runId, String name, TraceLevel level, String statusMessage, Map<String, Object> fields) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("time", OffsetDateTime.now(clock).toString());
        line.put("run_id", runId);
        line.put("name", name == null ? "" : name);
        line.put("level", level == null ? TraceLevel.DEFAULT.name() : level.name());
        if (statusMessage != null) {
            line.put("status_message", statusMessage);
        }
        if (!fields.isEmpty()) {
            line.put("fields", fields);
        }
        String text = safeWrite(line) + System.lineSeparator();
        synchronized (lock) {
            try {
                Files.writeString(output, text, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (Exception e) {
                warnOnce("Write agent run trace failed: " + e.getMessage(), e);
            }
        }
    }

    private String safeWrite(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            return "{}";
        }
    }

    private void warnOnce(String message, Exception e) {
        if (warned) {
            return;
        }
        warned = true;
        log.warn(message, e);
    }
}
