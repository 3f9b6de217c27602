package world.willfrog.agentrun.model.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * 工具结果事件。计费注解 _credit_info 可能直接挂在事件上，也可能在 metadata 中。
 */
public record ToolEvent(ObjectNode payload) implements ResponseEvent {

    public ToolEvent {
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public ResponseEventType type() {
        return ResponseEventType.TOOL;
    }

    public JsonNode metadata() {
        return payload.path("metadata");
    }

    public JsonNode content() {
        return payload.path("content");
    }
}
