package world.willfrog.agentrun.model.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import world.willfrog.agentrun.model.AgentRunStatus;

import java.util.Objects;
import java.util.Optional;

public record StatusEvent(ObjectNode payload) implements ResponseEvent {

    /** 异常兜底事件使用的状态值，不属于 run 的终态集合。 */
    public static final String STATUS_ERROR = "error";

    public StatusEvent {
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public ResponseEventType type() {
        return ResponseEventType.STATUS;
    }

    public String status() {
        return payload.path("status").asText("");
    }

    public String message() {
        JsonNode message = payload.get("message");
        return message == null || message.isNull() ? null : message.asText();
    }

    /**
     * producer 自己声明的终态（completed / failed / stopped）。
     */
    public Optional<AgentRunStatus> terminalStatus() {
        return AgentRunStatus.fromWire(status()).filter(AgentRunStatus::isTerminal);
    }

    public static StatusEvent of(String status, String message) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(TYPE_FIELD, ResponseEventType.STATUS.wireName());
        node.put("status", status);
        if (message != null) {
            node.put("message", message);
        }
        return new StatusEvent(node);
    }

    public static StatusEvent of(AgentRunStatus status, String message) {
        return of(status.wireName(), message);
    }
}
