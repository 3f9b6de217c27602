package world.willfrog.agentrun.model.event;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

public record AssistantEvent(ObjectNode payload) implements ResponseEvent {

    public AssistantEvent {
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public ResponseEventType type() {
        return ResponseEventType.ASSISTANT;
    }

    public static AssistantEvent ofText(String content) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(TYPE_FIELD, ResponseEventType.ASSISTANT.wireName());
        node.put("content", content);
        return new AssistantEvent(node);
    }
}
