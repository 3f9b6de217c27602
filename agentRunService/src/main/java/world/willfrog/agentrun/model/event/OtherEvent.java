package world.willfrog.agentrun.model.event;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

public record OtherEvent(ObjectNode payload) implements ResponseEvent {

    public OtherEvent {
        Objects.requireNonNull(payload, "payload");
    }

    @Override
    public ResponseEventType type() {
        return ResponseEventType.OTHER;
    }
}
