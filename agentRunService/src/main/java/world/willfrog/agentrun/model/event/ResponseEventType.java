package world.willfrog.agentrun.model.event;

public enum ResponseEventType {
    STATUS("status"),
    ASSISTANT("assistant"),
    TOOL("tool"),
    /** producer 产出的其它类型（user、browser_state 等），原样透传 */
    OTHER("");

    private final String wireName;

    ResponseEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ResponseEventType fromWire(String type) {
        if (type == null || type.isBlank()) {
            return OTHER;
        }
        for (ResponseEventType value : values()) {
            if (value != OTHER && value.wireName.equals(type)) {
                return value;
            }
        }
        return OTHER;
    }
}
