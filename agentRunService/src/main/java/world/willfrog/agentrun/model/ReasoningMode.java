package world.willfrog.agentrun.model;

import java.util.Locale;

public enum ReasoningMode {
    NONE("none"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    ReasoningMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 根据 run 的思考开关与 effort 解析计费档位：
     * 未开启思考一律按 none；high 按 high；medium/low 按 medium。
     */
    public static ReasoningMode resolve(Boolean enableThinking, String reasoningEffort) {
        if (!Boolean.TRUE.equals(enableThinking)) {
            return NONE;
        }
        String effort = reasoningEffort == null ? "" : reasoningEffort.trim().toLowerCase(Locale.ROOT);
        return switch (effort) {
            case "high" -> HIGH;
            case "medium", "low" -> MEDIUM;
            default -> NONE;
        };
    }

    public static ReasoningMode fromWire(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReasoningMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return mode;
            }
        }
        return NONE;
    }
}
