package world.willfrog.agentrun.model;

import java.util.Optional;

/**
 * 控制通道上传递的信号，线上载荷即枚举名本身（STOP / END_STREAM / ERROR）。
 */
public enum ControlSignal {
    STOP,
    END_STREAM,
    ERROR;

    public String payload() {
        return name();
    }

    public static Optional<ControlSignal> parse(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        String trimmed = payload.trim();
        for (ControlSignal signal : values()) {
            if (signal.name().equals(trimmed)) {
                return Optional.of(signal);
            }
        }
        return Optional.empty();
    }
}
