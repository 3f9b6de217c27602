package world.willfrog.agentrun.trace;

public enum TraceLevel {
    DEBUG,
    DEFAULT,
    WARNING,
    ERROR
}
