package io.github.drompincen.vibehub.protocol.event;

public enum AgentEventKind {
    SYSTEM_INIT,
    ASSISTANT,
    USER,
    RESULT
}
