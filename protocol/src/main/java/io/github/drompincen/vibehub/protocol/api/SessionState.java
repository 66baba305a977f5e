package io.github.drompincen.vibehub.protocol.api;

public enum SessionState {
    COLD,
    WARM_IDLE,
    WARM_THINKING,
    WARM_AWAITING_PERMISSION,
    ABORTED,
    SHUT_DOWN
}
