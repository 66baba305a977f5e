package io.github.drompincen.vibehub.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    CREATE_SESSION,
    START_SESSION,
    RESUME_SESSION,
    FORK_SESSION,
    SEND_MESSAGE,
    PERMISSION_RESPONSE,
    ABORT,
    SET_PERMISSION_MODE,
    GET_ALLOWED_TOOLS,
    SET_ALLOWED_TOOLS,
    GET_GLOBAL_ALLOWED_TOOLS,
    SET_GLOBAL_ALLOWED_TOOLS,
    GET_STATUS,

    // Server -> Client
    SESSION_READY,
    SESSION_CREATED,
    SESSION_FORKED,
    MESSAGE,
    PERMISSION_REQUEST,
    THINKING,
    TOOL_RESULT,
    SLASH_COMMANDS,
    ALLOWED_TOOLS,
    GLOBAL_ALLOWED_TOOLS,
    RESULT,
    ABORTED,
    PERMISSION_MODE_UPDATED,
    STATUS,
    ERROR;

    public boolean isClientAction() {
        return ordinal() <= GET_STATUS.ordinal();
    }
}
