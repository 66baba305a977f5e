package io.github.drompincen.vibehub.protocol.api;

public record SessionStatusDto(
        String sessionId,
        boolean exists,
        boolean active,
        boolean thinking,
        boolean hasPendingPermission,
        int pendingPermissionCount,
        long messageCount,
        SessionState state
) {
    public static SessionStatusDto inactive(String sessionId) {
        return new SessionStatusDto(sessionId, false, false, false, false, 0, 0, SessionState.COLD);
    }
}
