package io.github.drompincen.vibehub.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A human's answer to a pending tool permission request.
 *
 * @param behavior     allow or deny
 * @param updatedInput replacement tool input on allow; {@code null} keeps the original input
 * @param message      feedback passed back to the agent on deny
 * @param remember     add the invocation's pattern to an allow-list (allow only)
 * @param global       with {@code remember}, target the global allow-list instead of the session's
 */
public record PermissionDecision(
        PermissionBehavior behavior,
        JsonNode updatedInput,
        String message,
        boolean remember,
        boolean global
) {
    public static PermissionDecision allow() {
        return new PermissionDecision(PermissionBehavior.ALLOW, null, null, false, false);
    }

    public static PermissionDecision allowAndRemember(boolean global) {
        return new PermissionDecision(PermissionBehavior.ALLOW, null, null, true, global);
    }

    public static PermissionDecision deny(String message) {
        return new PermissionDecision(PermissionBehavior.DENY, null, message, false, false);
    }

    public boolean isAllow() {
        return behavior == PermissionBehavior.ALLOW;
    }
}
