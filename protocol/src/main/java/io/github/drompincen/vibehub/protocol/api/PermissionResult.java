package io.github.drompincen.vibehub.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What the agent receives for a tool permission check: either allow with the (possibly
 * edited) input, or deny with a message the agent should treat as feedback.
 */
public record PermissionResult(
        PermissionBehavior behavior,
        JsonNode updatedInput,
        String message
) {
    public static PermissionResult allow(JsonNode input) {
        return new PermissionResult(PermissionBehavior.ALLOW, input, null);
    }

    public static PermissionResult deny(String message) {
        return new PermissionResult(PermissionBehavior.DENY, null, message);
    }

    public boolean isAllow() {
        return behavior == PermissionBehavior.ALLOW;
    }
}
