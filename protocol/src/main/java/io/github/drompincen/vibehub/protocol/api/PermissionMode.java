package io.github.drompincen.vibehub.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Agent-side permission mode. The wire names match the agent runtime's own mode strings.
 */
public enum PermissionMode {
    DEFAULT("default"),
    ACCEPT_EDITS("acceptEdits"),
    BYPASS_PERMISSIONS("bypassPermissions"),
    PLAN("plan");

    private final String wireName;

    PermissionMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name (or enum constant name). Blank or unknown values fall back to {@link #DEFAULT}.
     */
    @JsonCreator
    public static PermissionMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        for (PermissionMode mode : values()) {
            if (mode.wireName.equals(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        return DEFAULT;
    }
}
