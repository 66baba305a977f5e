package io.github.drompincen.vibehub.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PermissionBehavior {
    ALLOW,
    DENY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PermissionBehavior fromWire(String value) {
        return "allow".equalsIgnoreCase(value) ? ALLOW : DENY;
    }
}
