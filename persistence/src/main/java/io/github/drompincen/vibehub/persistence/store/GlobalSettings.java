package io.github.drompincen.vibehub.persistence.store;

import java.util.List;

/**
 * Settings shared by every session.
 */
public record GlobalSettings(List<String> allowedTools) {

    public GlobalSettings {
        allowedTools = allowedTools != null ? List.copyOf(allowedTools) : List.of();
    }

    public static GlobalSettings empty() {
        return new GlobalSettings(List.of());
    }
}
