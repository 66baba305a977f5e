package io.github.drompincen.vibehub.protocol.api;

import java.util.List;

public record AllowedToolsDto(String sessionId, List<String> tools) {

    public static AllowedToolsDto global(List<String> tools) {
        return new AllowedToolsDto(null, tools);
    }
}
