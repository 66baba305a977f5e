package io.github.drompincen.vibehub.protocol.api;

public record SendMessageRequest(String content) {}
