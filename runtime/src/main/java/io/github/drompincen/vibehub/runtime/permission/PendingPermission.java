package io.github.drompincen.vibehub.runtime.permission;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.vibehub.protocol.api.PermissionResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A tool invocation suspended until a human decides. The future is the continuation handed back
 * to the agent adapter.
 */
public record PendingPermission(
        String invocationId,
        String toolName,
        JsonNode input,
        CompletableFuture<PermissionResult> future,
        Instant requestedAt
) {}
