package io.github.drompincen.vibehub.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.vibehub.protocol.api.PermissionResult;
import io.github.drompincen.vibehub.protocol.event.AgentEvent;

import java.util.concurrent.CompletionStage;

public interface AgentCallbacks {

    void onEvent(AgentEvent event);

    /**
     * Asks whether a tool may run. The returned stage may stay incomplete for as long as a human
     * takes to decide; it completes exceptionally when the request is rejected without a decision.
     */
    CompletionStage<PermissionResult> onPermissionRequest(String toolName, JsonNode input, String invocationId);

    void onError(Throwable error);

    void onComplete();
}
