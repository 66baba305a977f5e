package io.github.drompincen.vibehub.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.vibehub.protocol.event.AgentEvent;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the agent runtime's JSON messages onto {@link AgentEvent}. Message types the orchestrator
 * does not act on (stream deltas, non-init system messages, control traffic) yield empty.
 */
public final class AgentEventParser {

    private AgentEventParser() {}

    public static Optional<AgentEvent> parse(JsonNode message) {
        if (message == null || !message.isObject()) {
            return Optional.empty();
        }
        return switch (message.path("type").asText()) {
            case "system" -> parseSystem(message);
            case "assistant" -> Optional.of(new AgentEvent.AssistantMessage(message.path("message").path("content")));
            case "user" -> Optional.of(parseUser(message));
            case "result" -> Optional.of(parseResult(message));
            default -> Optional.empty();
        };
    }

    private static Optional<AgentEvent> parseSystem(JsonNode message) {
        if (!"init".equals(message.path("subtype").asText())) {
            return Optional.empty();
        }
        List<String> commands = new ArrayList<>();
        for (JsonNode command : message.path("slash_commands")) {
            commands.add(command.asText());
        }
        String conversationId = message.hasNonNull("session_id") ? message.get("session_id").asText() : null;
        return Optional.of(new AgentEvent.SystemInit(conversationId, commands));
    }

    private static AgentEvent parseUser(JsonNode message) {
        String parent = message.hasNonNull("parent_tool_use_id") ? message.get("parent_tool_use_id").asText() : null;
        JsonNode toolUseResult = message.hasNonNull("tool_use_result") ? message.get("tool_use_result") : null;
        boolean replay = message.path("isReplay").asBoolean(false);
        return new AgentEvent.UserMessage(parent, message.path("message"), toolUseResult, replay);
    }

    private static AgentEvent parseResult(JsonNode message) {
        JsonNode usage = message.path("usage");
        JsonNode modelUsage = message.path("modelUsage");
        Long contextWindow = null;
        Iterator<Map.Entry<String, JsonNode>> models = modelUsage.fields();
        if (models.hasNext()) {
            JsonNode first = models.next().getValue();
            if (first.path("contextWindow").canConvertToLong() && first.path("contextWindow").asLong() > 0) {
                contextWindow = first.path("contextWindow").asLong();
            }
        }
        return new AgentEvent.Result(
                usage.path("input_tokens").asLong(0),
                usage.path("cache_read_input_tokens").asLong(0),
                contextWindow,
                message.path("total_cost_usd").asDouble(0.0),
                usage.isMissingNode() ? null : usage,
                modelUsage.isMissingNode() ? null : modelUsage);
    }
}
