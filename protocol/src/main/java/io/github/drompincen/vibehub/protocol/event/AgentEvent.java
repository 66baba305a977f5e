package io.github.drompincen.vibehub.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Events emitted by the backing agent runtime, narrowed to the four kinds the session
 * orchestrator acts on. Anything else the runtime sends is dropped at the parsing boundary.
 */
public sealed interface AgentEvent
        permits AgentEvent.SystemInit, AgentEvent.AssistantMessage, AgentEvent.UserMessage, AgentEvent.Result {

    AgentEventKind kind();

    /**
     * First event of every query; carries the runtime's own conversation id.
     */
    record SystemInit(String conversationId, List<String> slashCommands) implements AgentEvent {
        public SystemInit {
            slashCommands = slashCommands != null ? List.copyOf(slashCommands) : List.of();
        }

        @Override
        public AgentEventKind kind() { return AgentEventKind.SYSTEM_INIT; }
    }

    record AssistantMessage(JsonNode content) implements AgentEvent {
        @Override
        public AgentEventKind kind() { return AgentEventKind.ASSISTANT; }
    }

    /**
     * A user-role message produced by the runtime: either a tool result fed back to the model
     * or a replayed history entry.
     *
     * @param parentToolUseId invocation id the runtime attached to the message, may be {@code null}
     * @param message         the raw {@code {role, content}} message
     * @param toolUseResult   tool output, {@code null} when the message is not a tool result
     * @param replay          true when the runtime is replaying history
     */
    record UserMessage(String parentToolUseId, JsonNode message, JsonNode toolUseResult, boolean replay)
            implements AgentEvent {

        @Override
        public AgentEventKind kind() { return AgentEventKind.USER; }

        public boolean hasToolResult() {
            return toolUseResult != null && !toolUseResult.isNull() && !toolUseResult.isMissingNode();
        }

        /**
         * The invocation id the tool result belongs to: the parent id when present, otherwise the
         * {@code tool_use_id} of the first {@code tool_result} content block.
         */
        public String toolInvocationId() {
            if (parentToolUseId != null && !parentToolUseId.isBlank()) {
                return parentToolUseId;
            }
            if (message == null) return null;
            JsonNode content = message.path("content");
            if (!content.isArray()) return null;
            for (JsonNode block : content) {
                if ("tool_result".equals(block.path("type").asText()) && block.hasNonNull("tool_use_id")) {
                    return block.get("tool_use_id").asText();
                }
            }
            return null;
        }
    }

    /**
     * Final event of a query.
     *
     * @param inputTokens              input tokens of the latest model call
     * @param cacheReadInputTokens     cache-read tokens of the latest model call
     * @param modelContextWindow       context window advertised by the first model, {@code null} if absent
     * @param totalCostUsd             cumulative cost reported by the runtime
     * @param usage                    raw per-call usage, relayed as-is
     * @param modelUsage               raw per-model usage, relayed as-is
     */
    record Result(long inputTokens,
                  long cacheReadInputTokens,
                  Long modelContextWindow,
                  double totalCostUsd,
                  JsonNode usage,
                  JsonNode modelUsage) implements AgentEvent {

        @Override
        public AgentEventKind kind() { return AgentEventKind.RESULT; }
    }
}
