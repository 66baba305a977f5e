package io.github.drompincen.vibehub.runtime.agent.fake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.PermissionResult;
import io.github.drompincen.vibehub.protocol.event.AgentEvent;
import io.github.drompincen.vibehub.runtime.agent.AgentCallbacks;
import io.github.drompincen.vibehub.runtime.agent.AgentOptions;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceAdapter;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Agent stand-in for running without the CLI. Every prompt produces an init, an optional tool
 * call, an echo reply and a result.
 *
 * <p>A prompt starting with {@code !} is treated as a shell command: the adapter asks for
 * {@code Bash} permission and reports a simulated tool result once a decision arrives.
 */
public class ScriptedAgentService implements AgentServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(ScriptedAgentService.class);

    static final List<String> SLASH_COMMANDS = List.of("/help", "/clear", "/compact");
    static final long CONTEXT_WINDOW = 200_000L;

    private final AgentOptions options;
    private final AgentCallbacks callbacks;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final long delayMillis;

    private final AtomicReference<Object> activeQuery = new AtomicReference<>();
    private volatile Future<?> current;
    private volatile String conversationId;
    private volatile PermissionMode permissionMode;
    private long totalInputTokens;
    private double totalCost;

    public ScriptedAgentService(AgentOptions options, AgentCallbacks callbacks, ObjectMapper objectMapper,
                                ExecutorService executor, long delayMillis) {
        this.options = options;
        this.callbacks = callbacks;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.delayMillis = delayMillis;
        this.permissionMode = options.permissionMode();
    }

    @Override
    public void start(String prompt) {
        Object query = new Object();
        if (!activeQuery.compareAndSet(null, query)) {
            throw new AgentServiceException("Agent query already running");
        }
        log.debug("[FAKE AGENT] prompt length={}", prompt != null ? prompt.length() : 0);
        current = executor.submit(() -> run(query, prompt != null ? prompt : ""));
    }

    @Override
    public void abort() {
        Future<?> inFlight = current;
        Object query = activeQuery.get();
        if (inFlight != null && query != null) {
            log.info("[FAKE AGENT] aborting");
            inFlight.cancel(true);
            activeQuery.compareAndSet(query, null);
        }
    }

    @Override
    public void setPermissionMode(PermissionMode mode) {
        this.permissionMode = mode;
    }

    @Override
    public boolean isActive() {
        return activeQuery.get() != null;
    }

    @Override
    public String getConversationId() {
        return conversationId;
    }

    PermissionMode permissionMode() {
        return permissionMode;
    }

    private void run(Object query, String prompt) {
        try {
            if (conversationId == null) {
                conversationId = options.resumeToken() != null && !options.fork()
                        ? options.resumeToken()
                        : "fake-" + UUID.randomUUID();
            }
            callbacks.onEvent(new AgentEvent.SystemInit(conversationId, SLASH_COMMANDS));
            pause();

            if (prompt.startsWith("!") && prompt.length() > 1) {
                runShellCommand(prompt.substring(1).trim());
            }

            callbacks.onEvent(new AgentEvent.AssistantMessage(textContent("Echo: " + prompt)));
            pause();

            totalInputTokens += Math.max(1, prompt.length() / 4);
            totalCost += 0.0001;
            AgentEvent.Result result = result();
            activeQuery.compareAndSet(query, null);
            callbacks.onEvent(result);
            callbacks.onComplete();
        } catch (InterruptedException | CancellationException e) {
            activeQuery.compareAndSet(query, null);
            log.info("[FAKE AGENT] query aborted");
        } catch (RuntimeException e) {
            activeQuery.compareAndSet(query, null);
            log.error("[FAKE AGENT] query failed", e);
            callbacks.onError(e);
        }
    }

    private void runShellCommand(String command) throws InterruptedException {
        String invocationId = "toolu_" + UUID.randomUUID().toString().replace("-", "");
        ObjectNode input = objectMapper.createObjectNode().put("command", command);

        ArrayNode content = objectMapper.createArrayNode();
        content.addObject().put("type", "tool_use").put("id", invocationId).put("name", "Bash").set("input", input);
        callbacks.onEvent(new AgentEvent.AssistantMessage(content));

        PermissionResult decision;
        try {
            decision = callbacks.onPermissionRequest("Bash", input, invocationId).toCompletableFuture().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            decision = PermissionResult.deny(cause.getMessage());
        }

        String output = decision.isAllow()
                ? "(simulated) ran: " + (decision.updatedInput() != null
                        ? decision.updatedInput().path("command").asText(command) : command)
                : decision.message();
        ObjectNode message = objectMapper.createObjectNode().put("role", "user");
        message.putArray("content").addObject()
                .put("type", "tool_result")
                .put("tool_use_id", invocationId)
                .put("content", output)
                .put("is_error", !decision.isAllow());
        ObjectNode toolUseResult = objectMapper.createObjectNode().put("stdout", output);
        callbacks.onEvent(new AgentEvent.UserMessage(invocationId, message, toolUseResult, false));
        pause();
    }

    private AgentEvent.Result result() {
        ObjectNode usage = objectMapper.createObjectNode()
                .put("input_tokens", totalInputTokens)
                .put("cache_read_input_tokens", 0);
        ObjectNode modelUsage = objectMapper.createObjectNode();
        modelUsage.putObject("fake-model").put("contextWindow", CONTEXT_WINDOW);
        return new AgentEvent.Result(totalInputTokens, 0, CONTEXT_WINDOW, totalCost, usage, modelUsage);
    }

    private JsonNode textContent(String text) {
        ArrayNode content = objectMapper.createArrayNode();
        content.addObject().put("type", "text").put("text", text);
        return content;
    }

    private void pause() throws InterruptedException {
        if (delayMillis > 0) {
            Thread.sleep(delayMillis);
        }
    }
}
