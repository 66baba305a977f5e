package io.github.drompincen.vibehub.runtime.agent.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.PermissionResult;
import io.github.drompincen.vibehub.protocol.event.AgentEvent;
import io.github.drompincen.vibehub.runtime.agent.AgentCallbacks;
import io.github.drompincen.vibehub.runtime.agent.AgentEventParser;
import io.github.drompincen.vibehub.runtime.agent.AgentOptions;
import io.github.drompincen.vibehub.runtime.agent.AgentProperties;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceAdapter;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one Claude Code CLI process per query over its stream-json protocol. The prompt is written
 * as a user frame on stdin, events arrive as NDJSON on stdout, and tool permission checks arrive as
 * {@code can_use_tool} control requests answered with control responses on stdin.
 */
public class ClaudeCliAgentService implements AgentServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliAgentService.class);

    private final AgentOptions options;
    private final AgentCallbacks callbacks;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicLong requestCounter = new AtomicLong();
    private final Object writeLock = new Object();

    private volatile Process process;
    private volatile Writer stdin;
    private volatile String conversationId;
    private volatile PermissionMode permissionMode;
    private volatile boolean restoreBypassAfterInit;
    private volatile boolean aborted;

    public ClaudeCliAgentService(AgentOptions options, AgentCallbacks callbacks, AgentProperties properties,
                                 ObjectMapper objectMapper, ExecutorService executor) {
        this.options = options;
        this.callbacks = callbacks;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.permissionMode = options.permissionMode();
    }

    @Override
    public void start(String prompt) {
        if (!running.compareAndSet(false, true)) {
            throw new AgentServiceException("Agent query already running");
        }
        aborted = false;
        List<String> command = buildCommand();
        log.info("Starting agent CLI in {} (resume={}, mode={})",
                options.workingDir(), resumeToken(), command.get(command.indexOf("--permission-mode") + 1));

        Process started;
        Writer input;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            if (options.workingDir() != null) {
                builder.directory(new File(options.workingDir()));
            }
            started = builder.start();
            input = new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));
            process = started;
            stdin = input;
            writeFrame(userFrame(prompt));
        } catch (IOException e) {
            running.set(false);
            release(process, stdin);
            throw new AgentServiceException("Failed to launch agent CLI: " + e.getMessage(), e);
        }

        executor.submit(() -> pumpStdout(started, input));
        executor.submit(() -> pumpStderr(started));
    }

    @Override
    public void abort() {
        Process current = process;
        if (current == null) {
            return;
        }
        log.info("Aborting agent CLI (conversation {})", conversationId);
        aborted = true;
        current.destroy();
    }

    @Override
    public void setPermissionMode(PermissionMode mode) {
        this.permissionMode = mode;
        if (running.get() && stdin != null) {
            sendSetPermissionMode(mode);
            log.info("Permission mode updated on running query: {}", mode.wireName());
        } else {
            log.info("Permission mode updated, applies to next query: {}", mode.wireName());
        }
    }

    @Override
    public boolean isActive() {
        return running.get();
    }

    @Override
    public String getConversationId() {
        return conversationId;
    }

    List<String> buildCommand() {
        List<String> command = new ArrayList<>();
        command.add(properties.getCliPath());
        command.add("--print");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--input-format");
        command.add("stream-json");
        command.add("--verbose");
        command.add("--permission-prompt-tool");
        command.add("stdio");

        PermissionMode mode = permissionMode;
        String resume = resumeToken();
        restoreBypassAfterInit = false;
        if (resume != null && mode == PermissionMode.BYPASS_PERMISSIONS) {
            log.warn("Downgrading permission mode from bypassPermissions to acceptEdits for resume");
            mode = PermissionMode.ACCEPT_EDITS;
            restoreBypassAfterInit = true;
        }
        command.add("--permission-mode");
        command.add(mode.wireName());

        if (resume != null) {
            command.add("--resume");
            command.add(resume);
            // only the first query branches; later ones continue the fork
            if (options.fork() && conversationId == null) {
                command.add("--fork-session");
            }
        }
        if (properties.getModel() != null && !properties.getModel().isBlank()) {
            command.add("--model");
            command.add(properties.getModel());
        }
        command.addAll(properties.getExtraArgs());
        return command;
    }

    /**
     * Handles one stdout line.
     *
     * @return true when the line was the query's final result
     */
    boolean handleLine(String line) {
        if (line == null || line.isBlank()) {
            return false;
        }
        JsonNode frame;
        try {
            frame = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Skipping non-JSON agent output: {}", line);
            return false;
        }

        String type = frame.path("type").asText();
        if ("control_request".equals(type)) {
            handleControlRequest(frame);
            return false;
        }
        if ("control_response".equals(type)) {
            log.debug("Control response from agent CLI: {}", frame.path("response").path("subtype").asText());
            return false;
        }

        AgentEvent event = AgentEventParser.parse(frame).orElse(null);
        if (event == null) {
            return false;
        }
        if (event instanceof AgentEvent.SystemInit init) {
            conversationId = init.conversationId();
            log.info("Agent conversation initialized: {}", conversationId);
            if (restoreBypassAfterInit) {
                restoreBypassAfterInit = false;
                sendSetPermissionMode(PermissionMode.BYPASS_PERMISSIONS);
                log.info("Restored permission mode to bypassPermissions after resume");
            }
        }
        boolean finalResult = event instanceof AgentEvent.Result;
        if (finalResult) {
            running.set(false);
        }
        callbacks.onEvent(event);
        return finalResult;
    }

    void attachInput(Writer writer) {
        this.stdin = writer;
    }

    private void handleControlRequest(JsonNode frame) {
        String requestId = frame.path("request_id").asText();
        JsonNode request = frame.path("request");
        String subtype = request.path("subtype").asText();
        if (!"can_use_tool".equals(subtype)) {
            log.warn("Unsupported control request {} ({})", subtype, requestId);
            writeControlError(requestId, "Unsupported control request: " + subtype);
            return;
        }

        String toolName = request.path("tool_name").asText();
        JsonNode input = request.path("input");
        String invocationId = request.hasNonNull("tool_use_id") ? request.get("tool_use_id").asText() : requestId;
        log.info("Permission check for {} ({})", toolName, invocationId);

        callbacks.onPermissionRequest(toolName, input, invocationId).whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                log.info("Permission {} rejected: {}", invocationId, cause.getMessage());
                writeControlSuccess(requestId, decisionBody(PermissionResult.deny(cause.getMessage()), input));
            } else {
                writeControlSuccess(requestId, decisionBody(result, input));
            }
        });
    }

    private ObjectNode decisionBody(PermissionResult result, JsonNode originalInput) {
        ObjectNode body = objectMapper.createObjectNode();
        if (result.isAllow()) {
            body.put("behavior", "allow");
            body.set("updatedInput", result.updatedInput() != null ? result.updatedInput() : originalInput);
        } else {
            body.put("behavior", "deny");
            body.put("message", result.message() != null ? result.message() : "Permission denied");
        }
        return body;
    }

    private void writeControlSuccess(String requestId, ObjectNode body) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("subtype", "success");
        response.put("request_id", requestId);
        response.set("response", body);
        writeControlResponse(response);
    }

    private void writeControlError(String requestId, String error) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("subtype", "error");
        response.put("request_id", requestId);
        response.put("error", error);
        writeControlResponse(response);
    }

    private void writeControlResponse(ObjectNode response) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "control_response");
        frame.set("response", response);
        try {
            writeFrame(frame);
        } catch (IOException e) {
            log.warn("Failed to write control response: {}", e.getMessage());
        }
    }

    private void sendSetPermissionMode(PermissionMode mode) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "control_request");
        frame.put("request_id", "vibehub-" + requestCounter.incrementAndGet());
        ObjectNode request = frame.putObject("request");
        request.put("subtype", "set_permission_mode");
        request.put("mode", mode.wireName());
        try {
            writeFrame(frame);
        } catch (IOException e) {
            log.warn("Failed to send permission mode to agent CLI: {}", e.getMessage());
        }
    }

    private ObjectNode userFrame(String prompt) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", "user");
        ObjectNode message = frame.putObject("message");
        message.put("role", "user");
        message.put("content", prompt);
        return frame;
    }

    private void writeFrame(JsonNode frame) throws IOException {
        Writer writer = stdin;
        if (writer == null) {
            throw new IOException("Agent CLI input is closed");
        }
        synchronized (writeLock) {
            writer.write(objectMapper.writeValueAsString(frame));
            writer.write('\n');
            writer.flush();
        }
    }

    private void pumpStdout(Process proc, Writer input) {
        boolean completed = false;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (handleLine(line)) {
                    completed = true;
                    break;
                }
            }
        } catch (IOException e) {
            if (!aborted) {
                log.error("Agent CLI stream failed", e);
            }
        } catch (RuntimeException e) {
            log.error("Agent event handling failed", e);
        } finally {
            running.set(false);
            release(proc, input);
        }

        if (completed) {
            log.info("Agent query completed");
            callbacks.onComplete();
        } else if (aborted) {
            log.info("Agent query aborted");
        } else {
            int exitCode = waitForExit(proc);
            callbacks.onError(new AgentServiceException(
                    "Agent CLI exited with code " + exitCode + " before producing a result"));
        }
    }

    private void pumpStderr(Process proc) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(proc.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    log.error("Agent CLI stderr: {}", line.trim());
                }
            }
        } catch (IOException e) {
            log.debug("Agent CLI stderr closed: {}", e.getMessage());
        }
    }

    private int waitForExit(Process proc) {
        try {
            return proc.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
    }

    /**
     * Closes one query's process. Fields are cleared only if a later query has not replaced them.
     */
    private void release(Process proc, Writer input) {
        synchronized (writeLock) {
            if (stdin == input) stdin = null;
            if (process == proc) process = null;
        }
        if (input != null) {
            try {
                input.close();
            } catch (IOException e) {
                log.debug("Closing agent CLI input failed: {}", e.getMessage());
            }
        }
        if (proc != null && proc.isAlive()) {
            proc.destroy();
        }
    }

    private String resumeToken() {
        return conversationId != null ? conversationId : options.resumeToken();
    }
}
