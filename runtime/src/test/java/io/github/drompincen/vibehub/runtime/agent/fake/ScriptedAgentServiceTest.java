package io.github.drompincen.vibehub.runtime.agent.fake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.PermissionResult;
import io.github.drompincen.vibehub.protocol.event.AgentEvent;
import io.github.drompincen.vibehub.runtime.agent.AgentCallbacks;
import io.github.drompincen.vibehub.runtime.agent.AgentOptions;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceException;
import io.github.drompincen.vibehub.runtime.permission.PermissionRejectedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptedAgentServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService executor;
    private RecordingCallbacks callbacks;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        callbacks = new RecordingCallbacks();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ScriptedAgentService service(String resumeToken, boolean fork, long delay) {
        return new ScriptedAgentService(new AgentOptions("/tmp", resumeToken, fork, PermissionMode.DEFAULT),
                callbacks, objectMapper, executor, delay);
    }

    @Test
    void plainPromptEmitsInitEchoAndResult() throws Exception {
        ScriptedAgentService service = service(null, false, 0);

        service.start("hello");

        assertThat(callbacks.completed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(callbacks.events).hasSize(3);
        assertThat(callbacks.events.get(0)).isInstanceOf(AgentEvent.SystemInit.class);
        AgentEvent.AssistantMessage echo = (AgentEvent.AssistantMessage) callbacks.events.get(1);
        assertThat(echo.content().get(0).path("text").asText()).isEqualTo("Echo: hello");
        AgentEvent.Result result = (AgentEvent.Result) callbacks.events.get(2);
        assertThat(result.modelContextWindow()).isEqualTo(ScriptedAgentService.CONTEXT_WINDOW);
        assertThat(service.isActive()).isFalse();
        assertThat(service.getConversationId()).startsWith("fake-");
    }

    @Test
    void resumeKeepsConversationIdUnlessForking() throws Exception {
        ScriptedAgentService resumed = service("conv-1", false, 0);
        resumed.start("hi");
        assertThat(callbacks.completed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(resumed.getConversationId()).isEqualTo("conv-1");

        callbacks = new RecordingCallbacks();
        ScriptedAgentService forked = service("conv-1", true, 0);
        forked.start("hi");
        assertThat(callbacks.completed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(forked.getConversationId()).isNotEqualTo("conv-1");
    }

    @Test
    void bangPromptAsksForBashPermission() throws Exception {
        callbacks.decision = CompletableFuture.completedFuture(
                PermissionResult.allow(objectMapper.createObjectNode().put("command", "ls -la")));
        ScriptedAgentService service = service(null, false, 0);

        service.start("!ls");

        assertThat(callbacks.completed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(callbacks.permissionTool).isEqualTo("Bash");
        assertThat(callbacks.permissionInput.path("command").asText()).isEqualTo("ls");
        AgentEvent.UserMessage toolResult = callbacks.events.stream()
                .filter(AgentEvent.UserMessage.class::isInstance)
                .map(AgentEvent.UserMessage.class::cast)
                .findFirst().orElseThrow();
        assertThat(toolResult.toolInvocationId()).isEqualTo(callbacks.permissionInvocationId);
        assertThat(toolResult.toolUseResult().path("stdout").asText()).isEqualTo("(simulated) ran: ls -la");
    }

    @Test
    void rejectedPermissionBecomesDeniedToolResult() throws Exception {
        callbacks.decision = CompletableFuture.failedFuture(new PermissionRejectedException("Session aborted"));
        ScriptedAgentService service = service(null, false, 0);

        service.start("!rm -rf build");

        assertThat(callbacks.completed.await(5, TimeUnit.SECONDS)).isTrue();
        AgentEvent.UserMessage toolResult = callbacks.events.stream()
                .filter(AgentEvent.UserMessage.class::isInstance)
                .map(AgentEvent.UserMessage.class::cast)
                .findFirst().orElseThrow();
        assertThat(toolResult.message().path("content").get(0).path("is_error").asBoolean()).isTrue();
        assertThat(toolResult.toolUseResult().path("stdout").asText()).isEqualTo("Session aborted");
    }

    @Test
    void secondStartWhileRunningIsRejected() {
        callbacks.decision = new CompletableFuture<>();
        ScriptedAgentService service = service(null, false, 0);
        service.start("!sleep 10");

        assertThatThrownBy(() -> service.start("again")).isInstanceOf(AgentServiceException.class);
        service.abort();
        assertThat(service.isActive()).isFalse();
    }

    @Test
    void abortStopsQueryWithoutCompleting() throws Exception {
        ScriptedAgentService service = service(null, false, 1_000);
        service.start("slow");

        service.abort();

        assertThat(service.isActive()).isFalse();
        assertThat(callbacks.completed.await(200, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(callbacks.errors).isEmpty();
    }

    @Test
    void permissionModeIsTracked() {
        ScriptedAgentService service = service(null, false, 0);
        service.setPermissionMode(PermissionMode.PLAN);
        assertThat(service.permissionMode()).isEqualTo(PermissionMode.PLAN);
    }

    private static class RecordingCallbacks implements AgentCallbacks {
        final List<AgentEvent> events = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();
        final CountDownLatch completed = new CountDownLatch(1);
        volatile CompletableFuture<PermissionResult> decision = new CompletableFuture<>();
        volatile String permissionTool;
        volatile JsonNode permissionInput;
        volatile String permissionInvocationId;

        @Override
        public void onEvent(AgentEvent event) {
            events.add(event);
        }

        @Override
        public CompletionStage<PermissionResult> onPermissionRequest(String toolName, JsonNode input, String invocationId) {
            permissionTool = toolName;
            permissionInput = input;
            permissionInvocationId = invocationId;
            return decision;
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
        }

        @Override
        public void onComplete() {
            completed.countDown();
        }
    }
}
