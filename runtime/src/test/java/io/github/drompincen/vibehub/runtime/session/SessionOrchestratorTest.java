package io.github.drompincen.vibehub.runtime.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.vibehub.persistence.store.InMemorySessionStore;
import io.github.drompincen.vibehub.protocol.api.ContextUsage;
import io.github.drompincen.vibehub.protocol.api.DeliveryResult;
import io.github.drompincen.vibehub.protocol.api.PermissionDecision;
import io.github.drompincen.vibehub.protocol.api.PermissionMode;
import io.github.drompincen.vibehub.protocol.api.PermissionResult;
import io.github.drompincen.vibehub.protocol.api.SessionState;
import io.github.drompincen.vibehub.protocol.api.SessionStatusDto;
import io.github.drompincen.vibehub.protocol.api.StoredMessage;
import io.github.drompincen.vibehub.protocol.event.AgentEvent;
import io.github.drompincen.vibehub.protocol.ws.WsMessage;
import io.github.drompincen.vibehub.protocol.ws.WsMessageType;
import io.github.drompincen.vibehub.runtime.agent.AgentCallbacks;
import io.github.drompincen.vibehub.runtime.agent.AgentOptions;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceAdapter;
import io.github.drompincen.vibehub.runtime.agent.AgentServiceException;
import io.github.drompincen.vibehub.runtime.permission.GlobalAllowlist;
import io.github.drompincen.vibehub.runtime.permission.PermissionRejectedException;
import io.github.drompincen.vibehub.runtime.transport.SessionEventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SessionOrchestratorTest {

    private static final String SESSION = "s1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final AtomicBoolean agentActive = new AtomicBoolean();

    private InMemorySessionStore store;
    private SessionProperties properties;
    private AgentServiceAdapter adapter;
    private AgentCallbacks callbacks;
    private AgentOptions lastOptions;
    private SessionOrchestrator orchestrator;

    private record Sent(String connectionId, WsMessage message) {}

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        store.register(SESSION, "main", "/repo", PermissionMode.DEFAULT);
        properties = new SessionProperties();
        adapter = mock(AgentServiceAdapter.class);
        when(adapter.isActive()).thenAnswer(inv -> agentActive.get());
        doAnswer(inv -> {
            agentActive.set(true);
            return null;
        }).when(adapter).start(anyString());
        orchestrator = newOrchestrator(store);
    }

    private SessionOrchestrator newOrchestrator(InMemorySessionStore sessionStore) {
        SessionEventSink sink = (connectionId, message) -> sent.add(new Sent(connectionId, message));
        return new SessionOrchestrator(sessionStore, new GlobalAllowlist(sessionStore), (options, cb) -> {
            lastOptions = options;
            callbacks = cb;
            return adapter;
        }, sink, properties, objectMapper);
    }

    private void start(String connectionId) {
        orchestrator.startOrResumeSession(new StartSessionCommand(
                SESSION, connectionId, "/repo", null, PermissionMode.DEFAULT, false, null));
    }

    private List<JsonNode> payloads(String connectionId, WsMessageType type) {
        return sent.stream()
                .filter(s -> s.connectionId().equals(connectionId) && s.message().type() == type)
                .map(s -> s.message().payload())
                .toList();
    }

    private JsonNode last(String connectionId, WsMessageType type) {
        List<JsonNode> matching = payloads(connectionId, type);
        assertThat(matching).as("%s events to %s", type, connectionId).isNotEmpty();
        return matching.get(matching.size() - 1);
    }

    private AgentEvent.Result result(long input, long cacheRead, Long contextWindow, double cost) {
        return new AgentEvent.Result(input, cacheRead, contextWindow, cost, null, null);
    }

    private void finishQuery(AgentEvent.Result result) {
        agentActive.set(false);
        callbacks.onEvent(result);
        callbacks.onComplete();
    }

    private void storeHistory(int count) {
        for (int i = 0; i < count; i++) {
            store.appendMessage(SESSION, new StoredMessage(i, StoredMessage.ROLE_USER, TextNode.valueOf("m" + i), i));
        }
    }

    // --- lifecycle and replay ---

    @Test
    void coldStartReportsReadyAndReplaysMissingHistory() {
        storeHistory(3);

        orchestrator.startOrResumeSession(new StartSessionCommand(
                SESSION, "c1", null, null, null, false, 1L));

        JsonNode ready = last("c1", WsMessageType.SESSION_READY);
        assertThat(ready.path("historyLength").asLong()).isEqualTo(3);
        assertThat(ready.path("historyStart").asLong()).isZero();
        assertThat(ready.path("permissionMode").asText()).isEqualTo("default");
        assertThat(payloads("c1", WsMessageType.MESSAGE))
                .extracting(p -> p.path("seq").asLong())
                .containsExactly(1L, 2L);
        assertThat(payloads("c1", WsMessageType.MESSAGE)).allMatch(p -> p.path("replay").asBoolean());
        assertThat(lastOptions.workingDir()).isEqualTo("/repo");
        assertThat(orchestrator.isSessionActive(SESSION)).isTrue();
    }

    @Test
    void replayIsLimitedToInMemoryWindow() {
        properties.setHistoryWindow(3);
        storeHistory(5);

        orchestrator.startOrResumeSession(StartSessionCommand.resume(SESSION, "c1", 0L));

        JsonNode ready = last("c1", WsMessageType.SESSION_READY);
        assertThat(ready.path("historyLength").asLong()).isEqualTo(5);
        assertThat(ready.path("historyStart").asLong()).isEqualTo(2);
        assertThat(ready.path("messageCount").asLong()).isEqualTo(3);
        assertThat(payloads("c1", WsMessageType.MESSAGE))
                .extracting(p -> p.path("content").asText())
                .containsExactly("m2", "m3", "m4");
    }

    @Test
    void reconnectAfterClippedColdStartReplaysEachEntryOnce() {
        properties.setHistoryWindow(3);
        storeHistory(5);
        List<String> replayed = new ArrayList<>();

        orchestrator.startOrResumeSession(StartSessionCommand.resume(SESSION, "c1", 0L));
        payloads("c1", WsMessageType.MESSAGE).forEach(p -> replayed.add(p.path("content").asText()));
        long shown = payloads("c1", WsMessageType.MESSAGE).size();

        // pure reconnect, nothing happened in between
        orchestrator.startOrResumeSession(StartSessionCommand.resume(SESSION, "c2", shown));
        assertThat(payloads("c2", WsMessageType.MESSAGE)).isEmpty();

        // the client renders its own prompt, then drops before the reply arrives
        orchestrator.sendMessage(SESSION, "prompt", false);
        shown++;
        orchestrator.detachConnection("c2");
        callbacks.onEvent(new AgentEvent.AssistantMessage(TextNode.valueOf("reply")));

        orchestrator.startOrResumeSession(StartSessionCommand.resume(SESSION, "c3", shown));
        payloads("c3", WsMessageType.MESSAGE).forEach(p -> replayed.add(p.path("content").asText()));

        assertThat(replayed).containsExactly("m2", "m3", "m4", "reply");
        assertThat(orchestrator.getStatus(SESSION).messageCount()).isEqualTo(5);
    }

    @Test
    void resumeMovesOwnershipToNewConnection() {
        start("c1");
        orchestrator.sendMessage(SESSION, "hello", false);
        sent.clear();

        orchestrator.startOrResumeSession(StartSessionCommand.resume(SESSION, "c2", null));
        callbacks.onEvent(new AgentEvent.AssistantMessage(TextNode.valueOf("hi")));

        assertThat(payloads("c2", WsMessageType.MESSAGE)).hasSize(2);
        assertThat(last("c2", WsMessageType.THINKING).path("thinking").asBoolean()).isTrue();
        assertThat(sent).noneMatch(s -> s.connectionId().equals("c1"));
    }

    @Test
    void clientAlreadyUpToDateGetsNoReplay() {
        storeHistory(2);

        orchestrator.startOrResumeSession(StartSessionCommand.resume(SESSION, "c1", 7L));

        assertThat(payloads("c1", WsMessageType.MESSAGE)).isEmpty();
    }

    @Test
    void detachedSessionKeepsRunningWithoutRelaying() {
        start("c1");
        orchestrator.detachConnection("c1");
        sent.clear();

        callbacks.onEvent(new AgentEvent.AssistantMessage(TextNode.valueOf("still working")));

        assertThat(sent).isEmpty();
        assertThat(store.getSession(SESSION).orElseThrow().messages()).hasSize(1);
        assertThat(orchestrator.isSessionActive(SESSION)).isTrue();
    }

    // --- messaging ---

    @Test
    void sendMessagePersistsAndStartsAgent() {
        start("c1");

        assertThat(orchestrator.sendMessage(SESSION, "build it", false)).isTrue();

        verify(adapter).start("build it");
        assertThat(store.getSession(SESSION).orElseThrow().messages())
                .extracting(StoredMessage::content)
                .containsExactly(TextNode.valueOf("build it"));
        assertThat(last("c1", WsMessageType.THINKING).path("thinking").asBoolean()).isTrue();
        assertThat(payloads("c1", WsMessageType.MESSAGE)).isEmpty();
    }

    @Test
    void sendMessageIsRefusedWhileAgentIsBusy() {
        start("c1");
        orchestrator.sendMessage(SESSION, "first", false);

        assertThat(orchestrator.sendMessage(SESSION, "second", false)).isFalse();

        verify(adapter, never()).start("second");
    }

    @Test
    void sendMessageToUnknownSessionThrows() {
        assertThatThrownBy(() -> orchestrator.sendMessage("nope", "x", false))
                .isInstanceOf(SessionNotFoundException.class)
                .hasMessage("Session not found: nope");
    }

    @Test
    void adapterStartFailureIsReportedAndClearsThinking() {
        start("c1");
        doThrow(new AgentServiceException("cli missing")).when(adapter).start(anyString());

        assertThat(orchestrator.sendMessage(SESSION, "hello", false)).isFalse();

        assertThat(last("c1", WsMessageType.ERROR).path("message").asText()).isEqualTo("cli missing");
        assertThat(last("c1", WsMessageType.THINKING).path("thinking").asBoolean()).isFalse();
    }

    @Test
    void idleTargetReceivesCrossSessionMessageImmediately() {
        start("c1");

        DeliveryResult result = orchestrator.sendMessageToSession(SESSION, "from another session");

        assertThat(result).isEqualTo(DeliveryResult.deliveredNow());
        verify(adapter).start("from another session");
    }

    @Test
    void busyTargetGetsCrossSessionMessageQueued() {
        start("c1");
        orchestrator.sendMessage(SESSION, "working", false);

        DeliveryResult result = orchestrator.sendMessageToSession(SESSION, "later please");

        assertThat(result).isEqualTo(DeliveryResult.queuedForLater());
        assertThat(store.getSession(SESSION).orElseThrow().pendingMessages()).containsExactly("later please");
    }

    @Test
    void inactiveStoredTargetGetsMessageQueued() {
        assertThat(orchestrator.sendMessageToSession(SESSION, "wake up")).isEqualTo(DeliveryResult.queuedForLater());
        assertThat(orchestrator.sendMessageToSession("ghost", "hello"))
                .isEqualTo(DeliveryResult.failed("Session not found"));
    }

    @Test
    void queuedMessagesAreDeliveredOnColdStart() {
        store.queueMessage(SESSION, "queued while away");

        start("c1");

        verify(adapter).start("queued while away");
        JsonNode echoed = last("c1", WsMessageType.MESSAGE);
        assertThat(echoed.path("programmatic").asBoolean()).isTrue();
        assertThat(echoed.path("content").asText()).isEqualTo("queued while away");
    }

    @Test
    void drainStopsAtFirstRefusalAndRequeuesTheRest() {
        start("c1");
        orchestrator.sendMessage(SESSION, "current", false);
        store.queueMessage(SESSION, "one");
        store.queueMessage(SESSION, "two");
        store.queueMessage(SESSION, "three");

        finishQuery(result(10, 0, null, 0.01));

        verify(adapter).start("one");
        verify(adapter, never()).start("two");
        assertThat(store.getSession(SESSION).orElseThrow().pendingMessages()).containsExactly("two", "three");
        assertThat(last("c1", WsMessageType.THINKING).path("thinking").asBoolean()).isTrue();
    }

    // --- agent events ---

    @Test
    void systemInitBindsConversationAndRelaysSlashCommands() {
        start("c1");

        callbacks.onEvent(new AgentEvent.SystemInit("conv-9", List.of("/help")));

        assertThat(orchestrator.getAgentConversationId(SESSION)).contains("conv-9");
        assertThat(store.getSession(SESSION).orElseThrow().agentConversationId()).isEqualTo("conv-9");
        assertThat(last("c1", WsMessageType.SLASH_COMMANDS).path("commands").get(0).asText()).isEqualTo("/help");
    }

    @Test
    void resultComputesContextUsageWithFallbackWindow() {
        start("c1");
        orchestrator.sendMessage(SESSION, "go", false);

        finishQuery(result(30_000, 20_000, null, 0.42));

        JsonNode payload = last("c1", WsMessageType.RESULT);
        assertThat(payload.path("tokensUsed").asLong()).isEqualTo(50_000);
        assertThat(payload.path("contextWindow").asLong()).isEqualTo(200_000);
        assertThat(payload.path("percentUsed").asInt()).isEqualTo(25);
        assertThat(payload.path("replay").asBoolean()).isFalse();
        assertThat(store.getSession(SESSION).orElseThrow().contextUsage())
                .isEqualTo(new ContextUsage(50_000, 200_000, 0.42));
        assertThat(last("c1", WsMessageType.THINKING).path("thinking").asBoolean()).isFalse();
    }

    @Test
    void resultUsesModelContextWindowWhenReported() {
        start("c1");

        finishQuery(result(1_000, 0, 1_000_000L, 0.0));

        assertThat(last("c1", WsMessageType.RESULT).path("contextWindow").asLong()).isEqualTo(1_000_000);
    }

    @Test
    void contextUsageIsReplayedOnReconnect() {
        start("c1");
        finishQuery(result(100, 0, 1_000L, 0.0));

        orchestrator.startOrResumeSession(StartSessionCommand.resume(SESSION, "c2", null));

        JsonNode replayed = last("c2", WsMessageType.RESULT);
        assertThat(replayed.path("replay").asBoolean()).isTrue();
        assertThat(replayed.path("percentUsed").asInt()).isEqualTo(10);
    }

    @Test
    void toolResultIsRelayedWithInvocationId() {
        start("c1");
        JsonNode message = objectMapper.createObjectNode().put("role", "user");

        callbacks.onEvent(new AgentEvent.UserMessage("toolu_1", message, TextNode.valueOf("ok"), false));

        JsonNode payload = last("c1", WsMessageType.TOOL_RESULT);
        assertThat(payload.path("invocationId").asText()).isEqualTo("toolu_1");
        assertThat(payload.path("result").asText()).isEqualTo("ok");
    }

    @Test
    void agentErrorIsRelayedAndClearsThinkingWhenIdle() {
        start("c1");
        orchestrator.sendMessage(SESSION, "go", false);
        agentActive.set(false);

        callbacks.onError(new AgentServiceException("Agent CLI exited with code 1 before producing a result"));

        assertThat(last("c1", WsMessageType.ERROR).path("message").asText()).contains("exited with code 1");
        assertThat(last("c1", WsMessageType.THINKING).path("thinking").asBoolean()).isFalse();
    }

    @Test
    void completionDoesNotClearThinkingOfNextQuery() {
        start("c1");
        orchestrator.sendMessage(SESSION, "go", false);
        agentActive.set(false);
        callbacks.onEvent(result(1, 0, null, 0));
        orchestrator.sendMessage(SESSION, "next", false);
        sent.clear();

        callbacks.onComplete();

        assertThat(payloads("c1", WsMessageType.THINKING)).isEmpty();
        assertThat(orchestrator.getStatus(SESSION).thinking()).isTrue();
    }

    @Test
    void storeFailuresDoNotBlockRelay() {
        InMemorySessionStore failing = spy(new InMemorySessionStore());
        failing.register(SESSION, "main", "/repo", PermissionMode.DEFAULT);
        doThrow(new IllegalStateException("db down")).when(failing).appendMessage(any(), any());
        orchestrator = newOrchestrator(failing);
        start("c1");

        callbacks.onEvent(new AgentEvent.AssistantMessage(TextNode.valueOf("reply")));

        assertThat(last("c1", WsMessageType.MESSAGE).path("content").asText()).isEqualTo("reply");
    }

    // --- permissions ---

    @Test
    void permissionRequestIsRelayedAndDecisionResumesAgent() {
        start("c1");
        JsonNode input = objectMapper.createObjectNode().put("command", "pnpm build");

        CompletableFuture<PermissionResult> future =
                callbacks.onPermissionRequest("Bash", input, "toolu_1").toCompletableFuture();

        JsonNode request = last("c1", WsMessageType.PERMISSION_REQUEST);
        assertThat(request.path("invocationId").asText()).isEqualTo("toolu_1");
        assertThat(request.path("toolName").asText()).isEqualTo("Bash");
        assertThat(orchestrator.getStatus(SESSION).state()).isEqualTo(SessionState.WARM_AWAITING_PERMISSION);

        boolean rendered = orchestrator.respondToPermission(SESSION, "toolu_1", PermissionDecision.allowAndRemember(false));

        assertThat(rendered).isTrue();
        assertThat(future.join().isAllow()).isTrue();
        assertThat(last("c1", WsMessageType.ALLOWED_TOOLS).path("tools").get(0).asText()).isEqualTo("Bash(pnpm build)");
        assertThat(store.getSession(SESSION).orElseThrow().allowedTools()).containsExactly("Bash(pnpm build)");
        assertThat(last("c1", WsMessageType.THINKING).path("thinking").asBoolean()).isTrue();
        assertThat(orchestrator.respondToPermission(SESSION, "toolu_1", PermissionDecision.allow())).isFalse();
    }

    @Test
    void rememberedPatternAutoAllowsLaterInvocations() {
        start("c1");
        JsonNode first = objectMapper.createObjectNode().put("command", "pnpm build");
        callbacks.onPermissionRequest("Bash", first, "toolu_1");
        orchestrator.respondToPermission(SESSION, "toolu_1", PermissionDecision.allowAndRemember(true));
        sent.clear();

        JsonNode second = objectMapper.createObjectNode().put("command", "pnpm build --filter web");
        CompletableFuture<PermissionResult> future =
                callbacks.onPermissionRequest("Bash", second, "toolu_2").toCompletableFuture();

        assertThat(future).isCompleted();
        assertThat(payloads("c1", WsMessageType.PERMISSION_REQUEST)).isEmpty();
        assertThat(orchestrator.getGlobalAllowedTools()).containsExactly("Bash(pnpm build)");
    }

    @Test
    void pendingPermissionsAreReplayedOnReconnect() {
        start("c1");
        callbacks.onPermissionRequest("Write", objectMapper.createObjectNode().put("file_path", "/repo/a"), "toolu_1");

        orchestrator.startOrResumeSession(StartSessionCommand.resume(SESSION, "c2", null));

        assertThat(last("c2", WsMessageType.PERMISSION_REQUEST).path("invocationId").asText()).isEqualTo("toolu_1");
    }

    @Test
    void permissionRequestForInactiveSessionFails() {
        CompletableFuture<PermissionResult> future = orchestrator
                .handlePermissionRequest("ghost", "Bash", objectMapper.createObjectNode(), "t1")
                .toCompletableFuture();

        assertThat(future).isCompletedExceptionally();
    }

    @Test
    void allowedToolsOfInactiveSessionComeFromStore() {
        orchestrator.setAllowedTools(SESSION, List.of("Read"));

        assertThat(orchestrator.getAllowedTools(SESSION)).containsExactly("Read");
    }

    @Test
    void permissionModeChangeReachesAdapterAndStore() {
        start("c1");

        orchestrator.setPermissionMode(SESSION, PermissionMode.ACCEPT_EDITS);

        verify(adapter).setPermissionMode(PermissionMode.ACCEPT_EDITS);
        assertThat(store.getSession(SESSION).orElseThrow().permissionMode()).isEqualTo(PermissionMode.ACCEPT_EDITS);
    }

    // --- abort and shutdown ---

    @Test
    void abortRejectsPendingPermissionsAndKeepsSessionActive() {
        start("c1");
        orchestrator.sendMessage(SESSION, "go", false);
        CompletableFuture<PermissionResult> future = callbacks
                .onPermissionRequest("Bash", objectMapper.createObjectNode().put("command", "rm -rf /"), "toolu_1")
                .toCompletableFuture();

        assertThat(orchestrator.abortSession(SESSION)).isTrue();

        verify(adapter).abort();
        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(PermissionRejectedException.class);
        assertThat(last("c1", WsMessageType.THINKING).path("thinking").asBoolean()).isFalse();
        SessionStatusDto status = orchestrator.getStatus(SESSION);
        assertThat(status.active()).isTrue();
        assertThat(status.state()).isEqualTo(SessionState.ABORTED);
        assertThat(orchestrator.abortSession("ghost")).isFalse();
    }

    @Test
    void shutdownRejectsEverythingAndRefusesNewSessions() {
        start("c1");
        CompletableFuture<PermissionResult> future = callbacks
                .onPermissionRequest("Bash", objectMapper.createObjectNode().put("command", "make"), "toolu_1")
                .toCompletableFuture();

        orchestrator.shutdown();

        verify(adapter).abort();
        assertThatThrownBy(future::join).hasMessageContaining(SessionOrchestrator.SHUTDOWN_REASON);
        assertThat(orchestrator.getActiveSessionCount()).isZero();

        start("c2");
        assertThat(last("c2", WsMessageType.ERROR).path("message").asText()).isEqualTo("Server is shutting down");
        assertThat(orchestrator.isSessionActive(SESSION)).isFalse();
    }

    @Test
    void statusOfUnknownAndStoredSessions() {
        assertThat(orchestrator.getStatus("ghost").exists()).isFalse();
        SessionStatusDto stored = orchestrator.getStatus(SESSION);
        assertThat(stored.exists()).isTrue();
        assertThat(stored.active()).isFalse();
        assertThat(stored.state()).isEqualTo(SessionState.COLD);

        start("c1");
        assertThat(orchestrator.getStatus(SESSION).state()).isEqualTo(SessionState.WARM_IDLE);
        assertThat(orchestrator.getActiveSessionIds()).containsExactly(SESSION);
    }
}
