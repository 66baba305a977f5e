package io.github.drompincen.vibehub.runtime.permission;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.vibehub.protocol.api.PermissionDecision;
import io.github.drompincen.vibehub.protocol.api.PermissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Per-session permission gate. Tool invocations that match the session or global allow-list are
 * answered immediately; everything else is parked as a {@link PendingPermission} until
 * {@link #renderDecision} or {@link #rejectAll} completes it.
 */
public class PermissionGate {

    private static final Logger log = LoggerFactory.getLogger(PermissionGate.class);

    public static final String FEEDBACK_MARKER = "[USER FEEDBACK]";
    public static final String DEFAULT_DENY_MESSAGE = "Permission denied by user";

    public interface Listener {
        void onPermissionRequested(PendingPermission pending);

        void onSessionAllowlistChanged(List<String> tools);

        void onGlobalAllowlistChanged(List<String> tools);
    }

    private final String sessionId;
    private final GlobalAllowlist globalAllowlist;
    private final Listener listener;
    private final Map<String, PendingPermission> pending = new LinkedHashMap<>();
    private final Object sessionAllowlistLock = new Object();
    private volatile Set<String> sessionAllowlist;

    public PermissionGate(String sessionId, GlobalAllowlist globalAllowlist, Listener listener,
                          Collection<String> initialSessionAllowlist) {
        this.sessionId = sessionId;
        this.globalAllowlist = globalAllowlist;
        this.listener = listener;
        this.sessionAllowlist = initialSessionAllowlist != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(initialSessionAllowlist))
                : Set.of();
    }

    /**
     * Returns an already-completed allow for allow-listed invocations, otherwise registers a pending
     * request, notifies the listener and returns the future that the decision will complete.
     * Asking again for an invocation id that is still pending returns the existing future.
     */
    public CompletableFuture<PermissionResult> requestPermission(String toolName, JsonNode input, String invocationId) {
        if (AllowlistMatcher.isAllowed(toolName, input, sessionAllowlist, globalAllowlist.snapshot())) {
            log.info("Auto-allowed {} for session {}", AllowlistMatcher.generatePattern(toolName, input), sessionId);
            return CompletableFuture.completedFuture(PermissionResult.allow(input));
        }

        PendingPermission request;
        synchronized (pending) {
            PendingPermission existing = pending.get(invocationId);
            if (existing != null) {
                log.warn("Duplicate permission request {} for session {}, reusing pending entry", invocationId, sessionId);
                return existing.future();
            }
            request = new PendingPermission(invocationId, toolName, input, new CompletableFuture<>(), Instant.now());
            pending.put(invocationId, request);
        }

        log.info("Permission requested for {} ({}) in session {}", toolName, invocationId, sessionId);
        listener.onPermissionRequested(request);
        return request.future();
    }

    /**
     * @return false when no pending request with this id exists, e.g. it was already decided
     */
    public boolean renderDecision(String invocationId, PermissionDecision decision) {
        PendingPermission request;
        synchronized (pending) {
            request = pending.remove(invocationId);
        }
        if (request == null) {
            log.warn("No pending permission {} in session {}", invocationId, sessionId);
            return false;
        }

        if (decision.isAllow()) {
            if (decision.remember()) {
                remember(AllowlistMatcher.generatePattern(request.toolName(), request.input()), decision.global());
            }
            JsonNode input = hasUpdatedInput(decision) ? decision.updatedInput() : request.input();
            log.info("Permission {} allowed for {} in session {}", invocationId, request.toolName(), sessionId);
            request.future().complete(PermissionResult.allow(input));
        } else {
            log.info("Permission {} denied for {} in session {}", invocationId, request.toolName(), sessionId);
            request.future().complete(PermissionResult.deny(formatDenyMessage(decision.message())));
        }
        return true;
    }

    /**
     * Completes every outstanding request with a {@link PermissionRejectedException}.
     *
     * @return number of requests rejected
     */
    public int rejectAll(String reason) {
        List<PendingPermission> rejected;
        synchronized (pending) {
            rejected = new ArrayList<>(pending.values());
            pending.clear();
        }
        for (PendingPermission request : rejected) {
            request.future().completeExceptionally(new PermissionRejectedException(reason));
        }
        if (!rejected.isEmpty()) {
            log.info("Rejected {} pending permissions in session {}: {}", rejected.size(), sessionId, reason);
        }
        return rejected.size();
    }

    public List<PendingPermission> pending() {
        synchronized (pending) {
            return List.copyOf(pending.values());
        }
    }

    public int pendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    public List<String> sessionAllowlist() {
        return List.copyOf(sessionAllowlist);
    }

    public void setSessionAllowlist(Collection<String> tools) {
        synchronized (sessionAllowlistLock) {
            sessionAllowlist = Collections.unmodifiableSet(new LinkedHashSet<>(tools));
        }
    }

    public static String formatDenyMessage(String message) {
        String feedback = message != null && !message.isBlank() ? message : DEFAULT_DENY_MESSAGE;
        return FEEDBACK_MARKER + " " + feedback + ". Respect this decision and do not attempt this action again.";
    }

    private void remember(String pattern, boolean global) {
        if (global) {
            globalAllowlist.add(pattern);
            listener.onGlobalAllowlistChanged(globalAllowlist.list());
            return;
        }
        List<String> updated;
        synchronized (sessionAllowlistLock) {
            Set<String> next = new LinkedHashSet<>(sessionAllowlist);
            next.add(pattern);
            sessionAllowlist = Collections.unmodifiableSet(next);
            updated = List.copyOf(next);
        }
        log.info("Added {} to session {} allowlist", pattern, sessionId);
        listener.onSessionAllowlistChanged(updated);
    }

    private static boolean hasUpdatedInput(PermissionDecision decision) {
        JsonNode updated = decision.updatedInput();
        return updated != null && !updated.isNull() && !updated.isMissingNode() && !updated.isEmpty();
    }
}
