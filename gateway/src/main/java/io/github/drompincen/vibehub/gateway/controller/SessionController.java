package io.github.drompincen.vibehub.gateway.controller;

import io.github.drompincen.vibehub.protocol.api.AllowedToolsDto;
import io.github.drompincen.vibehub.protocol.api.DeliveryResult;
import io.github.drompincen.vibehub.protocol.api.SendMessageRequest;
import io.github.drompincen.vibehub.protocol.api.SessionStatusDto;
import io.github.drompincen.vibehub.runtime.session.SessionOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionOrchestrator orchestrator;

    public SessionController(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/active")
    public List<SessionStatusDto> active() {
        return orchestrator.getActiveSessionIds().stream()
                .map(orchestrator::getStatus)
                .collect(Collectors.toList());
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<?> status(@PathVariable String id) {
        SessionStatusDto status = orchestrator.getStatus(id);
        if (!status.exists()) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(status);
    }

    /**
     * Hands a message to the session from outside its own connection, e.g. from another session's agent.
     */
    @PostMapping("/{id}/messages")
    public ResponseEntity<?> sendMessage(@PathVariable String id, @RequestBody SendMessageRequest req) {
        if (req == null || req.content() == null || req.content().isBlank()) {
            return ResponseEntity.badRequest().body(DeliveryResult.failed("content is required"));
        }
        DeliveryResult result = orchestrator.sendMessageToSession(id, req.content());
        if (!result.success()) {
            return "Session not found".equals(result.error())
                    ? ResponseEntity.status(404).body(result)
                    : ResponseEntity.internalServerError().body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{id}/allowed-tools")
    public AllowedToolsDto getAllowedTools(@PathVariable String id) {
        return new AllowedToolsDto(id, orchestrator.getAllowedTools(id));
    }

    @PutMapping("/{id}/allowed-tools")
    public ResponseEntity<?> setAllowedTools(@PathVariable String id, @RequestBody AllowedToolsDto req) {
        if (req == null || req.tools() == null) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(new AllowedToolsDto(id, orchestrator.setAllowedTools(id, req.tools())));
    }
}
