package io.github.drompincen.vibehub.gateway.controller;

import io.github.drompincen.vibehub.protocol.api.AllowedToolsDto;
import io.github.drompincen.vibehub.runtime.session.SessionOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final SessionOrchestrator orchestrator;

    public SettingsController(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/allowed-tools")
    public AllowedToolsDto getGlobalAllowedTools() {
        return AllowedToolsDto.global(orchestrator.getGlobalAllowedTools());
    }

    @PutMapping("/allowed-tools")
    public ResponseEntity<?> setGlobalAllowedTools(@RequestBody AllowedToolsDto req) {
        if (req == null || req.tools() == null) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(AllowedToolsDto.global(orchestrator.setGlobalAllowedTools(req.tools())));
    }
}
