package com.automation.api.rest;

import com.automation.core.model.Automation;
import com.automation.engine.service.AutomationService;
import com.automation.engine.service.AutomationService.AutomationRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST API for automation management.
 */
@RestController
@RequestMapping("/api/automations")
public class AutomationController {

    private final AutomationService automationService;

    public AutomationController(AutomationService automationService) {
        this.automationService = automationService;
    }

    @PostMapping
    public ResponseEntity<Automation> createAutomation(@RequestBody AutomationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(automationService.createAutomation(request));
    }

    @GetMapping("/{automationId}")
    public ResponseEntity<Automation> getAutomation(@PathVariable UUID automationId) {
        return ResponseEntity.ok(automationService.getAutomation(automationId));
    }

    @GetMapping
    public ResponseEntity<List<Automation>> listAutomations() {
        return ResponseEntity.ok(automationService.listAutomations());
    }

    /**
     * Replace an automation's definition. Its open windows are discarded.
     */
    @PutMapping("/{automationId}")
    public ResponseEntity<Automation> updateAutomation(
            @PathVariable UUID automationId,
            @RequestBody AutomationRequest request) {
        return ResponseEntity.ok(automationService.updateAutomation(automationId, request));
    }

    /**
     * Enable or disable an automation.
     */
    @PatchMapping("/{automationId}")
    public ResponseEntity<Automation> patchAutomation(
            @PathVariable UUID automationId,
            @RequestBody EnabledRequest request) {
        return ResponseEntity.ok(automationService.setEnabled(automationId, request.enabled()));
    }

    @DeleteMapping("/{automationId}")
    public ResponseEntity<Void> deleteAutomation(@PathVariable UUID automationId) {
        automationService.deleteAutomation(automationId);
        return ResponseEntity.noContent().build();
    }

    // ========== DTOs ==========

    public record EnabledRequest(boolean enabled) {}
}
