package com.automation.engine.service;

import com.automation.core.action.Action;
import com.automation.core.model.Automation;
import com.automation.core.model.EventTrigger;

import java.util.List;
import java.util.UUID;

/**
 * Authoring of automations.
 * Changes take effect for evaluation within one catalog refresh interval.
 */
public interface AutomationService {

    /**
     * Create a new automation.
     *
     * @param request The definition
     * @return The stored automation
     * @throws com.automation.core.exception.AutomationValidationException if the definition is malformed
     */
    Automation createAutomation(AutomationRequest request);

    /**
     * Get an automation by ID.
     *
     * @param automationId The automation ID
     * @return The automation
     * @throws com.automation.core.exception.NotFoundException if it does not exist
     */
    Automation getAutomation(UUID automationId);

    /**
     * List all automations, enabled or not.
     */
    List<Automation> listAutomations();

    /**
     * Replace the definition of an automation. Its open windows are discarded.
     *
     * @param automationId The automation ID
     * @param request The new definition
     * @return The updated automation
     */
    Automation updateAutomation(UUID automationId, AutomationRequest request);

    /**
     * Enable or disable an automation. Disabling discards its open windows.
     *
     * @param automationId The automation ID
     * @param enabled The new flag
     * @return The updated automation
     */
    Automation setEnabled(UUID automationId, boolean enabled);

    /**
     * Delete an automation. Its open windows are discarded.
     *
     * @param automationId The automation ID
     */
    void deleteAutomation(UUID automationId);

    /**
     * Request to create or replace an automation.
     */
    record AutomationRequest(
        String name,
        String description,
        Boolean enabled,
        EventTrigger trigger,
        List<Action> actions
    ) {}
}
