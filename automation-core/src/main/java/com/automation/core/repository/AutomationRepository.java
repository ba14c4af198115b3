package com.automation.core.repository;

import com.automation.core.model.Automation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Automation persistence.
 */
public interface AutomationRepository {

    /**
     * Insert or replace an automation.
     *
     * @param automation The automation to save
     */
    void save(Automation automation);

    /**
     * Find an automation by ID.
     *
     * @param automationId The automation ID
     * @return The automation if found
     */
    Optional<Automation> findById(UUID automationId);

    /**
     * Get all automations, ordered by creation time.
     */
    List<Automation> findAll();

    /**
     * Get automations that should be evaluated.
     */
    List<Automation> findEnabled();

    /**
     * Delete an automation.
     *
     * @param automationId The automation ID
     * @return true if it existed
     */
    boolean delete(UUID automationId);
}
