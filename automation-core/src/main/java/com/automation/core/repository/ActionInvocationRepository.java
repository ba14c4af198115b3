package com.automation.core.repository;

import com.automation.core.model.ActionInvocation;
import com.automation.core.model.ActionState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the action invocation ledger.
 * The ledger is what makes action execution at-most-once per invocation id.
 */
public interface ActionInvocationRepository {

    /**
     * Claim an invocation id.
     *
     * @param invocation The pending invocation
     * @return true if created, false if the id was already claimed
     */
    boolean tryCreate(ActionInvocation invocation);

    /**
     * Replace the stored invocation if it is still in the expected state.
     * Concurrent claimants of the same id race on this compare-and-set.
     *
     * @param invocation The updated invocation
     * @param expectedState The state the stored invocation must be in
     * @return true if updated, false if the stored state differed
     * @throws com.automation.core.exception.NotFoundException if it was never created
     */
    boolean update(ActionInvocation invocation, ActionState expectedState);

    /**
     * Find an invocation by ID.
     *
     * @param invocationId The invocation ID
     * @return The invocation if found
     */
    Optional<ActionInvocation> findById(UUID invocationId);

    /**
     * Find invocations in a state that have not been updated since a cutoff.
     * Used by recovery to locate invocations whose outcome is unknown.
     *
     * @param state The state to look for
     * @param updatedBefore Only invocations last updated before this instant
     * @param limit Maximum number of results
     * @return Matching invocations, oldest first
     */
    List<ActionInvocation> findByState(ActionState state, Instant updatedBefore, int limit);

    /**
     * Get all invocations of one automation, oldest first.
     */
    List<ActionInvocation> findByAutomation(UUID automationId);
}
