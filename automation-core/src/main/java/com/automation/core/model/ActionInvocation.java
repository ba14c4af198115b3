package com.automation.core.model;

import com.automation.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry tracking the execution of one TriggeredAction.
 *
 * Primary Key: invocationId (= TriggeredAction.id)
 *
 * Invariants:
 * - state only moves forward, see {@link ActionState#canTransitionTo}
 * - attempts counts calls to act(), including recovery re-invocations
 */
public record ActionInvocation(
    UUID invocationId,
    UUID automationId,
    int actionIndex,
    String actionType,
    ActionState state,
    int attempts,
    String reason,
    Instant createdAt,
    Instant updatedAt,
    TriggeredAction triggeredAction
) {

    /**
     * Create a pending ledger entry.
     */
    public static ActionInvocation create(TriggeredAction triggeredAction, Instant now) {
        return new ActionInvocation(
            triggeredAction.id(),
            triggeredAction.automation().id(),
            triggeredAction.actionIndex(),
            triggeredAction.action().type(),
            ActionState.PENDING,
            0,
            null,
            now,
            now,
            triggeredAction
        );
    }

    /**
     * Create a copy in a new state.
     *
     * @throws InvalidStateTransitionException if the transition is not allowed
     */
    public ActionInvocation withState(ActionState newState, Instant now, String newReason) {
        if (!state.canTransitionTo(newState)) {
            throw new InvalidStateTransitionException(state, newState);
        }
        int newAttempts = newState == ActionState.ACTING ? attempts + 1 : attempts;
        return new ActionInvocation(
            invocationId, automationId, actionIndex, actionType,
            newState, newAttempts, newReason, createdAt, now, triggeredAction
        );
    }

    /**
     * Record another act() attempt without leaving ACTING.
     */
    public ActionInvocation withRetriedAttempt(Instant now) {
        if (state != ActionState.ACTING) {
            throw new InvalidStateTransitionException(state, ActionState.ACTING);
        }
        return new ActionInvocation(
            invocationId, automationId, actionIndex, actionType,
            state, attempts + 1, reason, createdAt, now, triggeredAction
        );
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }
}
