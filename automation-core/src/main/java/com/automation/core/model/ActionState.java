package com.automation.core.model;

/**
 * Lifecycle states for one action invocation.
 */
public enum ActionState {
    /**
     * Claimed in the ledger, not yet started.
     * Transitions: -> ACTING, FAILED
     */
    PENDING,

    /**
     * act() has been called; outcome not yet recorded.
     * Transitions: -> SUCCEEDED, FAILED
     */
    ACTING,

    /**
     * The effect was applied and the executed event emitted. Terminal state.
     */
    SUCCEEDED,

    /**
     * The action failed and the failed event emitted. Terminal state.
     */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean canTransitionTo(ActionState target) {
        return switch (this) {
            case PENDING -> target == ACTING || target == FAILED;
            case ACTING -> target == SUCCEEDED || target == FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }
}
