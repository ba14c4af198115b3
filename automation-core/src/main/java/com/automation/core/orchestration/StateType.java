package com.automation.core.orchestration;

/**
 * State types of a flow run in the orchestrated system.
 * Legality of transitions between them is owned by the orchestrated system.
 */
public enum StateType {
    SCHEDULED,
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    CRASHED,
    PAUSED,
    CANCELLING;

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == CRASHED;
    }
}
