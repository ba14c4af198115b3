package com.automation.core.orchestration;

/**
 * Outcome of proposing a state to the orchestrated system.
 *
 * @param statusCode HTTP-style status; 201 when a new state was accepted, 200 when it was already current
 * @param accepted whether the orchestrated system applied the proposal
 * @param details reason given when the proposal was rejected
 */
public record StateChangeResult(int statusCode, boolean accepted, String details) {

    public static StateChangeResult accepted(int statusCode) {
        return new StateChangeResult(statusCode, true, null);
    }

    public static StateChangeResult rejected(int statusCode, String details) {
        return new StateChangeResult(statusCode, false, details);
    }
}
