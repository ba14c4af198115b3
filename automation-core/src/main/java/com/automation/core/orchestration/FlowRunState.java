package com.automation.core.orchestration;

import java.time.Instant;

/**
 * A proposed or current flow-run state.
 */
public record FlowRunState(
    StateType type,
    String name,
    String message,
    Instant timestamp
) {

    public static final String SUSPENDED = "Suspended";
    public static final String CANCELLING = "Cancelling";

    public static FlowRunState of(StateType type, String name) {
        return new FlowRunState(type, name, null, null);
    }

    /**
     * A paused state that releases the run's infrastructure.
     */
    public static FlowRunState suspended(String message) {
        return new FlowRunState(StateType.PAUSED, SUSPENDED, message, null);
    }

    public static FlowRunState cancelling(String message) {
        return new FlowRunState(StateType.CANCELLING, CANCELLING, message, null);
    }

    public FlowRunState at(Instant when) {
        return new FlowRunState(type, name, message, when);
    }

    /**
     * Same type and display name; message and timestamp are ignored.
     */
    public boolean sameAs(FlowRunState other) {
        return other != null && type == other.type
            && (name == null || name.equals(other.name));
    }
}
