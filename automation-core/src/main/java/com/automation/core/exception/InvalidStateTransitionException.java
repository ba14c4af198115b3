package com.automation.core.exception;

import com.automation.core.model.ActionState;

/**
 * Thrown when an action invocation is moved backwards or sideways
 * through its state machine.
 */
public class InvalidStateTransitionException extends AutomationException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(ActionState currentState, ActionState targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition invocation from %s to %s",
            currentState, targetState
        ));
    }
}
