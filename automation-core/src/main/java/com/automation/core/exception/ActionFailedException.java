package com.automation.core.exception;

/**
 * Raised by an action when its effect cannot be applied.
 * The message becomes the reason carried by the action.failed event.
 * Checked, so every action implementation decides what counts as failure.
 */
public class ActionFailedException extends Exception {

    public ActionFailedException(String reason) {
        super(reason);
    }

    public ActionFailedException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public String getReason() {
        return getMessage();
    }
}
