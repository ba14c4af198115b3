package com.automation.core.exception;

/**
 * Thrown when an event query asks for an invalid page size.
 */
public class InvalidEventQueryException extends AutomationException {

    public static final String ERROR_CODE = "INVALID_EVENT_QUERY";

    public InvalidEventQueryException(String message) {
        super(ERROR_CODE, message);
    }
}
