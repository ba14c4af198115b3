package com.automation.core.exception;

/**
 * Thrown when an ingested event is missing required fields.
 */
public class EventValidationException extends AutomationException {
    
    public static final String ERROR_CODE = "EVENT_VALIDATION_FAILED";
    
    public EventValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid event: %s - %s", field, reason));
    }
}
