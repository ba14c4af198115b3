package com.automation.core.exception;

/**
 * Thrown when event counting parameters cannot produce a sensible result.
 */
public class InvalidEventCountParametersException extends AutomationException {
    
    public static final String ERROR_CODE = "INVALID_EVENT_COUNT_PARAMETERS";
    
    public InvalidEventCountParametersException(String message) {
        super(ERROR_CODE, message);
    }
}
