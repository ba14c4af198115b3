package com.automation.core.exception;

/**
 * Thrown when an automation, event or invocation is not found.
 */
public class NotFoundException extends AutomationException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
