package com.automation.core.exception;

/**
 * Thrown when a page token is empty, undecodable or has been tampered with.
 * Page tokens carry the query they continue, so a bad token is a permission
 * problem rather than a missing resource.
 */
public class InvalidPageTokenException extends AutomationException {
    
    public static final String ERROR_CODE = "INVALID_PAGE_TOKEN";
    
    public InvalidPageTokenException(String reason) {
        super(ERROR_CODE, "Invalid page token: " + reason);
    }
    
    public InvalidPageTokenException(String reason, Throwable cause) {
        super(ERROR_CODE, "Invalid page token: " + reason, cause);
    }
}
