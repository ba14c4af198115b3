package com.automation.core.exception;

/**
 * Thrown when a request against the orchestrated system cannot be completed.
 */
public class OrchestrationException extends AutomationException {
    
    public static final String ERROR_CODE = "ORCHESTRATION_ERROR";
    
    private final int statusCode;
    
    public OrchestrationException(int statusCode, String message) {
        super(ERROR_CODE, message);
        this.statusCode = statusCode;
    }
    
    public OrchestrationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.statusCode = 0;
    }
    
    /**
     * HTTP-style status code reported by the orchestrated system, or 0 when
     * the request never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
