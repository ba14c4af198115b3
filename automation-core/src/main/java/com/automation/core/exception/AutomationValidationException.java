package com.automation.core.exception;

import java.util.List;

/**
 * Thrown when an automation or its trigger is malformed.
 * Raised at authoring time only, never during evaluation.
 */
public class AutomationValidationException extends AutomationException {
    
    public static final String ERROR_CODE = "AUTOMATION_VALIDATION_FAILED";
    
    private final List<String> problems;
    
    public AutomationValidationException(String message) {
        super(ERROR_CODE, message);
        this.problems = List.of(message);
    }
    
    public AutomationValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid automation: %s - %s", field, reason));
        this.problems = List.of(field + ": " + reason);
    }
    
    public AutomationValidationException(List<String> problems) {
        super(ERROR_CODE, "Invalid automation: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
    
    public List<String> getProblems() {
        return problems;
    }
}
