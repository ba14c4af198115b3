package com.automation.core.exception;

/**
 * Thrown when the backing store fails to read or write.
 */
public class StorageException extends AutomationException {
    
    public static final String ERROR_CODE = "STORAGE_ERROR";
    
    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
