package com.platform.wafoperator.error;

/**
 * Exception for cluster store failures other than not-found and conflicts.
 */
public class StoreUnavailableException extends OperatorException {
    
    private final String operation;
    
    public StoreUnavailableException(String operation, String message) {
        super(ErrorCode.STORE_UNAVAILABLE, message);
        this.operation = operation;
    }
    
    public StoreUnavailableException(ErrorCode errorCode, String operation, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.operation = operation;
    }
    
    public static StoreUnavailableException requestFailed(String operation, String target, Throwable cause) {
        return new StoreUnavailableException(
            ErrorCode.STORE_REQUEST_FAILED,
            operation,
            String.format("failed to %s %s: %s", operation, target, cause.getMessage()),
            cause
        );
    }
    
    public String getOperation() {
        return operation;
    }
}
