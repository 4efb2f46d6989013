package com.platform.wafoperator.error;

/**
 * Thrown when an object handed to a store write carries no kind or no name.
 */
public class MissingIdentityException extends OperatorException {
    
    public MissingIdentityException(String message) {
        super(ErrorCode.MISSING_IDENTITY, message);
    }
}
