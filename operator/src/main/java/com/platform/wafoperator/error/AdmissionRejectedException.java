package com.platform.wafoperator.error;

/**
 * Exception for writes the store refused at admission time.
 */
public class AdmissionRejectedException extends OperatorException {
    
    private final String field;
    private final Object rejectedValue;
    
    public AdmissionRejectedException(String field, Object rejectedValue, String message) {
        super(ErrorCode.ADMISSION_REJECTED, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    /**
     * Rejection reported by a remote store, where only the message is known.
     */
    public AdmissionRejectedException(String message) {
        super(ErrorCode.ADMISSION_REJECTED, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
