package com.platform.wafoperator.error;

/**
 * Standardized error codes for the operator.
 * 
 * Format: WAF-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors (admission, identity, request shape)
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Store errors (cluster store unreachable, deadlines)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    ADMISSION_REJECTED("WAF-100", "Rejected by admission validation", ErrorCategory.RECOVERABLE),
    MISSING_IDENTITY("WAF-101", "Object kind and name must be set", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("WAF-102", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("WAF-103", "Missing required field", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("WAF-300", "Resource not found", ErrorCategory.RECOVERABLE),
    RESOURCE_CONFLICT("WAF-310", "Resource version conflict", ErrorCategory.RECOVERABLE),
    ALREADY_EXISTS("WAF-311", "Resource already exists", ErrorCategory.RECOVERABLE),
    
    // ==================== Store Errors (4xx) ====================
    
    STORE_UNAVAILABLE("WAF-400", "Cluster store unavailable", ErrorCategory.RECOVERABLE),
    STORE_REQUEST_FAILED("WAF-401", "Cluster store request failed", ErrorCategory.RECOVERABLE),
    RECONCILE_DEADLINE_EXCEEDED("WAF-402", "Reconciliation pass exceeded its deadline", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("WAF-900", "Internal error", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("WAF-902", "Configuration error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - the next reconciliation pass may succeed.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - operator is misconfigured, may require intervention.
         */
        FATAL
    }
}
