package com.platform.wafoperator.reconciliation;

/**
 * Condition and event reasons written on WAFPolicy objects.
 */
public enum PolicyReason {
    
    ACCEPTED("Accepted"),
    PROGRAMMED("Programmed"),
    TARGET_NOT_FOUND("TargetNotFound"),
    NO_PARENT_GATEWAY("NoParentGateway"),
    INVALID_PARENT_REF("InvalidParentRef"),
    INVALID_TARGET_REF("InvalidTargetRef"),
    ENGINE_SYNC_FAILED("EngineSyncFailed");
    
    private final String value;
    
    PolicyReason(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
}
