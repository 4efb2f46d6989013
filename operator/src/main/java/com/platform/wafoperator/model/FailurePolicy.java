package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Behavior of the data plane when the WAF is not ready or errors.
 */
public enum FailurePolicy {
    
    /**
     * Block traffic.
     */
    FAIL("fail"),
    
    /**
     * Let traffic through.
     */
    ALLOW("allow");
    
    private final String value;
    
    FailurePolicy(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static FailurePolicy fromValue(String value) {
        for (FailurePolicy policy : values()) {
            if (policy.value.equals(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown failure policy: " + value);
    }
}
