package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionStatus {
    
    TRUE("True"),
    FALSE("False"),
    UNKNOWN("Unknown");
    
    private final String value;
    
    ConditionStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static ConditionStatus fromValue(String value) {
        for (ConditionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
