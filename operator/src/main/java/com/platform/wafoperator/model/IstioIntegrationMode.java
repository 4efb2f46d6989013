package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the Istio driver attaches the WASM filter.
 */
public enum IstioIntegrationMode {
    
    GATEWAY("gateway");
    
    private final String value;
    
    IstioIntegrationMode(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static IstioIntegrationMode fromValue(String value) {
        for (IstioIntegrationMode mode : values()) {
            if (mode.value.equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown Istio integration mode: " + value);
    }
}
