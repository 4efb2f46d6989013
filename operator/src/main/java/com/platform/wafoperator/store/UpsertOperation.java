package com.platform.wafoperator.store;

/**
 * Which write the create-or-update primitive performed.
 */
public enum UpsertOperation {
    
    CREATED("created"),
    UPDATED("updated");
    
    private final String value;
    
    UpsertOperation(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
