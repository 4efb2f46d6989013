package com.platform.wafoperator.events;

public enum EventType {
    
    NORMAL("Normal"),
    WARNING("Warning");
    
    private final String value;
    
    EventType(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
}
