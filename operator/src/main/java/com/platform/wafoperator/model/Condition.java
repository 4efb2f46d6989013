package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.With;

import java.time.Instant;

/**
 * A typed status fact with reason and message.
 */
@With
public record Condition(
    String type,
    ConditionStatus status,
    String reason,
    String message,
    long observedGeneration,
    Instant lastTransitionTime
) {
    
    @JsonIgnore
    public boolean isTrue() {
        return status == ConditionStatus.TRUE;
    }
    
    @JsonIgnore
    public boolean isFalse() {
        return status == ConditionStatus.FALSE;
    }
}
