package com.platform.wafoperator.model;

import java.util.List;

/**
 * Observed state of an Engine. Written by the engine controller using
 * the Ready / Degraded / Progressing helpers in {@link Conditions}.
 */
public record EngineStatus(List<Condition> conditions) {
    
    public static final EngineStatus EMPTY = new EngineStatus(List.of());
    
    public EngineStatus {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
