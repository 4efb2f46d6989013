package com.platform.wafoperator.model;

import java.util.List;

public record WafPolicyStatus(List<Condition> conditions) {
    
    public static final WafPolicyStatus EMPTY = new WafPolicyStatus(List.of());
    
    public WafPolicyStatus {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
