package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WafPolicySpec(
    PolicyTargetReference targetRef,
    RuleSetReference ruleSet,
    FailurePolicy failurePolicy
) {
    
    public FailurePolicy effectiveFailurePolicy() {
        return failurePolicy != null ? failurePolicy : FailurePolicy.FAIL;
    }
}
