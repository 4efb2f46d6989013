package com.platform.wafoperator.store.admission;

import com.platform.wafoperator.error.AdmissionRejectedException;
import com.platform.wafoperator.model.FailurePolicy;
import com.platform.wafoperator.model.PolicyTargetReference;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.model.WafPolicySpec;

import java.util.Set;

/**
 * Schema rules of the WAFPolicy resource.
 */
public class WafPolicyAdmissionValidator implements AdmissionValidator<WafPolicy> {
    
    static final int MAX_NAME_LENGTH = 253;
    
    private static final Set<String> TARGET_KINDS = Set.of(
        ResourceKind.GATEWAY.getKindName(),
        ResourceKind.HTTP_ROUTE.getKindName()
    );
    
    @Override
    public WafPolicy admit(WafPolicy policy) {
        WafPolicySpec spec = policy.spec();
        if (spec == null) {
            throw new AdmissionRejectedException("spec", null, "spec is required");
        }
        
        PolicyTargetReference targetRef = spec.targetRef();
        if (targetRef == null) {
            throw new AdmissionRejectedException("spec.targetRef", null, "targetRef is required");
        }
        if (!PolicyTargetReference.GATEWAY_API_GROUP.equals(targetRef.group())) {
            throw new AdmissionRejectedException("spec.targetRef.group", targetRef.group(),
                "targetRef.group must be gateway.networking.k8s.io");
        }
        if (!TARGET_KINDS.contains(targetRef.kind())) {
            throw new AdmissionRejectedException("spec.targetRef.kind", targetRef.kind(),
                "targetRef.kind must be Gateway or HTTPRoute");
        }
        if (targetRef.name() == null || targetRef.name().isEmpty()) {
            throw new AdmissionRejectedException("spec.targetRef.name", targetRef.name(),
                "targetRef name must not be empty");
        }
        
        if (spec.ruleSet() == null || spec.ruleSet().name() == null || spec.ruleSet().name().isEmpty()) {
            throw new AdmissionRejectedException("spec.ruleSet.name", null, "ruleSet name must not be empty");
        }
        if (spec.ruleSet().name().length() > MAX_NAME_LENGTH) {
            throw new AdmissionRejectedException("spec.ruleSet.name", spec.ruleSet().name(),
                "ruleSet name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        
        if (spec.failurePolicy() == null) {
            return new WafPolicy(policy.metadata(),
                new WafPolicySpec(targetRef, spec.ruleSet(), FailurePolicy.FAIL),
                policy.status());
        }
        return policy;
    }
}
