package com.platform.wafoperator.store.admission;

import com.platform.wafoperator.TestResources;
import com.platform.wafoperator.error.AdmissionRejectedException;
import com.platform.wafoperator.model.FailurePolicy;
import com.platform.wafoperator.model.PolicyTargetReference;
import com.platform.wafoperator.model.ResourceMetadata;
import com.platform.wafoperator.model.RuleSetReference;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.model.WafPolicySpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WafPolicyAdmissionValidatorTest {
    
    private final WafPolicyAdmissionValidator validator = new WafPolicyAdmissionValidator();
    
    @Test
    @DisplayName("accepts a Gateway target and defaults failurePolicy")
    void acceptsGateway() {
        WafPolicy admitted = validator.admit(TestResources.gatewayPolicy("p", "gw"));
        
        assertEquals(FailurePolicy.FAIL, admitted.spec().failurePolicy());
    }
    
    @Test
    @DisplayName("keeps an explicit failurePolicy")
    void keepsExplicitFailurePolicy() {
        WafPolicy policy = withSpec(new WafPolicySpec(PolicyTargetReference.httpRoute("r"),
            new RuleSetReference("crs"), FailurePolicy.ALLOW));
        
        assertEquals(FailurePolicy.ALLOW, validator.admit(policy).spec().failurePolicy());
    }
    
    @Test
    @DisplayName("rejects a foreign target group")
    void rejectsGroup() {
        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
            () -> validator.admit(TestResources.policy("p", new PolicyTargetReference("apps", "Gateway", "gw", null))));
        
        assertEquals("spec.targetRef.group", e.getField());
    }
    
    @Test
    @DisplayName("rejects an unsupported target kind")
    void rejectsKind() {
        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
            () -> validator.admit(TestResources.policy("p",
                new PolicyTargetReference(PolicyTargetReference.GATEWAY_API_GROUP, "Service", "svc", null))));
        
        assertEquals("spec.targetRef.kind", e.getField());
    }
    
    @Test
    @DisplayName("rejects an empty target name")
    void rejectsEmptyTargetName() {
        assertThrows(AdmissionRejectedException.class,
            () -> validator.admit(TestResources.gatewayPolicy("p", "")));
    }
    
    @Test
    @DisplayName("rejects a missing or oversized rule set name")
    void rejectsRuleSetName() {
        assertThrows(AdmissionRejectedException.class, () -> validator.admit(withSpec(
            new WafPolicySpec(PolicyTargetReference.gateway("gw"), new RuleSetReference(""), null))));
        
        String tooLong = "r".repeat(WafPolicyAdmissionValidator.MAX_NAME_LENGTH + 1);
        assertThrows(AdmissionRejectedException.class, () -> validator.admit(withSpec(
            new WafPolicySpec(PolicyTargetReference.gateway("gw"), new RuleSetReference(tooLong), null))));
    }
    
    @Test
    @DisplayName("rejects a policy without spec")
    void rejectsMissingSpec() {
        assertThrows(AdmissionRejectedException.class, () -> validator.admit(withSpec(null)));
    }
    
    private WafPolicy withSpec(WafPolicySpec spec) {
        return new WafPolicy(ResourceMetadata.of(TestResources.NAMESPACE, "p"), spec, null);
    }
}
