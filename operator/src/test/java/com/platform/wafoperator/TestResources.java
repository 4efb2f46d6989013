package com.platform.wafoperator;

import com.platform.wafoperator.model.Gateway;
import com.platform.wafoperator.model.HttpRoute;
import com.platform.wafoperator.model.ParentReference;
import com.platform.wafoperator.model.PolicyTargetReference;
import com.platform.wafoperator.model.ResourceMetadata;
import com.platform.wafoperator.model.RuleSetReference;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.model.WafPolicySpec;
import com.platform.wafoperator.store.admission.WafPolicyAdmissionValidator;
import com.platform.wafoperator.store.memory.InMemoryResourceStore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

/**
 * Object builders shared by tests.
 */
public final class TestResources {
    
    public static final String NAMESPACE = "ns";
    public static final String RULE_SET = "crs";
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
    
    private TestResources() {
    }
    
    public static InMemoryResourceStore store() {
        return new InMemoryResourceStore(CLOCK, true, new WafPolicyAdmissionValidator());
    }
    
    public static WafPolicy gatewayPolicy(String name, String gatewayName) {
        return policy(name, PolicyTargetReference.gateway(gatewayName));
    }
    
    public static WafPolicy routePolicy(String name, String routeName) {
        return policy(name, PolicyTargetReference.httpRoute(routeName));
    }
    
    public static WafPolicy policy(String name, PolicyTargetReference targetRef) {
        return new WafPolicy(
            ResourceMetadata.of(NAMESPACE, name),
            new WafPolicySpec(targetRef, new RuleSetReference(RULE_SET), null),
            null
        );
    }
    
    public static Gateway gateway(String name) {
        return new Gateway(ResourceMetadata.of(NAMESPACE, name), new Gateway.GatewaySpec("istio"));
    }
    
    /**
     * Route with the given parent references; null entries stand for malformed ones.
     */
    public static HttpRoute httpRoute(String name, ParentReference... parentRefs) {
        return new HttpRoute(ResourceMetadata.of(NAMESPACE, name),
            new HttpRoute.HttpRouteSpec(Arrays.asList(parentRefs)));
    }
}
