package com.platform.wafoperator.reconciliation;

import com.platform.wafoperator.model.Gateway;
import com.platform.wafoperator.model.HttpRoute;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.ParentReference;
import com.platform.wafoperator.model.PolicyTargetReference;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.store.ResourceStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a policy's target to the labels selecting the gateway workload.
 * 
 * Store failures other than a missing target propagate to the caller.
 */
@Slf4j
public class TargetResolver {
    
    public static final String GATEWAY_NAME_LABEL = "gateway.networking.k8s.io/gateway-name";
    
    private final ResourceStore store;
    
    public TargetResolver(ResourceStore store) {
        this.store = store;
    }
    
    public TargetResolution resolve(WafPolicy policy) {
        PolicyTargetReference targetRef = policy.spec() == null ? null : policy.spec().targetRef();
        String kind = targetRef == null || targetRef.kind() == null ? "" : targetRef.kind();
        String namespace = policy.metadata().namespace();
        
        if (kind.equals(ResourceKind.GATEWAY.getKindName())) {
            return resolveGateway(namespace, targetRef.name());
        }
        if (kind.equals(ResourceKind.HTTP_ROUTE.getKindName())) {
            return resolveHttpRoute(namespace, targetRef.name());
        }
        return TargetResolution.notAccepted(PolicyReason.INVALID_TARGET_REF,
            "Unsupported targetRef kind: " + kind, false);
    }
    
    public TargetResolution resolveGateway(String namespace, String gatewayName) {
        Optional<Gateway> gateway = store.gateways().get(ObjectKey.of(namespace, gatewayName));
        if (gateway.isEmpty()) {
            log.info("WAFPolicy: Target Gateway not found gateway={}", gatewayName);
            return TargetResolution.notAccepted(PolicyReason.TARGET_NOT_FOUND,
                String.format("Gateway \"%s\" not found", gatewayName), true);
        }
        return TargetResolution.resolved(Map.of(GATEWAY_NAME_LABEL, gatewayName));
    }
    
    /**
     * Only the first parent reference is considered.
     */
    public TargetResolution resolveHttpRoute(String namespace, String routeName) {
        Optional<HttpRoute> route = store.httpRoutes().get(ObjectKey.of(namespace, routeName));
        if (route.isEmpty()) {
            log.info("WAFPolicy: Target HTTPRoute not found httproute={}", routeName);
            return TargetResolution.notAccepted(PolicyReason.TARGET_NOT_FOUND,
                String.format("HTTPRoute \"%s\" not found", routeName), true);
        }
        
        List<ParentReference> parentRefs = route.get().parentRefs();
        if (parentRefs.isEmpty()) {
            return TargetResolution.notAccepted(PolicyReason.NO_PARENT_GATEWAY,
                String.format("HTTPRoute \"%s\" has no parentRefs", routeName), false);
        }
        
        ParentReference first = parentRefs.get(0);
        if (first == null) {
            return TargetResolution.notAccepted(PolicyReason.INVALID_PARENT_REF,
                String.format("HTTPRoute \"%s\" has invalid parentRef", routeName), false);
        }
        if (first.name() == null || first.name().isEmpty()) {
            return TargetResolution.notAccepted(PolicyReason.INVALID_PARENT_REF,
                String.format("HTTPRoute \"%s\" parentRef has no gateway name", routeName), false);
        }
        
        log.debug("WAFPolicy: Resolved HTTPRoute parent gateway gateway={}", first.name());
        return TargetResolution.resolved(Map.of(GATEWAY_NAME_LABEL, first.name()));
    }
}
