package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Same-namespace reference to the Gateway or HTTPRoute a policy protects.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyTargetReference(
    String group,
    String kind,
    String name,
    String sectionName
) {
    
    public static final String GATEWAY_API_GROUP = "gateway.networking.k8s.io";
    
    public static PolicyTargetReference gateway(String name) {
        return new PolicyTargetReference(GATEWAY_API_GROUP, ResourceKind.GATEWAY.getKindName(), name, null);
    }
    
    public static PolicyTargetReference httpRoute(String name) {
        return new PolicyTargetReference(GATEWAY_API_GROUP, ResourceKind.HTTP_ROUTE.getKindName(), name, null);
    }
    
    public boolean matches(String targetKind, String targetName) {
        return targetKind.equals(kind) && targetName.equals(name);
    }
}
