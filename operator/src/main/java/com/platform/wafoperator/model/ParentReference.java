package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Entry of an HTTPRoute's parentRefs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParentReference(
    String group,
    String kind,
    String namespace,
    String name,
    String sectionName,
    Integer port
) {
    
    public static ParentReference gateway(String name) {
        return new ParentReference(PolicyTargetReference.GATEWAY_API_GROUP,
            ResourceKind.GATEWAY.getKindName(), null, name, null, null);
    }
}
