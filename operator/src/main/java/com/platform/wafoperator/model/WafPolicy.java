package com.platform.wafoperator.model;

/**
 * Attaches WAF configuration to a Gateway or HTTPRoute.
 * 
 * Authored by users. The operator writes only finalizers and status.
 */
public record WafPolicy(
    ResourceMetadata metadata,
    WafPolicySpec spec,
    WafPolicyStatus status
) implements Resource<WafPolicy> {
    
    public WafPolicy {
        status = status == null ? WafPolicyStatus.EMPTY : status;
    }
    
    @Override
    public ResourceKind kind() {
        return ResourceKind.WAF_POLICY;
    }
    
    @Override
    public WafPolicy withMetadata(ResourceMetadata metadata) {
        return new WafPolicy(metadata, spec, status);
    }
    
    @Override
    public WafPolicy withStatusOf(WafPolicy source) {
        return new WafPolicy(metadata, spec, source.status());
    }
    
    public WafPolicy withStatus(WafPolicyStatus status) {
        return new WafPolicy(metadata, spec, status);
    }
}
