package com.platform.wafoperator.model;

/**
 * Gateway API Gateway. Only its existence matters to the operator.
 */
public record Gateway(
    ResourceMetadata metadata,
    GatewaySpec spec
) implements Resource<Gateway> {
    
    public record GatewaySpec(String gatewayClassName) {
    }
    
    @Override
    public ResourceKind kind() {
        return ResourceKind.GATEWAY;
    }
    
    @Override
    public Object status() {
        return null;
    }
    
    @Override
    public Gateway withMetadata(ResourceMetadata metadata) {
        return new Gateway(metadata, spec);
    }
    
    @Override
    public Gateway withStatusOf(Gateway source) {
        return this;
    }
}
