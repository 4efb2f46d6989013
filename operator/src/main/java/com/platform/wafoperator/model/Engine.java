package com.platform.wafoperator.model;

/**
 * Operator-synthesized object consumed by the enforcement data plane.
 */
public record Engine(
    ResourceMetadata metadata,
    EngineSpec spec,
    EngineStatus status
) implements Resource<Engine> {
    
    public Engine {
        status = status == null ? EngineStatus.EMPTY : status;
    }
    
    @Override
    public ResourceKind kind() {
        return ResourceKind.ENGINE;
    }
    
    @Override
    public Engine withMetadata(ResourceMetadata metadata) {
        return new Engine(metadata, spec, status);
    }
    
    @Override
    public Engine withStatusOf(Engine source) {
        return new Engine(metadata, spec, source.status());
    }
}
