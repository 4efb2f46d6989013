package com.platform.wafoperator.model;

/**
 * Typed object held by the cluster store: WAFPolicy, Engine, Gateway or HTTPRoute.
 *
 * @param <T> the concrete variant, so that copies keep their type
 */
public interface Resource<T extends Resource<T>> {
    
    ResourceKind kind();
    
    ResourceMetadata metadata();
    
    /**
     * Desired state. Compared by the store to decide whether a write bumps the generation.
     */
    Object spec();
    
    /**
     * Observed state, written only through the status subresource. Null for kinds without one.
     */
    Object status();
    
    T withMetadata(ResourceMetadata metadata);
    
    /**
     * Copy of this object carrying the status of {@code source}.
     */
    T withStatusOf(T source);
    
    default ObjectKey key() {
        return ObjectKey.of(metadata().namespace(), metadata().name());
    }
}
