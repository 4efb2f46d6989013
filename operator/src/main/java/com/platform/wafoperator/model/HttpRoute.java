package com.platform.wafoperator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gateway API HTTPRoute. The operator reads only its parent references.
 */
public record HttpRoute(
    ResourceMetadata metadata,
    HttpRouteSpec spec
) implements Resource<HttpRoute> {
    
    /**
     * A null entry in {@code parentRefs} stands for an entry the store returned
     * in a shape that is not a parent reference.
     */
    public record HttpRouteSpec(List<ParentReference> parentRefs) {
        
        public HttpRouteSpec {
            parentRefs = parentRefs == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(parentRefs));
        }
    }
    
    @Override
    public ResourceKind kind() {
        return ResourceKind.HTTP_ROUTE;
    }
    
    @Override
    public Object status() {
        return null;
    }
    
    @Override
    public HttpRoute withMetadata(ResourceMetadata metadata) {
        return new HttpRoute(metadata, spec);
    }
    
    @Override
    public HttpRoute withStatusOf(HttpRoute source) {
        return this;
    }
    
    public List<ParentReference> parentRefs() {
        return spec == null ? List.of() : spec.parentRefs();
    }
}
