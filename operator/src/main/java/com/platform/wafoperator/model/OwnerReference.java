package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Link from a dependent object to the object that owns it. The store
 * deletes dependents once their owner is gone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OwnerReference(
    String apiVersion,
    String kind,
    String name,
    String uid,
    Boolean controller,
    Boolean blockOwnerDeletion
) {
    
    /**
     * Controller reference to the given owner.
     */
    public static OwnerReference controllerOf(Resource<?> owner) {
        return new OwnerReference(
            owner.kind().getApiVersion(),
            owner.kind().getKindName(),
            owner.metadata().name(),
            owner.metadata().uid(),
            true,
            true
        );
    }
    
    @JsonIgnore
    public boolean isControllerRef() {
        return Boolean.TRUE.equals(controller);
    }
}
