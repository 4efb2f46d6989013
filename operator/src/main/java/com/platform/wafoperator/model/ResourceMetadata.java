package com.platform.wafoperator.model;

import lombok.Builder;
import lombok.With;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store-level metadata shared by every resource variant.
 */
@With
@Builder(toBuilder = true)
public record ResourceMetadata(
    String name,
    String namespace,
    String uid,
    long generation,
    String resourceVersion,
    Map<String, String> labels,
    Map<String, String> annotations,
    List<String> finalizers,
    List<OwnerReference> ownerReferences,
    Instant creationTimestamp,
    Instant deletionTimestamp
) {
    
    public ResourceMetadata {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        finalizers = finalizers == null ? List.of() : List.copyOf(finalizers);
        ownerReferences = ownerReferences == null ? List.of() : List.copyOf(ownerReferences);
    }
    
    public static ResourceMetadata of(String namespace, String name) {
        return ResourceMetadata.builder()
            .namespace(namespace)
            .name(name)
            .build();
    }
    
    public boolean isDeleting() {
        return deletionTimestamp != null;
    }
    
    public boolean hasFinalizer(String finalizer) {
        return finalizers.contains(finalizer);
    }
    
    public ResourceMetadata withFinalizerAdded(String finalizer) {
        if (hasFinalizer(finalizer)) {
            return this;
        }
        List<String> updated = new ArrayList<>(finalizers);
        updated.add(finalizer);
        return withFinalizers(updated);
    }
    
    public ResourceMetadata withFinalizerRemoved(String finalizer) {
        if (!hasFinalizer(finalizer)) {
            return this;
        }
        List<String> updated = new ArrayList<>(finalizers);
        updated.remove(finalizer);
        return withFinalizers(updated);
    }
    
    public Optional<OwnerReference> controllerOwner() {
        return ownerReferences.stream()
            .filter(OwnerReference::isControllerRef)
            .findFirst();
    }
    
    public boolean isOwnedBy(String ownerUid) {
        return ownerUid != null && ownerReferences.stream()
            .anyMatch(ref -> ownerUid.equals(ref.uid()));
    }
}
