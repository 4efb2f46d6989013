package com.platform.wafoperator.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceMetadataTest {
    
    private static final String FINALIZER = "example.com/finalizer";
    
    @Test
    @DisplayName("null collections are normalized to empty")
    void normalizesCollections() {
        ResourceMetadata metadata = ResourceMetadata.of("ns", "a");
        
        assertTrue(metadata.labels().isEmpty());
        assertTrue(metadata.finalizers().isEmpty());
        assertTrue(metadata.ownerReferences().isEmpty());
        assertFalse(metadata.isDeleting());
    }
    
    @Test
    @DisplayName("adding a finalizer twice keeps one entry")
    void finalizerAddIsIdempotent() {
        ResourceMetadata metadata = ResourceMetadata.of("ns", "a")
            .withFinalizerAdded(FINALIZER)
            .withFinalizerAdded(FINALIZER);
        
        assertEquals(List.of(FINALIZER), metadata.finalizers());
    }
    
    @Test
    @DisplayName("removing a finalizer keeps the others")
    void finalizerRemove() {
        ResourceMetadata metadata = ResourceMetadata.of("ns", "a")
            .withFinalizers(List.of("other", FINALIZER))
            .withFinalizerRemoved(FINALIZER);
        
        assertEquals(List.of("other"), metadata.finalizers());
        assertSame(metadata, metadata.withFinalizerRemoved(FINALIZER));
    }
    
    @Test
    @DisplayName("controller owner and ownership by uid")
    void ownership() {
        OwnerReference plain = new OwnerReference("v1", "ConfigMap", "cm", "uid-1", null, null);
        OwnerReference controller = new OwnerReference("v1", "WAFPolicy", "p", "uid-2", true, true);
        ResourceMetadata metadata = ResourceMetadata.of("ns", "a")
            .withOwnerReferences(List.of(plain, controller));
        
        assertEquals(controller, metadata.controllerOwner().orElseThrow());
        assertTrue(metadata.isOwnedBy("uid-1"));
        assertTrue(metadata.isOwnedBy("uid-2"));
        assertFalse(metadata.isOwnedBy("uid-3"));
        assertFalse(metadata.isOwnedBy(null));
    }
}
