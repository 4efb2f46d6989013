package com.platform.wafoperator.store;

import com.platform.wafoperator.error.MissingIdentityException;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.model.ResourceMetadata;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Idempotent create-or-update of fully owned objects.
 * 
 * A missing object is created. An existing one is overwritten with the desired
 * state, using the stored resource version as optimistic-concurrency precondition.
 * Conflicts are not retried here; the next reconciliation pass recomputes the
 * desired state against the current version.
 */
@Slf4j
public class ResourceUpserter {
    
    public static final String DEFAULT_NAMESPACE = "default";
    
    private final ResourceStore store;
    
    public ResourceUpserter(ResourceStore store) {
        this.store = store;
    }
    
    public <T extends Resource<T>> UpsertResult<T> upsert(T desired) {
        if (desired.kind() == null) {
            throw new MissingIdentityException("desired object must have a kind set");
        }
        ResourceMetadata metadata = desired.metadata();
        if (metadata == null || metadata.name() == null || metadata.name().isBlank()) {
            throw new MissingIdentityException(
                String.format("desired %s must have a name set", desired.kind().getKindName()));
        }
        
        T target = desired;
        if (metadata.namespace() == null || metadata.namespace().isBlank()) {
            target = desired.withMetadata(metadata.withNamespace(DEFAULT_NAMESPACE));
        }
        
        ResourceClient<T> client = store.clientFor(target);
        ObjectKey key = target.key();
        
        Optional<T> current = client.get(key);
        if (current.isEmpty()) {
            T created = client.create(target);
            log.debug("Created {} {}", target.kind().getKindName(), key);
            return new UpsertResult<>(UpsertOperation.CREATED, created);
        }
        
        String resourceVersion = current.get().metadata().resourceVersion();
        T updated = client.update(target.withMetadata(target.metadata().withResourceVersion(resourceVersion)));
        log.debug("Updated {} {} (resourceVersion {})", target.kind().getKindName(), key, resourceVersion);
        return new UpsertResult<>(UpsertOperation.UPDATED, updated);
    }
}
