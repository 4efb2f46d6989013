package com.platform.wafoperator.store.memory;

import com.platform.wafoperator.error.MissingIdentityException;
import com.platform.wafoperator.error.ResourceConflictException;
import com.platform.wafoperator.error.ResourceNotFoundException;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.ResourceMetadata;
import com.platform.wafoperator.store.ResourceClient;
import com.platform.wafoperator.store.ResourceUpserter;
import com.platform.wafoperator.store.WatchEvent;
import com.platform.wafoperator.store.WatchRegistration;
import com.platform.wafoperator.store.admission.AdmissionValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * One kind's slice of the {@link InMemoryResourceStore}.
 * 
 * Writes are serialized on the store-wide lock; watch events are delivered
 * after the lock is released, on the writing thread.
 */
@Slf4j
class InMemoryResourceClient<T extends Resource<T>> implements ResourceClient<T> {
    
    private final InMemoryResourceStore store;
    private final ResourceKind kind;
    private final AdmissionValidator<T> admission;
    private final Map<ObjectKey, T> objects = new ConcurrentHashMap<>();
    private final List<Consumer<WatchEvent<T>>> listeners = new CopyOnWriteArrayList<>();
    
    InMemoryResourceClient(InMemoryResourceStore store, ResourceKind kind, AdmissionValidator<T> admission) {
        this.store = store;
        this.kind = kind;
        this.admission = admission;
    }
    
    @Override
    public ResourceKind kind() {
        return kind;
    }
    
    @Override
    public Optional<T> get(ObjectKey key) {
        return Optional.ofNullable(objects.get(key));
    }
    
    @Override
    public List<T> list(String namespace) {
        return objects.values().stream()
            .filter(o -> namespace == null || namespace.equals(o.metadata().namespace()))
            .sorted(Comparator.comparing((T o) -> o.metadata().namespace())
                .thenComparing(o -> o.metadata().name()))
            .toList();
    }
    
    @Override
    public T create(T resource) {
        ObjectKey key = identityOf(resource);
        T stored;
        
        synchronized (store.lock()) {
            if (objects.containsKey(key)) {
                throw ResourceConflictException.alreadyExists(kind.getKindName(), key.toString());
            }
            T admitted = admission.admit(resource);
            ResourceMetadata metadata = admitted.metadata().toBuilder()
                .namespace(key.namespace())
                .uid(UUID.randomUUID().toString())
                .generation(1)
                .resourceVersion(store.nextResourceVersion())
                .creationTimestamp(store.now())
                .deletionTimestamp(null)
                .build();
            stored = admitted.withMetadata(metadata);
            objects.put(key, stored);
        }
        
        dispatch(WatchEvent.added(stored));
        return stored;
    }
    
    @Override
    public T update(T resource) {
        ObjectKey key = identityOf(resource);
        WatchEvent<T> event;
        T result;
        String removedUid = null;
        
        synchronized (store.lock()) {
            T current = require(key);
            ResourceMetadata currentMeta = current.metadata();
            String expectedVersion = resource.metadata().resourceVersion();
            if (expectedVersion != null && !expectedVersion.equals(currentMeta.resourceVersion())) {
                throw ResourceConflictException.versionMismatch(kind.getKindName(), key.toString(),
                    expectedVersion, currentMeta.resourceVersion());
            }
            
            T admitted = admission.admit(resource);
            long generation = Objects.equals(admitted.spec(), current.spec())
                ? currentMeta.generation()
                : currentMeta.generation() + 1;
            ResourceMetadata merged = admitted.metadata().toBuilder()
                .namespace(currentMeta.namespace())
                .name(currentMeta.name())
                .uid(currentMeta.uid())
                .creationTimestamp(currentMeta.creationTimestamp())
                .deletionTimestamp(currentMeta.deletionTimestamp())
                .generation(generation)
                .resourceVersion(currentMeta.resourceVersion())
                .build();
            T candidate = admitted.withMetadata(merged).withStatusOf(current);
            
            if (candidate.equals(current)) {
                return current;
            }
            
            if (merged.isDeleting() && merged.finalizers().isEmpty()) {
                objects.remove(key);
                result = candidate;
                removedUid = merged.uid();
                event = WatchEvent.deleted(candidate);
            } else {
                result = candidate.withMetadata(merged.withResourceVersion(store.nextResourceVersion()));
                objects.put(key, result);
                event = WatchEvent.modified(current, result);
            }
        }
        
        dispatch(event);
        store.collectDependents(removedUid);
        return result;
    }
    
    @Override
    public T patchStatus(T resource) {
        ObjectKey key = identityOf(resource);
        T result;
        WatchEvent<T> event;
        
        synchronized (store.lock()) {
            T current = require(key);
            T patched = current.withStatusOf(resource);
            if (patched.equals(current)) {
                return current;
            }
            result = patched.withMetadata(current.metadata().withResourceVersion(store.nextResourceVersion()));
            objects.put(key, result);
            event = WatchEvent.modified(current, result);
        }
        
        dispatch(event);
        return result;
    }
    
    @Override
    public void delete(ObjectKey key) {
        WatchEvent<T> event;
        String removedUid = null;
        
        synchronized (store.lock()) {
            T current = require(key);
            ResourceMetadata metadata = current.metadata();
            if (!metadata.finalizers().isEmpty()) {
                if (metadata.isDeleting()) {
                    return;
                }
                T marked = current.withMetadata(metadata
                    .withDeletionTimestamp(store.now())
                    .withGeneration(metadata.generation() + 1)
                    .withResourceVersion(store.nextResourceVersion()));
                objects.put(key, marked);
                event = WatchEvent.modified(current, marked);
            } else {
                objects.remove(key);
                removedUid = metadata.uid();
                event = WatchEvent.deleted(current);
            }
        }
        
        dispatch(event);
        store.collectDependents(removedUid);
    }
    
    @Override
    public WatchRegistration watch(Consumer<WatchEvent<T>> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }
    
    void deleteOwnedBy(String ownerUid) {
        List<ObjectKey> owned = objects.values().stream()
            .filter(o -> o.metadata().isOwnedBy(ownerUid))
            .map(Resource::key)
            .toList();
        for (ObjectKey key : owned) {
            try {
                log.debug("Garbage collecting {} {} (owner {})", kind.getKindName(), key, ownerUid);
                delete(key);
            } catch (ResourceNotFoundException e) {
                log.debug("{} {} already gone during garbage collection", kind.getKindName(), key);
            }
        }
    }
    
    private T require(ObjectKey key) {
        T current = objects.get(key);
        if (current == null) {
            throw new ResourceNotFoundException(kind.getKindName(), key.toString());
        }
        return current;
    }
    
    private ObjectKey identityOf(T resource) {
        ResourceMetadata metadata = resource.metadata();
        if (metadata == null || metadata.name() == null || metadata.name().isBlank()) {
            throw new MissingIdentityException(kind.getKindName() + " must have a name set");
        }
        String namespace = metadata.namespace() == null || metadata.namespace().isBlank()
            ? ResourceUpserter.DEFAULT_NAMESPACE
            : metadata.namespace();
        return ObjectKey.of(namespace, metadata.name());
    }
    
    private void dispatch(WatchEvent<T> event) {
        for (Consumer<WatchEvent<T>> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Watch listener failed for {} {} {}: {}", 
                    event.type(), kind.getKindName(), event.object().key(), e.getMessage(), e);
            }
        }
    }
}
