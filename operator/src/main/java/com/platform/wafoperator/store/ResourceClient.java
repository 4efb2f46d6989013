package com.platform.wafoperator.store;

import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.model.ResourceKind;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Typed access to one object kind in the cluster store.
 * 
 * All calls block. Failures other than a missing object surface as
 * {@link com.platform.wafoperator.error.OperatorException} subclasses.
 *
 * @param <T> resource variant served by this client
 */
public interface ResourceClient<T extends Resource<T>> {
    
    ResourceKind kind();
    
    /**
     * Returns the object, or empty when the store does not hold it.
     */
    Optional<T> get(ObjectKey key);
    
    /**
     * Lists objects in one namespace, or in all namespaces when {@code namespace} is null.
     */
    List<T> list(String namespace);
    
    T create(T resource);
    
    /**
     * Replaces spec and metadata. When the object carries a resource version the
     * write only succeeds if it matches the stored one. Status is left untouched.
     */
    T update(T resource);
    
    /**
     * Merge-patches the status subresource. Spec and metadata are left untouched.
     */
    T patchStatus(T resource);
    
    /**
     * Requests deletion. Objects with finalizers are only marked for deletion.
     */
    void delete(ObjectKey key);
    
    WatchRegistration watch(Consumer<WatchEvent<T>> listener);
}
