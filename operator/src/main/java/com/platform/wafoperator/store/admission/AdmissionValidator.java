package com.platform.wafoperator.store.admission;

import com.platform.wafoperator.model.Resource;

/**
 * Store-side validation applied to writes before they are persisted.
 * 
 * Validators may default fields; the returned object is what gets stored.
 * A rejected write raises {@link com.platform.wafoperator.error.AdmissionRejectedException}.
 *
 * @param <T> resource variant being admitted
 */
@FunctionalInterface
public interface AdmissionValidator<T extends Resource<T>> {
    
    T admit(T resource);
    
    static <T extends Resource<T>> AdmissionValidator<T> acceptAll() {
        return resource -> resource;
    }
}
