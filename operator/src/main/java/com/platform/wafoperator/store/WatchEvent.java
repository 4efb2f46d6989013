package com.platform.wafoperator.store;

import com.platform.wafoperator.model.Resource;

/**
 * Change notification for one object.
 *
 * @param oldObject previous state for modifications when the store knows it, otherwise null
 */
public record WatchEvent<T extends Resource<T>>(Type type, T oldObject, T object) {
    
    public enum Type {
        ADDED,
        MODIFIED,
        DELETED
    }
    
    public static <T extends Resource<T>> WatchEvent<T> added(T object) {
        return new WatchEvent<>(Type.ADDED, null, object);
    }
    
    public static <T extends Resource<T>> WatchEvent<T> modified(T oldObject, T object) {
        return new WatchEvent<>(Type.MODIFIED, oldObject, object);
    }
    
    public static <T extends Resource<T>> WatchEvent<T> deleted(T object) {
        return new WatchEvent<>(Type.DELETED, null, object);
    }
}
