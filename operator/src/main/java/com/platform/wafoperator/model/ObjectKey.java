package com.platform.wafoperator.model;

/**
 * Namespace and name of an object. Used as the reconciliation key.
 */
public record ObjectKey(String namespace, String name) {
    
    public static ObjectKey of(String namespace, String name) {
        return new ObjectKey(namespace, name);
    }
    
    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
