package com.platform.wafoperator.store;

/**
 * Handle on an active watch. Closing it stops delivery.
 */
@FunctionalInterface
public interface WatchRegistration extends AutoCloseable {
    
    @Override
    void close();
}
