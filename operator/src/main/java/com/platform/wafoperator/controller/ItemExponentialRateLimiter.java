package com.platform.wafoperator.controller;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key exponential backoff: base * 2^(failures - 1), capped at max.
 * A key's failure count is reset by {@link #forget(Object)}.
 */
public class ItemExponentialRateLimiter<K> {
    
    private final IntervalFunction intervalFunction;
    private final Map<K, Integer> failures = new ConcurrentHashMap<>();
    
    public ItemExponentialRateLimiter(Duration base, Duration max) {
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(base.toMillis(), 2.0, max.toMillis());
    }
    
    /**
     * Records a failure for the key and returns how long to wait before retrying it.
     */
    public Duration when(K key) {
        int attempt = failures.merge(key, 1, Integer::sum);
        return Duration.ofMillis(intervalFunction.apply(attempt));
    }
    
    public void forget(K key) {
        failures.remove(key);
    }
    
    public int numRequeues(K key) {
        return failures.getOrDefault(key, 0);
    }
}
