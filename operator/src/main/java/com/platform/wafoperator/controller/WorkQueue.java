package com.platform.wafoperator.controller;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deduplicating work queue with per-key rate limiting.
 * 
 * A key is pending at most once. A key handed to a worker is not handed
 * out again until {@link #done(Object)} is called for it; adds that arrive
 * in the meantime are replayed once it is done.
 */
@Slf4j
public class WorkQueue<K> {
    
    private final Object lock = new Object();
    private final Deque<K> queue = new ArrayDeque<>();
    private final Set<K> dirty = new HashSet<>();
    private final Set<K> processing = new HashSet<>();
    private final ItemExponentialRateLimiter<K> rateLimiter;
    private final ScheduledExecutorService delayer;
    private boolean shuttingDown;
    
    public WorkQueue(ItemExponentialRateLimiter<K> rateLimiter) {
        this.rateLimiter = rateLimiter;
        this.delayer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "workqueue-delay");
            thread.setDaemon(true);
            return thread;
        });
    }
    
    public void add(K key) {
        synchronized (lock) {
            if (shuttingDown || dirty.contains(key)) {
                return;
            }
            dirty.add(key);
            if (processing.contains(key)) {
                return;
            }
            queue.addLast(key);
            lock.notifyAll();
        }
    }
    
    public void addAfter(K key, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            add(key);
            return;
        }
        synchronized (lock) {
            if (shuttingDown) {
                return;
            }
        }
        try {
            delayer.schedule(() -> add(key), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Dropping delayed add of {}: queue is shutting down", key);
        }
    }
    
    /**
     * Adds the key after the rate limiter's backoff for it.
     */
    public void addRateLimited(K key) {
        addAfter(key, rateLimiter.when(key));
    }
    
    public void forget(K key) {
        rateLimiter.forget(key);
    }
    
    public int numRequeues(K key) {
        return rateLimiter.numRequeues(key);
    }
    
    /**
     * Waits up to {@code timeout} for a key. Empty on timeout, or once the
     * queue is shut down and drained.
     */
    public Optional<K> take(Duration timeout) throws InterruptedException {
        synchronized (lock) {
            long deadline = System.nanoTime() + timeout.toNanos();
            while (queue.isEmpty() && !shuttingDown) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                TimeUnit.NANOSECONDS.timedWait(lock, remaining);
            }
            K key = queue.pollFirst();
            if (key == null) {
                return Optional.empty();
            }
            processing.add(key);
            dirty.remove(key);
            return Optional.of(key);
        }
    }
    
    public void done(K key) {
        synchronized (lock) {
            processing.remove(key);
            if (dirty.contains(key)) {
                queue.addLast(key);
                lock.notifyAll();
            }
        }
    }
    
    /**
     * Number of keys waiting to be handed out.
     */
    public int size() {
        synchronized (lock) {
            return queue.size();
        }
    }
    
    public boolean isShuttingDown() {
        synchronized (lock) {
            return shuttingDown;
        }
    }
    
    public void shutDown() {
        synchronized (lock) {
            shuttingDown = true;
            lock.notifyAll();
        }
        delayer.shutdownNow();
    }
}
