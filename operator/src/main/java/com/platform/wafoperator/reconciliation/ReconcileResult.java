package com.platform.wafoperator.reconciliation;

import java.time.Duration;

/**
 * What the worker should do with a key after a successful pass.
 *
 * @param requeue      requeue through the per-key rate limiter
 * @param requeueAfter requeue after a fixed delay; takes precedence over {@code requeue}
 */
public record ReconcileResult(boolean requeue, Duration requeueAfter) {
    
    private static final ReconcileResult DONE = new ReconcileResult(false, null);
    private static final ReconcileResult REQUEUE = new ReconcileResult(true, null);
    
    public static ReconcileResult done() {
        return DONE;
    }
    
    public static ReconcileResult rateLimited() {
        return REQUEUE;
    }
    
    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(false, delay);
    }
    
    public boolean isDone() {
        return !requeue && requeueAfter == null;
    }
}
