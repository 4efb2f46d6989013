package com.platform.wafoperator.error;

import java.time.Instant;

/**
 * Thrown when a reconciliation pass runs past its deadline.
 */
public class ReconcileTimeoutException extends OperatorException {
    
    private final Instant deadline;
    
    public ReconcileTimeoutException(String key, Instant deadline) {
        super(ErrorCode.RECONCILE_DEADLINE_EXCEEDED,
            String.format("Reconciliation of %s exceeded its deadline %s", key, deadline));
        this.deadline = deadline;
    }
    
    public Instant getDeadline() {
        return deadline;
    }
}
