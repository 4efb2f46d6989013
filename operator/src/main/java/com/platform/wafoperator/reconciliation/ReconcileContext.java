package com.platform.wafoperator.reconciliation;

import com.platform.wafoperator.error.ReconcileTimeoutException;
import com.platform.wafoperator.model.ObjectKey;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-pass context: the key being reconciled, a short id for log
 * correlation and the deadline the pass must finish by.
 */
public record ReconcileContext(
    ObjectKey key,
    String reconcileId,
    Instant deadline,
    Clock clock
) {
    
    public static ReconcileContext start(ObjectKey key, Duration timeout, Clock clock) {
        return new ReconcileContext(
            key,
            UUID.randomUUID().toString().substring(0, 8),
            clock.instant().plus(timeout),
            clock
        );
    }
    
    /**
     * Throws when the deadline has passed. Called between store interactions.
     */
    public void checkDeadline() {
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw new ReconcileTimeoutException(key.toString(), deadline);
        }
    }
}
