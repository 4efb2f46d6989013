package com.platform.wafoperator.reconciliation;

import java.util.Map;

/**
 * Outcome of resolving a policy target: either the workload labels that
 * select the enforcing gateway, or the reason the policy cannot be accepted.
 */
public record TargetResolution(
    Map<String, String> workloadLabels,
    PolicyReason reason,
    String message,
    boolean requeue
) {
    
    public static TargetResolution resolved(Map<String, String> workloadLabels) {
        return new TargetResolution(Map.copyOf(workloadLabels), null, null, false);
    }
    
    public static TargetResolution notAccepted(PolicyReason reason, String message, boolean requeue) {
        return new TargetResolution(Map.of(), reason, message, requeue);
    }
    
    public boolean isResolved() {
        return reason == null;
    }
}
