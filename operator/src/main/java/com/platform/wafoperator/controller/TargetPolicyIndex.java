package com.platform.wafoperator.controller;

import com.platform.wafoperator.error.OperatorException;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.observability.OperatorMetrics;
import com.platform.wafoperator.store.ResourceStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Maps a change to a Gateway or HTTPRoute to the policies targeting it.
 * 
 * Answers from a namespace-scoped list of policies on every call.
 */
@Slf4j
public class TargetPolicyIndex {
    
    private final ResourceStore store;
    private final OperatorMetrics metrics;
    
    public TargetPolicyIndex(ResourceStore store, OperatorMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }
    
    /**
     * Keys of the policies in {@code namespace} whose target is the given object.
     * Returns an empty list when policies cannot be listed.
     */
    public List<ObjectKey> mapTargetEvent(ResourceKind kind, String name, String namespace) {
        List<WafPolicy> policies;
        try {
            policies = store.policies().list(namespace);
        } catch (OperatorException e) {
            log.error("Failed to list WAFPolicies for {} {}/{}: {}", 
                kind.getKindName(), namespace, name, e.getMessage());
            return List.of();
        }
        
        List<ObjectKey> keys = policies.stream()
            .filter(p -> p.spec() != null && p.spec().targetRef() != null)
            .filter(p -> p.spec().targetRef().matches(kind.getKindName(), name))
            .map(Resource::key)
            .toList();
        
        metrics.recordFanout(kind.getKindName(), keys.size());
        if (!keys.isEmpty()) {
            log.debug("{} {}/{} changed, enqueuing {} WAFPolicies", kind.getKindName(), namespace, name, keys.size());
        }
        return keys;
    }
}
