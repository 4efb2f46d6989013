package com.platform.wafoperator.reconciliation;

import com.platform.wafoperator.error.OperatorException;
import com.platform.wafoperator.error.ResourceNotFoundException;
import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.store.ResourceStore;
import com.platform.wafoperator.store.ResourceUpserter;
import com.platform.wafoperator.store.UpsertResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Translates one WAFPolicy into its Engine.
 * 
 * A pass is idempotent: it reads the policy, makes sure the finalizer is
 * present, resolves the target, writes the full desired Engine and projects
 * the outcome onto the policy status. Store failures propagate so the caller
 * can retry with backoff; validation outcomes are written to status and
 * are not retried.
 */
@Slf4j
public class WafPolicyReconciler {
    
    public static final String FINALIZER = "waf.k8s.coraza.io/wafpolicy-finalizer";
    public static final String CONTROLLER_NAME = "waf.k8s.coraza.io/wafpolicy-controller";
    
    private final ResourceStore store;
    private final TargetResolver targetResolver;
    private final EngineSynthesizer engineSynthesizer;
    private final ResourceUpserter upserter;
    private final PolicyStatusProjector statusProjector;
    
    public WafPolicyReconciler(
            ResourceStore store,
            TargetResolver targetResolver,
            EngineSynthesizer engineSynthesizer,
            ResourceUpserter upserter,
            PolicyStatusProjector statusProjector) {
        this.store = store;
        this.targetResolver = targetResolver;
        this.engineSynthesizer = engineSynthesizer;
        this.upserter = upserter;
        this.statusProjector = statusProjector;
    }
    
    public ReconcileResult reconcile(ObjectKey key, ReconcileContext context) {
        log.debug("WAFPolicy: Starting reconciliation");
        
        Optional<WafPolicy> found = store.policies().get(key);
        if (found.isEmpty()) {
            log.debug("WAFPolicy: Resource not found");
            return ReconcileResult.done();
        }
        
        try {
            return reconcile(found.get(), context);
        } catch (ResourceNotFoundException e) {
            if (!ResourceKind.WAF_POLICY.getKindName().equals(e.getResourceType())) {
                throw e;
            }
            log.debug("WAFPolicy: Resource deleted during reconciliation");
            return ReconcileResult.done();
        }
    }
    
    private ReconcileResult reconcile(WafPolicy policy, ReconcileContext context) {
        if (policy.metadata().isDeleting()) {
            return handleDeletion(policy, context);
        }
        
        if (!policy.metadata().hasFinalizer(FINALIZER)) {
            context.checkDeadline();
            policy = store.policies().update(
                policy.withMetadata(policy.metadata().withFinalizerAdded(FINALIZER)));
        }
        
        context.checkDeadline();
        TargetResolution resolution = targetResolver.resolve(policy);
        
        context.checkDeadline();
        if (!resolution.isResolved()) {
            statusProjector.projectNotAccepted(policy, resolution.reason(), resolution.message());
            return resolution.requeue() ? ReconcileResult.rateLimited() : ReconcileResult.done();
        }
        
        return ensureEngine(policy, resolution.workloadLabels(), context);
    }
    
    private ReconcileResult ensureEngine(WafPolicy policy, Map<String, String> workloadLabels,
            ReconcileContext context) {
        Engine desired = engineSynthesizer.synthesize(policy, workloadLabels);
        
        UpsertResult<Engine> result;
        try {
            result = upserter.upsert(desired);
        } catch (OperatorException e) {
            log.error("WAFPolicy: Failed to ensure Engine: {}", e.getMessage(), e);
            statusProjector.projectEngineSyncFailed(policy, e);
            throw e;
        }
        
        log.info("WAFPolicy: Engine synced engine={} operation={}", desired.metadata().name(), result.operation());
        
        context.checkDeadline();
        statusProjector.projectProgrammed(policy, result.resource(), result.operation());
        return ReconcileResult.done();
    }
    
    private ReconcileResult handleDeletion(WafPolicy policy, ReconcileContext context) {
        if (!policy.metadata().hasFinalizer(FINALIZER)) {
            return ReconcileResult.done();
        }
        
        if (!store.garbageCollectsOwnedResources()) {
            context.checkDeadline();
            deleteOwnedEngine(policy);
        }
        
        log.info("WAFPolicy: Removing finalizer");
        context.checkDeadline();
        store.policies().update(policy.withMetadata(policy.metadata().withFinalizerRemoved(FINALIZER)));
        return ReconcileResult.done();
    }
    
    /**
     * Used when the store does not garbage-collect dependents by owner.
     */
    private void deleteOwnedEngine(WafPolicy policy) {
        ObjectKey engineKey = ObjectKey.of(policy.metadata().namespace(),
            EngineSynthesizer.engineNameFor(policy.metadata().name()));
        Optional<Engine> engine = store.engines().get(engineKey)
            .filter(e -> e.metadata().isOwnedBy(policy.metadata().uid()));
        if (engine.isEmpty()) {
            return;
        }
        try {
            store.engines().delete(engineKey);
            log.info("WAFPolicy: Deleted owned Engine engine={}", engineKey.name());
        } catch (ResourceNotFoundException e) {
            log.debug("WAFPolicy: Owned Engine already gone engine={}", engineKey.name());
        }
    }
}
