package com.platform.wafoperator.reconciliation;

import com.platform.wafoperator.error.OperatorException;
import com.platform.wafoperator.events.EventRecorder;
import com.platform.wafoperator.events.EventType;
import com.platform.wafoperator.model.Condition;
import com.platform.wafoperator.model.Conditions;
import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.model.WafPolicyStatus;
import com.platform.wafoperator.observability.OperatorMetrics;
import com.platform.wafoperator.store.ResourceStore;
import com.platform.wafoperator.store.UpsertOperation;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Writes the outcome of a reconcile pass onto the policy's status and
 * emits the matching event.
 * 
 * Every status write is a single patch of the status subresource, with
 * observedGeneration set to the policy's current generation.
 */
@Slf4j
public class PolicyStatusProjector {
    
    static final String ACCEPTED_MESSAGE = "WAFPolicy is accepted";
    
    private final ResourceStore store;
    private final EventRecorder eventRecorder;
    private final Clock clock;
    private final OperatorMetrics metrics;
    
    public PolicyStatusProjector(ResourceStore store, EventRecorder eventRecorder, Clock clock,
            OperatorMetrics metrics) {
        this.store = store;
        this.eventRecorder = eventRecorder;
        this.clock = clock;
        this.metrics = metrics;
    }
    
    /**
     * Accepted=False with the given reason; Programmed is removed.
     */
    public WafPolicy projectNotAccepted(WafPolicy policy, PolicyReason reason, String message) {
        eventRecorder.event(policy, EventType.WARNING, reason.getValue(), message);
        metrics.recordNotAccepted(reason.getValue());
        
        List<Condition> conditions = Conditions.setFalse(policy.status().conditions(),
            policy.metadata().generation(), Conditions.ACCEPTED, reason.getValue(), message, now());
        conditions = Conditions.remove(conditions, Conditions.PROGRAMMED);
        
        return patch(policy, conditions);
    }
    
    /**
     * Accepted=True and Programmed=True after the Engine was written.
     */
    public WafPolicy projectProgrammed(WafPolicy policy, Engine engine, UpsertOperation operation) {
        long generation = policy.metadata().generation();
        Instant now = now();
        
        List<Condition> conditions = Conditions.setTrue(policy.status().conditions(), generation,
            Conditions.ACCEPTED, PolicyReason.ACCEPTED.getValue(), ACCEPTED_MESSAGE, now);
        conditions = Conditions.setTrue(conditions, generation, Conditions.PROGRAMMED,
            PolicyReason.PROGRAMMED.getValue(),
            String.format("Engine \"%s\" %s", engine.metadata().name(), operation), now);
        
        WafPolicy patched = patch(policy, conditions);
        metrics.recordEngineSync(operation.toString());
        
        eventRecorder.event(policy, EventType.NORMAL, PolicyReason.PROGRAMMED.getValue(),
            String.format("Engine %s/%s %s", engine.metadata().namespace(), engine.metadata().name(), operation));
        return patched;
    }
    
    /**
     * Programmed=False after the Engine write failed. Accepted is left as is.
     * A failing status patch is only logged; the caller returns the write error.
     */
    public void projectEngineSyncFailed(WafPolicy policy, Exception cause) {
        String message = "Failed to create/update Engine: " + cause.getMessage();
        eventRecorder.event(policy, EventType.WARNING, PolicyReason.ENGINE_SYNC_FAILED.getValue(), message);
        
        List<Condition> conditions = Conditions.setFalse(policy.status().conditions(),
            policy.metadata().generation(), Conditions.PROGRAMMED,
            PolicyReason.ENGINE_SYNC_FAILED.getValue(), message, now());
        try {
            patch(policy, conditions);
        } catch (OperatorException e) {
            log.error("WAFPolicy: Failed to patch status: {}", e.getMessage(), e);
        }
    }
    
    private WafPolicy patch(WafPolicy policy, List<Condition> conditions) {
        return store.policies().patchStatus(policy.withStatus(new WafPolicyStatus(conditions)));
    }
    
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
