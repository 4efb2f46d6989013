package com.platform.wafoperator.store.memory;

import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.Gateway;
import com.platform.wafoperator.model.HttpRoute;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.store.ResourceClient;
import com.platform.wafoperator.store.ResourceStore;
import com.platform.wafoperator.store.admission.AdmissionValidator;
import com.platform.wafoperator.store.admission.WafPolicyAdmissionValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local cluster store with the semantics the operator relies on:
 * resource versions, generations bumped on spec changes, finalizer-gated
 * deletion, status subresource, watches and owner-based cascading deletion.
 * 
 * Used when the operator runs without a cluster and as the test double.
 */
@Slf4j
public class InMemoryResourceStore implements ResourceStore {
    
    private final Object lock = new Object();
    private final AtomicLong resourceVersions = new AtomicLong();
    private final Clock clock;
    private final boolean garbageCollectOwned;
    
    private final InMemoryResourceClient<WafPolicy> policies;
    private final InMemoryResourceClient<Engine> engines;
    private final InMemoryResourceClient<Gateway> gateways;
    private final InMemoryResourceClient<HttpRoute> httpRoutes;
    private final List<InMemoryResourceClient<?>> clients;
    
    public InMemoryResourceStore(Clock clock, boolean garbageCollectOwned, 
            AdmissionValidator<WafPolicy> policyAdmission) {
        this.clock = clock;
        this.garbageCollectOwned = garbageCollectOwned;
        this.policies = new InMemoryResourceClient<>(this, ResourceKind.WAF_POLICY, policyAdmission);
        this.engines = new InMemoryResourceClient<>(this, ResourceKind.ENGINE, AdmissionValidator.<Engine>acceptAll());
        this.gateways = new InMemoryResourceClient<>(this, ResourceKind.GATEWAY, AdmissionValidator.<Gateway>acceptAll());
        this.httpRoutes = new InMemoryResourceClient<>(this, ResourceKind.HTTP_ROUTE, AdmissionValidator.<HttpRoute>acceptAll());
        this.clients = List.of(policies, engines, gateways, httpRoutes);
        
        log.info("In-memory resource store initialized (garbageCollectOwned={})", garbageCollectOwned);
    }
    
    /**
     * Store with WAFPolicy admission rules and owner-based garbage collection.
     */
    public static InMemoryResourceStore create() {
        return new InMemoryResourceStore(Clock.systemUTC(), true, new WafPolicyAdmissionValidator());
    }
    
    @Override
    public ResourceClient<WafPolicy> policies() {
        return policies;
    }
    
    @Override
    public ResourceClient<Engine> engines() {
        return engines;
    }
    
    @Override
    public ResourceClient<Gateway> gateways() {
        return gateways;
    }
    
    @Override
    public ResourceClient<HttpRoute> httpRoutes() {
        return httpRoutes;
    }
    
    @Override
    public boolean garbageCollectsOwnedResources() {
        return garbageCollectOwned;
    }
    
    Object lock() {
        return lock;
    }
    
    String nextResourceVersion() {
        return String.valueOf(resourceVersions.incrementAndGet());
    }
    
    Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
    
    /**
     * Deletes every object owned by the removed owner, across all kinds.
     */
    void collectDependents(String ownerUid) {
        if (!garbageCollectOwned || ownerUid == null) {
            return;
        }
        for (InMemoryResourceClient<?> client : clients) {
            client.deleteOwnedBy(ownerUid);
        }
    }
}
