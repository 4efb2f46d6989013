package com.platform.wafoperator.controller;

import com.platform.wafoperator.TestResources;
import com.platform.wafoperator.model.Conditions;
import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.EngineSpec;
import com.platform.wafoperator.model.FailurePolicy;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.OwnerReference;
import com.platform.wafoperator.model.ParentReference;
import com.platform.wafoperator.model.PolicyTargetReference;
import com.platform.wafoperator.model.ResourceMetadata;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.model.WafPolicySpec;
import com.platform.wafoperator.model.WafPolicyStatus;
import com.platform.wafoperator.observability.OperatorMetrics;
import com.platform.wafoperator.store.memory.InMemoryResourceStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.platform.wafoperator.TestResources.NAMESPACE;
import static org.junit.jupiter.api.Assertions.*;

class PolicyWatchDispatcherTest {
    
    private InMemoryResourceStore store;
    private WorkQueue<ObjectKey> queue;
    private PolicyWatchDispatcher dispatcher;
    
    @BeforeEach
    void setUp() {
        store = TestResources.store();
        queue = new WorkQueue<>(new ItemExponentialRateLimiter<>(Duration.ofMillis(10), Duration.ofMillis(100)));
        dispatcher = new PolicyWatchDispatcher(store,
            new TargetPolicyIndex(store, new OperatorMetrics(new SimpleMeterRegistry())), queue);
        dispatcher.start();
    }
    
    @AfterEach
    void tearDown() {
        dispatcher.stop();
        queue.shutDown();
    }
    
    private List<ObjectKey> drain() throws InterruptedException {
        List<ObjectKey> keys = new ArrayList<>();
        Optional<ObjectKey> next;
        while ((next = queue.take(Duration.ZERO)).isPresent()) {
            keys.add(next.get());
            queue.done(next.get());
        }
        return keys;
    }
    
    @Test
    @DisplayName("policy creation enqueues the policy")
    void policyCreated() throws InterruptedException {
        store.policies().create(TestResources.gatewayPolicy("p", "gw1"));
        
        assertEquals(List.of(ObjectKey.of(NAMESPACE, "p")), drain());
    }
    
    @Test
    @DisplayName("status and finalizer writes do not enqueue")
    void statusWriteIgnored() throws InterruptedException {
        WafPolicy created = store.policies().create(TestResources.gatewayPolicy("p", "gw1"));
        drain();
        
        WafPolicy updated = store.policies().update(
            created.withMetadata(created.metadata().withFinalizerAdded("example.com/f")));
        store.policies().patchStatus(updated.withStatus(new WafPolicyStatus(Conditions.setTrue(List.of(), 1,
            Conditions.ACCEPTED, "Accepted", "ok", TestResources.CLOCK.instant()))));
        
        assertTrue(drain().isEmpty());
    }
    
    @Test
    @DisplayName("spec change enqueues")
    void specChange() throws InterruptedException {
        WafPolicy created = store.policies().create(TestResources.gatewayPolicy("p", "gw1"));
        drain();
        
        store.policies().update(new WafPolicy(created.metadata(),
            new WafPolicySpec(PolicyTargetReference.gateway("gw2"), created.spec().ruleSet(), FailurePolicy.FAIL),
            null));
        
        assertEquals(List.of(ObjectKey.of(NAMESPACE, "p")), drain());
    }
    
    @Test
    @DisplayName("deletion marking enqueues")
    void deletionMarking() throws InterruptedException {
        WafPolicy created = store.policies().create(TestResources.gatewayPolicy("p", "gw1"));
        store.policies().update(created.withMetadata(created.metadata().withFinalizerAdded("example.com/f")));
        drain();
        
        store.policies().delete(created.key());
        
        assertEquals(List.of(ObjectKey.of(NAMESPACE, "p")), drain());
    }
    
    @Test
    @DisplayName("engine change enqueues its controlling policy")
    void engineChange() throws InterruptedException {
        WafPolicy owner = store.policies().create(TestResources.gatewayPolicy("p", "gw1"));
        drain();
        
        store.engines().create(new Engine(
            ResourceMetadata.of(NAMESPACE, "wafpolicy-p")
                .withOwnerReferences(List.of(OwnerReference.controllerOf(owner))),
            new EngineSpec(null, FailurePolicy.FAIL, null),
            null));
        
        assertEquals(List.of(ObjectKey.of(NAMESPACE, "p")), drain());
    }
    
    @Test
    @DisplayName("engine without a policy owner enqueues nothing")
    void unownedEngine() throws InterruptedException {
        store.engines().create(new Engine(ResourceMetadata.of(NAMESPACE, "e"),
            new EngineSpec(null, FailurePolicy.FAIL, null), null));
        
        assertTrue(drain().isEmpty());
    }
    
    @Test
    @DisplayName("gateway and route changes enqueue the policies targeting them")
    void targetChanges() throws InterruptedException {
        store.policies().create(TestResources.gatewayPolicy("a", "gw1"));
        store.policies().create(TestResources.routePolicy("b", "r1"));
        drain();
        
        store.gateways().create(TestResources.gateway("gw1"));
        assertEquals(List.of(ObjectKey.of(NAMESPACE, "a")), drain());
        
        store.httpRoutes().create(TestResources.httpRoute("r1", ParentReference.gateway("gw1")));
        assertEquals(List.of(ObjectKey.of(NAMESPACE, "b")), drain());
    }
    
    @Test
    @DisplayName("stop ends delivery")
    void stop() throws InterruptedException {
        dispatcher.stop();
        
        store.policies().create(TestResources.gatewayPolicy("p", "gw1"));
        
        assertTrue(drain().isEmpty());
    }
}
