package com.platform.wafoperator.controller;

import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.Gateway;
import com.platform.wafoperator.model.HttpRoute;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.store.ResourceStore;
import com.platform.wafoperator.store.WatchEvent;
import com.platform.wafoperator.store.WatchRegistration;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns store watch events into work queue keys.
 * 
 * <ul>
 *   <li>WAFPolicy: creation, deletion and generation changes. Status and
 *       metadata-only writes are ignored.</li>
 *   <li>Engine: any change enqueues the controlling policy.</li>
 *   <li>Gateway and HTTPRoute: any change enqueues the policies targeting them.</li>
 * </ul>
 */
@Slf4j
public class PolicyWatchDispatcher {
    
    private final ResourceStore store;
    private final TargetPolicyIndex targetIndex;
    private final WorkQueue<ObjectKey> queue;
    private final Map<ObjectKey, Long> observedGenerations = new ConcurrentHashMap<>();
    private final List<WatchRegistration> registrations = new ArrayList<>();
    
    public PolicyWatchDispatcher(ResourceStore store, TargetPolicyIndex targetIndex, WorkQueue<ObjectKey> queue) {
        this.store = store;
        this.targetIndex = targetIndex;
        this.queue = queue;
    }
    
    public synchronized void start() {
        if (!registrations.isEmpty()) {
            return;
        }
        registrations.add(store.policies().watch(this::handlePolicyEvent));
        registrations.add(store.engines().watch(this::handleEngineEvent));
        registrations.add(store.gateways().watch(this::handleGatewayEvent));
        registrations.add(store.httpRoutes().watch(this::handleHttpRouteEvent));
        log.info("Watching WAFPolicy, Engine, Gateway and HTTPRoute");
    }
    
    public synchronized void stop() {
        registrations.forEach(WatchRegistration::close);
        registrations.clear();
        observedGenerations.clear();
    }
    
    public void handlePolicyEvent(WatchEvent<WafPolicy> event) {
        ObjectKey key = event.object().key();
        long generation = event.object().metadata().generation();
        
        switch (event.type()) {
            case ADDED -> {
                observedGenerations.put(key, generation);
                queue.add(key);
            }
            case DELETED -> {
                observedGenerations.remove(key);
                queue.add(key);
            }
            case MODIFIED -> {
                Long previous = event.oldObject() != null
                    ? Long.valueOf(event.oldObject().metadata().generation())
                    : observedGenerations.get(key);
                observedGenerations.put(key, generation);
                if (previous == null || previous != generation) {
                    queue.add(key);
                }
            }
        }
    }
    
    public void handleEngineEvent(WatchEvent<Engine> event) {
        Engine engine = event.object();
        engine.metadata().controllerOwner()
            .filter(owner -> ResourceKind.WAF_POLICY.getKindName().equals(owner.kind()))
            .ifPresent(owner -> queue.add(ObjectKey.of(engine.metadata().namespace(), owner.name())));
    }
    
    public void handleGatewayEvent(WatchEvent<Gateway> event) {
        enqueueTargeting(ResourceKind.GATEWAY, event.object().key());
    }
    
    public void handleHttpRouteEvent(WatchEvent<HttpRoute> event) {
        enqueueTargeting(ResourceKind.HTTP_ROUTE, event.object().key());
    }
    
    private void enqueueTargeting(ResourceKind kind, ObjectKey target) {
        targetIndex.mapTargetEvent(kind, target.name(), target.namespace()).forEach(queue::add);
    }
}
