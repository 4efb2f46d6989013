package com.platform.wafoperator.api;

import com.platform.wafoperator.controller.WorkQueue;
import com.platform.wafoperator.error.ResourceNotFoundException;
import com.platform.wafoperator.events.EventRecorder;
import com.platform.wafoperator.events.RecordedEvent;
import com.platform.wafoperator.lifecycle.ControllerLifecycleManager;
import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.store.ResourceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operations API: inspect policies, engines and events, and trigger reconciliation.
 */
@Slf4j
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {
    
    private final ResourceStore store;
    private final EventRecorder eventRecorder;
    private final WorkQueue<ObjectKey> workQueue;
    private final ControllerLifecycleManager lifecycleManager;
    
    public ReconciliationController(
            ResourceStore store,
            EventRecorder eventRecorder,
            WorkQueue<ObjectKey> workQueue,
            ControllerLifecycleManager lifecycleManager) {
        this.store = store;
        this.eventRecorder = eventRecorder;
        this.workQueue = workQueue;
        this.lifecycleManager = lifecycleManager;
    }
    
    @GetMapping("/policies")
    public List<WafPolicy> getPolicies(@RequestParam(required = false) String namespace) {
        return store.policies().list(namespace);
    }
    
    @GetMapping("/policies/{namespace}/{name}")
    public WafPolicy getPolicy(@PathVariable String namespace, @PathVariable String name) {
        ObjectKey key = ObjectKey.of(namespace, name);
        return store.policies().get(key)
            .orElseThrow(() -> new ResourceNotFoundException(ResourceKind.WAF_POLICY.getKindName(), key.toString()));
    }
    
    @GetMapping("/engines/{namespace}/{name}")
    public Engine getEngine(@PathVariable String namespace, @PathVariable String name) {
        ObjectKey key = ObjectKey.of(namespace, name);
        return store.engines().get(key)
            .orElseThrow(() -> new ResourceNotFoundException(ResourceKind.ENGINE.getKindName(), key.toString()));
    }
    
    @GetMapping("/events")
    public List<RecordedEvent> getEvents() {
        return eventRecorder.recentEvents();
    }
    
    @GetMapping("/queue")
    public ControllerLifecycleManager.LifecycleStatus getQueue() {
        return lifecycleManager.getStatus();
    }
    
    @PostMapping("/trigger")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void triggerReconciliation(@RequestParam String namespace, @RequestParam String name) {
        ObjectKey key = ObjectKey.of(namespace, name);
        log.info("Manual reconciliation triggered for WAFPolicy {}", key);
        workQueue.add(key);
    }
}
