package com.platform.wafoperator.lifecycle;

import com.platform.wafoperator.config.ControllerProperties;
import com.platform.wafoperator.controller.ControllerRunner;
import com.platform.wafoperator.controller.PolicyWatchDispatcher;
import com.platform.wafoperator.controller.WorkQueue;
import com.platform.wafoperator.error.OperatorException;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.store.ResourceStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controller lifecycle.
 * 
 * Phases:
 * - STARTING: watches not yet registered
 * - READY: watches registered, initial sync enqueued, workers running
 * - DRAINING: shutdown initiated, in-flight passes finishing
 * - STOPPED: workers stopped
 */
@Slf4j
@Component
public class ControllerLifecycleManager {
    
    private final ResourceStore store;
    private final PolicyWatchDispatcher dispatcher;
    private final ControllerRunner runner;
    private final WorkQueue<ObjectKey> queue;
    private final ControllerProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    
    private final AtomicReference<LifecyclePhase> currentPhase = new AtomicReference<>(LifecyclePhase.STARTING);
    private volatile Instant phaseStartTime = Instant.now();
    
    public ControllerLifecycleManager(
            ResourceStore store,
            PolicyWatchDispatcher dispatcher,
            ControllerRunner runner,
            WorkQueue<ObjectKey> queue,
            ControllerProperties properties,
            ApplicationEventPublisher eventPublisher) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.runner = runner;
        this.queue = queue;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }
    
    public void start() {
        if (!currentPhase.compareAndSet(LifecyclePhase.STARTING, LifecyclePhase.READY)) {
            return;
        }
        dispatcher.start();
        int enqueued = enqueueAllPolicies();
        runner.start();
        phaseStartTime = Instant.now();
        
        log.info("Controller READY ({} WAFPolicies enqueued for initial sync)", enqueued);
        AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.ACCEPTING_TRAFFIC);
    }
    
    /**
     * Periodic full resync, catching events missed by the watches.
     */
    @Scheduled(fixedDelayString = "${wafoperator.controller.resync-interval-ms:300000}",
        initialDelayString = "${wafoperator.controller.resync-interval-ms:300000}")
    public void resync() {
        if (currentPhase.get() != LifecyclePhase.READY) {
            return;
        }
        int enqueued = enqueueAllPolicies();
        log.debug("Resync enqueued {} WAFPolicies", enqueued);
    }
    
    @PreDestroy
    public void stop() {
        LifecyclePhase previous = currentPhase.getAndSet(LifecyclePhase.DRAINING);
        if (previous == LifecyclePhase.DRAINING || previous == LifecyclePhase.STOPPED) {
            currentPhase.set(previous);
            return;
        }
        phaseStartTime = Instant.now();
        log.info("Controller entering DRAINING phase (was {})", previous);
        AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.REFUSING_TRAFFIC);
        
        dispatcher.stop();
        runner.stop(Duration.ofSeconds(properties.getShutdownTimeoutSeconds()));
        
        currentPhase.set(LifecyclePhase.STOPPED);
        phaseStartTime = Instant.now();
        log.info("Controller STOPPED");
    }
    
    public LifecyclePhase getCurrentPhase() {
        return currentPhase.get();
    }
    
    /**
     * Get lifecycle status for health and operations endpoints.
     */
    public LifecycleStatus getStatus() {
        return new LifecycleStatus(
            currentPhase.get(),
            phaseStartTime,
            runner.getActiveWorkers(),
            queue.size()
        );
    }
    
    private int enqueueAllPolicies() {
        try {
            List<ObjectKey> keys = store.policies().list(null).stream()
                .map(Resource::key)
                .toList();
            keys.forEach(queue::add);
            return keys.size();
        } catch (OperatorException e) {
            log.error("Failed to list WAFPolicies for sync: {}", e.getMessage());
            return 0;
        }
    }
    
    public enum LifecyclePhase {
        STARTING,
        READY,
        DRAINING,
        STOPPED
    }
    
    public record LifecycleStatus(
        LifecyclePhase phase,
        Instant phaseStartTime,
        int activeWorkers,
        int queueDepth
    ) {}
}
