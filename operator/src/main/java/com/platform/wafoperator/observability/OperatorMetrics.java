package com.platform.wafoperator.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Central registry for operator metrics: reconcile outcomes, engine writes,
 * watch fan-out and work queue depth.
 */
@Slf4j
@Component
public class OperatorMetrics {
    
    public static final String RECONCILE_TOTAL = "wafoperator.reconcile.total";
    public static final String RECONCILE_DURATION = "wafoperator.reconcile.duration";
    public static final String ENGINE_SYNC = "wafoperator.engine.sync";
    public static final String POLICY_NOT_ACCEPTED = "wafoperator.policy.not_accepted";
    public static final String WATCH_FANOUT = "wafoperator.watch.fanout";
    public static final String WORKQUEUE_DEPTH = "wafoperator.workqueue.depth";
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Timer reconcileTimer;
    
    public OperatorMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.reconcileTimer = Timer.builder(RECONCILE_DURATION)
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
        
        log.info("Operator metrics initialized");
    }
    
    /**
     * Record the outcome of one reconcile pass (success, requeue, error).
     */
    public void recordReconcile(String result, Duration duration) {
        incrementCounter(RECONCILE_TOTAL, "result", result);
        reconcileTimer.record(duration);
    }
    
    /**
     * Record a successful Engine create or update.
     */
    public void recordEngineSync(String operation) {
        incrementCounter(ENGINE_SYNC, "operation", operation);
    }
    
    public void recordNotAccepted(String reason) {
        incrementCounter(POLICY_NOT_ACCEPTED, "reason", reason);
    }
    
    /**
     * Record how many policies a target event was mapped to.
     */
    public void recordFanout(String kind, int policies) {
        Counter counter = counters.computeIfAbsent(WATCH_FANOUT + kind, k ->
            Counter.builder(WATCH_FANOUT)
                .tag("kind", kind)
                .register(meterRegistry));
        counter.increment(policies);
    }
    
    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder(WORKQUEUE_DEPTH, depth)
            .register(meterRegistry);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
