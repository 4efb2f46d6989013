package com.platform.wafoperator.controller;

import com.platform.wafoperator.error.OperatorException;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.observability.LoggingConfig;
import com.platform.wafoperator.observability.OperatorMetrics;
import com.platform.wafoperator.observability.TracingConfig;
import com.platform.wafoperator.reconciliation.ReconcileContext;
import com.platform.wafoperator.reconciliation.ReconcileResult;
import com.platform.wafoperator.reconciliation.WafPolicyReconciler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of workers pulling keys from the work queue and running
 * one reconcile pass per key.
 * 
 * Failed passes are requeued through the per-key rate limiter; successful
 * passes reset it.
 */
@Slf4j
public class ControllerRunner {
    
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);
    
    private final WorkQueue<ObjectKey> queue;
    private final WafPolicyReconciler reconciler;
    private final OperatorMetrics metrics;
    private final Tracer tracer;
    private final Clock clock;
    private final int workers;
    private final Duration passTimeout;
    
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private ExecutorService executor;
    
    public ControllerRunner(
            WorkQueue<ObjectKey> queue,
            WafPolicyReconciler reconciler,
            OperatorMetrics metrics,
            Tracer tracer,
            Clock clock,
            int workers,
            Duration passTimeout) {
        this.queue = queue;
        this.reconciler = reconciler;
        this.metrics = metrics;
        this.tracer = tracer;
        this.clock = clock;
        this.workers = workers;
        this.passTimeout = passTimeout;
    }
    
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers, r -> {
            Thread thread = new Thread(r, "wafpolicy-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < workers; i++) {
            executor.submit(this::runWorker);
        }
        log.info("Started {} WAFPolicy workers", workers);
    }
    
    /**
     * Stops taking new keys and waits for in-flight passes.
     */
    public synchronized void stop(Duration timeout) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        queue.shutDown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timeout waiting for WAFPolicy workers, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Stopped WAFPolicy workers");
    }
    
    public boolean isRunning() {
        return running.get();
    }
    
    public int getActiveWorkers() {
        return activeWorkers.get();
    }
    
    private void runWorker() {
        activeWorkers.incrementAndGet();
        try {
            while (running.get()) {
                processNextItem(POLL_INTERVAL);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            activeWorkers.decrementAndGet();
        }
    }
    
    /**
     * Runs one pass for the next key, waiting up to {@code wait} for one.
     *
     * @return whether a key was processed
     */
    public boolean processNextItem(Duration wait) throws InterruptedException {
        Optional<ObjectKey> next = queue.take(wait);
        if (next.isEmpty()) {
            return false;
        }
        
        ObjectKey key = next.get();
        ReconcileContext context = ReconcileContext.start(key, passTimeout, clock);
        LoggingConfig.setReconcileContext(key, context.reconcileId());
        
        Span span = tracer.spanBuilder(TracingConfig.RECONCILE_SPAN)
            .setAttribute(TracingConfig.POLICY_NAMESPACE, key.namespace())
            .setAttribute(TracingConfig.POLICY_NAME, key.name())
            .setAttribute(TracingConfig.RECONCILE_ID, context.reconcileId())
            .startSpan();
        long startNanos = System.nanoTime();
        String outcome = "success";
        
        try (Scope ignored = span.makeCurrent()) {
            ReconcileResult result = reconciler.reconcile(key, context);
            if (result.requeueAfter() != null) {
                queue.forget(key);
                queue.addAfter(key, result.requeueAfter());
                outcome = "requeue_after";
            } else if (result.requeue()) {
                queue.addRateLimited(key);
                outcome = "requeue";
            } else {
                queue.forget(key);
            }
        } catch (OperatorException e) {
            outcome = "error";
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.error("WAFPolicy: Reconcile failed [{}], requeuing (attempt {}): {}",
                e.getErrorCode().getCode(), queue.numRequeues(key) + 1, e.getMessage());
            queue.addRateLimited(key);
        } catch (RuntimeException e) {
            outcome = "error";
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.error("WAFPolicy: Unexpected error during reconcile, requeuing", e);
            queue.addRateLimited(key);
        } finally {
            span.setAttribute(TracingConfig.RECONCILE_OUTCOME, outcome);
            span.end();
            metrics.recordReconcile(outcome, Duration.ofNanos(System.nanoTime() - startNanos));
            queue.done(key);
            LoggingConfig.clearReconcileContext();
        }
        return true;
    }
}
