package com.platform.wafoperator.config;

import com.platform.wafoperator.controller.ControllerRunner;
import com.platform.wafoperator.controller.ItemExponentialRateLimiter;
import com.platform.wafoperator.controller.PolicyWatchDispatcher;
import com.platform.wafoperator.controller.TargetPolicyIndex;
import com.platform.wafoperator.controller.WorkQueue;
import com.platform.wafoperator.events.EventRecorder;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.observability.OperatorMetrics;
import com.platform.wafoperator.reconciliation.EngineSynthesizer;
import com.platform.wafoperator.reconciliation.PolicyStatusProjector;
import com.platform.wafoperator.reconciliation.TargetResolver;
import com.platform.wafoperator.reconciliation.TranslatorConfig;
import com.platform.wafoperator.reconciliation.WafPolicyReconciler;
import com.platform.wafoperator.store.ResourceStore;
import com.platform.wafoperator.store.ResourceUpserter;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the reconciliation pipeline around the selected {@link ResourceStore}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
    TranslatorProperties.class,
    ControllerProperties.class,
    StoreProperties.class
})
public class OperatorConfiguration {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public TranslatorConfig translatorConfig(TranslatorProperties properties) {
        TranslatorConfig config = properties.toConfig();
        log.info("Translator configured: wasmImage={}, pollInterval={}s", 
            config.defaultWasmImage(), config.defaultPollInterval());
        return config;
    }
    
    @Bean
    public WafPolicyReconciler wafPolicyReconciler(ResourceStore store, TranslatorConfig translatorConfig,
            EventRecorder eventRecorder, Clock clock, OperatorMetrics metrics) {
        return new WafPolicyReconciler(
            store,
            new TargetResolver(store),
            new EngineSynthesizer(translatorConfig),
            new ResourceUpserter(store),
            new PolicyStatusProjector(store, eventRecorder, clock, metrics)
        );
    }
    
    @Bean
    public WorkQueue<ObjectKey> workQueue(ControllerProperties properties, OperatorMetrics metrics) {
        WorkQueue<ObjectKey> queue = new WorkQueue<>(
            new ItemExponentialRateLimiter<>(properties.getBackoffBase(), properties.getBackoffMax()));
        metrics.registerQueueDepth(queue::size);
        return queue;
    }
    
    @Bean
    public PolicyWatchDispatcher policyWatchDispatcher(ResourceStore store, WorkQueue<ObjectKey> workQueue,
            OperatorMetrics metrics) {
        return new PolicyWatchDispatcher(store, new TargetPolicyIndex(store, metrics), workQueue);
    }
    
    @Bean
    public ControllerRunner controllerRunner(WorkQueue<ObjectKey> workQueue, WafPolicyReconciler reconciler,
            OperatorMetrics metrics, Tracer tracer, Clock clock, ControllerProperties properties) {
        return new ControllerRunner(workQueue, reconciler, metrics, tracer, clock,
            properties.getWorkers(), properties.getPassTimeout());
    }
}
