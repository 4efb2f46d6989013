package com.platform.wafoperator.observability;

import com.platform.wafoperator.TestResources;
import com.platform.wafoperator.config.StoreProperties;
import com.platform.wafoperator.controller.ControllerRunner;
import com.platform.wafoperator.controller.ItemExponentialRateLimiter;
import com.platform.wafoperator.controller.WorkQueue;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.reconciliation.ReconcileResult;
import com.platform.wafoperator.reconciliation.WafPolicyReconciler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TracingConfigTest {
    
    @Test
    @DisplayName("exported resource names the controller and its store")
    void operatorResource() {
        Resource resource = TracingConfig.operatorResource("waf-policy-operator", StoreProperties.Mode.KUBERNETES, 4);
        
        assertEquals("waf-policy-operator", resource.getAttribute(TracingConfig.SERVICE_NAME));
        assertEquals(TracingConfig.CONTROLLER_NAME, resource.getAttribute(TracingConfig.CONTROLLER));
        assertEquals("kubernetes", resource.getAttribute(TracingConfig.STORE_MODE));
        assertEquals(4L, resource.getAttribute(TracingConfig.WORKERS));
    }
    
    @Test
    @DisplayName("a reconcile pass is exported as one span carrying the policy key and outcome")
    void reconcileSpan() throws InterruptedException {
        InMemorySpanExporter exporter = InMemorySpanExporter.create();
        SdkTracerProvider provider = SdkTracerProvider.builder()
            .addSpanProcessor(SimpleSpanProcessor.create(exporter))
            .build();
        ObjectKey key = ObjectKey.of(TestResources.NAMESPACE, "p");
        WafPolicyReconciler reconciler = mock(WafPolicyReconciler.class);
        when(reconciler.reconcile(eq(key), any())).thenReturn(ReconcileResult.done());
        WorkQueue<ObjectKey> queue = new WorkQueue<>(
            new ItemExponentialRateLimiter<>(Duration.ofMillis(10), Duration.ofMillis(100)));
        ControllerRunner runner = new ControllerRunner(queue, reconciler,
            new OperatorMetrics(new SimpleMeterRegistry()),
            provider.get(TracingConfig.INSTRUMENTATION_SCOPE), TestResources.CLOCK, 1, Duration.ofSeconds(30));
        
        try {
            queue.add(key);
            runner.processNextItem(Duration.ZERO);
        } finally {
            queue.shutDown();
            provider.close();
        }
        
        List<SpanData> spans = exporter.getFinishedSpanItems();
        assertEquals(1, spans.size());
        SpanData span = spans.get(0);
        assertEquals(TracingConfig.RECONCILE_SPAN, span.getName());
        assertEquals("ns", span.getAttributes().get(TracingConfig.POLICY_NAMESPACE));
        assertEquals("p", span.getAttributes().get(TracingConfig.POLICY_NAME));
        assertEquals("success", span.getAttributes().get(TracingConfig.RECONCILE_OUTCOME));
        assertNotNull(span.getAttributes().get(TracingConfig.RECONCILE_ID));
    }
}
