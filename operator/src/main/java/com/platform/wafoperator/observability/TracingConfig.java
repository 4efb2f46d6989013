package com.platform.wafoperator.observability;

import com.platform.wafoperator.config.ControllerProperties;
import com.platform.wafoperator.config.StoreProperties;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tracing for reconcile passes.
 *
 * Each pass becomes one span named {@link #RECONCILE_SPAN}; the exported
 * resource identifies the controller and the store it runs against.
 * Without {@code otel.traces.enabled} the tracer is a noop.
 */
@Slf4j
@Configuration
public class TracingConfig {

    public static final String INSTRUMENTATION_SCOPE = "com.platform.wafoperator.controller";
    public static final String CONTROLLER_NAME = "wafpolicy-controller";
    public static final String RECONCILE_SPAN = "reconcile WAFPolicy";

    public static final AttributeKey<String> POLICY_NAMESPACE = AttributeKey.stringKey("wafpolicy.namespace");
    public static final AttributeKey<String> POLICY_NAME = AttributeKey.stringKey("wafpolicy.name");
    public static final AttributeKey<String> RECONCILE_ID = AttributeKey.stringKey("wafoperator.reconcile.id");
    public static final AttributeKey<String> RECONCILE_OUTCOME = AttributeKey.stringKey("wafoperator.reconcile.outcome");

    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    static final AttributeKey<String> CONTROLLER = AttributeKey.stringKey("wafoperator.controller");
    static final AttributeKey<String> STORE_MODE = AttributeKey.stringKey("wafoperator.store.mode");
    static final AttributeKey<Long> WORKERS = AttributeKey.longKey("wafoperator.workers");

    @Value("${spring.application.name:waf-policy-operator}")
    private String serviceName;

    @Value("${otel.exporter.otlp.endpoint:http://localhost:4317}")
    private String otlpEndpoint;

    @Value("${otel.traces.enabled:false}")
    private boolean tracingEnabled;

    @Bean
    public OpenTelemetry openTelemetry(StoreProperties storeProperties, ControllerProperties controllerProperties) {
        if (!tracingEnabled) {
            log.info("Reconcile tracing disabled");
            return OpenTelemetry.noop();
        }

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(OtlpGrpcSpanExporter.builder()
                .setEndpoint(otlpEndpoint)
                .build()).build())
            .setResource(operatorResource(serviceName, storeProperties.getMode(), controllerProperties.getWorkers()))
            .build();
        Runtime.getRuntime().addShutdownHook(new Thread(tracerProvider::close));

        log.info("Exporting reconcile spans of {} ({} store, {} workers) to {}",
            CONTROLLER_NAME, storeProperties.getMode(), controllerProperties.getWorkers(), otlpEndpoint);
        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.noop())
            .build();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    }

    static Resource operatorResource(String serviceName, StoreProperties.Mode storeMode, int workers) {
        return Resource.getDefault().merge(Resource.create(Attributes.builder()
            .put(SERVICE_NAME, serviceName)
            .put(CONTROLLER, CONTROLLER_NAME)
            .put(STORE_MODE, storeMode.name().toLowerCase())
            .put(WORKERS, (long) workers)
            .build()));
    }
}
