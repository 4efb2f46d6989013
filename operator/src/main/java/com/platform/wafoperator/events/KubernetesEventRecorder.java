package com.platform.wafoperator.events;

import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.reconciliation.WafPolicyReconciler;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Publishes core/v1 Events to the API server and mirrors them locally.
 */
@Slf4j
public class KubernetesEventRecorder implements EventRecorder {
    
    private final KubernetesClient client;
    private final Clock clock;
    private final InMemoryEventRecorder local;
    
    public KubernetesEventRecorder(KubernetesClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
        this.local = new InMemoryEventRecorder(clock);
    }
    
    @Override
    public void event(Resource<?> object, EventType type, String reason, String message) {
        local.event(object, type, reason, message);
        
        String namespace = object.metadata().namespace();
        String timestamp = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
        Event event = new EventBuilder()
            .withNewMetadata()
                .withGenerateName(object.metadata().name() + ".")
                .withNamespace(namespace)
            .endMetadata()
            .withInvolvedObject(new ObjectReferenceBuilder()
                .withApiVersion(object.kind().getApiVersion())
                .withKind(object.kind().getKindName())
                .withName(object.metadata().name())
                .withNamespace(namespace)
                .withUid(object.metadata().uid())
                .withResourceVersion(object.metadata().resourceVersion())
                .build())
            .withType(type.getValue())
            .withReason(reason)
            .withMessage(message)
            .withFirstTimestamp(timestamp)
            .withLastTimestamp(timestamp)
            .withCount(1)
            .withNewSource()
                .withComponent(WafPolicyReconciler.CONTROLLER_NAME)
            .endSource()
            .build();
        
        try {
            client.v1().events().inNamespace(namespace).resource(event).create();
        } catch (KubernetesClientException e) {
            log.warn("Failed to publish event {} for {} {}: {}", 
                reason, object.kind().getKindName(), object.key(), e.getMessage());
        }
    }
    
    @Override
    public List<RecordedEvent> recentEvents() {
        return local.recentEvents();
    }
}
