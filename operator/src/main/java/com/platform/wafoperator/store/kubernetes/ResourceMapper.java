package com.platform.wafoperator.store.kubernetes;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.EngineSpec;
import com.platform.wafoperator.model.EngineStatus;
import com.platform.wafoperator.model.Gateway;
import com.platform.wafoperator.model.HttpRoute;
import com.platform.wafoperator.model.OwnerReference;
import com.platform.wafoperator.model.ParentReference;
import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.ResourceMetadata;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.model.WafPolicySpec;
import com.platform.wafoperator.model.WafPolicyStatus;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts between fabric8 generic objects and the typed resource model.
 */
@Slf4j
public class ResourceMapper {
    
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    
    private final ObjectMapper objectMapper;
    
    public ResourceMapper() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
    
    @SuppressWarnings("unchecked")
    public <T extends Resource<T>> T fromGeneric(ResourceKind kind, GenericKubernetesResource generic) {
        ResourceMetadata metadata = toMetadata(generic.getMetadata());
        Object spec = generic.getAdditionalProperties().get("spec");
        Object status = generic.getAdditionalProperties().get("status");
        
        Resource<?> resource = switch (kind) {
            case WAF_POLICY -> new WafPolicy(metadata,
                convert(spec, WafPolicySpec.class),
                convert(status, WafPolicyStatus.class));
            case ENGINE -> new Engine(metadata,
                convert(spec, EngineSpec.class),
                convert(status, EngineStatus.class));
            case GATEWAY -> new Gateway(metadata, convert(spec, Gateway.GatewaySpec.class));
            case HTTP_ROUTE -> new HttpRoute(metadata, toHttpRouteSpec(spec));
        };
        return (T) resource;
    }
    
    public GenericKubernetesResource toGeneric(Resource<?> resource) {
        GenericKubernetesResource generic = new GenericKubernetesResource();
        generic.setApiVersion(resource.kind().getApiVersion());
        generic.setKind(resource.kind().getKindName());
        generic.setMetadata(toObjectMeta(resource.metadata()));
        if (resource.spec() != null) {
            generic.setAdditionalProperty("spec", toMap(resource.spec()));
        }
        if (resource.status() != null) {
            generic.setAdditionalProperty("status", toMap(resource.status()));
        }
        return generic;
    }
    
    /**
     * Object carrying only identity and status, for status subresource patches.
     */
    public GenericKubernetesResource toStatusPatch(Resource<?> resource) {
        GenericKubernetesResource generic = new GenericKubernetesResource();
        generic.setApiVersion(resource.kind().getApiVersion());
        generic.setKind(resource.kind().getKindName());
        generic.setMetadata(new ObjectMetaBuilder()
            .withName(resource.metadata().name())
            .withNamespace(resource.metadata().namespace())
            .build());
        generic.setAdditionalProperty("status", toMap(resource.status()));
        return generic;
    }
    
    public ResourceMetadata toMetadata(ObjectMeta meta) {
        if (meta == null) {
            return ResourceMetadata.builder().build();
        }
        List<OwnerReference> owners = new ArrayList<>();
        if (meta.getOwnerReferences() != null) {
            for (io.fabric8.kubernetes.api.model.OwnerReference ref : meta.getOwnerReferences()) {
                owners.add(new OwnerReference(ref.getApiVersion(), ref.getKind(), ref.getName(),
                    ref.getUid(), ref.getController(), ref.getBlockOwnerDeletion()));
            }
        }
        return ResourceMetadata.builder()
            .name(meta.getName())
            .namespace(meta.getNamespace())
            .uid(meta.getUid())
            .generation(meta.getGeneration() == null ? 0 : meta.getGeneration())
            .resourceVersion(meta.getResourceVersion())
            .labels(meta.getLabels())
            .annotations(meta.getAnnotations())
            .finalizers(meta.getFinalizers())
            .ownerReferences(owners)
            .creationTimestamp(parseTimestamp(meta.getCreationTimestamp()))
            .deletionTimestamp(parseTimestamp(meta.getDeletionTimestamp()))
            .build();
    }
    
    public ObjectMeta toObjectMeta(ResourceMetadata metadata) {
        ObjectMetaBuilder builder = new ObjectMetaBuilder()
            .withName(metadata.name())
            .withNamespace(metadata.namespace())
            .withUid(metadata.uid())
            .withResourceVersion(metadata.resourceVersion());
        if (!metadata.labels().isEmpty()) {
            builder.withLabels(metadata.labels());
        }
        if (!metadata.annotations().isEmpty()) {
            builder.withAnnotations(metadata.annotations());
        }
        if (!metadata.finalizers().isEmpty()) {
            builder.withFinalizers(metadata.finalizers());
        }
        for (OwnerReference ref : metadata.ownerReferences()) {
            builder.addToOwnerReferences(new OwnerReferenceBuilder()
                .withApiVersion(ref.apiVersion())
                .withKind(ref.kind())
                .withName(ref.name())
                .withUid(ref.uid())
                .withController(ref.controller())
                .withBlockOwnerDeletion(ref.blockOwnerDeletion())
                .build());
        }
        return builder.build();
    }
    
    /**
     * Route spec whose parentRefs entries that are not objects, or cannot be
     * read as parent references, are kept as null entries.
     */
    private HttpRoute.HttpRouteSpec toHttpRouteSpec(Object spec) {
        if (!(spec instanceof Map<?, ?> specMap)) {
            return null;
        }
        Object rawRefs = specMap.get("parentRefs");
        if (!(rawRefs instanceof List<?> entries)) {
            return new HttpRoute.HttpRouteSpec(List.of());
        }
        List<ParentReference> parentRefs = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            parentRefs.add(entry instanceof Map<?, ?> ? convertLeniently(entry) : null);
        }
        return new HttpRoute.HttpRouteSpec(parentRefs);
    }
    
    private ParentReference convertLeniently(Object entry) {
        try {
            return objectMapper.convertValue(entry, ParentReference.class);
        } catch (IllegalArgumentException e) {
            log.debug("Unreadable HTTPRoute parentRef {}: {}", entry, e.getMessage());
            return null;
        }
    }
    
    private <V> V convert(Object value, Class<V> type) {
        if (value == null) {
            return null;
        }
        return objectMapper.convertValue(value, type);
    }
    
    private Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }
    
    private static Instant parseTimestamp(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }
}
