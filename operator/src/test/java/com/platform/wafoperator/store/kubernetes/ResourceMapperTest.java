package com.platform.wafoperator.store.kubernetes;

import com.platform.wafoperator.TestResources;
import com.platform.wafoperator.model.Conditions;
import com.platform.wafoperator.model.HttpRoute;
import com.platform.wafoperator.model.OwnerReference;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.ResourceMetadata;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.model.WafPolicyStatus;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceMapperTest {
    
    private final ResourceMapper mapper = new ResourceMapper();
    
    @Test
    @DisplayName("policy with status survives conversion to and from the generic form")
    void policyConversion() {
        WafPolicy policy = TestResources.gatewayPolicy("p", "gw")
            .withMetadata(ResourceMetadata.builder()
                .namespace("ns")
                .name("p")
                .uid("uid-1")
                .generation(3)
                .resourceVersion("42")
                .finalizers(List.of("waf.k8s.coraza.io/wafpolicy-finalizer"))
                .creationTimestamp(Instant.parse("2025-01-01T00:00:00Z"))
                .build())
            .withStatus(new WafPolicyStatus(Conditions.setTrue(List.of(), 3, Conditions.ACCEPTED,
                "Accepted", "ok", Instant.parse("2025-01-01T00:01:00Z"))));
        
        GenericKubernetesResource generic = mapper.toGeneric(policy);
        WafPolicy back = mapper.fromGeneric(ResourceKind.WAF_POLICY, generic);
        
        assertEquals("waf.k8s.coraza.io/v1alpha1", generic.getApiVersion());
        assertEquals("WAFPolicy", generic.getKind());
        assertEquals(policy.spec(), back.spec());
        assertEquals(policy.status(), back.status());
        assertEquals("42", back.metadata().resourceVersion());
    }
    
    @Test
    @DisplayName("status patch carries identity and status only")
    void statusPatch() {
        WafPolicy policy = TestResources.gatewayPolicy("p", "gw");
        
        GenericKubernetesResource patch = mapper.toStatusPatch(policy);
        
        assertEquals("p", patch.getMetadata().getName());
        assertEquals("ns", patch.getMetadata().getNamespace());
        assertNull(patch.getAdditionalProperties().get("spec"));
        assertNotNull(patch.getAdditionalProperties().get("status"));
    }
    
    @Test
    @DisplayName("metadata keeps owner references and timestamps")
    void metadataConversion() {
        ObjectMeta meta = new ObjectMetaBuilder()
            .withName("e")
            .withNamespace("ns")
            .withGeneration(2L)
            .withCreationTimestamp("2025-01-01T00:00:00Z")
            .withDeletionTimestamp("2025-01-02T00:00:00Z")
            .addNewOwnerReference()
                .withApiVersion("waf.k8s.coraza.io/v1alpha1")
                .withKind("WAFPolicy")
                .withName("p")
                .withUid("uid-1")
                .withController(true)
            .endOwnerReference()
            .build();
        
        ResourceMetadata metadata = mapper.toMetadata(meta);
        
        assertEquals(2, metadata.generation());
        assertTrue(metadata.isDeleting());
        OwnerReference owner = metadata.controllerOwner().orElseThrow();
        assertEquals("p", owner.name());
        assertEquals("uid-1", owner.uid());
    }
    
    @Test
    @DisplayName("annotations survive a finalizer update of a stored policy")
    void annotationsKeptAcrossFinalizerUpdate() {
        Map<String, String> annotations = Map.of(
            "team", "sec",
            "kubectl.kubernetes.io/last-applied-configuration", "{}");
        GenericKubernetesResource stored = mapper.toGeneric(TestResources.gatewayPolicy("p", "gw"));
        stored.setMetadata(new ObjectMetaBuilder(stored.getMetadata())
            .withAnnotations(annotations)
            .withResourceVersion("7")
            .build());
        
        WafPolicy read = mapper.fromGeneric(ResourceKind.WAF_POLICY, stored);
        WafPolicy withFinalizer = read.withMetadata(
            read.metadata().withFinalizerAdded("waf.k8s.coraza.io/wafpolicy-finalizer"));
        GenericKubernetesResource body = mapper.toGeneric(withFinalizer);
        
        assertEquals(annotations, body.getMetadata().getAnnotations());
        assertEquals(List.of("waf.k8s.coraza.io/wafpolicy-finalizer"), body.getMetadata().getFinalizers());
        assertEquals("7", body.getMetadata().getResourceVersion());
    }
    
    @Test
    @DisplayName("unreadable parentRefs entries become null entries")
    void malformedParentRefs() {
        GenericKubernetesResource generic = new GenericKubernetesResource();
        generic.setMetadata(new ObjectMetaBuilder().withName("r").withNamespace("ns").build());
        generic.setAdditionalProperty("spec", Map.of("parentRefs", List.of("not-an-object", Map.of("name", "gw"))));
        
        HttpRoute route = mapper.fromGeneric(ResourceKind.HTTP_ROUTE, generic);
        
        assertEquals(2, route.parentRefs().size());
        assertNull(route.parentRefs().get(0));
        assertEquals("gw", route.parentRefs().get(1).name());
    }
}
