package com.platform.wafoperator.reconciliation;

import com.platform.wafoperator.TestResources;
import com.platform.wafoperator.model.ParentReference;
import com.platform.wafoperator.model.PolicyTargetReference;
import com.platform.wafoperator.store.admission.AdmissionValidator;
import com.platform.wafoperator.store.memory.InMemoryResourceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TargetResolverTest {
    
    private InMemoryResourceStore store;
    private TargetResolver resolver;
    
    @BeforeEach
    void setUp() {
        store = TestResources.store();
        resolver = new TargetResolver(store);
    }
    
    @Nested
    @DisplayName("Gateway target")
    class GatewayTarget {
        
        @Test
        @DisplayName("resolves to the gateway-name label")
        void resolves() {
            store.gateways().create(TestResources.gateway("gw1"));
            
            TargetResolution resolution = resolver.resolve(TestResources.gatewayPolicy("p", "gw1"));
            
            assertTrue(resolution.isResolved());
            assertEquals(Map.of(TargetResolver.GATEWAY_NAME_LABEL, "gw1"), resolution.workloadLabels());
        }
        
        @Test
        @DisplayName("missing gateway is TargetNotFound with requeue")
        void missing() {
            TargetResolution resolution = resolver.resolve(TestResources.gatewayPolicy("p", "missing"));
            
            assertFalse(resolution.isResolved());
            assertEquals(PolicyReason.TARGET_NOT_FOUND, resolution.reason());
            assertEquals("Gateway \"missing\" not found", resolution.message());
            assertTrue(resolution.requeue());
        }
    }
    
    @Nested
    @DisplayName("HTTPRoute target")
    class HttpRouteTarget {
        
        @Test
        @DisplayName("resolves to the first parent gateway")
        void resolvesFirstParent() {
            store.httpRoutes().create(TestResources.httpRoute("r1",
                ParentReference.gateway("gw-a"), ParentReference.gateway("gw-b")));
            
            TargetResolution resolution = resolver.resolve(TestResources.routePolicy("p", "r1"));
            
            assertEquals(Map.of(TargetResolver.GATEWAY_NAME_LABEL, "gw-a"), resolution.workloadLabels());
        }
        
        @Test
        @DisplayName("does not require the parent gateway to exist")
        void parentGatewayNotChecked() {
            store.httpRoutes().create(TestResources.httpRoute("r1", ParentReference.gateway("absent")));
            
            assertTrue(resolver.resolve(TestResources.routePolicy("p", "r1")).isResolved());
        }
        
        @Test
        @DisplayName("missing route is TargetNotFound with requeue")
        void missing() {
            TargetResolution resolution = resolver.resolve(TestResources.routePolicy("p", "r1"));
            
            assertEquals(PolicyReason.TARGET_NOT_FOUND, resolution.reason());
            assertEquals("HTTPRoute \"r1\" not found", resolution.message());
            assertTrue(resolution.requeue());
        }
        
        @Test
        @DisplayName("empty parentRefs is NoParentGateway")
        void noParents() {
            store.httpRoutes().create(TestResources.httpRoute("r1"));
            
            TargetResolution resolution = resolver.resolve(TestResources.routePolicy("p", "r1"));
            
            assertEquals(PolicyReason.NO_PARENT_GATEWAY, resolution.reason());
            assertEquals("HTTPRoute \"r1\" has no parentRefs", resolution.message());
            assertFalse(resolution.requeue());
        }
        
        @Test
        @DisplayName("malformed first parentRef is InvalidParentRef")
        void malformedParent() {
            store.httpRoutes().create(TestResources.httpRoute("r1", (ParentReference) null));
            
            TargetResolution resolution = resolver.resolve(TestResources.routePolicy("p", "r1"));
            
            assertEquals(PolicyReason.INVALID_PARENT_REF, resolution.reason());
            assertEquals("HTTPRoute \"r1\" has invalid parentRef", resolution.message());
        }
        
        @Test
        @DisplayName("first parentRef without name is InvalidParentRef")
        void namelessParent() {
            store.httpRoutes().create(TestResources.httpRoute("r1",
                new ParentReference(PolicyTargetReference.GATEWAY_API_GROUP, "Gateway", null, "", null, null)));
            
            TargetResolution resolution = resolver.resolve(TestResources.routePolicy("p", "r1"));
            
            assertEquals(PolicyReason.INVALID_PARENT_REF, resolution.reason());
            assertEquals("HTTPRoute \"r1\" parentRef has no gateway name", resolution.message());
        }
    }
    
    @Test
    @DisplayName("unsupported kind is InvalidTargetRef without requeue")
    void unsupportedKind() {
        TargetResolver permissive = new TargetResolver(
            new InMemoryResourceStore(TestResources.CLOCK, true, AdmissionValidator.acceptAll()));
        
        TargetResolution resolution = permissive.resolve(TestResources.policy("p",
            new PolicyTargetReference(PolicyTargetReference.GATEWAY_API_GROUP, "Service", "svc", null)));
        
        assertEquals(PolicyReason.INVALID_TARGET_REF, resolution.reason());
        assertEquals("Unsupported targetRef kind: Service", resolution.message());
        assertFalse(resolution.requeue());
    }
}
