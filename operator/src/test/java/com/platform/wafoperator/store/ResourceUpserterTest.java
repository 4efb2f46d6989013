package com.platform.wafoperator.store;

import com.platform.wafoperator.TestResources;
import com.platform.wafoperator.error.MissingIdentityException;
import com.platform.wafoperator.error.ResourceConflictException;
import com.platform.wafoperator.model.Gateway;
import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.ResourceMetadata;
import com.platform.wafoperator.store.memory.InMemoryResourceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResourceUpserterTest {
    
    private InMemoryResourceStore store;
    private ResourceUpserter upserter;
    
    @BeforeEach
    void setUp() {
        store = TestResources.store();
        upserter = new ResourceUpserter(store);
    }
    
    @Test
    @DisplayName("creates a missing object")
    void createsMissing() {
        UpsertResult<Gateway> result = upserter.upsert(TestResources.gateway("gw"));
        
        assertEquals(UpsertOperation.CREATED, result.operation());
        assertNotNull(result.resource().metadata().uid());
    }
    
    @Test
    @DisplayName("overwrites an existing object with the desired spec")
    void updatesExisting() {
        Gateway existing = store.gateways().create(TestResources.gateway("gw"));
        Gateway desired = new Gateway(ResourceMetadata.of(TestResources.NAMESPACE, "gw"),
            new Gateway.GatewaySpec("envoy"));
        
        UpsertResult<Gateway> result = upserter.upsert(desired);
        
        assertEquals(UpsertOperation.UPDATED, result.operation());
        assertEquals("envoy", result.resource().spec().gatewayClassName());
        assertEquals(existing.metadata().uid(), result.resource().metadata().uid());
        assertEquals(2, result.resource().metadata().generation());
    }
    
    @Test
    @DisplayName("an identical desired state leaves the object unchanged")
    void identicalIsNoOp() {
        Gateway existing = store.gateways().create(TestResources.gateway("gw"));
        
        UpsertResult<Gateway> result = upserter.upsert(TestResources.gateway("gw"));
        
        assertEquals(UpsertOperation.UPDATED, result.operation());
        assertEquals(existing, result.resource());
    }
    
    @Test
    @DisplayName("a write between read and update surfaces a conflict and is not retried")
    @SuppressWarnings("unchecked")
    void concurrentWriteConflicts() {
        ObjectKey key = ObjectKey.of(TestResources.NAMESPACE, "gw");
        store.gateways().create(TestResources.gateway("gw"));
        ResourceClient<Gateway> stored = store.gateways();
        ResourceClient<Gateway> gateways = mock(ResourceClient.class, delegatesTo(stored));
        doAnswer(invocation -> {
            Optional<Gateway> read = stored.get(invocation.getArgument(0));
            Gateway other = read.orElseThrow();
            stored.update(new Gateway(other.metadata(), new Gateway.GatewaySpec("other")));
            return read;
        }).when(gateways).get(any());
        InMemoryResourceStore racing = spy(store);
        doReturn(gateways).when(racing).gateways();
        Gateway desired = new Gateway(ResourceMetadata.of(TestResources.NAMESPACE, "gw"),
            new Gateway.GatewaySpec("envoy"));
        
        assertThrows(ResourceConflictException.class, () -> new ResourceUpserter(racing).upsert(desired));
        
        verify(gateways, times(1)).update(any());
        assertEquals("other", store.gateways().get(key).orElseThrow().spec().gatewayClassName());
    }
    
    @Test
    @DisplayName("defaults an empty namespace")
    void defaultsNamespace() {
        upserter.upsert(new Gateway(ResourceMetadata.of(null, "gw"), null));
        
        assertTrue(store.gateways().get(ObjectKey.of(ResourceUpserter.DEFAULT_NAMESPACE, "gw")).isPresent());
    }
    
    @Test
    @DisplayName("rejects an object without a name")
    void rejectsMissingName() {
        Gateway unnamed = new Gateway(ResourceMetadata.of(TestResources.NAMESPACE, ""), null);
        
        assertThrows(MissingIdentityException.class, () -> upserter.upsert(unnamed));
    }
}
