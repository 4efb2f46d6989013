package com.platform.wafoperator.store.kubernetes;

import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.Gateway;
import com.platform.wafoperator.model.HttpRoute;
import com.platform.wafoperator.model.ResourceKind;
import com.platform.wafoperator.model.WafPolicy;
import com.platform.wafoperator.store.ResourceClient;
import com.platform.wafoperator.store.ResourceStore;
import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Cluster store served by a Kubernetes API server. Admission and
 * owner-based garbage collection are done by the cluster.
 */
public class KubernetesResourceStore implements ResourceStore {
    
    private final ResourceClient<WafPolicy> policies;
    private final ResourceClient<Engine> engines;
    private final ResourceClient<Gateway> gateways;
    private final ResourceClient<HttpRoute> httpRoutes;
    
    public KubernetesResourceStore(KubernetesClient client, ResourceMapper mapper) {
        this.policies = new KubernetesResourceClient<>(client, ResourceKind.WAF_POLICY, mapper);
        this.engines = new KubernetesResourceClient<>(client, ResourceKind.ENGINE, mapper);
        this.gateways = new KubernetesResourceClient<>(client, ResourceKind.GATEWAY, mapper);
        this.httpRoutes = new KubernetesResourceClient<>(client, ResourceKind.HTTP_ROUTE, mapper);
    }
    
    @Override
    public ResourceClient<WafPolicy> policies() {
        return policies;
    }
    
    @Override
    public ResourceClient<Engine> engines() {
        return engines;
    }
    
    @Override
    public ResourceClient<Gateway> gateways() {
        return gateways;
    }
    
    @Override
    public ResourceClient<HttpRoute> httpRoutes() {
        return httpRoutes;
    }
    
    @Override
    public boolean garbageCollectsOwnedResources() {
        return true;
    }
}
