package com.platform.wafoperator.store;

import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.Gateway;
import com.platform.wafoperator.model.HttpRoute;
import com.platform.wafoperator.model.Resource;
import com.platform.wafoperator.model.WafPolicy;

/**
 * The cluster store holding policies, engines and their targets.
 */
public interface ResourceStore {
    
    ResourceClient<WafPolicy> policies();
    
    ResourceClient<Engine> engines();
    
    ResourceClient<Gateway> gateways();
    
    ResourceClient<HttpRoute> httpRoutes();
    
    /**
     * Whether the store deletes dependents once their owner is removed.
     * When false, owners must delete their dependents themselves.
     */
    boolean garbageCollectsOwnedResources();
    
    /**
     * Client serving the kind of the given object.
     */
    @SuppressWarnings("unchecked")
    default <T extends Resource<T>> ResourceClient<T> clientFor(T resource) {
        ResourceClient<?> client = switch (resource.kind()) {
            case WAF_POLICY -> policies();
            case ENGINE -> engines();
            case GATEWAY -> gateways();
            case HTTP_ROUTE -> httpRoutes();
        };
        return (ResourceClient<T>) client;
    }
}
