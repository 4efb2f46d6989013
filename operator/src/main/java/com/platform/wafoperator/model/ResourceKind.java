package com.platform.wafoperator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Object kinds the operator reads or writes.
 */
public enum ResourceKind {
    
    WAF_POLICY("waf.k8s.coraza.io", "v1alpha1", "WAFPolicy", "wafpolicies"),
    ENGINE("waf.k8s.coraza.io", "v1alpha1", "Engine", "engines"),
    GATEWAY("gateway.networking.k8s.io", "v1", "Gateway", "gateways"),
    HTTP_ROUTE("gateway.networking.k8s.io", "v1", "HTTPRoute", "httproutes");
    
    private final String group;
    private final String version;
    private final String kindName;
    private final String plural;
    
    ResourceKind(String group, String version, String kindName, String plural) {
        this.group = group;
        this.version = version;
        this.kindName = kindName;
        this.plural = plural;
    }
    
    public String getGroup() {
        return group;
    }
    
    public String getVersion() {
        return version;
    }
    
    public String getKindName() {
        return kindName;
    }
    
    public String getPlural() {
        return plural;
    }
    
    public String getApiVersion() {
        return group + "/" + version;
    }
    
    public static Optional<ResourceKind> fromKindName(String kindName) {
        return Arrays.stream(values())
            .filter(k -> k.kindName.equals(kindName))
            .findFirst();
    }
}
