package com.platform.wafoperator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Desired state of an Engine: which rule set to enforce and how the
 * enforcement filter is deployed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineSpec(
    ObjectReference ruleSet,
    FailurePolicy failurePolicy,
    DriverConfig driver
) {
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DriverConfig(IstioDriverConfig istio) {
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record IstioDriverConfig(IstioWasmConfig wasm) {
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record IstioWasmConfig(
        String image,
        IstioIntegrationMode mode,
        LabelSelector workloadSelector,
        RuleSetCacheServerConfig ruleSetCacheServer
    ) {
    }
    
    public record LabelSelector(Map<String, String> matchLabels) {
        
        public LabelSelector {
            matchLabels = matchLabels == null ? Map.of() : Map.copyOf(matchLabels);
        }
    }
    
    public record RuleSetCacheServerConfig(int pollIntervalSeconds) {
    }
    
    /**
     * Shortcut to the WASM block, or null when the spec carries no Istio driver.
     */
    public IstioWasmConfig istioWasm() {
        if (driver == null || driver.istio() == null) {
            return null;
        }
        return driver.istio().wasm();
    }
}
