package com.platform.wafoperator.reconciliation;

import com.platform.wafoperator.model.Engine;
import com.platform.wafoperator.model.EngineSpec;
import com.platform.wafoperator.model.IstioIntegrationMode;
import com.platform.wafoperator.model.ObjectReference;
import com.platform.wafoperator.model.OwnerReference;
import com.platform.wafoperator.model.ResourceMetadata;
import com.platform.wafoperator.model.WafPolicy;

import java.util.List;
import java.util.Map;

/**
 * Builds the complete desired Engine for a policy. The spec is recomputed
 * from scratch on every pass; nothing is read from the existing Engine.
 */
public class EngineSynthesizer {
    
    public static final String ENGINE_NAME_PREFIX = "wafpolicy-";
    public static final String RULE_SET_API_VERSION = "waf.k8s.coraza.io/v1alpha1";
    public static final String RULE_SET_KIND = "RuleSet";
    
    private final TranslatorConfig config;
    
    public EngineSynthesizer(TranslatorConfig config) {
        this.config = config;
    }
    
    public static String engineNameFor(String policyName) {
        return ENGINE_NAME_PREFIX + policyName;
    }
    
    public Engine synthesize(WafPolicy policy, Map<String, String> workloadLabels) {
        ResourceMetadata metadata = ResourceMetadata.builder()
            .name(engineNameFor(policy.metadata().name()))
            .namespace(policy.metadata().namespace())
            .ownerReferences(List.of(OwnerReference.controllerOf(policy)))
            .build();
        
        EngineSpec.IstioWasmConfig wasm = new EngineSpec.IstioWasmConfig(
            config.defaultWasmImage(),
            IstioIntegrationMode.GATEWAY,
            new EngineSpec.LabelSelector(workloadLabels),
            new EngineSpec.RuleSetCacheServerConfig(config.defaultPollInterval())
        );
        
        EngineSpec spec = new EngineSpec(
            new ObjectReference(RULE_SET_API_VERSION, RULE_SET_KIND,
                policy.spec().ruleSet().name(), null),
            policy.spec().effectiveFailurePolicy(),
            new EngineSpec.DriverConfig(new EngineSpec.IstioDriverConfig(wasm))
        );
        
        return new Engine(metadata, spec, null);
    }
}
