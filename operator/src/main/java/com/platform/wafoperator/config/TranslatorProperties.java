package com.platform.wafoperator.config;

import com.platform.wafoperator.reconciliation.TranslatorConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults used when translating WAFPolicies into Engines.
 */
@Data
@ConfigurationProperties(prefix = "wafoperator.translator")
public class TranslatorProperties {
    
    /**
     * OCI image of the Coraza WASM filter.
     */
    private String defaultWasmImage = TranslatorConfig.FALLBACK_WASM_IMAGE;
    
    /**
     * Rule set cache server poll interval, in seconds.
     */
    private int defaultPollInterval = TranslatorConfig.DEFAULT_POLL_INTERVAL_SECONDS;
    
    private String envoyClusterName;
    
    public TranslatorConfig toConfig() {
        return new TranslatorConfig(defaultWasmImage, defaultPollInterval, envoyClusterName);
    }
}
