package com.platform.wafoperator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Selects the cluster store backing the operator.
 */
@Data
@ConfigurationProperties(prefix = "wafoperator.store")
public class StoreProperties {
    
    private Mode mode = Mode.MEMORY;
    
    /**
     * Whether the in-memory store deletes dependents of removed owners.
     */
    private boolean garbageCollect = true;
    
    public enum Mode {
        MEMORY,
        KUBERNETES
    }
}
