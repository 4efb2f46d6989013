package com.platform.wafoperator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Controller runtime settings.
 */
@Data
@ConfigurationProperties(prefix = "wafoperator.controller")
public class ControllerProperties {
    
    private int workers = 2;
    
    /**
     * First retry delay of a failing key; doubles on every further failure.
     */
    private Duration backoffBase = Duration.ofSeconds(1);
    
    private Duration backoffMax = Duration.ofMinutes(1);
    
    /**
     * Deadline of a single reconcile pass.
     */
    private Duration passTimeout = Duration.ofSeconds(30);
    
    /**
     * Interval of the periodic full resync.
     */
    private long resyncIntervalMs = 300_000;
    
    private int shutdownTimeoutSeconds = 30;
}
