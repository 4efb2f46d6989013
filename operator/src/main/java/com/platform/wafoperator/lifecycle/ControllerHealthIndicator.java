package com.platform.wafoperator.lifecycle;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the controller phase, worker count and queue depth.
 */
@Component
public class ControllerHealthIndicator implements HealthIndicator {
    
    private final ControllerLifecycleManager lifecycleManager;
    
    public ControllerHealthIndicator(ControllerLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }
    
    @Override
    public Health health() {
        ControllerLifecycleManager.LifecycleStatus status = lifecycleManager.getStatus();
        Health.Builder builder = status.phase() == ControllerLifecycleManager.LifecyclePhase.READY
            ? Health.up()
            : Health.outOfService();
        return builder
            .withDetail("phase", status.phase())
            .withDetail("since", status.phaseStartTime())
            .withDetail("activeWorkers", status.activeWorkers())
            .withDetail("queueDepth", status.queueDepth())
            .build();
    }
}
