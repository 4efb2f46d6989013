package com.platform.wafoperator.config;

import com.platform.wafoperator.events.EventRecorder;
import com.platform.wafoperator.events.InMemoryEventRecorder;
import com.platform.wafoperator.store.ResourceStore;
import com.platform.wafoperator.store.admission.WafPolicyAdmissionValidator;
import com.platform.wafoperator.store.memory.InMemoryResourceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Runs the operator against the process-local store.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "wafoperator.store.mode", havingValue = "memory", matchIfMissing = true)
public class MemoryStoreConfiguration {
    
    @Bean
    public ResourceStore resourceStore(Clock clock, StoreProperties properties) {
        log.info("Using in-memory cluster store");
        return new InMemoryResourceStore(clock, properties.isGarbageCollect(), new WafPolicyAdmissionValidator());
    }
    
    @Bean
    public EventRecorder eventRecorder(Clock clock) {
        return new InMemoryEventRecorder(clock);
    }
}
