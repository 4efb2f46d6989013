package com.platform.wafoperator.config;

import com.platform.wafoperator.events.EventRecorder;
import com.platform.wafoperator.events.KubernetesEventRecorder;
import com.platform.wafoperator.store.ResourceStore;
import com.platform.wafoperator.store.kubernetes.KubernetesResourceStore;
import com.platform.wafoperator.store.kubernetes.ResourceMapper;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Runs the operator against a Kubernetes API server, using the ambient
 * kubeconfig or in-cluster service account.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "wafoperator.store.mode", havingValue = "kubernetes")
public class KubernetesStoreConfiguration {
    
    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        KubernetesClient client = new KubernetesClientBuilder().build();
        log.info("Kubernetes client configured for {}", client.getMasterUrl());
        return client;
    }
    
    @Bean
    public ResourceStore resourceStore(KubernetesClient kubernetesClient) {
        return new KubernetesResourceStore(kubernetesClient, new ResourceMapper());
    }
    
    @Bean
    public EventRecorder eventRecorder(KubernetesClient kubernetesClient, Clock clock) {
        return new KubernetesEventRecorder(kubernetesClient, clock);
    }
}
