package com.platform.wafoperator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * WAF policy operator: keeps Engine objects in sync with WAFPolicy objects.
 */
@SpringBootApplication
@EnableScheduling
public class WafOperatorApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(WafOperatorApplication.class, args);
    }
}
