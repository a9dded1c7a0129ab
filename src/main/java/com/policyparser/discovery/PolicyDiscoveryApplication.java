package com.policyparser.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PolicyDiscoveryApplication {
    public static void main(String[] args) {
        SpringApplication.run(PolicyDiscoveryApplication.class, args);
    }
}
