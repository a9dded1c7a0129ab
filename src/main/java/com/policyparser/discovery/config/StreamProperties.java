package com.policyparser.discovery.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizing of the pool that runs streamed discovery sessions. Requests beyond
 * {@code poolSize + queueCapacity} are turned away.
 */
@ConfigurationProperties(prefix = "discovery.stream")
@Validated
public record StreamProperties(@Min(1) int poolSize,
                               @Min(0) int queueCapacity,
                               @Min(1000) long defaultTimeoutMs) {
}
