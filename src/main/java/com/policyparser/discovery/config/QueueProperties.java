package com.policyparser.discovery.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "discovery.queue")
@Validated
public record QueueProperties(boolean workerEnabled,
                              @Min(1) long staleAfterMs,
                              boolean trainOnOutcome,
                              @Min(1) long cacheRetentionHours,
                              @Min(1) int transitionRetries) {
}
