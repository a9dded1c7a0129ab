package com.policyparser.discovery.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "discovery.analysis")
@Validated
public record AnalysisProperties(boolean enabled,
                                 String endpoint,
                                 String apiKey,
                                 String model,
                                 @Min(100) long timeoutMs,
                                 @Min(100) int excerptChars) {
}
