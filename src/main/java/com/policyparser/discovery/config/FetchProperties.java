package com.policyparser.discovery.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@ConfigurationProperties(prefix = "discovery.fetch")
@Validated
public record FetchProperties(@Min(100) long timeoutMs,
                              @Min(0) long retryBudgetMs,
                              @Min(0) int minContentChars,
                              @Min(1) int requestsPerSecond,
                              @Min(1000) long hostIdleExpiryMs,
                              @NotEmpty List<String> userAgents,
                              Rendering rendering) {

    public record Rendering(boolean enabled, String endpoint, long timeoutMs) {
    }

    public boolean renderingEnabled() {
        return rendering != null && rendering.enabled() && rendering.endpoint() != null && !rendering.endpoint().isBlank();
    }
}
