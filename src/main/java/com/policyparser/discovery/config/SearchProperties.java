package com.policyparser.discovery.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "discovery.search")
@Validated
public record SearchProperties(@NotBlank String provider,
                               @NotBlank String baseUrl,
                               String fallbackUrl,
                               String serperUrl,
                               String apiKey,
                               @Min(1) int resultLimit) {

    public boolean serper() {
        return "serper".equalsIgnoreCase(provider) && apiKey != null && !apiKey.isBlank();
    }
}
