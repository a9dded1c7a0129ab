package com.policyparser.discovery.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "discovery.scoring")
@Validated
public record ScoringProperties(@NotBlank String modelId,
                                long seed,
                                @Positive double learningRate) {
}
