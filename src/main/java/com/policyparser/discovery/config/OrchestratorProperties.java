package com.policyparser.discovery.config;

import com.policyparser.discovery.domain.DomainModels;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "discovery.orchestrator")
@Validated
public record OrchestratorProperties(@Min(0) long sessionBudgetMs,
                                     @Min(1) long workerTimeoutMs,
                                     @Min(1) int maxWorkers,
                                     @Min(1) int maxVerifications,
                                     double neuralWeight,
                                     @NotEmpty List<DomainModels.StrategyKind> strategies,
                                     @NotEmpty List<DomainModels.DocumentType> targetTypes,
                                     Map<String, List<String>> knownPolicies) {

    public List<String> knownPoliciesFor(String domain) {
        if (knownPolicies == null) return List.of();
        return knownPolicies.getOrDefault(domain, List.of());
    }
}
