package com.policyparser.discovery.discovery;

import com.policyparser.discovery.config.OrchestratorProperties;
import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.search.PolicySearchService;
import com.policyparser.discovery.search.SearchModels;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class SearchEngineWorker implements DiscoveryWorker {
    private static final Map<DomainModels.DocumentType, String> TOPICS = Map.of(
            DomainModels.DocumentType.PRIVACY, "privacy policy",
            DomainModels.DocumentType.TERMS, "terms of service",
            DomainModels.DocumentType.COOKIE, "cookie policy",
            DomainModels.DocumentType.DATA_PROCESSING_AGREEMENT, "data processing agreement");

    private final PolicySearchService searchService;
    private final WorkerSupport support;
    private final OrchestratorProperties properties;

    public SearchEngineWorker(PolicySearchService searchService, WorkerSupport support, OrchestratorProperties properties) {
        this.searchService = searchService;
        this.support = support;
        this.properties = properties;
    }

    @Override
    public DomainModels.StrategyKind strategy() {
        return DomainModels.StrategyKind.SEARCH_ENGINE;
    }

    @Override
    public List<DomainModels.CandidateLink> discover(DiscoveryModels.WorkerContext context) {
        List<DomainModels.CandidateLink> found = new ArrayList<>();
        for (DomainModels.DocumentType type : properties.targetTypes()) {
            String topic = TOPICS.get(type);
            if (topic == null || WorkerSupport.stopped(context)) continue;
            for (SearchModels.SearchHit hit : searchService.findPolicyPages(context.domain(), topic, context.budget().deadlineMs())) {
                support.ranker()
                        .scoreDirect(hit.url(), hit.title(), DomainModels.LinkContext.BODY, context.baseUrl(), strategy())
                        .ifPresent(found::add);
            }
        }
        return found;
    }
}
