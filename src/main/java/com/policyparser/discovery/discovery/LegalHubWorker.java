package com.policyparser.discovery.discovery;

import com.policyparser.discovery.domain.DomainModels;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens the common legal index pages and collects what they link to.
 */
@Component
public class LegalHubWorker implements DiscoveryWorker {
    static final List<String> HUB_PATHS = List.of("/legal", "/policies", "/about/legal");

    private final WorkerSupport support;

    public LegalHubWorker(WorkerSupport support) {
        this.support = support;
    }

    @Override
    public DomainModels.StrategyKind strategy() {
        return DomainModels.StrategyKind.LEGAL_HUB_CRAWL;
    }

    @Override
    public List<DomainModels.CandidateLink> discover(DiscoveryModels.WorkerContext context) {
        List<DomainModels.CandidateLink> found = new ArrayList<>();
        for (String path : HUB_PATHS) {
            if (WorkerSupport.stopped(context)) break;
            support.tryFetch(context.baseUrl() + path, context.budget(), Long.MAX_VALUE)
                    .filter(page -> page.status() == 200)
                    .ifPresent(page -> found.addAll(support.linksFrom(page, strategy())));
        }
        return found;
    }
}
