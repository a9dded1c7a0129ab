package com.policyparser.discovery.discovery;

import com.policyparser.discovery.domain.DomainModels;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class HomepageCrawlWorker implements DiscoveryWorker {
    private final WorkerSupport support;

    public HomepageCrawlWorker(WorkerSupport support) {
        this.support = support;
    }

    @Override
    public DomainModels.StrategyKind strategy() {
        return DomainModels.StrategyKind.HOMEPAGE_CRAWL;
    }

    @Override
    public List<DomainModels.CandidateLink> discover(DiscoveryModels.WorkerContext context) {
        return support.tryFetch(context.baseUrl(), context.budget(), Long.MAX_VALUE)
                .map(page -> support.linksFrom(page, strategy()))
                .orElse(List.of());
    }
}
