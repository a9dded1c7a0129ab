package com.policyparser.discovery.discovery;

import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.fetch.FetchException;
import com.policyparser.discovery.fetch.FetchModels;
import com.policyparser.discovery.fetch.PageFetcher;
import com.policyparser.discovery.parser.LinkExtractor;
import com.policyparser.discovery.scoring.CandidateRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Fetch, extract and rank helpers shared by the page-based workers.
 */
@Component
public class WorkerSupport {
    private static final Logger log = LoggerFactory.getLogger(WorkerSupport.class);

    private final PageFetcher fetcher;
    private final LinkExtractor linkExtractor;
    private final CandidateRanker ranker;

    public WorkerSupport(PageFetcher fetcher, LinkExtractor linkExtractor, CandidateRanker ranker) {
        this.fetcher = fetcher;
        this.linkExtractor = linkExtractor;
        this.ranker = ranker;
    }

    public CandidateRanker ranker() {
        return ranker;
    }

    public static boolean stopped(DiscoveryModels.WorkerContext context) {
        return Thread.currentThread().isInterrupted() || context.budget().exhausted();
    }

    public Optional<FetchModels.FetchResult> tryFetch(String url, TimeBudget budget, long capMs) {
        long remaining = budget.remainingMs();
        if (remaining <= 0) return Optional.empty();
        FetchModels.FetchOptions options = fetcher.defaultOptions().capTo(Math.min(remaining, capMs));
        try {
            return Optional.of(fetcher.fetch(url, options));
        } catch (FetchException e) {
            log.debug("Fetch {} failed: {} {}", url, e.kind(), e.getMessage());
            return Optional.empty();
        }
    }

    public List<DomainModels.CandidateLink> linksFrom(FetchModels.FetchResult page, DomainModels.StrategyKind strategy) {
        List<DomainModels.RawLink> links = linkExtractor.extract(page.html(), page.finalUrl());
        return ranker.rank(links, page.finalUrl(), strategy);
    }
}
