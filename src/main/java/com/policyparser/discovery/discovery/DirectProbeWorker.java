package com.policyparser.discovery.discovery;

import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.fetch.FetchModels;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Guesses the usual policy paths and keeps the ones that answer with a substantial page.
 */
@Component
public class DirectProbeWorker implements DiscoveryWorker {
    static final List<String> PROBE_PATHS = List.of(
            "/privacy", "/privacy-policy", "/privacypolicy", "/datenschutz",
            "/terms", "/tos", "/terms-of-service", "/nutzungsbedingungen",
            "/cookies", "/cookie-policy");
    static final int MIN_BODY_CHARS = 2000;
    private static final long PROBE_TIMEOUT_MS = 3000;

    private final WorkerSupport support;

    public DirectProbeWorker(WorkerSupport support) {
        this.support = support;
    }

    @Override
    public DomainModels.StrategyKind strategy() {
        return DomainModels.StrategyKind.DIRECT_PROBE;
    }

    @Override
    public List<DomainModels.CandidateLink> discover(DiscoveryModels.WorkerContext context) {
        List<DomainModels.CandidateLink> found = new ArrayList<>();
        for (String path : PROBE_PATHS) {
            if (WorkerSupport.stopped(context)) break;
            Optional<FetchModels.FetchResult> page = support.tryFetch(context.baseUrl() + path, context.budget(), PROBE_TIMEOUT_MS);
            if (page.isEmpty() || page.get().status() != 200 || page.get().html().length() <= MIN_BODY_CHARS) continue;
            String label = path.substring(1).replace('-', ' ');
            support.ranker()
                    .scoreDirect(page.get().finalUrl(), label, DomainModels.LinkContext.UNKNOWN, context.baseUrl(), strategy())
                    .ifPresent(found::add);
        }
        return found;
    }
}
