package com.policyparser.discovery.discovery;

import com.policyparser.discovery.domain.DomainModels;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class SitemapWorker implements DiscoveryWorker {
    static final int MAX_LOCATIONS = 5000;

    private final WorkerSupport support;

    public SitemapWorker(WorkerSupport support) {
        this.support = support;
    }

    @Override
    public DomainModels.StrategyKind strategy() {
        return DomainModels.StrategyKind.SITEMAP;
    }

    @Override
    public List<DomainModels.CandidateLink> discover(DiscoveryModels.WorkerContext context) {
        return support.tryFetch(context.baseUrl() + "/sitemap.xml", context.budget(), Long.MAX_VALUE)
                .filter(page -> page.status() == 200)
                .map(page -> fromSitemap(page.html(), context))
                .orElse(List.of());
    }

    List<DomainModels.CandidateLink> fromSitemap(String xml, DiscoveryModels.WorkerContext context) {
        List<DomainModels.CandidateLink> found = new ArrayList<>();
        int seen = 0;
        for (Element loc : Jsoup.parse(xml, "", Parser.xmlParser()).select("url > loc")) {
            if (++seen > MAX_LOCATIONS || WorkerSupport.stopped(context)) break;
            String url = loc.text().trim();
            if (url.isEmpty()) continue;
            support.ranker()
                    .scoreDirect(url, "", DomainModels.LinkContext.UNKNOWN, context.baseUrl(), strategy())
                    .filter(c -> c.heuristicScore() > 5)
                    .ifPresent(found::add);
        }
        return found;
    }
}
