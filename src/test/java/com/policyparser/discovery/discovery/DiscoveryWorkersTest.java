package com.policyparser.discovery.discovery;

import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.fetch.FetchException;
import com.policyparser.discovery.fetch.FetchModels;
import com.policyparser.discovery.fetch.PageFetcher;
import com.policyparser.discovery.search.PolicySearchService;
import com.policyparser.discovery.search.SearchModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

@SpringBootTest
class DiscoveryWorkersTest {
    private static final String BASE = "https://acme.test";

    @MockBean
    private PageFetcher fetcher;
    @MockBean
    private PolicySearchService searchService;
    @Autowired
    private DirectProbeWorker directProbeWorker;
    @Autowired
    private HomepageCrawlWorker homepageCrawlWorker;
    @Autowired
    private SitemapWorker sitemapWorker;
    @Autowired
    private SearchEngineWorker searchEngineWorker;

    private DiscoveryModels.WorkerContext context;

    @BeforeEach
    void setUp() {
        context = new DiscoveryModels.WorkerContext("acme.test", BASE, new TimeBudget(5000));
        when(fetcher.defaultOptions()).thenReturn(FetchModels.FetchOptions.of(1000, 2000));
        when(fetcher.fetch(anyString(), any())).thenAnswer(inv -> {
            throw FetchException.httpStatus(inv.getArgument(0), 404);
        });
    }

    private void serve(String url, String html) {
        doReturn(new FetchModels.FetchResult(200, url, html, 1, FetchModels.FetchMode.LIGHTWEIGHT))
                .when(fetcher).fetch(eq(url), any());
    }

    @Test
    void directProbeKeepsOnlySubstantialPages() {
        serve(BASE + "/privacy", "<html><body>" + "x".repeat(3000) + "</body></html>");
        serve(BASE + "/terms", "<html><body>tiny</body></html>");

        var found = directProbeWorker.discover(context);

        assertEquals(List.of(BASE + "/privacy"), found.stream().map(DomainModels.CandidateLink::url).toList());
        assertEquals(DomainModels.StrategyKind.DIRECT_PROBE, found.get(0).strategy());
    }

    @Test
    void homepageCrawlRanksFooterPolicyLinksFirst() {
        serve(BASE, """
                <html><body>
                <main><a href="/blog">Blog</a><a href="/login">Log in</a></main>
                <footer><a href="/legal/terms">Terms of Use</a><a href="/en/privacy">Privacy Policy</a></footer>
                </body></html>
                """);

        var found = homepageCrawlWorker.discover(context);

        assertEquals(List.of(BASE + "/en/privacy", BASE + "/legal/terms", BASE + "/blog"),
                found.stream().map(DomainModels.CandidateLink::url).toList());
    }

    @Test
    void unreachableHomepageYieldsNothing() {
        assertTrue(homepageCrawlWorker.discover(context).isEmpty());
    }

    @Test
    void sitemapKeepsPolicyLikeLocations() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <url><loc>https://acme.test/privacy-policy</loc></url>
                  <url><loc>https://acme.test/blog/launch</loc></url>
                  <url><loc>https://acme.test/terms</loc></url>
                  <url><loc>https://acme.test/login</loc></url>
                </urlset>
                """;

        var found = sitemapWorker.fromSitemap(xml, context);

        assertEquals(List.of(BASE + "/privacy-policy", BASE + "/terms"),
                found.stream().map(DomainModels.CandidateLink::url).toList());
    }

    @Test
    void searchWorkerAsksOncePerTargetType() {
        when(searchService.findPolicyPages(eq("acme.test"), eq("privacy policy"), anyLong()))
                .thenReturn(List.of(new SearchModels.SearchHit(BASE + "/privacy", "Acme Privacy Policy", "stub")));
        when(searchService.findPolicyPages(eq("acme.test"), eq("terms of service"), anyLong()))
                .thenReturn(List.of(new SearchModels.SearchHit(BASE + "/terms", "Acme Terms of Service", "stub")));

        var found = searchEngineWorker.discover(context);

        assertEquals(2, found.size());
        assertTrue(found.stream().allMatch(c -> c.strategy() == DomainModels.StrategyKind.SEARCH_ENGINE));
    }
}
