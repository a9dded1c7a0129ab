package com.policyparser.discovery;

import com.policyparser.discovery.config.OrchestratorProperties;
import com.policyparser.discovery.discovery.DiscoveryModels;
import com.policyparser.discovery.discovery.DiscoveryOrchestrator;
import com.policyparser.discovery.discovery.DiscoveryWorker;
import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.fetch.FetchException;
import com.policyparser.discovery.fetch.FetchModels;
import com.policyparser.discovery.fetch.PageFetcher;
import com.policyparser.discovery.parser.PageTextExtractor;
import com.policyparser.discovery.scoring.CandidateRanker;
import com.policyparser.discovery.validation.ContentValidator;
import com.policyparser.discovery.validation.DocumentClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.*;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@SpringBootTest
class DiscoveryOrchestratorTest {
    private static final String BASE = "https://acme.test";

    @MockBean
    private PageFetcher fetcher;
    @Autowired
    private PageTextExtractor textExtractor;
    @Autowired
    private ContentValidator validator;
    @Autowired
    private DocumentClassifier classifier;
    @Autowired
    private CandidateRanker ranker;

    private record StubWorker(DomainModels.StrategyKind strategy,
                              Function<DiscoveryModels.WorkerContext, List<DomainModels.CandidateLink>> body)
            implements DiscoveryWorker {
        @Override
        public List<DomainModels.CandidateLink> discover(DiscoveryModels.WorkerContext context) {
            return body.apply(context);
        }
    }

    @BeforeEach
    void defaultFetchOptions() {
        when(fetcher.defaultOptions()).thenReturn(FetchModels.FetchOptions.of(1000, 2000));
    }

    private DiscoveryOrchestrator orchestrator(long workerTimeoutMs, List<DomainModels.DocumentType> targets,
                                               Map<String, List<String>> known, StubWorker... workers) {
        List<DomainModels.StrategyKind> strategies = Arrays.stream(workers).map(StubWorker::strategy).toList();
        var properties = new OrchestratorProperties(5000, workerTimeoutMs, 4, 8, 30, strategies, targets, known);
        return new DiscoveryOrchestrator(List.of(workers), fetcher, textExtractor, validator, classifier, ranker, properties);
    }

    private DomainModels.CandidateLink candidate(String url, String text, DomainModels.StrategyKind strategy) {
        return candidate(url, text, DomainModels.LinkContext.FOOTER, strategy);
    }

    private DomainModels.CandidateLink candidate(String url, String text, DomainModels.LinkContext context,
                                                 DomainModels.StrategyKind strategy) {
        return ranker.scoreDirect(url, text, context, BASE, strategy).orElseThrow();
    }

    private void serve(String url, String html) {
        when(fetcher.fetch(eq(url), any())).thenReturn(new FetchModels.FetchResult(200, url, html, 1, FetchModels.FetchMode.LIGHTWEIGHT));
    }

    @Test
    void zeroBudgetFailsBeforeDispatch() {
        var events = new ArrayList<DiscoveryModels.PhaseEvent>();
        var orchestrator = orchestrator(1000, List.of(DomainModels.DocumentType.PRIVACY), Map.of(),
                new StubWorker(DomainModels.StrategyKind.DIRECT_PROBE, ctx -> fail("worker must not run")));

        var outcome = orchestrator.discover("acme.test", 0, events::add);

        assertFalse(outcome.success());
        assertTrue(outcome.error().contains("exhausted"));
        assertTrue(outcome.documents().isEmpty());
        assertEquals(DiscoveryModels.Phase.DONE, events.get(events.size() - 1).phase());
        verify(fetcher, never()).fetch(anyString(), any());
    }

    @Test
    void blankDomainIsRejected() {
        var orchestrator = orchestrator(1000, List.of(DomainModels.DocumentType.PRIVACY), Map.of(),
                new StubWorker(DomainModels.StrategyKind.DIRECT_PROBE, ctx -> List.of()));

        assertThrows(IllegalArgumentException.class, () -> orchestrator.discover("  ", 1000, DiscoveryModels.ProgressListener.NONE));
    }

    @Test
    void duplicateCandidatesAreVerifiedOnce() {
        serve(BASE + "/privacy", PolicyTexts.page("Privacy Policy", PolicyTexts.FULL_PRIVACY_POLICY));
        serve(BASE + "/privacy/", PolicyTexts.page("Privacy Policy", PolicyTexts.FULL_PRIVACY_POLICY));
        var events = new ArrayList<DiscoveryModels.PhaseEvent>();
        var orchestrator = orchestrator(2000, List.of(DomainModels.DocumentType.PRIVACY), Map.of(),
                new StubWorker(DomainModels.StrategyKind.DIRECT_PROBE,
                        ctx -> List.of(candidate(BASE + "/privacy", "Privacy Policy", DomainModels.StrategyKind.DIRECT_PROBE))),
                new StubWorker(DomainModels.StrategyKind.HOMEPAGE_CRAWL,
                        ctx -> List.of(candidate(BASE + "/privacy/", "privacy", DomainModels.StrategyKind.HOMEPAGE_CRAWL))));

        var outcome = orchestrator.discover("https://www.Acme.test/", 5000, events::add);

        assertTrue(outcome.success());
        assertEquals("acme.test", outcome.domain());
        assertEquals(1, outcome.candidatesConsidered());
        assertEquals(1, outcome.documents().size());
        var doc = outcome.documents().get(0);
        assertEquals(DomainModels.DocumentType.PRIVACY, doc.type());
        assertEquals("Privacy Policy", doc.title());
        assertTrue(doc.confidence() >= DocumentClassifier.POLICY_THRESHOLD);
        assertEquals(1, outcome.labels().size());
        assertEquals(1, outcome.labels().get(0).target());
        verify(fetcher, times(1)).fetch(anyString(), any());

        assertEquals(List.of(DiscoveryModels.Phase.DISPATCHING, DiscoveryModels.Phase.COLLECTING,
                        DiscoveryModels.Phase.VERIFYING, DiscoveryModels.Phase.DONE),
                events.stream().map(DiscoveryModels.PhaseEvent::phase).toList());
    }

    @Test
    void failingAndSlowStrategiesDoNotSinkTheSession() {
        serve(BASE + "/legal/privacy", PolicyTexts.page("Privacy", PolicyTexts.FULL_PRIVACY_POLICY));
        var orchestrator = orchestrator(300, List.of(DomainModels.DocumentType.PRIVACY), Map.of(),
                new StubWorker(DomainModels.StrategyKind.SEARCH_ENGINE, ctx -> {
                    throw new IllegalStateException("search provider down");
                }),
                new StubWorker(DomainModels.StrategyKind.SITEMAP, ctx -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return List.of();
                }),
                new StubWorker(DomainModels.StrategyKind.LEGAL_HUB_CRAWL,
                        ctx -> List.of(candidate(BASE + "/legal/privacy", "Privacy", DomainModels.StrategyKind.LEGAL_HUB_CRAWL))));
        long started = System.currentTimeMillis();

        var outcome = orchestrator.discover("acme.test", 5000, DiscoveryModels.ProgressListener.NONE);

        assertTrue(System.currentTimeMillis() - started < 5000);
        assertTrue(outcome.success());
        Map<DomainModels.StrategyKind, DiscoveryModels.WorkerStatus> statuses = new EnumMap<>(DomainModels.StrategyKind.class);
        outcome.workerReports().forEach(r -> statuses.put(r.strategy(), r.status()));
        assertEquals(DiscoveryModels.WorkerStatus.FAILED, statuses.get(DomainModels.StrategyKind.SEARCH_ENGINE));
        assertEquals(DiscoveryModels.WorkerStatus.TIMED_OUT, statuses.get(DomainModels.StrategyKind.SITEMAP));
        assertEquals(DiscoveryModels.WorkerStatus.OK, statuses.get(DomainModels.StrategyKind.LEGAL_HUB_CRAWL));
    }

    private static StubWorker sleeper(DomainModels.StrategyKind strategy, long sleepMs, List<DomainModels.CandidateLink> result) {
        return new StubWorker(strategy, ctx -> {
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
            return result;
        });
    }

    @Test
    void workerTimeoutsRunFromDispatchNotFromWhenTheyAreCollected() {
        serve(BASE + "/legal/privacy", PolicyTexts.page("Privacy", PolicyTexts.FULL_PRIVACY_POLICY));
        var late = candidate(BASE + "/privacy-notice", "Privacy notice", DomainModels.StrategyKind.SITEMAP);
        var orchestrator = orchestrator(400, List.of(DomainModels.DocumentType.PRIVACY), Map.of(),
                sleeper(DomainModels.StrategyKind.DIRECT_PROBE, 3000, List.of()),
                sleeper(DomainModels.StrategyKind.SITEMAP, 700, List.of(late)),
                new StubWorker(DomainModels.StrategyKind.LEGAL_HUB_CRAWL,
                        ctx -> List.of(candidate(BASE + "/legal/privacy", "Privacy", DomainModels.StrategyKind.LEGAL_HUB_CRAWL))));
        long started = System.currentTimeMillis();

        var outcome = orchestrator.discover("acme.test", 5000, DiscoveryModels.ProgressListener.NONE);

        assertTrue(System.currentTimeMillis() - started < 2000);
        assertTrue(outcome.success());
        Map<DomainModels.StrategyKind, DiscoveryModels.WorkerReport> reports = new EnumMap<>(DomainModels.StrategyKind.class);
        outcome.workerReports().forEach(r -> reports.put(r.strategy(), r));
        assertEquals(DiscoveryModels.WorkerStatus.TIMED_OUT, reports.get(DomainModels.StrategyKind.DIRECT_PROBE).status());
        assertEquals(DiscoveryModels.WorkerStatus.TIMED_OUT, reports.get(DomainModels.StrategyKind.SITEMAP).status());
        assertTrue(reports.get(DomainModels.StrategyKind.SITEMAP).elapsedMs() >= 400);
        assertTrue(reports.get(DomainModels.StrategyKind.SITEMAP).elapsedMs() < 700);
        assertEquals(DiscoveryModels.WorkerStatus.OK, reports.get(DomainModels.StrategyKind.LEGAL_HUB_CRAWL).status());
        verify(fetcher, never()).fetch(eq(BASE + "/privacy-notice"), any());
    }

    @Test
    void rejectedCandidatesAreLabelledNegativeAndNextOneIsTried() {
        when(fetcher.fetch(eq(BASE + "/en/privacy"), any())).thenThrow(FetchException.httpStatus(BASE + "/en/privacy", 404));
        serve(BASE + "/cookies", PolicyTexts.page("Recipes", PolicyTexts.RECIPE));
        serve(BASE + "/data-protection", PolicyTexts.page("Data protection", PolicyTexts.FULL_PRIVACY_POLICY));
        var orchestrator = orchestrator(2000, List.of(DomainModels.DocumentType.PRIVACY), Map.of(),
                new StubWorker(DomainModels.StrategyKind.HOMEPAGE_CRAWL, ctx -> List.of(
                        candidate(BASE + "/data-protection", "Data protection", DomainModels.LinkContext.BODY,
                                DomainModels.StrategyKind.HOMEPAGE_CRAWL),
                        candidate(BASE + "/cookies", "Cookies", DomainModels.StrategyKind.HOMEPAGE_CRAWL),
                        candidate(BASE + "/en/privacy", "Privacy Policy", DomainModels.StrategyKind.HOMEPAGE_CRAWL))));

        var outcome = orchestrator.discover("acme.test", 5000, DiscoveryModels.ProgressListener.NONE);

        assertTrue(outcome.success());
        assertEquals(BASE + "/data-protection", outcome.documents().get(0).url());
        assertEquals(3, outcome.verifications().size());
        var rejected = outcome.verifications().stream().filter(v -> !v.accepted()).toList();
        assertEquals(2, rejected.size());
        assertTrue(rejected.stream().anyMatch(v -> v.rejection().startsWith("fetch HTTP_STATUS")));
        // fetch failures carry no label, rejected content does
        assertEquals(List.of(0, 1), outcome.labels().stream().map(DomainModels.LabeledExample::target).sorted().toList());
    }

    @Test
    void knownPoliciesAreVerifiedFirst() {
        serve("https://policies.acme.test/privacy", PolicyTexts.page("Privacy", PolicyTexts.FULL_PRIVACY_POLICY));
        var orchestrator = orchestrator(2000, List.of(DomainModels.DocumentType.PRIVACY),
                Map.of("acme.test", List.of("https://policies.acme.test/privacy")),
                new StubWorker(DomainModels.StrategyKind.DIRECT_PROBE,
                        ctx -> List.of(candidate(BASE + "/privacy", "Privacy Policy", DomainModels.StrategyKind.DIRECT_PROBE))));

        var outcome = orchestrator.discover("acme.test", 5000, DiscoveryModels.ProgressListener.NONE);

        assertTrue(outcome.success());
        assertEquals(DomainModels.StrategyKind.KNOWN_POLICY, outcome.documents().get(0).source());
        verify(fetcher, never()).fetch(eq(BASE + "/privacy"), any());
    }
}
