package com.policyparser.discovery.discovery;

import com.policyparser.discovery.config.OrchestratorProperties;
import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.fetch.FetchException;
import com.policyparser.discovery.fetch.FetchModels;
import com.policyparser.discovery.fetch.PageFetcher;
import com.policyparser.discovery.parser.PageTextExtractor;
import com.policyparser.discovery.scoring.CandidateRanker;
import com.policyparser.discovery.validation.ContentValidator;
import com.policyparser.discovery.validation.DocumentClassifier;
import com.policyparser.discovery.validation.ValidationModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the discovery strategies for one domain in parallel, merges their candidates and verifies
 * the best of them within a wall-clock budget.
 *
 * <p>Phases: DISPATCHING starts one task per strategy on a pool owned by the call, COLLECTING
 * waits for each task up to its own timeout, VERIFYING fetches and classifies candidates in
 * ranked order on the calling thread, DONE closes the session. A failing or slow strategy is
 * recorded in its {@link DiscoveryModels.WorkerReport} and never fails the session.
 */
@Service
public class DiscoveryOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryOrchestrator.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final Map<DomainModels.StrategyKind, DiscoveryWorker> workers;
    private final PageFetcher fetcher;
    private final PageTextExtractor textExtractor;
    private final ContentValidator validator;
    private final DocumentClassifier classifier;
    private final CandidateRanker ranker;
    private final OrchestratorProperties properties;

    public DiscoveryOrchestrator(List<DiscoveryWorker> workers,
                                 PageFetcher fetcher,
                                 PageTextExtractor textExtractor,
                                 ContentValidator validator,
                                 DocumentClassifier classifier,
                                 CandidateRanker ranker,
                                 OrchestratorProperties properties) {
        this.workers = new EnumMap<>(DomainModels.StrategyKind.class);
        workers.forEach(w -> this.workers.put(w.strategy(), w));
        this.fetcher = fetcher;
        this.textExtractor = textExtractor;
        this.validator = validator;
        this.classifier = classifier;
        this.ranker = ranker;
        this.properties = properties;
    }

    public DiscoveryModels.DiscoveryOutcome discover(String domain) {
        return discover(domain, properties.sessionBudgetMs(), DiscoveryModels.ProgressListener.NONE);
    }

    public DiscoveryModels.DiscoveryOutcome discover(String rawDomain, long budgetMs, DiscoveryModels.ProgressListener listener) {
        String domain = DomainModels.normalizeDomain(rawDomain);
        if (domain.isEmpty()) throw new IllegalArgumentException("domain is required");

        TimeBudget budget = new TimeBudget(budgetMs);
        DiscoverySession session = new DiscoverySession(domain, budget, listener);
        if (budget.exhausted()) {
            session.enter(DiscoveryModels.Phase.DONE, "no time budget");
            return failure(domain, session, 0, List.of(), List.of(), "session budget exhausted before dispatch");
        }

        String previousDomain = MDC.get("domain");
        MDC.put("domain", domain);
        try {
            String baseUrl = "https://" + domain;
            List<DomainModels.CandidateLink> collected = collect(domain, baseUrl, session);
            List<DomainModels.CandidateLink> ranked = merge(collected, domain, baseUrl);
            log.debug("{} unique candidates after merge", ranked.size());

            session.enter(DiscoveryModels.Phase.VERIFYING, ranked.size() + " candidates to verify");
            List<DiscoveryModels.VerificationRecord> records = new ArrayList<>();
            List<DomainModels.LabeledExample> labels = new ArrayList<>();
            List<DomainModels.PolicyDocument> documents = verify(ranked, budget, records, labels);

            if (documents.isEmpty()) {
                String reason = budget.exhausted() && records.size() < ranked.size()
                        ? "session budget exhausted before a candidate verified"
                        : "no candidate survived verification";
                session.enter(DiscoveryModels.Phase.DONE, "failed: " + reason);
                return failure(domain, session, ranked.size(), records, labels, reason);
            }
            session.enter(DiscoveryModels.Phase.DONE, "found " + documents.size() + " document(s)");
            return new DiscoveryModels.DiscoveryOutcome(domain, true, documents, ranked.size(), records,
                    session.reports(), session.events(), labels, null, budget.elapsedMs(), false);
        } finally {
            if (previousDomain == null) MDC.remove("domain");
            else MDC.put("domain", previousDomain);
        }
    }

    private List<DomainModels.CandidateLink> collect(String domain, String baseUrl, DiscoverySession session) {
        List<DiscoveryWorker> active = properties.strategies().stream()
                .distinct()
                .map(workers::get)
                .filter(Objects::nonNull)
                .toList();
        session.enter(DiscoveryModels.Phase.DISPATCHING, "starting " + active.size() + " strategies");
        if (active.isEmpty()) {
            session.enter(DiscoveryModels.Phase.COLLECTING, "no strategies configured");
            return List.of();
        }

        TimeBudget budget = session.budget();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(properties.maxWorkers(), active.size()), r -> {
            Thread t = new Thread(r, "discovery-worker-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        List<DomainModels.CandidateLink> collected = new ArrayList<>();
        try {
            DiscoveryModels.WorkerContext context = new DiscoveryModels.WorkerContext(domain, baseUrl, budget);
            List<Dispatched> dispatched = new ArrayList<>();
            for (DiscoveryWorker worker : active) {
                long submittedAt = System.currentTimeMillis();
                long deadline = Math.min(submittedAt + properties.workerTimeoutMs(), budget.deadlineMs());
                AtomicLong finishedAt = new AtomicLong();
                Future<List<DomainModels.CandidateLink>> future = pool.submit(MdcTasks.wrap(() -> {
                    List<DomainModels.CandidateLink> found = worker.discover(context);
                    finishedAt.set(System.currentTimeMillis());
                    return found;
                }));
                dispatched.add(new Dispatched(worker.strategy(), future, submittedAt, deadline, finishedAt));
            }

            session.enter(DiscoveryModels.Phase.COLLECTING, "waiting for " + dispatched.size() + " strategies");
            for (Dispatched d : dispatched) {
                long timeoutMs = d.deadlineMs() - d.submittedAtMs();
                try {
                    long wait = d.deadlineMs() - System.currentTimeMillis();
                    if (wait <= 0 && !d.future().isDone()) throw new TimeoutException();
                    List<DomainModels.CandidateLink> result = d.future().get(Math.max(wait, 0), TimeUnit.MILLISECONDS);
                    // done before we looked, but after its own deadline
                    if (d.finishedAtMs().get() > d.deadlineMs()) throw new TimeoutException();
                    collected.addAll(result);
                    session.report(new DiscoveryModels.WorkerReport(d.strategy(), DiscoveryModels.WorkerStatus.OK,
                            result.size(), d.finishedAtMs().get() - d.submittedAtMs(), null));
                } catch (TimeoutException e) {
                    d.future().cancel(true);
                    session.report(new DiscoveryModels.WorkerReport(d.strategy(), DiscoveryModels.WorkerStatus.TIMED_OUT,
                            0, d.sinceSubmitMs(), "no result within " + timeoutMs + " ms"));
                    log.warn("Strategy {} timed out", d.strategy());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    session.report(new DiscoveryModels.WorkerReport(d.strategy(), DiscoveryModels.WorkerStatus.FAILED,
                            0, d.sinceSubmitMs(), cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                    log.warn("Strategy {} failed: {}", d.strategy(), cause.toString());
                } catch (CancellationException e) {
                    session.report(new DiscoveryModels.WorkerReport(d.strategy(), DiscoveryModels.WorkerStatus.CANCELLED,
                            0, d.sinceSubmitMs(), "cancelled"));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    dispatched.forEach(x -> x.future().cancel(true));
                    session.report(new DiscoveryModels.WorkerReport(d.strategy(), DiscoveryModels.WorkerStatus.CANCELLED,
                            0, d.sinceSubmitMs(), "session interrupted"));
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return collected;
    }

    private record Dispatched(DomainModels.StrategyKind strategy,
                              Future<List<DomainModels.CandidateLink>> future,
                              long submittedAtMs,
                              long deadlineMs,
                              AtomicLong finishedAtMs) {
        long sinceSubmitMs() {
            return System.currentTimeMillis() - submittedAtMs;
        }
    }

    private List<DomainModels.CandidateLink> merge(List<DomainModels.CandidateLink> collected, String domain, String baseUrl) {
        Map<String, DomainModels.CandidateLink> unique = new LinkedHashMap<>();
        for (String known : properties.knownPoliciesFor(domain)) {
            ranker.scoreDirect(known, "", DomainModels.LinkContext.UNKNOWN, baseUrl, DomainModels.StrategyKind.KNOWN_POLICY)
                    .ifPresent(c -> unique.put(DomainModels.normalizeUrl(c.url()), c));
        }
        for (DomainModels.CandidateLink c : collected) {
            unique.merge(DomainModels.normalizeUrl(c.url()), c,
                    (a, b) -> a.strategy() == DomainModels.StrategyKind.KNOWN_POLICY || ranker.combinedScore(a) >= ranker.combinedScore(b) ? a : b);
        }
        List<DomainModels.CandidateLink> ranked = new ArrayList<>(unique.values());
        ranked.sort(Comparator.comparing((DomainModels.CandidateLink c) -> c.strategy() != DomainModels.StrategyKind.KNOWN_POLICY)
                .thenComparing(ranker.order()));
        return ranked;
    }

    private List<DomainModels.PolicyDocument> verify(List<DomainModels.CandidateLink> ranked,
                                                     TimeBudget budget,
                                                     List<DiscoveryModels.VerificationRecord> records,
                                                     List<DomainModels.LabeledExample> labels) {
        Set<DomainModels.DocumentType> wanted = EnumSet.copyOf(properties.targetTypes());
        Map<DomainModels.DocumentType, DomainModels.PolicyDocument> found = new EnumMap<>(DomainModels.DocumentType.class);

        for (DomainModels.CandidateLink candidate : ranked) {
            if (found.keySet().containsAll(wanted) || records.size() >= properties.maxVerifications()) break;
            if (budget.exhausted() || Thread.currentThread().isInterrupted()) break;

            FetchModels.FetchResult page;
            try {
                page = fetcher.fetch(candidate.url(), fetcher.defaultOptions().capTo(budget.remainingMs()));
            } catch (FetchException e) {
                records.add(new DiscoveryModels.VerificationRecord(candidate.url(), candidate.strategy(), false,
                        "fetch " + e.kind() + (e.statusCode() > 0 ? " " + e.statusCode() : ""), null, 0));
                continue;
            }

            PageTextExtractor.PageContent content = textExtractor.extract(page.html(), page.finalUrl());
            ValidationModels.ValidationResult validation = validator.check(page.html(), content.text());
            if (!validation.valid()) {
                records.add(new DiscoveryModels.VerificationRecord(candidate.url(), candidate.strategy(), false,
                        validation.reason().name(), null, 0));
                labels.add(new DomainModels.LabeledExample(candidate.url(), candidate.features(), 0));
                continue;
            }

            ValidationModels.ClassificationResult classification = classifier.classify(content.text(), budget.remainingMs());
            if (!classification.policy()) {
                records.add(new DiscoveryModels.VerificationRecord(candidate.url(), candidate.strategy(), false,
                        ValidationModels.RejectionReason.NOT_A_POLICY.name(), classification.type(), classification.confidence()));
                labels.add(new DomainModels.LabeledExample(candidate.url(), candidate.features(), 0));
                continue;
            }

            records.add(new DiscoveryModels.VerificationRecord(candidate.url(), candidate.strategy(), true, null,
                    classification.type(), classification.confidence()));
            labels.add(new DomainModels.LabeledExample(candidate.url(), candidate.features(), 1));
            DomainModels.PolicyDocument doc = new DomainModels.PolicyDocument(page.finalUrl(), content.title(), content.text(),
                    classification.type(), classification.confidence(), candidate.strategy());
            found.merge(classification.type(), doc, (a, b) -> b.confidence() > a.confidence() ? b : a);
        }
        return new ArrayList<>(found.values());
    }

    private DiscoveryModels.DiscoveryOutcome failure(String domain,
                                                     DiscoverySession session,
                                                     int candidates,
                                                     List<DiscoveryModels.VerificationRecord> records,
                                                     List<DomainModels.LabeledExample> labels,
                                                     String reason) {
        return new DiscoveryModels.DiscoveryOutcome(domain, false, List.of(), candidates, records,
                session.reports(), session.events(), labels, reason, session.budget().elapsedMs(), false);
    }
}
