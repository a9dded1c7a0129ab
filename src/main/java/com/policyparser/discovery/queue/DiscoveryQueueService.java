package com.policyparser.discovery.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyparser.discovery.config.QueueProperties;
import com.policyparser.discovery.discovery.DiscoveryModels;
import com.policyparser.discovery.discovery.DiscoveryService;
import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.repository.QueueJdbcRepository;
import com.policyparser.discovery.scoring.ScoringModelService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Durable FIFO of domains to discover. Items move pending -> processing -> completed|failed through
 * conditional updates, so concurrent processors never claim the same row.
 */
@Service
public class DiscoveryQueueService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryQueueService.class);
    private static final int MAX_CLAIM_ATTEMPTS = 10;
    private static final long RETRY_BACKOFF_MS = 50;

    private final QueueJdbcRepository repository;
    private final DiscoveryService discoveryService;
    private final ScoringModelService modelService;
    private final QueueProperties properties;
    private final ObjectMapper objectMapper;

    public DiscoveryQueueService(QueueJdbcRepository repository,
                                 DiscoveryService discoveryService,
                                 ScoringModelService modelService,
                                 QueueProperties properties,
                                 ObjectMapper objectMapper) {
        this.repository = repository;
        this.discoveryService = discoveryService;
        this.modelService = modelService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public QueueModels.AddDomainsResponse addDomains(List<String> domains) {
        if (domains == null) return new QueueModels.AddDomainsResponse(0, 0);
        Set<String> unique = new LinkedHashSet<>();
        for (String d : domains) {
            String normalized = DomainModels.normalizeDomain(d);
            if (!normalized.isEmpty()) unique.add(normalized);
        }
        int added = 0;
        for (String domain : unique) {
            try {
                repository.insertPending(domain);
                added++;
            } catch (DuplicateKeyException e) {
                log.debug("{} already queued", domain);
            }
        }
        log.info("Queued {} new domain(s), skipped {}", added, domains.size() - added);
        return new QueueModels.AddDomainsResponse(added, domains.size() - added);
    }

    public QueueModels.ProcessOutcome processNext() {
        Claim claim = claim();
        if (claim.domain() == null) {
            return claim.contended() ? QueueModels.ProcessOutcome.contended() : QueueModels.ProcessOutcome.empty();
        }
        String domain = claim.domain();

        MDC.put("domain", domain);
        try {
            DiscoveryModels.DiscoveryOutcome outcome;
            try {
                outcome = discoveryService.discover(new DiscoveryModels.DiscoveryRequest(domain, null, false),
                        DiscoveryModels.ProgressListener.NONE);
            } catch (RuntimeException e) {
                log.error("Discovery crashed for {}", domain, e);
                finish(domain, DomainModels.JobStatus.FAILED, null, "discovery error: " + e.getMessage());
                return new QueueModels.ProcessOutcome(QueueModels.ProcessKind.FAILED, domain, List.of(), e.getMessage(), 0);
            }

            int trained = properties.trainOnOutcome() ? train(domain, outcome.labels()) : 0;
            List<QueueModels.DocumentSummary> summaries = outcome.documents().stream()
                    .map(d -> new QueueModels.DocumentSummary(d.url(), d.title(), d.type(), d.confidence(), d.source()))
                    .toList();
            if (outcome.success()) {
                finish(domain, DomainModels.JobStatus.COMPLETED, toJson(summaries), null);
                log.info("Completed {} with {} document(s)", domain, summaries.size());
                return new QueueModels.ProcessOutcome(QueueModels.ProcessKind.COMPLETED, domain, summaries, null, trained);
            }
            finish(domain, DomainModels.JobStatus.FAILED, null, outcome.error());
            log.info("Failed {}: {}", domain, outcome.error());
            return new QueueModels.ProcessOutcome(QueueModels.ProcessKind.FAILED, domain, List.of(), outcome.error(), trained);
        } finally {
            MDC.remove("domain");
        }
    }

    public QueueModels.QueueStatus getStatus() {
        Map<DomainModels.JobStatus, Long> counts = repository.countByStatus();
        return new QueueModels.QueueStatus(
                counts.get(DomainModels.JobStatus.PENDING),
                counts.get(DomainModels.JobStatus.PROCESSING),
                counts.get(DomainModels.JobStatus.COMPLETED),
                counts.get(DomainModels.JobStatus.FAILED));
    }

    public Optional<DomainModels.DiscoveryJob> find(String domain) {
        return repository.find(DomainModels.normalizeDomain(domain));
    }

    /**
     * Drops cached documents and the finished job row so the domain can be queued again.
     */
    public QueueModels.ClearResult clearCache(String rawDomain) {
        String domain = DomainModels.normalizeDomain(rawDomain);
        if (domain.isEmpty()) throw new IllegalArgumentException("domain is required");
        int documents = discoveryService.evict(domain);
        boolean job = repository.deleteTerminal(domain) > 0;
        return new QueueModels.ClearResult(domain, documents, job);
    }

    @Scheduled(fixedDelayString = "${discovery.queue.fixed-delay-ms:5000}")
    public void scheduledProcess() {
        if (!properties.workerEnabled()) return;
        try {
            QueueModels.ProcessOutcome outcome = processNext();
            if (!outcome.queueEmpty()) log.debug("Worker processed {} -> {}", outcome.domain(), outcome.kind());
        } catch (QueuePersistenceException e) {
            log.error("Queue transition failed for {}", e.domain(), e);
        }
    }

    @Scheduled(fixedDelayString = "${discovery.queue.stale-check-ms:60000}")
    public void requeueStale() {
        Instant cutoff = Instant.now().minus(Duration.ofMillis(properties.staleAfterMs()));
        for (String domain : repository.staleProcessing(cutoff)) {
            if (repository.transition(domain, DomainModels.JobStatus.PROCESSING, DomainModels.JobStatus.PENDING,
                    null, "requeued after stale claim", false)) {
                log.warn("Requeued stale item {}", domain);
            }
        }
    }

    private record Claim(String domain, boolean contended) {
    }

    private Claim claim() {
        for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
            Optional<String> candidate = repository.oldestPending();
            if (candidate.isEmpty()) return new Claim(null, false);
            if (repository.transition(candidate.get(), DomainModels.JobStatus.PENDING, DomainModels.JobStatus.PROCESSING,
                    null, null, true)) {
                return new Claim(candidate.get(), false);
            }
        }
        // lost every race; the next call will try again
        return new Claim(null, true);
    }

    private void finish(String domain, DomainModels.JobStatus status, String result, String error) {
        DataAccessException last = null;
        for (int attempt = 1; attempt <= properties.transitionRetries(); attempt++) {
            try {
                if (repository.transition(domain, DomainModels.JobStatus.PROCESSING, status, result, error, false)) return;
                throw new QueuePersistenceException(domain, domain + " is no longer in processing state", null);
            } catch (DataAccessException e) {
                last = e;
                log.warn("Transition of {} to {} failed (attempt {}): {}", domain, status, attempt, e.getMessage());
                sleep(RETRY_BACKOFF_MS * attempt);
            }
        }
        throw new QueuePersistenceException(domain, "could not mark " + domain + " as " + status.dbValue(), last);
    }

    private int train(String domain, List<DomainModels.LabeledExample> labels) {
        int trained = 0;
        for (DomainModels.LabeledExample example : labels) {
            try {
                modelService.train(example.features(), example.target(), domain, example.url());
                trained++;
            } catch (IllegalArgumentException e) {
                log.warn("Skipping training example {}: {}", example.url(), e.getMessage());
            }
        }
        return trained;
    }

    private String toJson(List<QueueModels.DocumentSummary> summaries) {
        try {
            return objectMapper.writeValueAsString(summaries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize discovery result", e);
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
