package com.policyparser.discovery.discovery;

import com.policyparser.discovery.config.OrchestratorProperties;
import com.policyparser.discovery.config.QueueProperties;
import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.repository.PolicyDocumentJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Front door for discovery: serves fresh cached documents, otherwise runs the orchestrator and
 * caches what it verified.
 */
@Service
public class DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final DiscoveryOrchestrator orchestrator;
    private final PolicyDocumentJdbcRepository documentRepository;
    private final OrchestratorProperties orchestratorProperties;
    private final Duration retention;

    public DiscoveryService(DiscoveryOrchestrator orchestrator,
                            PolicyDocumentJdbcRepository documentRepository,
                            OrchestratorProperties orchestratorProperties,
                            QueueProperties queueProperties) {
        this.orchestrator = orchestrator;
        this.documentRepository = documentRepository;
        this.orchestratorProperties = orchestratorProperties;
        this.retention = Duration.ofHours(queueProperties.cacheRetentionHours());
    }

    public DiscoveryModels.DiscoveryOutcome discover(DiscoveryModels.DiscoveryRequest request, DiscoveryModels.ProgressListener listener) {
        if (request == null || request.domain() == null || request.domain().isBlank()) {
            throw new IllegalArgumentException("domain is required");
        }
        String domain = DomainModels.normalizeDomain(request.domain());
        long budget = request.budgetMs() == null ? orchestratorProperties.sessionBudgetMs() : request.budgetMs();
        if (budget < 0) throw new IllegalArgumentException("budgetMs must be >= 0");

        if (!Boolean.TRUE.equals(request.forceRefresh())) {
            List<DomainModels.PolicyDocument> cached = freshCached(domain);
            if (!cached.isEmpty()) {
                log.info("Serving {} cached document(s) for {}", cached.size(), domain);
                return new DiscoveryModels.DiscoveryOutcome(domain, true, cached, 0, List.of(), List.of(), List.of(),
                        List.of(), null, 0, true);
            }
        }

        DiscoveryModels.DiscoveryOutcome outcome = orchestrator.discover(domain, budget, listener);
        if (outcome.success()) cache(domain, outcome.documents());
        return outcome;
    }

    public int evict(String domain) {
        return documentRepository.deleteByDomain(DomainModels.normalizeDomain(domain));
    }

    @Scheduled(fixedDelayString = "${discovery.queue.purge-fixed-delay-ms:3600000}")
    public void scheduledPurge() {
        int removed = documentRepository.deleteOlderThan(Instant.now().minus(retention));
        if (removed > 0) log.info("Purged {} expired cached document(s)", removed);
    }

    private List<DomainModels.PolicyDocument> freshCached(String domain) {
        Instant cutoff = Instant.now().minus(retention);
        try {
            return documentRepository.findByDomain(domain).stream()
                    .filter(c -> c.cachedAt().isAfter(cutoff))
                    .map(PolicyDocumentJdbcRepository.CachedDocument::document)
                    .toList();
        } catch (DataAccessException e) {
            log.warn("Document cache unavailable for {}: {}", domain, e.getMessage());
            return List.of();
        }
    }

    private void cache(String domain, List<DomainModels.PolicyDocument> documents) {
        try {
            documents.forEach(d -> documentRepository.upsert(domain, d));
        } catch (DataAccessException e) {
            log.warn("Could not cache documents for {}: {}", domain, e.getMessage());
        }
    }
}
