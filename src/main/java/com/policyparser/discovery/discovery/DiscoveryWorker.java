package com.policyparser.discovery.discovery;

import com.policyparser.discovery.domain.DomainModels;

import java.util.List;

/**
 * One discovery strategy. Runs on a pooled thread and must stop promptly when interrupted or
 * when the context budget runs out.
 */
public interface DiscoveryWorker {

    DomainModels.StrategyKind strategy();

    List<DomainModels.CandidateLink> discover(DiscoveryModels.WorkerContext context);
}
