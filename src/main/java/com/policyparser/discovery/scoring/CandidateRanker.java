package com.policyparser.discovery.scoring;

import com.policyparser.discovery.config.OrchestratorProperties;
import com.policyparser.discovery.domain.DomainModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw links into scored candidates: rule score, feature vector and network probability.
 */
@Component
public class CandidateRanker {
    private static final Logger log = LoggerFactory.getLogger(CandidateRanker.class);

    private final CandidateScorer candidateScorer;
    private final FeatureExtractor featureExtractor;
    private final ScoringModelService modelService;
    private final double neuralWeight;

    public CandidateRanker(CandidateScorer candidateScorer,
                           FeatureExtractor featureExtractor,
                           ScoringModelService modelService,
                           OrchestratorProperties properties) {
        this.candidateScorer = candidateScorer;
        this.featureExtractor = featureExtractor;
        this.modelService = modelService;
        this.neuralWeight = properties.neuralWeight();
    }

    public List<DomainModels.CandidateLink> rank(List<DomainModels.RawLink> links, String pageUrl, DomainModels.StrategyKind strategy) {
        List<DomainModels.CandidateLink> out = new ArrayList<>();
        for (DomainModels.RawLink link : links) {
            int heuristic = candidateScorer.heuristicScore(link);
            if (heuristic <= 0) continue;
            score(link.url(), link.anchorText(), link.context(), link.visible(), heuristic, pageUrl, strategy)
                    .ifPresent(out::add);
        }
        out.sort(order());
        return out;
    }

    /**
     * Scores a URL that did not come from an anchor, such as a probed path or a search hit.
     */
    public Optional<DomainModels.CandidateLink> scoreDirect(String url, String text, DomainModels.LinkContext context,
                                                                    String pageUrl, DomainModels.StrategyKind strategy) {
        int heuristic = candidateScorer.heuristicScore(url, text, context, true);
        if (heuristic <= 0) return Optional.empty();
        return score(url, text, context, true, heuristic, pageUrl, strategy);
    }

    public double combinedScore(DomainModels.CandidateLink c) {
        return c.heuristicScore() + neuralWeight * c.neuralScore();
    }

    public Comparator<DomainModels.CandidateLink> order() {
        return Comparator.<DomainModels.CandidateLink>comparingDouble(this::combinedScore).reversed()
                .thenComparing(Comparator.<DomainModels.CandidateLink>comparingDouble(DomainModels.CandidateLink::neuralScore).reversed());
    }

    private Optional<DomainModels.CandidateLink> score(String url, String text, DomainModels.LinkContext context,
                                                                 boolean visible, int heuristic, String pageUrl,
                                                                 DomainModels.StrategyKind strategy) {
        double[] features = featureExtractor.extractFeatures(text, url, context, pageUrl);
        try {
            double neural = modelService.predict(features);
            return Optional.of(new DomainModels.CandidateLink(url, text, context, heuristic, features, neural, strategy, visible));
        } catch (DimensionMismatchException e) {
            log.warn("Dropping candidate {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
