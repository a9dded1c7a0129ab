package com.policyparser.discovery.api;

import com.policyparser.discovery.domain.DomainModels;
import com.policyparser.discovery.scoring.FeatureExtractor;
import com.policyparser.discovery.scoring.ScoringModel;
import com.policyparser.discovery.scoring.ScoringModelService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/model")
public class ModelController {
    private final ScoringModelService modelService;
    private final FeatureExtractor featureExtractor;

    public ModelController(ScoringModelService modelService, FeatureExtractor featureExtractor) {
        this.modelService = modelService;
        this.featureExtractor = featureExtractor;
    }

    public record LinkFeedback(String url, String anchorText, DomainModels.LinkContext context, String pageUrl,
                               boolean policy) {
    }

    public record FeedbackResponse(long generation, double scoreBefore, double scoreAfter) {
    }

    @GetMapping
    public ResponseEntity<ScoringModelService.ModelInfo> info() {
        return ResponseEntity.ok(modelService.info());
    }

    @PostMapping("/feedback")
    public ResponseEntity<FeedbackResponse> feedback(@RequestBody LinkFeedback feedback) {
        if (feedback == null || feedback.url() == null || feedback.url().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        String pageUrl = feedback.pageUrl() == null ? feedback.url() : feedback.pageUrl();
        double[] features = featureExtractor.extractFeatures(feedback.anchorText(), feedback.url(), feedback.context(), pageUrl);
        double before = modelService.predict(features);
        ScoringModel trained = modelService.train(features, feedback.policy() ? 1 : 0, null, feedback.url());
        return ResponseEntity.ok(new FeedbackResponse(trained.generation(), before, modelService.predict(features)));
    }
}
