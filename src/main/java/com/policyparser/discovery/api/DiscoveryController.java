package com.policyparser.discovery.api;

import com.policyparser.discovery.discovery.DiscoveryModels;
import com.policyparser.discovery.discovery.DiscoveryService;
import com.policyparser.discovery.validation.ContentValidator;
import com.policyparser.discovery.validation.DocumentClassifier;
import com.policyparser.discovery.validation.ValidationModels;
import com.policyparser.discovery.config.StreamProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

@RestController
@RequestMapping("/api")
public class DiscoveryController {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryController.class);
    private static final long STREAM_TIMEOUT_PADDING_MS = 5000;

    private final DiscoveryService discoveryService;
    private final ContentValidator validator;
    private final DocumentClassifier classifier;
    private final TaskExecutor streamExecutor;
    private final StreamProperties streamProperties;

    public DiscoveryController(DiscoveryService discoveryService,
                               ContentValidator validator,
                               DocumentClassifier classifier,
                               @Qualifier("discoveryStreamExecutor") TaskExecutor streamExecutor,
                               StreamProperties streamProperties) {
        this.discoveryService = discoveryService;
        this.validator = validator;
        this.classifier = classifier;
        this.streamExecutor = streamExecutor;
        this.streamProperties = streamProperties;
    }

    @PostMapping("/discovery")
    public ResponseEntity<DiscoveryModels.DiscoveryOutcome> discover(@RequestBody DiscoveryModels.DiscoveryRequest request) {
        return ResponseEntity.ok(discoveryService.discover(request, DiscoveryModels.ProgressListener.NONE));
    }

    /**
     * Streams phase events as {@code progress} and the final outcome as {@code result}. Fails with
     * a {@link org.springframework.core.task.TaskRejectedException} when the stream pool is saturated.
     */
    @GetMapping("/discovery/stream")
    public SseEmitter stream(@RequestParam String domain,
                             @RequestParam(required = false) Long budgetMs,
                             @RequestParam(defaultValue = "false") boolean forceRefresh) {
        DiscoveryModels.DiscoveryRequest request = new DiscoveryModels.DiscoveryRequest(domain, budgetMs, forceRefresh);
        long timeout = (budgetMs == null ? streamProperties.defaultTimeoutMs() : budgetMs) + STREAM_TIMEOUT_PADDING_MS;
        SseEmitter emitter = new SseEmitter(timeout);
        streamExecutor.execute(() -> {
            try {
                DiscoveryModels.DiscoveryOutcome outcome = discoveryService.discover(request, event -> send(emitter, "progress", event));
                send(emitter, "result", outcome);
                emitter.complete();
            } catch (RuntimeException e) {
                log.warn("Streaming discovery for {} failed: {}", domain, e.getMessage());
                emitter.completeWithError(e);
            }
        });
        return emitter;
    }

    @PostMapping("/classify")
    public ResponseEntity<ClassifyResponse> classify(@RequestBody ValidationModels.ClassifyRequest request) {
        String text = request == null || request.text() == null ? "" : request.text();
        return ResponseEntity.ok(new ClassifyResponse(
                validator.isGarbage(text),
                validator.validate(text),
                classifier.classify(text, 10000)));
    }

    public record ClassifyResponse(boolean garbage,
                                   ValidationModels.ValidationResult validation,
                                   ValidationModels.ClassificationResult classification) {
    }

    private static void send(SseEmitter emitter, String name, Object data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException e) {
            throw new IllegalStateException("client disconnected", e);
        }
    }
}
