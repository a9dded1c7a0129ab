package com.policyparser.discovery.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyparser.discovery.config.AnalysisProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks an OpenAI-compatible chat completions endpoint to label a text excerpt.
 */
@Component
public class ChatCompletionAnalysisClient implements AnalysisClient {
    private static final Logger log = LoggerFactory.getLogger(ChatCompletionAnalysisClient.class);
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*}");

    private static final String PROMPT = """
            Analyze this text excerpt and determine if it's from a privacy policy, terms of service, or other legal document.

            TEXT EXCERPT:
            %s

            Answer with a JSON object:
            {
              "isLegalDocument": true/false,
              "documentType": "privacy_policy" | "terms_of_service" | "cookie_policy" | "other_legal" | "not_legal",
              "confidence": 0.0-1.0,
              "reasoning": "brief explanation"
            }

            Only output the JSON, nothing else.""";

    private final WebClient webClient;
    private final AnalysisProperties properties;
    private final ObjectMapper objectMapper;

    public ChatCompletionAnalysisClient(@Qualifier("analysisWebClient") WebClient webClient,
                                        AnalysisProperties properties,
                                        ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Verdict> analyze(String excerpt, long timeoutMs) {
        if (!properties.enabled() || properties.endpoint() == null || properties.endpoint().isBlank() || timeoutMs <= 0) {
            return Optional.empty();
        }
        String text = excerpt.length() > properties.excerptChars() ? excerpt.substring(0, properties.excerptChars()) : excerpt;
        Map<String, Object> body = Map.of(
                "model", properties.model(),
                "temperature", 0,
                "messages", List.of(Map.of("role", "user", "content", PROMPT.formatted(text)))
        );
        try {
            JsonNode response = webClient.post()
                    .uri(properties.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofMillis(Math.min(timeoutMs, properties.timeoutMs())))
                    .block();
            String content = response == null ? null : response.path("choices").path(0).path("message").path("content").asText(null);
            return parseVerdict(content);
        } catch (RuntimeException e) {
            log.warn("Analysis service unavailable, using keyword analysis only: {}", e.getMessage());
            return Optional.empty();
        }
    }

    Optional<Verdict> parseVerdict(String content) {
        if (content == null) return Optional.empty();
        Matcher m = JSON_OBJECT.matcher(content);
        if (!m.find()) return Optional.empty();
        try {
            JsonNode node = objectMapper.readTree(m.group());
            return Optional.of(new Verdict(
                    node.path("isLegalDocument").asBoolean(false),
                    node.path("documentType").asText("not_legal"),
                    Math.max(0, Math.min(1, node.path("confidence").asDouble(0))),
                    node.path("reasoning").asText("")
            ));
        } catch (JsonProcessingException e) {
            log.warn("Analysis reply was not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
