package com.policyparser.discovery.fetch;

import com.policyparser.discovery.config.FetchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Calls a browserless-style {@code /content} endpoint. Returns empty when rendering is disabled or fails.
 */
@Component
public class RemoteBrowserPageRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(RemoteBrowserPageRenderer.class);

    private final WebClient webClient;
    private final FetchProperties properties;

    public RemoteBrowserPageRenderer(@Qualifier("fetchWebClient") WebClient webClient, FetchProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public Optional<String> render(String url, long timeoutMs) {
        if (!properties.renderingEnabled() || timeoutMs <= 0) return Optional.empty();
        long effective = Math.min(timeoutMs, properties.rendering().timeoutMs());
        try {
            String html = webClient.post()
                    .uri(properties.rendering().endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("url", url))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(effective))
                    .block();
            return Optional.ofNullable(html).filter(h -> !h.isBlank());
        } catch (RuntimeException e) {
            log.warn("Rendering failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
