package com.policyparser.discovery.search;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public class SerperSearchClient implements SearchClient {
    private final WebClient webClient;
    private final String endpoint;
    private final String apiKey;
    private final int maxResults;

    public SerperSearchClient(WebClient webClient, String endpoint, String apiKey, int maxResults) {
        this.webClient = webClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.maxResults = maxResults;
    }

    @Override
    public String name() {
        return "serper";
    }

    @Override
    public List<SearchModels.SearchHit> search(String query, long timeoutMs) {
        if (timeoutMs <= 0) return List.of();
        SearchModels.SerperResponse response = webClient.post()
                .uri(endpoint + "/search")
                .header("X-API-KEY", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("q", query, "num", maxResults))
                .retrieve()
                .bodyToMono(SearchModels.SerperResponse.class)
                .timeout(Duration.ofMillis(timeoutMs))
                .block();
        if (response == null || response.organic() == null) return List.of();
        return response.organic().stream()
                .filter(o -> o.link() != null)
                .map(o -> new SearchModels.SearchHit(o.link(), o.title(), name()))
                .toList();
    }
}
