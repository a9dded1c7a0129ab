package com.policyparser.discovery.search;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scrapes an HTML search results page. Result anchors are found with a CSS selector; redirect
 * wrappers carrying the target in a {@code uddg} parameter are unwrapped.
 */
public class HtmlResultsSearchClient implements SearchClient {
    private static final Logger log = LoggerFactory.getLogger(HtmlResultsSearchClient.class);
    static final int MAX_RESULTS_CHECKED = 5;

    private final String name;
    private final WebClient webClient;
    private final String searchUrl;
    private final String resultSelector;
    private final String userAgent;

    public HtmlResultsSearchClient(String name, WebClient webClient, String searchUrl, String resultSelector, String userAgent) {
        this.name = name;
        this.webClient = webClient;
        this.searchUrl = searchUrl;
        this.resultSelector = resultSelector;
        this.userAgent = userAgent;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<SearchModels.SearchHit> search(String query, long timeoutMs) {
        if (timeoutMs <= 0) return List.of();
        String uri = UriComponentsBuilder.fromHttpUrl(searchUrl).queryParam("q", query).encode().build().toUriString();
        String html;
        try {
            html = webClient.get()
                    .uri(java.net.URI.create(uri))
                    .header(HttpHeaders.USER_AGENT, userAgent)
                    .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .block();
        } catch (WebClientResponseException e) {
            log.info("{} search returned status {}", name, e.getStatusCode().value());
            return List.of();
        }
        return parse(html, uri);
    }

    List<SearchModels.SearchHit> parse(String html, String pageUrl) {
        if (html == null || html.isBlank()) return List.of();
        Document doc = Jsoup.parse(html, pageUrl);
        List<SearchModels.SearchHit> hits = new ArrayList<>();
        for (Element a : doc.select(resultSelector)) {
            if (hits.size() >= MAX_RESULTS_CHECKED) break;
            String href = unwrap(a.absUrl("href").isEmpty() ? a.attr("href") : a.absUrl("href"));
            if (href.isEmpty()) continue;
            hits.add(new SearchModels.SearchHit(href, a.text().trim(), name));
        }
        return hits;
    }

    static String unwrap(String href) {
        int idx = href.indexOf("uddg=");
        if (idx < 0) return href;
        String encoded = href.substring(idx + 5);
        int amp = encoded.indexOf('&');
        if (amp >= 0) encoded = encoded.substring(0, amp);
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }
}
