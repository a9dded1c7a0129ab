package com.policyparser.discovery;

import com.policyparser.discovery.config.FetchProperties;
import com.policyparser.discovery.fetch.FetchException;
import com.policyparser.discovery.fetch.FetchModels;
import com.policyparser.discovery.fetch.HostRateLimiter;
import com.policyparser.discovery.fetch.PageFetcher;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class PageFetcherTest {
    private static final String PAGE = "<html><body><main>Privacy policy</main></body></html>";

    private final List<ClientRequest> requests = Collections.synchronizedList(new ArrayList<>());

    private PageFetcher fetcher(Function<ClientRequest, Mono<ClientResponse>> responder) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return responder.apply(request);
        };
        WebClient client = WebClient.builder().exchangeFunction(exchange).build();
        FetchProperties properties = new FetchProperties(1000, 5000, 0, 1000, 60_000, List.of("ua-1", "ua-2", "ua-3"),
                new FetchProperties.Rendering(false, "", 1000));
        return new PageFetcher(client, properties, new HostRateLimiter(properties), (url, timeoutMs) -> Optional.empty());
    }

    private static Mono<ClientResponse> status(HttpStatus status) {
        return Mono.just(ClientResponse.create(status).build());
    }

    private static Mono<ClientResponse> html(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "text/html")
                .body(body)
                .build());
    }

    private List<String> agents() {
        return requests.stream().map(r -> r.headers().getFirst(HttpHeaders.USER_AGENT)).toList();
    }

    @Test
    void forbiddenRotatesToTheNextUserAgent() {
        var fetcher = fetcher(r -> requests.size() < 3 ? status(HttpStatus.FORBIDDEN) : html(PAGE));

        var result = fetcher.fetch("https://acme.test/privacy", fetcher.defaultOptions());

        assertEquals(200, result.status());
        assertEquals(3, result.attempts());
        assertEquals(PAGE, result.html());
        assertEquals(FetchModels.FetchMode.LIGHTWEIGHT, result.mode());
        assertEquals(List.of("ua-1", "ua-2", "ua-3"), agents());
    }

    @Test
    void notFoundStopsWithoutRotating() {
        var fetcher = fetcher(r -> status(HttpStatus.NOT_FOUND));

        var e = assertThrows(FetchException.class, () -> fetcher.fetch("https://acme.test/privacy", fetcher.defaultOptions()));

        assertEquals(FetchException.Kind.HTTP_STATUS, e.kind());
        assertEquals(404, e.statusCode());
        assertEquals(1, requests.size());
    }

    @Test
    void everyAgentForbiddenSurfacesTheLastStatus() {
        var fetcher = fetcher(r -> status(HttpStatus.UNAUTHORIZED));

        var e = assertThrows(FetchException.class, () -> fetcher.fetch("https://acme.test/terms", fetcher.defaultOptions()));

        assertEquals(401, e.statusCode());
        assertEquals(3, requests.size());
    }

    @Test
    void followsRedirectsAndReportsFinalUrl() {
        var fetcher = fetcher(r -> r.url().getPath().equals("/privacy")
                ? Mono.just(ClientResponse.create(HttpStatus.MOVED_PERMANENTLY)
                .header(HttpHeaders.LOCATION, "/legal/privacy-policy")
                .build())
                : html(PAGE));

        var result = fetcher.fetch("https://acme.test/privacy", fetcher.defaultOptions());

        assertEquals("https://acme.test/legal/privacy-policy", result.finalUrl());
        assertEquals(1, result.attempts());
        assertEquals(2, requests.size());
    }

    @Test
    void silentServerTimesOutWithinTheRetryBudget() {
        var fetcher = fetcher(r -> Mono.never());
        long started = System.currentTimeMillis();

        var e = assertThrows(FetchException.class,
                () -> fetcher.fetch("https://slow.test/", FetchModels.FetchOptions.of(200, 500)));

        assertEquals(FetchException.Kind.TIMEOUT, e.kind());
        assertTrue(System.currentTimeMillis() - started < 3000);
    }

    @Test
    void cappedOptionsNeverExceedTheRemainingBudget() {
        var capped = FetchModels.FetchOptions.of(8000, 15000).capTo(1200);
        assertEquals(1200, capped.retryBudgetMs());
        assertEquals(1200, capped.timeoutMs());
        assertEquals(0, FetchModels.FetchOptions.of(8000, 15000).capTo(-5).retryBudgetMs());
    }
}
