package com.policyparser.discovery.fetch;

import com.policyparser.discovery.config.FetchProperties;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Fetches a page with user-agent rotation. A 401 or 403 moves on to the next agent; any other
 * non-2xx status ends the attempt loop. Redirects are followed here so the final URL is known.
 */
@Component
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    private static final int MAX_REDIRECTS = 5;

    private final WebClient webClient;
    private final FetchProperties properties;
    private final HostRateLimiter rateLimiter;
    private final PageRenderer renderer;

    public PageFetcher(@Qualifier("fetchWebClient") WebClient webClient,
                       FetchProperties properties,
                       HostRateLimiter rateLimiter,
                       PageRenderer renderer) {
        this.webClient = webClient;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.renderer = renderer;
    }

    public FetchModels.FetchOptions defaultOptions() {
        return FetchModels.FetchOptions.of(properties.timeoutMs(), properties.retryBudgetMs());
    }

    public FetchModels.FetchResult fetch(String url, FetchModels.FetchOptions options) {
        long deadline = System.currentTimeMillis() + options.retryBudgetMs();
        List<String> agents = properties.userAgents();
        FetchException last = null;
        int attempts = 0;

        for (String agent : agents) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) break;
            if (!rateLimiter.acquire(url, remaining)) {
                throw FetchException.timeout(url, "no request slot for host within budget");
            }
            remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) break;
            attempts++;
            RawResponse response;
            try {
                response = exchange(url, agent, Math.min(options.timeoutMs(), remaining), deadline);
            } catch (FetchException e) {
                if (Thread.currentThread().isInterrupted()) throw e;
                log.debug("Attempt {} for {} failed: {}", attempts, url, e.getMessage());
                last = e;
                continue;
            }
            if (response.status() >= 200 && response.status() < 300) {
                return maybeRender(new FetchModels.FetchResult(response.status(), response.finalUrl(), response.body(),
                        attempts, FetchModels.FetchMode.LIGHTWEIGHT), deadline);
            }
            last = FetchException.httpStatus(url, response.status());
            if (response.status() != 401 && response.status() != 403) {
                throw last;
            }
            log.debug("HTTP {} for {} with agent #{}, rotating", response.status(), url, attempts);
        }
        if (last != null) throw last;
        throw FetchException.timeout(url, "retry budget exhausted before first attempt");
    }

    private FetchModels.FetchResult maybeRender(FetchModels.FetchResult result, long deadline) {
        if (!properties.renderingEnabled()) return result;
        int textLength = Jsoup.parse(result.html()).text().length();
        if (textLength >= properties.minContentChars()) return result;
        long remaining = deadline - System.currentTimeMillis();
        return renderer.render(result.finalUrl(), remaining)
                .map(html -> new FetchModels.FetchResult(result.status(), result.finalUrl(), html, result.attempts(), FetchModels.FetchMode.RENDERED))
                .orElse(result);
    }

    private RawResponse exchange(String url, String agent, long timeoutMs, long deadline) {
        String current = url;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            long allowed = Math.min(timeoutMs, deadline - System.currentTimeMillis());
            if (allowed <= 0) throw FetchException.timeout(url, "timed out following redirects");
            RawResponse response = single(current, agent, allowed);
            if (response.status() >= 300 && response.status() < 400 && response.location() != null) {
                current = resolve(current, response.location());
                continue;
            }
            return response;
        }
        throw FetchException.network(url, new IllegalStateException("too many redirects"));
    }

    private RawResponse single(String url, String agent, long timeoutMs) {
        final String target = url;
        try {
            RawResponse response = webClient.get()
                    .uri(URI.create(target))
                    .header(HttpHeaders.USER_AGENT, agent)
                    .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                    .exchangeToMono(r -> {
                        int status = r.statusCode().value();
                        String location = r.headers().asHttpHeaders().getFirst(HttpHeaders.LOCATION);
                        if (status >= 300 && status < 400) {
                            return r.releaseBody().thenReturn(new RawResponse(status, target, location, ""));
                        }
                        return r.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new RawResponse(status, target, location, body));
                    })
                    .timeout(Duration.ofMillis(timeoutMs))
                    .block();
            if (response == null) throw FetchException.network(target, new IllegalStateException("empty response"));
            return response;
        } catch (FetchException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw FetchException.network(target, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (isTimeout(cause)) {
                throw FetchException.timeout(target, "no response within " + timeoutMs + " ms");
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw FetchException.timeout(target, "fetch interrupted");
            }
            throw FetchException.network(target, cause);
        }
    }

    private static boolean isTimeout(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof java.util.concurrent.TimeoutException
                    || c instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String resolve(String base, String location) {
        try {
            return URI.create(base).resolve(location.trim()).toString();
        } catch (IllegalArgumentException e) {
            return location;
        }
    }

    private record RawResponse(int status, String finalUrl, String location, String body) {
    }
}
