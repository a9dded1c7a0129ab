package com.policyparser.discovery.search;

import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicySearchServiceTest {

    private record StubClient(String name, List<SearchModels.SearchHit> hits, List<String> queries) implements SearchClient {
        StubClient(String name, List<SearchModels.SearchHit> hits) {
            this(name, hits, new ArrayList<>());
        }

        @Override
        public List<SearchModels.SearchHit> search(String query, long timeoutMs) {
            queries.add(query);
            if (hits == null) throw new IllegalStateException(name + " is down");
            return hits;
        }
    }

    private static SearchModels.SearchHit hit(String url) {
        return new SearchModels.SearchHit(url, "Privacy", "stub");
    }

    @Test
    void fallsThroughFailingAndEmptyProvidersAndKeepsOnDomainHits() {
        var broken = new StubClient("broken", null);
        var empty = new StubClient("empty", List.of(hit("https://elsewhere.test/privacy")));
        var working = new StubClient("working", List.of(
                hit("https://elsewhere.test/privacy"),
                hit("https://acme.test/privacy"),
                hit("https://help.acme.test/terms"),
                hit("https://acme.test/cookies")));
        var service = new PolicySearchService(List.of(broken, empty, working), 2);

        var hits = service.findPolicyPages("acme.test", "privacy policy", System.currentTimeMillis() + 5000);

        assertEquals(List.of("https://acme.test/privacy", "https://help.acme.test/terms"),
                hits.stream().map(SearchModels.SearchHit::url).toList());
        assertEquals(List.of("site:acme.test privacy policy"), working.queries());
        assertEquals(1, broken.queries().size());
    }

    @Test
    void expiredDeadlineSkipsEveryProvider() {
        var client = new StubClient("working", List.of(hit("https://acme.test/privacy")));
        var service = new PolicySearchService(List.of(client), 3);

        assertTrue(service.findPolicyPages("acme.test", "terms", System.currentTimeMillis() - 1).isEmpty());
        assertTrue(client.queries().isEmpty());
    }

    @Test
    void hostMatchingRejectsLookalikeDomains() {
        assertTrue(PolicySearchService.onDomain("https://www.acme.test/privacy", "acme.test"));
        assertFalse(PolicySearchService.onDomain("https://notacme.test/privacy", "acme.test"));
        assertFalse(PolicySearchService.onDomain("not a url", "acme.test"));
    }

    @Test
    void parsesResultPageAndUnwrapsRedirectLinks() {
        var client = new HtmlResultsSearchClient("duckduckgo", WebClient.create(), "https://html.duckduckgo.com/html/",
                "a.result__a", "ua");
        String html = """
                <html><body>
                <div class="result"><a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Facme.test%2Fprivacy&amp;rut=abc">Acme Privacy</a></div>
                <div class="result"><a class="result__a" href="https://acme.test/terms">Acme Terms</a></div>
                <div class="ad"><a class="ad__a" href="https://ads.test/">Ad</a></div>
                </body></html>
                """;

        var hits = client.parse(html, "https://html.duckduckgo.com/html/?q=site%3Aacme.test");

        assertEquals(2, hits.size());
        assertEquals("https://acme.test/privacy", hits.get(0).url());
        assertEquals("Acme Privacy", hits.get(0).title());
        assertEquals("duckduckgo", hits.get(0).provider());
        assertEquals("https://acme.test/terms", hits.get(1).url());
    }
}
