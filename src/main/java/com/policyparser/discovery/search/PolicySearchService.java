package com.policyparser.discovery.search;

import com.policyparser.discovery.config.FetchProperties;
import com.policyparser.discovery.config.SearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Site-restricted search for policy pages. Providers are tried in order until one yields hits on
 * the target domain.
 */
@Service
public class PolicySearchService {
    private static final Logger log = LoggerFactory.getLogger(PolicySearchService.class);

    private final List<SearchClient> clients;
    private final int resultLimit;

    @Autowired
    public PolicySearchService(@Qualifier("searchWebClient") WebClient webClient,
                               SearchProperties properties,
                               FetchProperties fetchProperties) {
        this(buildClients(webClient, properties, fetchProperties.userAgents().get(0)), properties.resultLimit());
    }

    PolicySearchService(List<SearchClient> clients, int resultLimit) {
        this.clients = clients;
        this.resultLimit = resultLimit;
    }

    private static List<SearchClient> buildClients(WebClient webClient, SearchProperties p, String userAgent) {
        List<SearchClient> list = new ArrayList<>();
        if (p.serper()) {
            list.add(new SerperSearchClient(webClient, p.serperUrl(), p.apiKey(), HtmlResultsSearchClient.MAX_RESULTS_CHECKED));
        }
        list.add(new HtmlResultsSearchClient("duckduckgo", webClient, p.baseUrl() + "/html/", "a.result__a", userAgent));
        if (p.fallbackUrl() != null && !p.fallbackUrl().isBlank()) {
            list.add(new HtmlResultsSearchClient("bing", webClient, p.fallbackUrl() + "/search", "li.b_algo h2 a", userAgent));
        }
        return list;
    }

    public List<SearchModels.SearchHit> findPolicyPages(String domain, String topic, long deadline) {
        String query = "site:" + domain + " " + topic;
        for (SearchClient client : clients) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) break;
            try {
                List<SearchModels.SearchHit> hits = client.search(query, remaining).stream()
                        .filter(h -> onDomain(h.url(), domain))
                        .limit(resultLimit)
                        .toList();
                if (!hits.isEmpty()) {
                    log.debug("{} returned {} hits for {}", client.name(), hits.size(), query);
                    return hits;
                }
            } catch (RuntimeException e) {
                log.warn("{} search failed for {}: {}", client.name(), domain, e.getMessage());
            }
        }
        return List.of();
    }

    static boolean onDomain(String url, String domain) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) return false;
            host = host.toLowerCase(Locale.ROOT);
            return host.equals(domain) || host.endsWith("." + domain);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
