package com.policyparser.discovery.parser;

import com.policyparser.discovery.domain.DomainModels;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;
import java.util.regex.Pattern;

@Component
public class LinkExtractor {

    static final String FOOTER_SELECTOR = "footer, .footer, #footer, [role=contentinfo], .site-footer, .page-footer, "
            + ".main-footer, .bottom-bar, .bottom-nav, .legal-links";
    static final String NAV_SELECTOR = "nav, .nav, #nav, .navigation, .main-nav, .site-nav, [role=navigation]";
    private static final String HIDDEN_SELECTOR = "[hidden], [aria-hidden=true], [style~=display:\\s*none], "
            + "[style~=visibility:\\s*hidden]";

    private static final List<DomainModels.LinkContext> CONTEXT_PRIORITY = List.of(
            DomainModels.LinkContext.UNKNOWN, DomainModels.LinkContext.BODY, DomainModels.LinkContext.NAV,
            DomainModels.LinkContext.LEGAL_HUB, DomainModels.LinkContext.FOOTER);

    private static final Pattern LEGAL_HUB_PATH = Pattern.compile("/(legal|policies|impressum|about/legal)(/|$|\\?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEGAL_HUB_TITLE = Pattern.compile("\\b(legal|policies|impressum|rechtliche hinweise|mentions l[ée]gales)\\b",
            Pattern.CASE_INSENSITIVE);

    public List<DomainModels.RawLink> extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) return List.of();
        Document doc = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        boolean legalHub = isLegalHub(baseUrl, doc.title());

        Map<String, DomainModels.RawLink> byUrl = new LinkedHashMap<>();
        for (Element a : doc.select("a[href]")) {
            String raw = a.attr("href").trim();
            if (raw.isEmpty() || isExcluded(raw)) continue;
            String abs = a.absUrl("href");
            if (abs.isEmpty() || !isHttpUrl(abs)) continue;

            DomainModels.LinkContext context = classify(a, legalHub);
            String text = anchorText(a);
            boolean visible = a.closest(HIDDEN_SELECTOR) == null;
            byUrl.merge(DomainModels.normalizeUrl(abs), new DomainModels.RawLink(abs, text, context, visible),
                    (existing, candidate) -> rank(candidate.context()) > rank(existing.context()) ? candidate : existing);
        }
        return new ArrayList<>(byUrl.values());
    }

    public static boolean isLegalHub(String pageUrl, String title) {
        String path = pathOf(pageUrl);
        if (path != null && LEGAL_HUB_PATH.matcher(path).find()) return true;
        return title != null && LEGAL_HUB_TITLE.matcher(title).find();
    }

    private static DomainModels.LinkContext classify(Element a, boolean legalHub) {
        if (a.closest(FOOTER_SELECTOR) != null) return DomainModels.LinkContext.FOOTER;
        if (a.closest(NAV_SELECTOR) != null) return DomainModels.LinkContext.NAV;
        if (legalHub) return DomainModels.LinkContext.LEGAL_HUB;
        return DomainModels.LinkContext.BODY;
    }

    private static int rank(DomainModels.LinkContext context) {
        return CONTEXT_PRIORITY.indexOf(context);
    }

    private static String anchorText(Element a) {
        String text = a.text().trim();
        if (!text.isEmpty()) return text;
        String label = a.attr("aria-label").trim();
        if (!label.isEmpty()) return label;
        return a.attr("title").trim();
    }

    private static boolean isExcluded(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        return lower.startsWith("#") || lower.startsWith("mailto:") || lower.startsWith("tel:") || lower.startsWith("javascript:");
    }

    private static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            return uri.getHost() != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String pathOf(String url) {
        if (url == null) return null;
        try {
            return new URI(url).getPath();
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
