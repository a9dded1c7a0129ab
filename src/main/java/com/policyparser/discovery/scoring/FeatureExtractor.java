package com.policyparser.discovery.scoring;

import com.policyparser.discovery.domain.DomainModels;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Builds the fixed 24-slot feature vector for a link. Every slot is normalized into [0,1].
 *
 * <pre>
 *  0-4   text: privacy, terms, cookie, legal keyword flags, match strength
 *  5-10  url: privacy path, terms path, legal path, depth, length, https
 * 11-14  context one-hot: footer, nav, legal hub, body
 * 15-19  page content: privacy text, policy structure, legal jargon, word count, contact info
 * 20-23  link: text length, icon, external, year
 * </pre>
 */
@Component
public class FeatureExtractor {

    public static final int FEATURE_COUNT = 24;

    static final List<String> PRIVACY_KEYWORDS = List.of(
            "privacy", "privacy policy", "data protection", "personal data", "your data",
            "personal information", "data privacy", "privacy notice", "privacy statement",
            "datenschutz", "datenschutzerklärung", "datenschutzrichtlinie", "datenschutzhinweise",
            "privatsphäre", "personenbezogene daten",
            "confidentialité", "politique de confidentialité", "données personnelles",
            "privacidad", "política de privacidad", "datos personales",
            "gdpr", "ccpa", "dsgvo", "rgpd");

    static final List<String> TERMS_KEYWORDS = List.of(
            "terms", "terms of service", "terms of use", "terms and conditions",
            "conditions of use", "user agreement", "service agreement",
            "nutzungsbedingungen", "agb", "allgemeine geschäftsbedingungen",
            "conditions générales", "condiciones de uso", "términos y condiciones");

    static final List<String> COOKIE_KEYWORDS = List.of(
            "cookie", "cookies", "cookie policy", "cookie notice",
            "cookie-richtlinie", "cookies policy", "use of cookies",
            "politique cookies", "política de cookies");

    static final List<String> LEGAL_HUB_KEYWORDS = List.of(
            "legal", "legal notice", "legal information", "impressum",
            "rechtliche hinweise", "mentions légales", "aviso legal");

    private static final List<String> PRIVACY_PATHS = List.of(
            "privacy", "privacy-policy", "privacypolicy", "privacy_policy",
            "datenschutz", "datenschutzerklaerung", "data-protection");

    private static final List<String> TERMS_PATHS = List.of(
            "terms", "terms-of-service", "tos", "terms-of-use", "termsofservice", "nutzungsbedingungen", "agb");

    private static final List<String> STRUCTURE_KEYWORDS = List.of(
            "data collection", "information we collect", "how we use",
            "your rights", "third parties", "cookies", "security",
            "retention", "updates to this policy", "contact us",
            "datenerhebung", "ihre rechte", "dritte");

    private static final List<String> LEGAL_JARGON = List.of(
            "pursuant to", "hereby", "notwithstanding", "liability",
            "indemnify", "consent", "processing", "controller", "processor",
            "gemäß", "hiermit", "verarbeitung", "verantwortlicher");

    private static final List<String> ALL_DOCUMENT_KEYWORDS = Stream.of(PRIVACY_KEYWORDS, TERMS_KEYWORDS, COOKIE_KEYWORDS)
            .flatMap(List::stream)
            .toList();

    private static final Pattern PHONE = Pattern.compile("\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b");
    private static final Pattern YEAR = Pattern.compile("\\b20[2-3]\\d\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public double[] extractFeatures(String linkText, String href, DomainModels.LinkContext context, String baseUrl) {
        return extractFeatures(linkText, href, context, baseUrl, null);
    }

    public double[] extractFeatures(String linkText,
                                    String href,
                                    DomainModels.LinkContext context,
                                    String baseUrl,
                                    String pageContent) {
        String text = linkText == null ? "" : linkText.toLowerCase(Locale.ROOT).trim();
        String rawHref = href == null ? "" : href;
        String url = rawHref.toLowerCase(Locale.ROOT);
        String base = baseUrl == null ? "" : baseUrl;
        String content = pageContent == null ? "" : pageContent.toLowerCase(Locale.ROOT);
        DomainModels.LinkContext ctx = context == null ? DomainModels.LinkContext.UNKNOWN : context;

        double[] f = new double[FEATURE_COUNT];

        f[0] = flag(containsAny(text, PRIVACY_KEYWORDS));
        f[1] = flag(containsAny(text, TERMS_KEYWORDS));
        f[2] = flag(containsAny(text, COOKIE_KEYWORDS));
        f[3] = flag(containsAny(text, LEGAL_HUB_KEYWORDS));
        f[4] = normalize(countMatches(text, ALL_DOCUMENT_KEYWORDS), 5);

        f[5] = flag(containsAny(url, PRIVACY_PATHS));
        f[6] = flag(containsAny(url, TERMS_PATHS));
        f[7] = flag(url.contains("legal") || url.contains("policies"));
        f[8] = normalize(pathDepth(rawHref, base), 5);
        f[9] = normalize(url.length(), 200);
        f[10] = flag(url.startsWith("https") || base.toLowerCase(Locale.ROOT).startsWith("https"));

        f[11] = flag(ctx == DomainModels.LinkContext.FOOTER);
        f[12] = flag(ctx == DomainModels.LinkContext.NAV);
        f[13] = flag(ctx == DomainModels.LinkContext.LEGAL_HUB);
        f[14] = flag(ctx == DomainModels.LinkContext.BODY || ctx == DomainModels.LinkContext.UNKNOWN);

        if (!content.isEmpty()) {
            f[15] = flag(containsAny(content, PRIVACY_KEYWORDS));
            f[16] = flag(countMatches(content, STRUCTURE_KEYWORDS) >= 3);
            f[17] = flag(countMatches(content, LEGAL_JARGON) >= 2);
            f[18] = normalize(wordCount(content), 5000);
            f[19] = flag(content.contains("@") || PHONE.matcher(content).find() || content.contains("contact us"));
        }

        f[20] = normalize(text.length(), 50);
        f[21] = flag(text.contains("🔒") || text.contains("🛡") || text.contains("⚖")
                || rawHref.contains("shield") || rawHref.contains("lock") || rawHref.contains("secure"));
        f[22] = flag(isExternal(rawHref, base));
        f[23] = flag(YEAR.matcher(text).find());
        return f;
    }

    public static double normalize(double value, double max) {
        return Math.min(Math.max(value / max, 0), 1);
    }

    static boolean containsAny(String haystack, List<String> needles) {
        for (String n : needles) {
            if (haystack.contains(n)) return true;
        }
        return false;
    }

    static int countMatches(String haystack, List<String> needles) {
        int count = 0;
        for (String n : needles) {
            if (haystack.contains(n)) count++;
        }
        return count;
    }

    private static double flag(boolean b) {
        return b ? 1.0 : 0.0;
    }

    private static int wordCount(String content) {
        return (int) Arrays.stream(WHITESPACE.split(content)).filter(w -> !w.isEmpty()).count();
    }

    private static int pathDepth(String href, String baseUrl) {
        URI uri = resolve(href, baseUrl);
        if (uri == null || uri.getPath() == null) return 0;
        return (int) Arrays.stream(uri.getPath().split("/")).filter(s -> !s.isEmpty()).count();
    }

    private static boolean isExternal(String href, String baseUrl) {
        URI link = resolve(href, baseUrl);
        URI base = resolve(baseUrl, null);
        if (link == null || base == null || link.getHost() == null || base.getHost() == null) return false;
        return !link.getHost().equalsIgnoreCase(base.getHost());
    }

    private static URI resolve(String href, String baseUrl) {
        try {
            URI uri = new URI(href.trim());
            if (!uri.isAbsolute() && baseUrl != null && !baseUrl.isBlank()) {
                uri = new URI(baseUrl.trim()).resolve(uri);
            }
            return uri;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }
}
