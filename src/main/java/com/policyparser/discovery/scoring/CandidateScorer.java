package com.policyparser.discovery.scoring;

import com.policyparser.discovery.domain.DomainModels;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Additive rule score for a link. Anything at or below zero is not a candidate.
 */
@Component
public class CandidateScorer {

    private static final List<String> PREFERRED_LANGUAGE = List.of("/en/", "en-us", "lang=en");
    private static final List<String> DEPRIORITIZED_LANGUAGE = List.of("/de/", "/fr/");
    private static final List<String> PRIVACY = List.of("privacy", "data protection", "gdpr", "ccpa", "security",
            "datenschutz", "confidentialité", "privacidad", "cookie", "cookies", "personal data");
    private static final List<String> TERMS = List.of("terms", "conditions", "tos", "user agreement",
            "nutzungsbedingungen", "agb", "service agreement", "legal notice");
    private static final List<String> LEGAL = List.of("legal", "compliance", "policies", "rechtliches", "impressum", "imprint");
    private static final List<String> NEGATIVE = List.of("login", "signup", "register", "signin", "share",
            "/help/", "/support/", "/faq/");

    public int heuristicScore(DomainModels.CandidateLink link) {
        return heuristicScore(link.url(), link.anchorText(), link.context(), link.visible());
    }

    public int heuristicScore(DomainModels.RawLink link) {
        return heuristicScore(link.url(), link.anchorText(), link.context(), link.visible());
    }

    public int heuristicScore(String url, String anchorText, DomainModels.LinkContext context, boolean visible) {
        String u = url == null ? "" : url.toLowerCase(Locale.ROOT);
        String t = anchorText == null ? "" : anchorText.toLowerCase(Locale.ROOT);
        if (isExcludedUrl(u)) return 0;

        int score = 0;
        if (containsAny(u, PREFERRED_LANGUAGE)) score += 50;
        if (containsAny(u, DEPRIORITIZED_LANGUAGE)) score -= 20;
        if (containsAny(u, PRIVACY) || containsAny(t, PRIVACY)) score += 40;
        if (containsAny(u, TERMS) || containsAny(t, TERMS)) score += 20;
        if (containsAny(u, LEGAL) || containsAny(t, LEGAL)) score += 10;
        if (context == DomainModels.LinkContext.FOOTER) score += 30;
        if (visible) score += 5;
        return score;
    }

    public boolean isExcludedUrl(String url) {
        return url != null && containsAny(url.toLowerCase(Locale.ROOT), NEGATIVE);
    }

    private static boolean containsAny(String s, List<String> keys) {
        for (String k : keys) {
            if (s.contains(k)) return true;
        }
        return false;
    }
}
