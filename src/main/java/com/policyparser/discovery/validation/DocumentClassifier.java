package com.policyparser.discovery.validation;

import com.policyparser.discovery.analysis.AnalysisClient;
import com.policyparser.discovery.config.AnalysisProperties;
import com.policyparser.discovery.domain.DomainModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Weighted keyword and structure scoring of legal documents. Confidence of 0.6 or more counts as a
 * policy; scores in the ambiguous band can be refined by an {@link AnalysisClient}.
 */
@Component
public class DocumentClassifier {
    private static final Logger log = LoggerFactory.getLogger(DocumentClassifier.class);

    public static final double POLICY_THRESHOLD = 0.6;
    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.8;
    static final double AMBIGUOUS_LOW = 0.4;
    static final int MIN_TEXT_LENGTH = 500;
    private static final double TYPE_MIN_SCORE = 0.15;

    private record Category(String name, double weight, List<String> keywords) {
    }

    private static final List<Category> CATEGORIES = List.of(
            new Category("core", 3.0, List.of(
                    "privacy policy", "privacy notice", "data protection", "personal data",
                    "personal information", "data subject", "data controller", "data processor",
                    "terms of service", "terms of use", "terms and conditions", "user agreement",
                    "cookie policy", "cookie notice")),
            new Category("legal", 2.5, List.of(
                    "gdpr", "ccpa", "cpra", "lgpd", "pipeda", "dpa", "vcdpa",
                    "general data protection regulation", "california consumer privacy act",
                    "virginia consumer data protection act", "colorado privacy act",
                    "data protection act", "privacy act", "electronic communications",
                    "e-privacy", "coppa", "children's online privacy protection")),
            new Category("dataHandling", 1.5, List.of(
                    "collect", "collection", "process", "processing", "store", "storage",
                    "retain", "retention", "delete", "deletion", "anonymize", "anonymization",
                    "pseudonymize", "pseudonymization", "aggregate", "aggregation",
                    "transfer", "disclose", "disclosure", "share", "sharing")),
            new Category("rights", 1.5, List.of(
                    "consent", "withdraw consent", "opt-out", "opt out", "opt-in", "opt in",
                    "right to access", "right to rectification", "right to erasure",
                    "right to delete", "right to portability", "right to object",
                    "data subject rights", "your rights", "user rights", "exercise your rights",
                    "request deletion", "request access", "do not sell", "do not share")),
            new Category("thirdParty", 1.2, List.of(
                    "third party", "third parties", "service provider", "service providers",
                    "business partner", "affiliate", "affiliates", "vendor", "vendors",
                    "advertising partner", "analytics provider", "subprocessor")),
            new Category("security", 1.2, List.of(
                    "encryption", "encrypted", "ssl", "tls", "secure", "security measures",
                    "data breach", "breach notification", "unauthorized access",
                    "security safeguards", "protect your data", "protect your information")),
            new Category("cookies", 1.2, List.of(
                    "cookie", "cookies", "tracking technology", "tracking technologies",
                    "pixel", "pixels", "web beacon", "web beacons", "local storage",
                    "session storage", "fingerprint", "fingerprinting", "device identifier")),
            new Category("structure", 0.8, List.of(
                    "effective date", "last updated", "last modified", "revision date",
                    "table of contents", "definitions", "scope", "applicability",
                    "contact us", "how to contact", "questions about this",
                    "changes to this", "updates to this", "modifications to this",
                    "governing law", "jurisdiction", "dispute resolution", "arbitration",
                    "limitation of liability", "indemnification", "warranty", "disclaimer"))
    );

    private static final Map<DomainModels.DocumentType, List<String>> TYPE_INDICATORS = new LinkedHashMap<>();

    static {
        TYPE_INDICATORS.put(DomainModels.DocumentType.PRIVACY, List.of(
                "privacy policy", "privacy notice", "privacy statement", "data protection",
                "personal data", "personal information", "information we collect",
                "how we use your", "how we collect"));
        TYPE_INDICATORS.put(DomainModels.DocumentType.TERMS, List.of(
                "terms of service", "terms of use", "terms and conditions", "user agreement",
                "service agreement", "acceptable use", "prohibited conduct",
                "your responsibilities", "account termination"));
        TYPE_INDICATORS.put(DomainModels.DocumentType.COOKIE, List.of(
                "cookie policy", "cookie notice", "use of cookies", "cookie statement",
                "cookies we use", "types of cookies", "cookie preferences"));
        TYPE_INDICATORS.put(DomainModels.DocumentType.DATA_PROCESSING_AGREEMENT, List.of(
                "data processing agreement", "data processing addendum", "dpa",
                "subprocessor", "data processor", "standard contractual clauses"));
    }

    private static final Map<String, Pattern> STRUCTURE_INDICATORS = new LinkedHashMap<>();

    static {
        int flags = Pattern.CASE_INSENSITIVE;
        STRUCTURE_INDICATORS.put("numbered_sections", Pattern.compile("\\b(?:section|article|clause)\\s*\\d+", flags));
        STRUCTURE_INDICATORS.put("definitions_section", Pattern.compile("(?:\"[^\"]+\"\\s+(?:means|refers to|shall mean)|\\bdefinitions?:)", flags));
        STRUCTURE_INDICATORS.put("date_reference", Pattern.compile("(?:effective|last\\s+(?:updated|modified|revised))[:\\s]+\\d", flags));
        STRUCTURE_INDICATORS.put("legal_boilerplate", Pattern.compile("to the (?:fullest|maximum) extent (?:permitted|allowed) by law", flags));
        STRUCTURE_INDICATORS.put("contact_section", Pattern.compile("contact\\s+us|how\\s+to\\s+contact|questions?\\s+(?:about|regarding)|reach\\s+us", flags));
        STRUCTURE_INDICATORS.put("table_of_contents", Pattern.compile("table\\s+of\\s+contents|contents:|index:", flags));
        STRUCTURE_INDICATORS.put("change_notification", Pattern.compile("we\\s+(?:may|will|reserve\\s+the\\s+right\\s+to)\\s+(?:update|modify|change|revise)\\s+this", flags));
    }

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s'-]");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Map<String, Pattern> KEYWORD_PATTERNS = new java.util.concurrent.ConcurrentHashMap<>();

    static {
        CATEGORIES.forEach(c -> c.keywords().forEach(DocumentClassifier::keywordPattern));
        TYPE_INDICATORS.values().forEach(list -> list.forEach(DocumentClassifier::keywordPattern));
    }

    private final AnalysisClient analysisClient;
    private final AnalysisProperties analysisProperties;

    public DocumentClassifier(AnalysisClient analysisClient, AnalysisProperties analysisProperties) {
        this.analysisClient = analysisClient;
        this.analysisProperties = analysisProperties;
    }

    /**
     * Keyword and structure analysis only.
     */
    public ValidationModels.ClassificationResult classifyDocumentType(String text) {
        if (text == null || text.length() < MIN_TEXT_LENGTH) {
            int length = text == null ? 0 : text.length();
            return new ValidationModels.ClassificationResult(false, 0, DomainModels.DocumentType.OTHER, 0,
                    List.of(), List.of(), false, false,
                    "Text too short (" + length + " chars, minimum " + MIN_TEXT_LENGTH + ")");
        }
        String normalized = normalizeText(text);

        List<ValidationModels.CategoryMatch> matches = new ArrayList<>();
        double weighted = 0;
        double totalWeight = 0;
        for (Category category : CATEGORIES) {
            List<String> found = new ArrayList<>();
            double raw = 0;
            for (String keyword : category.keywords()) {
                int occurrences = count(normalized, keyword);
                if (occurrences > 0) {
                    found.add(keyword);
                    raw += 1 + Math.min(occurrences - 1, 4) * 0.2;
                }
            }
            double score = raw / category.keywords().size();
            if (!found.isEmpty()) matches.add(new ValidationModels.CategoryMatch(category.name(), found, score));
            weighted += score * category.weight();
            totalWeight += category.weight();
        }

        List<String> indicators = STRUCTURE_INDICATORS.entrySet().stream()
                .filter(e -> e.getValue().matcher(text).find())
                .map(Map.Entry::getKey)
                .toList();

        TypeScore type = detectType(normalized);
        double base = weighted / totalWeight;
        double confidence = Math.min(1, base + indicators.size() * 0.05 + type.confidence() * 0.1);
        boolean policy = confidence >= POLICY_THRESHOLD;
        boolean high = confidence >= HIGH_CONFIDENCE_THRESHOLD;

        return new ValidationModels.ClassificationResult(policy, confidence, type.type(), type.confidence(),
                matches, indicators, high, false, reasoning(confidence, policy, high, type.type(), matches));
    }

    /**
     * Keyword analysis, refined by the analysis service when confidence lands in the ambiguous band.
     */
    public ValidationModels.ClassificationResult classify(String text, long timeoutMs) {
        ValidationModels.ClassificationResult basic = classifyDocumentType(text);
        if (!analysisProperties.enabled() || basic.confidence() < AMBIGUOUS_LOW || basic.confidence() >= HIGH_CONFIDENCE_THRESHOLD) {
            return basic;
        }
        Optional<AnalysisClient.Verdict> verdict = analysisClient.analyze(text, timeoutMs);
        if (verdict.isEmpty()) return basic;

        AnalysisClient.Verdict v = verdict.get();
        double combined = basic.confidence() * 0.6 + v.confidence() * 0.4;
        DomainModels.DocumentType type = "not_legal".equals(v.documentType()) ? basic.type() : fromLabel(v.documentType(), basic.type());
        boolean policy = v.legalDocument() || basic.policy();
        log.debug("Analysis service refined confidence {} -> {} ({})", basic.confidence(), combined, v.documentType());
        return new ValidationModels.ClassificationResult(policy, combined, type, basic.typeConfidence(),
                basic.keywordMatches(), basic.structureIndicators(), combined >= HIGH_CONFIDENCE_THRESHOLD, true,
                v.reasoning() == null || v.reasoning().isBlank() ? basic.reasoning() : v.reasoning());
    }

    private record TypeScore(DomainModels.DocumentType type, double confidence) {
    }

    private TypeScore detectType(String normalized) {
        DomainModels.DocumentType best = null;
        double bestScore = -1;
        for (var entry : TYPE_INDICATORS.entrySet()) {
            double score = 0;
            for (String indicator : entry.getValue()) {
                int m = count(normalized, indicator);
                if (m > 0) score += 1 + Math.min(m - 1, 3) * 0.3;
            }
            score = score / entry.getValue().size();
            if (score > bestScore) {
                bestScore = score;
                best = entry.getKey();
            }
        }
        if (bestScore > TYPE_MIN_SCORE) return new TypeScore(best, Math.min(1, bestScore));
        return new TypeScore(DomainModels.DocumentType.OTHER, 0);
    }

    static String normalizeText(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return SPACES.matcher(NON_WORD.matcher(lower).replaceAll(" ")).replaceAll(" ").trim();
    }

    private static int count(String normalized, String keyword) {
        Matcher m = keywordPattern(keyword).matcher(normalized);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static Pattern keywordPattern(String keyword) {
        return KEYWORD_PATTERNS.computeIfAbsent(keyword,
                k -> Pattern.compile("\\b" + Pattern.quote(k.toLowerCase(Locale.ROOT)) + "\\b"));
    }

    private static DomainModels.DocumentType fromLabel(String label, DomainModels.DocumentType fallback) {
        if (label == null) return fallback;
        switch (label) {
            case "privacy_policy":
                return DomainModels.DocumentType.PRIVACY;
            case "terms_of_service":
                return DomainModels.DocumentType.TERMS;
            case "cookie_policy":
                return DomainModels.DocumentType.COOKIE;
            case "data_processing_agreement":
                return DomainModels.DocumentType.DATA_PROCESSING_AGREEMENT;
            default:
                return DomainModels.DocumentType.OTHER;
        }
    }

    private static String reasoning(double confidence, boolean policy, boolean high, DomainModels.DocumentType type,
                                    List<ValidationModels.CategoryMatch> matches) {
        if (high) {
            return "High confidence policy document. Strong matches in: "
                    + matches.stream().map(ValidationModels.CategoryMatch::category).collect(Collectors.joining(", "));
        }
        if (policy) {
            return "Likely a policy document based on keyword analysis. Document appears to be "
                    + (type == DomainModels.DocumentType.OTHER ? "a legal document" : type.label()) + ".";
        }
        if (confidence >= 0.3) {
            return "Some policy-related content detected, but not enough to classify as a policy document.";
        }
        return "Does not appear to be a policy document. Few policy-specific keywords found.";
    }
}
