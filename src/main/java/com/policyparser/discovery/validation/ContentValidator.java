package com.policyparser.discovery.validation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class ContentValidator {
    static final int MIN_LENGTH = 500;
    static final int GARBAGE_MAX_LENGTH = 1000;
    static final int MIN_KEYWORDS = 3;
    // long documents with an embedded sign-in form are still documents
    static final int LOGIN_WALL_MAX_TEXT = 3000;

    private static final List<String> POLICY_KEYWORDS = List.of(
            "privacy", "data", "personal information", "collect", "share",
            "cookies", "rights", "contact us", "policy", "terms");

    private static final List<String> GARBAGE_PHRASES = List.of(
            "enable javascript", "browser not supported", "please update your browser",
            "access denied", "403 forbidden", "404 not found", "captcha",
            "verify you are human", "click here to continue");

    private static final List<String> LOGIN_INDICATORS = List.of(
            "<input type=\"password\"", "<input type='password'", "sign in to continue", "log in to continue",
            "please log in", "login required", "authentication required", "enter your password");

    public boolean isGarbage(String text) {
        if (text == null) return true;
        if (text.length() >= GARBAGE_MAX_LENGTH) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        return GARBAGE_PHRASES.stream().anyMatch(lower::contains);
    }

    public ValidationModels.ValidationResult validate(String text) {
        if (text == null || text.length() < MIN_LENGTH) {
            return ValidationModels.ValidationResult.rejected(ValidationModels.RejectionReason.TOO_SHORT,
                    "content too short (" + (text == null ? 0 : text.length()) + " < " + MIN_LENGTH + " chars)");
        }
        String lower = text.toLowerCase(Locale.ROOT);
        long found = POLICY_KEYWORDS.stream().filter(lower::contains).count();
        if (found < MIN_KEYWORDS) {
            return ValidationModels.ValidationResult.rejected(ValidationModels.RejectionReason.LOW_KEYWORD_DENSITY,
                    "only " + found + " policy keywords present");
        }
        return ValidationModels.ValidationResult.ok();
    }

    /**
     * Full gate for fetched pages: login walls and error pages first, then the text checks.
     */
    public ValidationModels.ValidationResult check(String html, String text) {
        if (isLoginWall(html) && (text == null || text.length() < LOGIN_WALL_MAX_TEXT)) {
            return ValidationModels.ValidationResult.rejected(ValidationModels.RejectionReason.LOGIN_WALL, "page requires sign-in");
        }
        if (isGarbage(text)) {
            return ValidationModels.ValidationResult.rejected(ValidationModels.RejectionReason.GARBAGE, "error or bot-check page");
        }
        return validate(text);
    }

    public boolean isLoginWall(String html) {
        if (html == null) return false;
        String lower = html.toLowerCase(Locale.ROOT);
        return LOGIN_INDICATORS.stream().anyMatch(lower::contains);
    }
}
