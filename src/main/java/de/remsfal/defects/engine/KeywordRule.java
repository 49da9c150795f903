package de.remsfal.defects.engine;

import java.util.Locale;
import java.util.regex.Pattern;

public record KeywordRule(DefectCategory category, String keyword, Severity severity) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public KeywordRule {
        if (category == null) {
            throw new IllegalArgumentException("category is missing for keyword '" + keyword + "'");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity is missing for keyword '" + keyword + "'");
        }
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword is missing/empty for category " + category);
        }
        // sentences are matched whitespace-collapsed
        keyword = WHITESPACE.matcher(keyword.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public static KeywordRule of(DefectCategory category, String keyword, Severity severity) {
        return new KeywordRule(category, keyword, severity);
    }

    public int wordCount() {
        return keyword.split(" ").length;
    }
}
