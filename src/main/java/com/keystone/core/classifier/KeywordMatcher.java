package com.keystone.core.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Case-insensitive keyword matching shared by the classifier and the trigger table.
 */
public final class KeywordMatcher {

    /**
     * Keywords that require word-boundary matching to avoid false positives.
     * Short tokens such as "ci" or "ui" would otherwise match inside unrelated words.
     */
    private static final Set<String> WORD_BOUNDARY_KEYWORDS = Set.of(
            "add", "fix", "bug", "ui", "ux", "ci", "e2e", "prd", "adr", "spec", "test", "tests",
            "docs", "css", "sox", "pii", "sql", "db", "aria", "a11y", "new", "index", "slow");

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private KeywordMatcher() {} // utility class

    public static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    /**
     * Returns the keywords found in {@code text}, in the order given.
     */
    public static List<String> matches(String text, List<String> keywords) {
        String lower = normalize(text);
        if (lower.isEmpty()) {
            return List.of();
        }
        var matched = new ArrayList<String>();
        for (String keyword : keywords) {
            if (matchesKeyword(lower, keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    /**
     * Returns the keywords found in {@code text} as whole words, in the order given. A plain
     * keyword also matches its plural with a trailing "s"; a keyword ending in {@code *} is a
     * stem and matches any word that starts with it.
     */
    public static List<String> matchesWords(String text, List<String> keywords) {
        String lower = normalize(text);
        if (lower.isEmpty()) {
            return List.of();
        }
        var matched = new ArrayList<String>();
        for (String keyword : keywords) {
            if (wordPattern(keyword).matcher(lower).find()) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    public static boolean containsAny(String text, List<String> keywords) {
        return !matches(text, keywords).isEmpty();
    }

    private static boolean matchesKeyword(String lowerText, String keyword) {
        if (WORD_BOUNDARY_KEYWORDS.contains(keyword)) {
            return PATTERNS.computeIfAbsent(keyword, k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b"))
                    .matcher(lowerText).find();
        }
        return lowerText.contains(keyword);
    }

    static Pattern wordPattern(String keyword) {
        return PATTERNS.computeIfAbsent("w:" + keyword, k -> keyword.endsWith("*")
                ? Pattern.compile("\\b" + Pattern.quote(keyword.substring(0, keyword.length() - 1)))
                : Pattern.compile("\\b" + Pattern.quote(keyword) + "s?\\b"));
    }
}
