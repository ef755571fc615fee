package com.dcruver.docguide.index;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lowercase keyword extraction shared by fingerprints and queries.
 */
public final class KeywordExtractor {

    public static final int MAX_KEYWORDS = 20;

    static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "for", "with", "this", "that", "will", "can", "are", "you",
        "how", "what", "when", "where", "why", "who", "which", "was", "were", "been",
        "have", "has", "had", "should", "would", "could", "may", "might", "must", "shall",
        "not", "but", "however", "therefore", "thus", "also", "such", "very", "more", "most",
        "much", "many", "some", "any", "all"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?]+$");
    private static final Pattern NOT_A_WORD = Pattern.compile("^[\\d\\W]+$");

    private KeywordExtractor() {
    }

    /**
     * Up to {@link #MAX_KEYWORDS} distinct keywords in order of first appearance.
     */
    public static Set<String> extract(String title, String preview) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String word : tokens(title + " " + preview)) {
            if (keywords.size() >= MAX_KEYWORDS) {
                break;
            }
            if (!NOT_A_WORD.matcher(word).matches()) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    /**
     * Query terms after stop-word filtering. Empty when nothing meaningful is left.
     */
    public static List<String> queryTerms(String query) {
        if (query == null) {
            return List.of();
        }
        return new ArrayList<>(new LinkedHashSet<>(tokens(query)));
    }

    private static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        for (String raw : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            String word = TRAILING_PUNCTUATION.matcher(raw).replaceAll("");
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                tokens.add(word);
            }
        }
        return tokens;
    }
}
