package com.dcruver.docguide.markdown;

import java.text.Normalizer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Generates heading slugs for one document.
 * Repeated titles get numeric suffixes in document order: {@code task}, {@code task-1}, {@code task-2}.
 * Use one instance per document parse.
 */
public class Slugger {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s_-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    static final String FALLBACK_SLUG = "section";

    private final Map<String, Integer> occurrences = new HashMap<>();

    public String slug(String title) {
        String base = normalize(title);
        String result = base;
        while (occurrences.containsKey(result)) {
            int next = occurrences.merge(base, 1, Integer::sum);
            result = base + "-" + next;
        }
        occurrences.put(result, 0);
        return result;
    }

    /**
     * Slug of a title without collision handling.
     */
    public static String normalize(String title) {
        String folded = Normalizer.normalize(title == null ? "" : title.trim(), Normalizer.Form.NFD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");
        String slug = PUNCTUATION.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll("");
        slug = WHITESPACE.matcher(slug).replaceAll("-");
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }
}
