package com.dcruver.docguide.domain;

import com.dcruver.docguide.cache.CachedDocument;
import com.dcruver.docguide.markdown.Heading;

import java.util.List;
import java.util.Locale;

/**
 * Lexical relevance of a loaded document for a set of query terms.
 * Title hits weigh most, then headings by how shallow they are, then body occurrences.
 */
final class SearchScorer {

    private static final double TITLE_WEIGHT = 20.0;
    private static final double HEADING_WEIGHT = 1.5;
    private static final int MAX_BODY_HITS_PER_TERM = 10;

    private SearchScorer() {
    }

    static double score(CachedDocument document, List<String> terms) {
        String title = document.getMetadata().getTitle().toLowerCase(Locale.ROOT);
        String content = document.getContent().toLowerCase(Locale.ROOT);
        double score = 0;

        for (String term : terms) {
            if (title.contains(term)) {
                score += TITLE_WEIGHT;
            }
            for (Heading heading : document.getHeadings()) {
                if (heading.getTitle().toLowerCase(Locale.ROOT).contains(term)) {
                    score += HEADING_WEIGHT * (7 - heading.getDepth());
                }
            }
            score += occurrences(content, term);
        }
        return score;
    }

    private static int occurrences(String content, String term) {
        int count = 0;
        int from = content.indexOf(term);
        while (from >= 0 && count < MAX_BODY_HITS_PER_TERM) {
            count++;
            from = content.indexOf(term, from + term.length());
        }
        return count;
    }
}
