package com.dcruver.docguide.markdown;

import lombok.Builder;
import lombok.Value;

/**
 * A heading of a parsed document.
 * {@code startLine} is the first line of the heading block and {@code endLine} the line
 * right after it (setext headings span two lines).
 */
@Value
@Builder
public class Heading {
    int index;
    int depth;
    String title;
    String slug;
    int parentIndex;
    int startLine;
    int endLine;

    public boolean isTopLevel() {
        return parentIndex < 0;
    }
}
