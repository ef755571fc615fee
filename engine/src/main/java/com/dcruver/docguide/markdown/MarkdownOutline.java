package com.dcruver.docguide.markdown;

import com.dcruver.docguide.exception.SectionNotFoundException;

import java.util.List;

/**
 * A Markdown body split into lines together with its headings.
 * A section runs from its heading line up to the next heading of the same or lower depth,
 * or to the end of the document.
 */
public class MarkdownOutline {

    private final String content;
    private final List<String> lines;
    private final List<Heading> headings;

    MarkdownOutline(String content, List<String> lines, List<Heading> headings) {
        this.content = content;
        this.lines = List.copyOf(lines);
        this.headings = List.copyOf(headings);
    }

    public String getContent() {
        return content;
    }

    public List<Heading> getHeadings() {
        return headings;
    }

    public List<String> getSlugs() {
        return headings.stream().map(Heading::getSlug).toList();
    }

    int lineCount() {
        return lines.size();
    }

    List<String> lines() {
        return lines;
    }

    public Heading find(String slug) {
        for (Heading heading : headings) {
            if (heading.getSlug().equals(slug)) {
                return heading;
            }
        }
        throw new SectionNotFoundException(slug, null, getSlugs());
    }

    /**
     * Exclusive end line of the section opened by the given heading.
     */
    public int sectionEnd(Heading heading) {
        for (int i = heading.getIndex() + 1; i < headings.size(); i++) {
            Heading next = headings.get(i);
            if (next.getDepth() <= heading.getDepth()) {
                return next.getStartLine();
            }
        }
        return lines.size();
    }

    /**
     * Heading and body of a section.
     */
    public String sectionText(Heading heading) {
        return text(heading.getStartLine(), sectionEnd(heading));
    }

    /**
     * Everything after the heading block up to the end of the section, untouched.
     */
    public String rawBody(Heading heading) {
        return text(heading.getEndLine(), sectionEnd(heading));
    }

    /**
     * Text before the first heading.
     */
    public String preamble() {
        return headings.isEmpty() ? content : text(0, headings.get(0).getStartLine());
    }

    String text(int fromLine, int toLine) {
        return MarkdownLines.join(lines, fromLine, toLine);
    }
}
