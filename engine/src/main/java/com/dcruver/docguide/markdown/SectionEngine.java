package com.dcruver.docguide.markdown;

import com.dcruver.docguide.exception.SectionOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and edits heading-delimited sections of a Markdown body.
 * Every mutation parses the input, splices lines and returns a new body; the input string
 * is never modified. Text outside the touched section is copied byte for byte, and the
 * spliced result is parsed again so an edit can never hide or create headings elsewhere.
 */
@Component
@Slf4j
public class SectionEngine {

    public static final int MAX_DEPTH = 6;
    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_BODY_LENGTH = 100_000;
    public static final int MAX_HEADINGS = 1000;

    private final HeadingParser headingParser = new HeadingParser();

    public MarkdownOutline outline(String content) {
        List<String> lines = MarkdownLines.split(content);
        List<Heading> headings = headingParser.parse(content, lines);
        if (headings.size() > MAX_HEADINGS) {
            throw SectionOperationException.tooManyHeadings(headings.size(), MAX_HEADINGS);
        }
        return new MarkdownOutline(content, lines, headings);
    }

    public List<Heading> listHeadings(String content) {
        return outline(content).getHeadings();
    }

    /**
     * Heading line plus body of the section, exactly as written.
     */
    public String readSection(String content, String slug) {
        MarkdownOutline outline = outline(content);
        return outline.sectionText(outline.find(slug));
    }

    /**
     * Body of the section without its heading, leading blank lines or trailing whitespace.
     * Subsections are part of the body.
     */
    public String readSectionBody(String content, String slug) {
        MarkdownOutline outline = outline(content);
        return MarkdownLines.trimBlankEdges(outline.rawBody(outline.find(slug)));
    }

    /**
     * Replace everything below the heading, subsections included. The body may contain
     * headings only if they are deeper than the section's own heading.
     */
    public SectionEdit replaceSectionBody(String content, String slug, String newBody) {
        MarkdownOutline outline = outline(content);
        Heading heading = outline.find(slug);
        String body = checkBody(newBody, heading.getDepth());
        int end = outline.sectionEnd(heading);

        String rebuilt = withTerminator(outline.text(0, heading.getEndLine()))
            + (body.isEmpty() ? "" : "\n" + body + "\n")
            + (end < outline.lineCount() ? "\n" : "")
            + outline.text(end, outline.lineCount());

        List<String> expected = new ArrayList<>();
        outline.getHeadings().subList(0, heading.getIndex() + 1).forEach(h -> expected.add(shape(h)));
        expected.addAll(shapes(body));
        headingsFrom(outline, end).forEach(h -> expected.add(shape(h)));
        verifyHeadings(rebuilt, expected, slug);
        log.debug("Replaced body of section '{}' ({} chars)", slug, body.length());
        return new SectionEdit(rebuilt, slug);
    }

    public SectionEdit appendToSection(String content, String slug, String text) {
        String current = readSectionBody(content, slug);
        String addition = MarkdownLines.trimBlankEdges(text == null ? "" : text);
        String body = current.isEmpty() ? addition : current + "\n\n" + addition;
        return replaceSectionBody(content, slug, body);
    }

    public SectionEdit prependToSection(String content, String slug, String text) {
        String current = readSectionBody(content, slug);
        String addition = MarkdownLines.trimBlankEdges(text == null ? "" : text);
        String body = current.isEmpty() ? addition : addition + "\n\n" + current;
        return replaceSectionBody(content, slug, body);
    }

    public SectionEdit insertRelative(String content, String refSlug, InsertMode mode, String title, String body) {
        return insertRelative(content, refSlug, mode, null, title, body);
    }

    /**
     * Insert a new section next to, or inside, the reference section.
     * Without an explicit depth, siblings take the reference depth and children take
     * reference depth + 1, capped at 6. An explicit depth outside 1..6 is rejected.
     */
    public SectionEdit insertRelative(String content, String refSlug, InsertMode mode,
                                      Integer depth, String title, String body) {
        MarkdownOutline outline = outline(content);
        Heading reference = outline.find(refSlug);

        int newDepth;
        if (depth != null) {
            newDepth = depth;
        } else if (mode == InsertMode.APPEND_CHILD) {
            newDepth = Math.min(MAX_DEPTH, reference.getDepth() + 1);
        } else {
            newDepth = reference.getDepth();
        }
        if (newDepth < 1 || newDepth > MAX_DEPTH) {
            throw SectionOperationException.invalidDepth(newDepth);
        }

        String headingLine = headingLine(newDepth, title);
        String sanitized = checkBody(body, newDepth);
        int at = mode == InsertMode.INSERT_BEFORE ? reference.getStartLine() : outline.sectionEnd(reference);

        String prefix = outline.text(0, at);
        if (!prefix.isEmpty()) {
            prefix = withTerminator(prefix);
            if (!outline.lines().get(at - 1).isBlank()) {
                prefix += "\n";
            }
        }
        String suffix = outline.text(at, outline.lineCount());
        String block = headingLine + "\n" + (sanitized.isEmpty() ? "" : "\n" + sanitized + "\n");
        String result = prefix + block + (suffix.isEmpty() ? "" : "\n" + suffix);

        List<String> expected = new ArrayList<>();
        List<Heading> before = outline.getHeadings().stream().filter(h -> h.getStartLine() < at).toList();
        before.forEach(h -> expected.add(shape(h)));
        expected.addAll(shapes(block));
        headingsFrom(outline, at).forEach(h -> expected.add(shape(h)));
        String slug = verifyHeadings(result, expected, refSlug).get(before.size()).getSlug();
        log.debug("Inserted '{}' at depth {} ({} '{}')", slug, newDepth, mode, refSlug);
        return new SectionEdit(result, slug);
    }

    /**
     * Rewrite the heading line keeping its depth. Setext headings come back as ATX headings.
     * The returned slug may carry a suffix if the new title collides with another heading.
     */
    public SectionEdit renameHeading(String content, String slug, String newTitle) {
        MarkdownOutline outline = outline(content);
        Heading heading = outline.find(slug);
        String line = headingLine(heading.getDepth(), newTitle);
        String lastHeadingLine = outline.lines().get(heading.getEndLine() - 1);

        String result = outline.text(0, heading.getStartLine())
            + line + terminatorOf(lastHeadingLine)
            + outline.text(heading.getEndLine(), outline.lineCount());
        return new SectionEdit(result, slugAtLine(result, heading.getStartLine(), slug));
    }

    /**
     * Remove the section and its subsections. The following heading is kept.
     */
    public SectionEdit deleteSection(String content, String slug) {
        MarkdownOutline outline = outline(content);
        Heading heading = outline.find(slug);
        int end = outline.sectionEnd(heading);

        String prefix = outline.text(0, heading.getStartLine());
        String suffix = outline.text(end, outline.lineCount());
        if (suffix.isEmpty()) {
            String trimmed = prefix.stripTrailing();
            prefix = trimmed.isEmpty() ? "" : trimmed + "\n";
        }
        String result = prefix + suffix;
        if (result.isBlank()) {
            throw SectionOperationException.emptyDocument(slug);
        }
        log.debug("Deleted section '{}' (lines {}-{})", slug, heading.getStartLine(), end);
        return new SectionEdit(result, null);
    }

    public boolean isTaskSection(String slug, List<Heading> headings) {
        return TaskClassifier.isTask(headings, slug);
    }

    private String headingLine(int depth, String title) {
        if (title == null || title.isBlank()) {
            throw SectionOperationException.invalidTitle("title is empty");
        }
        if (title.contains("\n") || title.contains("\r")) {
            throw SectionOperationException.invalidTitle("title must be a single line");
        }
        String trimmed = title.trim();
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw SectionOperationException.invalidTitle("longer than " + MAX_TITLE_LENGTH + " characters");
        }
        return "#".repeat(depth) + " " + trimmed;
    }

    private String checkBody(String body, int sectionDepth) {
        if (body == null) {
            return "";
        }
        if (body.length() > MAX_BODY_LENGTH) {
            throw SectionOperationException.bodyTooLarge(body.length(), MAX_BODY_LENGTH);
        }
        String trimmed = MarkdownLines.trimBlankEdges(body);
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        for (Heading heading : headingParser.parse(trimmed, MarkdownLines.split(trimmed))) {
            if (heading.getDepth() <= sectionDepth) {
                throw new SectionOperationException("INVALID_BODY", "Body heading '" + heading.getTitle()
                    + "' has depth " + heading.getDepth() + ", headings in this body must be deeper than "
                    + sectionDepth);
            }
        }
        return trimmed;
    }

    private String slugAtLine(String content, int line, String editedSlug) {
        return outline(content).getHeadings().stream()
            .filter(h -> h.getStartLine() == line)
            .map(Heading::getSlug)
            .findFirst()
            .orElseThrow(() -> SectionOperationException.structureChanged(editedSlug,
                "no heading at line " + line + " after edit"));
    }

    /**
     * Parse the edited body and compare its headings, by depth and title, with the expected ones.
     *
     * @return headings of the edited body
     */
    private List<Heading> verifyHeadings(String result, List<String> expected, String slug) {
        List<Heading> actual = outline(result).getHeadings();
        List<String> actualShapes = actual.stream().map(SectionEngine::shape).toList();
        if (!actualShapes.equals(expected)) {
            throw SectionOperationException.structureChanged(slug,
                "expected " + expected.size() + " headings, found " + actualShapes.size()
                    + " (check for an unclosed code fence)");
        }
        return actual;
    }

    private List<String> shapes(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        return headingParser.parse(text, MarkdownLines.split(text)).stream().map(SectionEngine::shape).toList();
    }

    private static List<Heading> headingsFrom(MarkdownOutline outline, int line) {
        return outline.getHeadings().stream().filter(h -> h.getStartLine() >= line).toList();
    }

    private static String shape(Heading heading) {
        return heading.getDepth() + " " + heading.getTitle();
    }

    private static String withTerminator(String text) {
        return text.isEmpty() || MarkdownLines.endsWithTerminator(text) ? text : text + "\n";
    }

    private static String terminatorOf(String line) {
        if (line.endsWith("\r\n")) {
            return "\r\n";
        }
        if (line.endsWith("\n") || line.endsWith("\r")) {
            return line.substring(line.length() - 1);
        }
        return "";
    }
}
