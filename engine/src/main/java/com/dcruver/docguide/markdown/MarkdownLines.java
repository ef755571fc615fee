package com.dcruver.docguide.markdown;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-level view of a Markdown body.
 * Each line keeps its own terminator ({@code \n}, {@code \r\n} or {@code \r}) so that
 * joining a range of lines reproduces the original bytes. Line indices match the
 * source span line indices reported by commonmark.
 */
final class MarkdownLines {

    private MarkdownLines() {
    }

    static List<String> split(String content) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int length = content.length();
        for (int i = 0; i < length; i++) {
            char c = content.charAt(i);
            if (c == '\n') {
                lines.add(content.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < length && content.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(content.substring(start, end));
                start = end;
                i = end - 1;
            }
        }
        if (start < length) {
            lines.add(content.substring(start));
        }
        return lines;
    }

    static String join(List<String> lines, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            sb.append(lines.get(i));
        }
        return sb.toString();
    }

    static boolean endsWithTerminator(String text) {
        return text.endsWith("\n") || text.endsWith("\r");
    }

    /**
     * Drop leading blank lines and trailing whitespace.
     */
    static String trimBlankEdges(String text) {
        List<String> lines = split(text);
        int first = 0;
        while (first < lines.size() && lines.get(first).isBlank()) {
            first++;
        }
        return join(lines, first, lines.size()).stripTrailing();
    }
}
