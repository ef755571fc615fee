package com.dcruver.docguide.markdown;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Node;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds the headings of a Markdown body with their line positions.
 * Headings inside fenced or indented code are not headings, commonmark decides that.
 */
class HeadingParser {

    private static final Parser PARSER = Parser.builder()
        .includeSourceSpans(IncludeSourceSpans.BLOCKS)
        .build();

    private static final Pattern ATX_LINE = Pattern.compile("^ {0,3}#{1,6}(?:[ \\t].*|)\\R?$");
    private static final Pattern SETEXT_UNDERLINE = Pattern.compile("^ {0,3}(?:=+|-+)[ \\t]*\\R?$");

    /**
     * Parse headings in document order, assigning slugs with a fresh {@link Slugger}.
     */
    List<Heading> parse(String content, List<String> lines) {
        HeadingCollector collector = new HeadingCollector();
        PARSER.parse(content).accept(collector);

        Slugger slugger = new Slugger();
        List<Heading> headings = new ArrayList<>();
        for (org.commonmark.node.Heading node : collector.nodes) {
            List<SourceSpan> spans = node.getSourceSpans();
            if (spans.isEmpty()) {
                continue;
            }
            int startLine = spans.get(0).getLineIndex();
            int lastLine = spans.get(spans.size() - 1).getLineIndex();
            if (!ATX_LINE.matcher(lines.get(startLine)).matches()
                && lastLine + 1 < lines.size()
                && !SETEXT_UNDERLINE.matcher(lines.get(lastLine)).matches()
                && SETEXT_UNDERLINE.matcher(lines.get(lastLine + 1)).matches()) {
                lastLine++;
            }

            String title = plainText(node);
            int depth = node.getLevel();
            headings.add(Heading.builder()
                .index(headings.size())
                .depth(depth)
                .title(title)
                .slug(slugger.slug(title))
                .parentIndex(findParent(headings, depth))
                .startLine(startLine)
                .endLine(lastLine + 1)
                .build());
        }
        return headings;
    }

    private int findParent(List<Heading> preceding, int depth) {
        for (int i = preceding.size() - 1; i >= 0; i--) {
            if (preceding.get(i).getDepth() < depth) {
                return i;
            }
        }
        return -1;
    }

    private String plainText(Node node) {
        StringBuilder sb = new StringBuilder();
        collectText(node, sb);
        return sb.toString().trim();
    }

    private void collectText(Node node, StringBuilder sb) {
        if (node instanceof Text text) {
            sb.append(text.getLiteral());
        } else if (node instanceof Code code) {
            sb.append(code.getLiteral());
        } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
            sb.append(' ');
        } else {
            Node child = node.getFirstChild();
            while (child != null) {
                collectText(child, sb);
                child = child.getNext();
            }
        }
    }

    private static final class HeadingCollector extends AbstractVisitor {

        private final List<org.commonmark.node.Heading> nodes = new ArrayList<>();

        @Override
        public void visit(org.commonmark.node.Heading heading) {
            nodes.add(heading);
        }
    }
}
