package com.dcruver.docguide.cache;

import com.dcruver.docguide.io.ContentHash;
import com.dcruver.docguide.io.FileSnapshot;
import com.dcruver.docguide.markdown.Heading;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives {@link DocumentMetadata} from document text.
 */
final class MetadataExtractor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]+\\)");
    private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");

    private MetadataExtractor() {
    }

    static DocumentMetadata extract(String fileSlug, FileSnapshot snapshot, List<Heading> headings) {
        String content = snapshot.getContent();
        String title = headings.isEmpty() ? fileSlug : headings.get(0).getTitle();
        String trimmed = content.trim();

        return DocumentMetadata.builder()
            .title(title)
            .wordCount(trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length)
            .linkCount(count(LINK, content))
            .codeBlockCount(count(CODE_BLOCK, content))
            .contentHash(ContentHash.of(content))
            .size(snapshot.getSize())
            .lastModified(snapshot.getLastModified())
            .build();
    }

    private static int count(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
