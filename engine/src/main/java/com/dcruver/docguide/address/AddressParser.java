package com.dcruver.docguide.address;

import com.dcruver.docguide.config.GuideSettings;
import com.dcruver.docguide.exception.InvalidAddressException;
import com.dcruver.docguide.exception.NotATaskException;
import com.dcruver.docguide.exception.SectionNotFoundException;
import com.dcruver.docguide.markdown.Heading;
import com.dcruver.docguide.markdown.TaskClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses document, section and task addresses from the forms callers type:
 * {@code /api/auth.md}, {@code /api/auth.md#overview}, {@code #overview} or {@code overview}.
 * The last two need a context document.
 */
@Component
@Slf4j
public class AddressParser {

    private static final String EXTENSION = ".md";

    private final PathResolver pathResolver;
    private final LruMemo<String, DocumentAddress> documents;
    private final LruMemo<String, SectionAddress> sections;

    public AddressParser(PathResolver pathResolver, GuideSettings settings) {
        this.pathResolver = pathResolver;
        this.documents = new LruMemo<>(settings.getAddressCacheSize());
        this.sections = new LruMemo<>(settings.getAddressCacheSize());
    }

    public DocumentAddress parseDocumentAddress(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidAddressException(String.valueOf(path), "document path is empty");
        }
        return documents.computeIfAbsent(path, this::buildDocumentAddress);
    }

    public SectionAddress parseSectionAddress(String input, String contextDocument) {
        if (input == null || input.isBlank()) {
            throw new InvalidAddressException(String.valueOf(input), "section reference is empty");
        }
        String key = input + "|" + (contextDocument == null ? "" : contextDocument);
        return sections.computeIfAbsent(key, k -> buildSectionAddress(input.trim(), contextDocument));
    }

    /**
     * Section address that must sit under a tasks heading in the document's current structure.
     * Never memoized, placement can change with every edit.
     */
    public TaskAddress parseTaskAddress(String input, String contextDocument, HeadingLookup lookup) {
        SectionAddress section = parseSectionAddress(input, contextDocument);
        List<Heading> headings = lookup.headingsOf(section.getDocument());

        Heading heading = headings.stream()
            .filter(h -> h.getSlug().equals(section.getSlug()))
            .findFirst()
            .orElseThrow(() -> new SectionNotFoundException(section.getSlug(), section.getDocument().getPath(),
                headings.stream().map(Heading::getSlug).toList()));

        if (!TaskClassifier.isTask(headings, heading)) {
            throw new NotATaskException(section.getSlug(), section.getDocument().getPath(),
                TaskClassifier.taskSlugs(headings));
        }
        return new TaskAddress(section, headings.get(heading.getParentIndex()).getSlug());
    }

    public int getCachedAddressCount() {
        return documents.size() + sections.size();
    }

    public void clearCache() {
        documents.clear();
        sections.clear();
    }

    private DocumentAddress buildDocumentAddress(String input) {
        String path = input.trim();
        if (path.indexOf('\\') >= 0 || path.indexOf('\0') >= 0 || path.startsWith("~")) {
            throw new InvalidAddressException(input, "path contains forbidden characters");
        }

        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new InvalidAddressException(input, "traversal segments are not allowed");
            }
            segments.add(segment);
        }
        if (segments.isEmpty()) {
            throw new InvalidAddressException(input, "path names no document");
        }

        int last = segments.size() - 1;
        String fileName = segments.get(last);
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(EXTENSION) || fileName.length() == EXTENSION.length()) {
            throw new InvalidAddressException(input, "path must name a " + EXTENSION + " document");
        }
        String slug = fileName.substring(0, fileName.length() - EXTENSION.length());
        segments.set(last, slug + EXTENSION);

        String normalized = "/" + String.join("/", segments);
        String namespace = last == 0 ? DocumentAddress.ROOT_NAMESPACE : String.join("/", segments.subList(0, last));
        log.debug("Parsed document address {} -> {}", input, normalized);
        return new DocumentAddress(normalized, namespace, slug, pathResolver.classify(normalized));
    }

    private SectionAddress buildSectionAddress(String input, String contextDocument) {
        String documentPart;
        String slug;
        int hash = input.indexOf('#');
        if (hash >= 0) {
            documentPart = input.substring(0, hash).trim();
            slug = input.substring(hash + 1).trim();
        } else if (input.toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            throw new InvalidAddressException(input, "document path given where a section is required");
        } else {
            documentPart = "";
            slug = input;
        }

        if (slug.isEmpty()) {
            throw new InvalidAddressException(input, "section slug is empty");
        }
        if (slug.contains("/") || slug.contains("#") || slug.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidAddressException(input, "'" + slug + "' is not a section slug");
        }

        DocumentAddress document;
        if (!documentPart.isEmpty()) {
            document = parseDocumentAddress(documentPart);
        } else if (contextDocument != null && !contextDocument.isBlank()) {
            document = parseDocumentAddress(contextDocument);
        } else {
            throw new InvalidAddressException(input, "a context document is required for a bare section reference");
        }
        return new SectionAddress(document, slug);
    }
}
