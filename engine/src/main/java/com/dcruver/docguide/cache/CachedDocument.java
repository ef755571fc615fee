package com.dcruver.docguide.cache;

import com.dcruver.docguide.address.DocumentAddress;
import com.dcruver.docguide.markdown.Heading;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed view of one document. Built whole on every parse and never patched;
 * {@code sections} maps each heading slug to its section text in document order.
 */
@Value
@Builder
public class CachedDocument {
    DocumentAddress address;
    String content;
    List<Heading> headings;
    Map<String, String> sections;
    @With
    DocumentMetadata metadata;

    public String getPath() {
        return address.getPath();
    }

    public String getCacheKey() {
        return address.getCacheKey();
    }

    public Optional<String> getSection(String slug) {
        return Optional.ofNullable(sections.get(slug));
    }

    public List<String> getSlugs() {
        return List.copyOf(sections.keySet());
    }

    public int getHeadingCount() {
        return headings.size();
    }
}
