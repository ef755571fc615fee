package com.dcruver.docguide.exception;

import java.util.List;

/** Exception thrown when a slug does not match any heading of a document. */
public class SectionNotFoundException extends AddressingException {

    private final String slug;
    private final String documentPath;
    private final List<String> availableSlugs;

    public SectionNotFoundException(String slug, String documentPath, List<String> availableSlugs) {
        super("SECTION_NOT_FOUND", "Section '" + slug + "' not found"
            + (documentPath != null ? " in " + documentPath : ""));
        this.slug = slug;
        this.documentPath = documentPath;
        this.availableSlugs = List.copyOf(availableSlugs);
    }

    public String getSlug() {
        return slug;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public List<String> getAvailableSlugs() {
        return availableSlugs;
    }
}
