package com.dcruver.docguide.domain;

import com.dcruver.docguide.address.DocumentAddress;
import com.dcruver.docguide.address.SectionAddress;
import lombok.Value;

/**
 * Outcome of resolving free-form address input: a document, or a section of one.
 */
@Value
public class ResolvedAddress {

    public enum Kind {
        DOCUMENT,
        SECTION
    }

    Kind kind;
    DocumentAddress document;
    SectionAddress section;

    static ResolvedAddress of(DocumentAddress document) {
        return new ResolvedAddress(Kind.DOCUMENT, document, null);
    }

    static ResolvedAddress of(SectionAddress section) {
        return new ResolvedAddress(Kind.SECTION, section.getDocument(), section);
    }

    @Override
    public String toString() {
        return kind == Kind.SECTION ? section.getFullPath() : document.getPath();
    }
}
