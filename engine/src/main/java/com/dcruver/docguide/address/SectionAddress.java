package com.dcruver.docguide.address;

import lombok.Value;

/**
 * A section of a document, identified by heading slug.
 */
@Value
public class SectionAddress {
    DocumentAddress document;
    String slug;

    public String getFullPath() {
        return document.getPath() + "#" + slug;
    }

    public String getCacheKey() {
        return getFullPath();
    }

    @Override
    public String toString() {
        return getFullPath();
    }
}
