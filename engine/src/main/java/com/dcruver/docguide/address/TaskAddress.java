package com.dcruver.docguide.address;

import lombok.Value;

/**
 * A section that sits under a tasks heading at the time it was resolved.
 */
@Value
public class TaskAddress {
    SectionAddress section;
    String containerSlug;

    public DocumentAddress getDocument() {
        return section.getDocument();
    }

    public String getSlug() {
        return section.getSlug();
    }

    public String getFullPath() {
        return section.getFullPath();
    }

    @Override
    public String toString() {
        return section.getFullPath();
    }
}
