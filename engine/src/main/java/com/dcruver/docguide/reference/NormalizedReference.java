package com.dcruver.docguide.reference;

import lombok.Value;

/**
 * A reference resolved against its base document. {@code sectionSlug} is null for a
 * whole-document reference.
 */
@Value
public class NormalizedReference {
    String originalReference;
    String documentPath;
    String sectionSlug;

    public String getTarget() {
        return sectionSlug == null ? documentPath : documentPath + "#" + sectionSlug;
    }
}
