package com.dcruver.docguide.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MutationResult {
    String path;
    SectionOperation operation;
    /** Slug of the written section, null after a removal. */
    String slug;
    String content;
    String diff;
    boolean written;
    Instant lastModified;
}
