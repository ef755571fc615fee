package com.dcruver.docguide.index;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Keyword summary of a document built from the start of its file.
 */
@Value
@Builder
public class Fingerprint {
    String path;
    String namespace;
    Set<String> keywords;
    String contentHash;
    Instant lastModified;
}
