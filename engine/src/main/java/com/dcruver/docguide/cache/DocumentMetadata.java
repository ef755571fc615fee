package com.dcruver.docguide.cache;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

@Value
@Builder
public class DocumentMetadata {
    String title;
    int wordCount;
    int linkCount;
    int codeBlockCount;
    String contentHash;
    @With
    long size;
    @With
    Instant lastModified;
}
