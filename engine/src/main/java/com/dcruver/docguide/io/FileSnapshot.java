package com.dcruver.docguide.io;

import lombok.Value;

import java.time.Instant;

/**
 * Content of a document together with the modification time it was read at.
 * Writes use the time as their precondition.
 */
@Value
public class FileSnapshot {
    String path;
    String content;
    Instant lastModified;
    long size;
}
