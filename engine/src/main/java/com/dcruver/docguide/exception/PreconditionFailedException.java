package com.dcruver.docguide.exception;

import java.time.Instant;

/** Exception thrown when a write targets a document that changed after it was read. */
public class PreconditionFailedException extends AddressingException {

    private final String path;
    private final Instant expectedModified;
    private final Instant actualModified;

    public PreconditionFailedException(String path, Instant expectedModified, Instant actualModified) {
        super("PRECONDITION_FAILED", "Document " + path + " changed since it was read (expected "
            + expectedModified + ", found " + actualModified + "); re-read and retry");
        this.path = path;
        this.expectedModified = expectedModified;
        this.actualModified = actualModified;
    }

    public String getPath() {
        return path;
    }

    public Instant getExpectedModified() {
        return expectedModified;
    }

    public Instant getActualModified() {
        return actualModified;
    }
}
