package com.dcruver.docguide.reference;

public enum ResolutionState {
    RESOLVED,
    DOCUMENT_NOT_FOUND,
    SECTION_NOT_FOUND,
    LOAD_FAILED,
    /** Target is already on the path from the root, not expanded. */
    CYCLE_DETECTED,
    /** Node or time budget ran out before this node was loaded. */
    TRUNCATED;

    public boolean isFailure() {
        return this == DOCUMENT_NOT_FOUND || this == SECTION_NOT_FOUND || this == LOAD_FAILED;
    }
}
