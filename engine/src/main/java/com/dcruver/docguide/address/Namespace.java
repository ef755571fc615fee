package com.dcruver.docguide.address;

/**
 * Physical areas of the document root. Virtual paths under {@code /coordinator} and
 * {@code /archived} live in their own folders, everything else lives under {@code docs}.
 */
public enum Namespace {
    DOCS("docs"),
    COORDINATOR("coordinator"),
    ARCHIVED("archived");

    private final String folder;

    Namespace(String folder) {
        this.folder = folder;
    }

    public String getFolder() {
        return folder;
    }
}
