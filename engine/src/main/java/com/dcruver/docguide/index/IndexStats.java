package com.dcruver.docguide.index;

import lombok.Data;

/**
 * Fingerprint index statistics.
 */
@Data
public class IndexStats {
    private boolean initialized;
    private int documentCount;
    private int keywordCount;
    private int failedDocuments;
    private long lastBuildMillis;
}
