package com.dcruver.docguide.config;

import com.dcruver.docguide.cache.AccessContext;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Settings read once at startup. Immutable for the life of the process.
 */
@Value
@Builder(toBuilder = true)
public class GuideSettings {

    public static final int MIN_REFERENCE_DEPTH = 1;
    public static final int MAX_REFERENCE_DEPTH = 5;
    public static final int DEFAULT_REFERENCE_DEPTH = 3;

    Path docsRoot;

    @Builder.Default
    int referenceDepth = DEFAULT_REFERENCE_DEPTH;

    @Builder.Default
    int maxTotalHeadings = 100_000;

    @Builder.Default
    double directBoost = 1.0;

    @Builder.Default
    double searchBoost = 3.0;

    @Builder.Default
    double referenceBoost = 2.0;

    @Builder.Default
    int maxReferenceNodes = 1000;

    @Builder.Default
    long referenceTimeoutMs = 30_000;

    @Builder.Default
    int addressCacheSize = 1000;

    @Builder.Default
    int previewBytes = 1500;

    @Builder.Default
    boolean watcherEnabled = true;

    @Builder.Default
    int watcherMaxErrors = 3;

    @Builder.Default
    long watcherBackoffBaseMs = 1000;

    public static GuideSettings defaults(Path docsRoot) {
        return builder().docsRoot(docsRoot).build();
    }

    /**
     * Depths outside 1..5 fall back to the default without complaint.
     */
    public static int normalizeDepth(Integer depth) {
        if (depth == null || depth < MIN_REFERENCE_DEPTH || depth > MAX_REFERENCE_DEPTH) {
            return DEFAULT_REFERENCE_DEPTH;
        }
        return depth;
    }

    public double boostFor(AccessContext context) {
        return switch (context) {
            case SEARCH -> searchBoost;
            case REFERENCE -> referenceBoost;
            case DIRECT -> directBoost;
        };
    }
}
