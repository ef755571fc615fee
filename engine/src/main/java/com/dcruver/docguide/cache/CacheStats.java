package com.dcruver.docguide.cache;

import lombok.Data;

/**
 * Document cache statistics.
 */
@Data
public class CacheStats {
    private int documentCount;
    private long totalHeadings;
    private int maxTotalHeadings;
    private long hits;
    private long misses;
    private long refreshes;
    private long evictions;
}
