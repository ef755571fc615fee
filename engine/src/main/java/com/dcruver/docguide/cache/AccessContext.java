package com.dcruver.docguide.cache;

/**
 * Why a document was fetched. Search and reference accesses keep an entry cached longer
 * than a direct read; the multipliers come from {@code guide.cache.boost.*}.
 */
public enum AccessContext {
    DIRECT,
    SEARCH,
    REFERENCE
}
