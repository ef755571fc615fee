package com.dcruver.docguide.address;

import lombok.Value;

/**
 * A normalized virtual document path with the parts derived from it.
 * Build through {@link AddressParser#parseDocumentAddress(String)}.
 */
@Value
public class DocumentAddress {
    public static final String ROOT_NAMESPACE = "root";

    String path;
    String namespace;
    String slug;
    Namespace area;

    public String getNormalizedPath() {
        return path;
    }

    public String getCacheKey() {
        return path;
    }

    @Override
    public String toString() {
        return path;
    }
}
