package com.dcruver.docguide.markdown;

import java.util.Locale;

/**
 * Where a new section goes relative to an existing heading.
 */
public enum InsertMode {
    INSERT_BEFORE,
    INSERT_AFTER,
    APPEND_CHILD;

    /**
     * Accepts {@code insert_before}, {@code insert-before} and any casing.
     */
    public static InsertMode fromString(String value) {
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
