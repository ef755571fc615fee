package com.dcruver.docguide.domain;

import java.util.Locale;

public enum SectionOperation {
    REPLACE,
    APPEND,
    PREPEND,
    INSERT_BEFORE,
    INSERT_AFTER,
    APPEND_CHILD,
    RENAME,
    REMOVE;

    public static SectionOperation fromString(String value) {
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
