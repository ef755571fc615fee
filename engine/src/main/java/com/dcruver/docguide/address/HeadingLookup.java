package com.dcruver.docguide.address;

import com.dcruver.docguide.markdown.Heading;

import java.util.List;

/**
 * Source of the current headings of a document, used to check task placement.
 */
@FunctionalInterface
public interface HeadingLookup {
    List<Heading> headingsOf(DocumentAddress document);
}
