package com.dcruver.docguide.markdown;

import lombok.Value;

/**
 * Result of a section mutation: the full re-serialized body and the slug of the section
 * that was written, or {@code null} when the section was removed.
 */
@Value
public class SectionEdit {
    String content;
    String slug;
}
