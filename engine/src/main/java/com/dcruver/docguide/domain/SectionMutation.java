package com.dcruver.docguide.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Payload of a section edit. {@code title} is used by insert and rename operations,
 * {@code depth} optionally overrides the depth of an inserted heading. When
 * {@code expectedModified} is set the write only happens if the file still has that time.
 */
@Value
@Builder
public class SectionMutation {
    SectionOperation operation;
    String title;
    String body;
    Integer depth;
    Instant expectedModified;
    boolean dryRun;
}
