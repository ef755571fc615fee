package com.dcruver.docguide.io;

import lombok.Value;

import java.time.Instant;

@Value
public class FileStat {
    Instant lastModified;
    long size;
}
