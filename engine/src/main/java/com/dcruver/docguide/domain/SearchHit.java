package com.dcruver.docguide.domain;

import lombok.Value;

@Value
public class SearchHit {
    String path;
    String title;
    double score;
}
