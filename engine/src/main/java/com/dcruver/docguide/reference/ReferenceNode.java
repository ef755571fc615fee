package com.dcruver.docguide.reference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One reference in a loaded tree. Filled in by {@link ReferenceLoader}; read-only for callers.
 */
@Getter
public class ReferenceNode {

    private final String originalReference;
    private final String target;
    private final String documentPath;
    private final String sectionSlug;
    private final int depth;

    private ResolutionState state = ResolutionState.TRUNCATED;
    private String title;
    @JsonIgnore
    private String content;
    private String message;
    private boolean childrenTruncated;
    private final List<ReferenceNode> children = new ArrayList<>();

    ReferenceNode(NormalizedReference reference, int depth) {
        this.originalReference = reference.getOriginalReference();
        this.target = reference.getTarget();
        this.documentPath = reference.getDocumentPath();
        this.sectionSlug = reference.getSectionSlug();
        this.depth = depth;
    }

    public List<ReferenceNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void resolve(String title, String content) {
        this.state = ResolutionState.RESOLVED;
        this.title = title;
        this.content = content;
    }

    void fail(ResolutionState state, String message) {
        this.state = state;
        this.message = message;
    }

    void addChild(ReferenceNode child) {
        children.add(child);
    }

    void markChildrenTruncated() {
        this.childrenTruncated = true;
    }
}
