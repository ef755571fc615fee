package com.dcruver.docguide.reference;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Trees of references loaded from one document, with counts over all of them.
 */
@Value
@Builder
public class ReferenceForest {
    List<ReferenceNode> roots;
    int totalNodes;
    int maxDepthReached;
    int resolvedCount;
    int cycleCount;
    int failedCount;
    int truncatedCount;
    boolean truncated;
    long elapsedMillis;

    /**
     * All nodes, breadth first.
     */
    public List<ReferenceNode> flatten() {
        List<ReferenceNode> all = new ArrayList<>();
        Deque<ReferenceNode> queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            ReferenceNode node = queue.poll();
            all.add(node);
            queue.addAll(node.getChildren());
        }
        return all;
    }
}
