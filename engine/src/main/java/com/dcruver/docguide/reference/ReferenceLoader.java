package com.dcruver.docguide.reference;

import com.dcruver.docguide.cache.AccessContext;
import com.dcruver.docguide.cache.CachedDocument;
import com.dcruver.docguide.cache.DocumentCache;
import com.dcruver.docguide.config.GuideSettings;
import com.dcruver.docguide.exception.DocumentNotFoundException;
import com.dcruver.docguide.exception.InvalidAddressException;
import com.dcruver.docguide.exception.SectionOperationException;
import com.dcruver.docguide.markdown.Heading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Loads referenced documents level by level into a forest of {@link ReferenceNode}s.
 *
 * The traversal is a breadth-first worklist sharing one node counter and one deadline.
 * A node whose document already appears between the root and the node is marked as a
 * cycle and not expanded; the same document can still be expanded in another branch.
 * When a budget runs out the remaining nodes stay {@link ResolutionState#TRUNCATED}.
 */
@Component
@Slf4j
public class ReferenceLoader {

    private final DocumentCache documentCache;
    private final ReferenceExtractor extractor;
    private final GuideSettings settings;
    private final Clock clock;

    @Autowired
    public ReferenceLoader(DocumentCache documentCache, ReferenceExtractor extractor, GuideSettings settings) {
        this(documentCache, extractor, settings, Clock.systemUTC());
    }

    public ReferenceLoader(DocumentCache documentCache, ReferenceExtractor extractor,
                           GuideSettings settings, Clock clock) {
        this.documentCache = documentCache;
        this.extractor = extractor;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Extract, normalize and load the references of a piece of content.
     *
     * @param depth levels to load, 1..5; anything else uses the configured default
     */
    public ReferenceForest loadReferenceTree(String content, String baseDocumentPath, Integer depth) {
        List<NormalizedReference> refs = extractor.normalizeReferences(
            extractor.extractReferences(content), baseDocumentPath);
        return loadReferences(refs, depth, baseDocumentPath);
    }

    public ReferenceForest loadReferences(List<NormalizedReference> refs, Integer depth) {
        return loadReferences(refs, depth, null);
    }

    /**
     * @param rootDocumentPath document the references came from; counts as the first
     *                         ancestor for cycle detection, may be null
     */
    public ReferenceForest loadReferences(List<NormalizedReference> refs, Integer depth, String rootDocumentPath) {
        int maxDepth = depth == null ? settings.getReferenceDepth() : GuideSettings.normalizeDepth(depth);
        long started = clock.millis();
        long deadline = started + settings.getReferenceTimeoutMs();
        int maxNodes = settings.getMaxReferenceNodes();

        Traversal traversal = new Traversal();
        Set<String> rootAncestors = new HashSet<>();
        if (rootDocumentPath != null) {
            rootAncestors.add(rootDocumentPath);
        }

        List<ReferenceNode> roots = new ArrayList<>();
        Deque<WorkItem> worklist = new ArrayDeque<>();
        for (NormalizedReference ref : refs) {
            if (traversal.created >= maxNodes) {
                traversal.truncated = true;
                break;
            }
            ReferenceNode node = new ReferenceNode(ref, 1);
            traversal.created++;
            roots.add(node);
            worklist.add(new WorkItem(node, rootAncestors));
        }

        while (!worklist.isEmpty()) {
            WorkItem item = worklist.poll();
            ReferenceNode node = item.node;
            if (clock.millis() > deadline) {
                traversal.truncated = true;
                log.debug("Reference time budget exhausted at {}", node.getTarget());
                continue;
            }
            traversal.maxDepth = Math.max(traversal.maxDepth, node.getDepth());

            if (item.ancestors.contains(node.getDocumentPath())) {
                node.fail(ResolutionState.CYCLE_DETECTED, "Already loaded on this branch: " + node.getDocumentPath());
                continue;
            }
            Optional<String> content = resolve(node);
            if (content.isEmpty() || node.getDepth() >= maxDepth) {
                continue;
            }

            List<NormalizedReference> childRefs = extractor.normalizeReferences(
                extractor.extractReferences(content.get()), node.getDocumentPath());
            Set<String> childAncestors = new HashSet<>(item.ancestors);
            childAncestors.add(node.getDocumentPath());
            for (NormalizedReference childRef : childRefs) {
                if (traversal.created >= maxNodes) {
                    node.markChildrenTruncated();
                    traversal.truncated = true;
                    break;
                }
                ReferenceNode child = new ReferenceNode(childRef, node.getDepth() + 1);
                traversal.created++;
                node.addChild(child);
                worklist.add(new WorkItem(child, childAncestors));
            }
        }

        ReferenceForest.ReferenceForestBuilder forest = ReferenceForest.builder()
            .roots(roots)
            .totalNodes(traversal.created)
            .maxDepthReached(traversal.maxDepth)
            .truncated(traversal.truncated)
            .elapsedMillis(clock.millis() - started);
        countStates(roots, forest);
        ReferenceForest result = forest.build();
        log.debug("Loaded {} reference nodes to depth {} in {}ms (truncated: {})",
            result.getTotalNodes(), result.getMaxDepthReached(), result.getElapsedMillis(), result.isTruncated());
        return result;
    }

    private Optional<String> resolve(ReferenceNode node) {
        CachedDocument document;
        try {
            document = documentCache.getDocument(node.getDocumentPath(), AccessContext.REFERENCE);
        } catch (DocumentNotFoundException | InvalidAddressException e) {
            node.fail(ResolutionState.DOCUMENT_NOT_FOUND, e.getMessage());
            return Optional.empty();
        } catch (UncheckedIOException | SectionOperationException e) {
            log.warn("Could not load referenced document {}: {}", node.getDocumentPath(), e.getMessage());
            node.fail(ResolutionState.LOAD_FAILED, e.getMessage());
            return Optional.empty();
        }

        if (node.getSectionSlug() == null) {
            node.resolve(document.getMetadata().getTitle(), document.getContent());
            return Optional.of(document.getContent());
        }
        Optional<String> section = document.getSection(node.getSectionSlug());
        if (section.isEmpty()) {
            node.fail(ResolutionState.SECTION_NOT_FOUND, "Section '" + node.getSectionSlug() + "' not found in "
                + node.getDocumentPath() + "; available: " + String.join(", ", document.getSlugs()));
            return Optional.empty();
        }
        String title = document.getHeadings().stream()
            .filter(h -> h.getSlug().equals(node.getSectionSlug()))
            .map(Heading::getTitle)
            .findFirst()
            .orElse(node.getSectionSlug());
        node.resolve(title, section.get());
        return section;
    }

    private static void countStates(List<ReferenceNode> roots, ReferenceForest.ReferenceForestBuilder forest) {
        int resolved = 0;
        int cycles = 0;
        int failed = 0;
        int truncated = 0;
        Deque<ReferenceNode> queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            ReferenceNode node = queue.poll();
            switch (node.getState()) {
                case RESOLVED -> resolved++;
                case CYCLE_DETECTED -> cycles++;
                case TRUNCATED -> truncated++;
                default -> failed++;
            }
            queue.addAll(node.getChildren());
        }
        forest.resolvedCount(resolved).cycleCount(cycles).failedCount(failed).truncatedCount(truncated);
    }

    private static final class Traversal {
        private int created;
        private int maxDepth;
        private boolean truncated;
    }

    private record WorkItem(ReferenceNode node, Set<String> ancestors) {
    }
}
