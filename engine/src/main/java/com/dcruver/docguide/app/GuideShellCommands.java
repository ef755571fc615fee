package com.dcruver.docguide.app;

import com.dcruver.docguide.address.TaskAddress;
import com.dcruver.docguide.cache.AccessContext;
import com.dcruver.docguide.cache.CacheStats;
import com.dcruver.docguide.cache.CachedDocument;
import com.dcruver.docguide.cache.DocumentCache;
import com.dcruver.docguide.cache.DocumentWatcher;
import com.dcruver.docguide.domain.DocumentWorkspace;
import com.dcruver.docguide.domain.MutationResult;
import com.dcruver.docguide.domain.ResolvedAddress;
import com.dcruver.docguide.domain.SearchHit;
import com.dcruver.docguide.domain.SectionMutation;
import com.dcruver.docguide.domain.SectionOperation;
import com.dcruver.docguide.exception.DocumentNotFoundException;
import com.dcruver.docguide.exception.NotATaskException;
import com.dcruver.docguide.exception.SectionNotFoundException;
import com.dcruver.docguide.index.FingerprintIndex;
import com.dcruver.docguide.index.IndexStats;
import com.dcruver.docguide.markdown.Heading;
import com.dcruver.docguide.reference.ReferenceForest;
import com.dcruver.docguide.reference.ReferenceNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.List;

/**
 * Spring Shell commands for browsing and editing the document tree.
 */
@ShellComponent
@Slf4j
public class GuideShellCommands {

    private final DocumentWorkspace workspace;
    private final DocumentCache documentCache;
    private final FingerprintIndex fingerprintIndex;
    private final DocumentWatcher documentWatcher;
    private final ObjectMapper objectMapper;

    public GuideShellCommands(DocumentWorkspace workspace, DocumentCache documentCache,
                              FingerprintIndex fingerprintIndex, DocumentWatcher documentWatcher) {
        this.workspace = workspace;
        this.documentCache = documentCache;
        this.fingerprintIndex = fingerprintIndex;
        this.documentWatcher = documentWatcher;
        this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @ShellMethod(key = "resolve", value = "Resolve a document or section address")
    public String resolve(@ShellOption String input,
                          @ShellOption(defaultValue = ShellOption.NULL) String context) {
        try {
            ResolvedAddress address = workspace.resolve(input, context);
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%s: %s\n", address.getKind(), address));
            sb.append(String.format("  Namespace: %s (%s)\n",
                address.getDocument().getNamespace(), address.getDocument().getArea()));
            sb.append(String.format("  Document slug: %s\n", address.getDocument().getSlug()));
            return sb.toString();
        } catch (Exception e) {
            return "Resolve failed: " + describe(e);
        }
    }

    @ShellMethod(key = "task", value = "Resolve a task address")
    public String task(@ShellOption String input,
                       @ShellOption(defaultValue = ShellOption.NULL) String context) {
        try {
            TaskAddress task = workspace.resolveTask(input, context);
            return String.format("Task: %s (under #%s)\n", task.getFullPath(), task.getContainerSlug());
        } catch (Exception e) {
            return "Task lookup failed: " + describe(e);
        }
    }

    @ShellMethod(key = "headings", value = "List the headings of a document")
    public String headings(@ShellOption String path) {
        try {
            CachedDocument document = workspace.getDocument(path, AccessContext.DIRECT);
            StringBuilder sb = new StringBuilder(String.format("%s - %s\n\n",
                document.getPath(), document.getMetadata().getTitle()));
            for (Heading heading : document.getHeadings()) {
                sb.append("  ".repeat(heading.getDepth() - 1))
                    .append(String.format("%s  #%s\n", heading.getTitle(), heading.getSlug()));
            }
            sb.append(String.format("\n%d headings, %d words, %d links, %d code blocks\n",
                document.getHeadingCount(),
                document.getMetadata().getWordCount(),
                document.getMetadata().getLinkCount(),
                document.getMetadata().getCodeBlockCount()));
            return sb.toString();
        } catch (Exception e) {
            return "Headings failed: " + describe(e);
        }
    }

    @ShellMethod(key = "section read", value = "Print one section")
    public String sectionRead(@ShellOption String path, @ShellOption String slug) {
        try {
            return workspace.getSection(path, slug);
        } catch (Exception e) {
            return "Read failed: " + describe(e);
        }
    }

    @ShellMethod(key = "section edit", value = "Edit a section: replace, append, prepend, insert_before, "
        + "insert_after, append_child, rename or remove")
    public String sectionEdit(@ShellOption String path,
                              @ShellOption String slug,
                              @ShellOption String op,
                              @ShellOption(defaultValue = ShellOption.NULL) String title,
                              @ShellOption(defaultValue = ShellOption.NULL) String body,
                              @ShellOption(defaultValue = ShellOption.NULL) Integer depth,
                              @ShellOption(defaultValue = "false") boolean dryRun) {
        try {
            SectionMutation mutation = SectionMutation.builder()
                .operation(SectionOperation.fromString(op))
                .title(title)
                .body(body == null ? null : body.replace("\\n", "\n"))
                .depth(depth)
                .dryRun(dryRun)
                .build();
            MutationResult result = workspace.mutateSection(path, slug, mutation);

            StringBuilder sb = new StringBuilder();
            sb.append(result.isWritten() ? "Written " : "Dry run of ")
                .append(String.format("%s on %s", result.getOperation(), result.getPath()));
            if (result.getSlug() != null) {
                sb.append("#").append(result.getSlug());
            }
            sb.append("\n\n");
            sb.append(result.getDiff().isEmpty() ? "No changes.\n" : result.getDiff() + "\n");
            return sb.toString();
        } catch (Exception e) {
            log.error("Section edit failed", e);
            return "Edit failed: " + describe(e);
        }
    }

    @ShellMethod(key = "refs", value = "Expand the @references of a document")
    public String refs(@ShellOption String path,
                       @ShellOption(defaultValue = ShellOption.NULL) Integer depth,
                       @ShellOption(defaultValue = "false") boolean json) {
        try {
            CachedDocument document = workspace.getDocument(path, AccessContext.DIRECT);
            ReferenceForest forest = workspace.loadReferenceTree(document.getContent(), document.getPath(), depth);
            if (json) {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(forest);
            }

            StringBuilder sb = new StringBuilder(String.format("References of %s:\n\n", document.getPath()));
            for (ReferenceNode node : forest.getRoots()) {
                appendNode(sb, node);
            }
            sb.append(String.format("\n%d nodes, depth %d, %d resolved, %d cyclic, %d failed, %d truncated (%dms)\n",
                forest.getTotalNodes(), forest.getMaxDepthReached(), forest.getResolvedCount(),
                forest.getCycleCount(), forest.getFailedCount(), forest.getTruncatedCount(),
                forest.getElapsedMillis()));
            return sb.toString();
        } catch (Exception e) {
            return "Reference loading failed: " + describe(e);
        }
    }

    @ShellMethod(key = "search", value = "Search documents by keyword")
    public String search(@ShellOption String query) {
        try {
            List<SearchHit> hits = workspace.search(query);
            if (hits.isEmpty()) {
                return "No matching documents.";
            }
            StringBuilder sb = new StringBuilder();
            for (SearchHit hit : hits) {
                sb.append(String.format("%6.1f  %s  (%s)\n", hit.getScore(), hit.getPath(), hit.getTitle()));
            }
            sb.append(String.format("\n%d documents\n", hits.size()));
            return sb.toString();
        } catch (Exception e) {
            return "Search failed: " + describe(e);
        }
    }

    @ShellMethod(key = "stats", value = "Show cache and index statistics")
    public String stats(@ShellOption(defaultValue = "false") boolean json) {
        try {
            CacheStats cache = documentCache.getStats();
            IndexStats index = fingerprintIndex.getStats();
            if (json) {
                return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(List.of(cache, index));
            }

            StringBuilder sb = new StringBuilder("Document cache:\n");
            sb.append(String.format("- Documents: %d\n", cache.getDocumentCount()));
            sb.append(String.format("- Headings: %d / %d\n", cache.getTotalHeadings(), cache.getMaxTotalHeadings()));
            sb.append(String.format("- Hits: %d, misses: %d, refreshes: %d, evictions: %d\n",
                cache.getHits(), cache.getMisses(), cache.getRefreshes(), cache.getEvictions()));
            sb.append("\nFingerprint index:\n");
            sb.append(String.format("- Documents: %d (%d failed)\n", index.getDocumentCount(), index.getFailedDocuments()));
            sb.append(String.format("- Keywords: %d\n", index.getKeywordCount()));
            sb.append(String.format("- Last build: %dms\n", index.getLastBuildMillis()));
            sb.append(String.format("\nWatcher: %s (%d errors)\n",
                documentWatcher.isPollingMode() ? "polling" : "events", documentWatcher.getErrorCount()));
            return sb.toString();
        } catch (Exception e) {
            return "Stats failed: " + describe(e);
        }
    }

    @ShellMethod(key = "cache clear", value = "Drop all cached documents")
    public String cacheClear() {
        documentCache.clear();
        return "Document cache cleared.";
    }

    private void appendNode(StringBuilder sb, ReferenceNode node) {
        sb.append("  ".repeat(node.getDepth() - 1))
            .append(String.format("%s [%s]", node.getTarget(), node.getState()));
        if (node.getTitle() != null) {
            sb.append(" ").append(node.getTitle());
        }
        if (node.isChildrenTruncated()) {
            sb.append(" (more references not loaded)");
        }
        sb.append("\n");
        for (ReferenceNode child : node.getChildren()) {
            appendNode(sb, child);
        }
    }

    private String describe(Exception e) {
        if (e instanceof DocumentNotFoundException notFound && !notFound.getSiblingDocuments().isEmpty()) {
            return e.getMessage() + "\nAvailable: " + String.join(", ", notFound.getSiblingDocuments());
        }
        if (e instanceof SectionNotFoundException notFound && !notFound.getAvailableSlugs().isEmpty()) {
            return e.getMessage() + "\nAvailable: " + String.join(", ", notFound.getAvailableSlugs());
        }
        if (e instanceof NotATaskException notATask && !notATask.getTaskSlugs().isEmpty()) {
            return e.getMessage() + "\nTasks: " + String.join(", ", notATask.getTaskSlugs());
        }
        return e.getMessage();
    }
}
