package com.dcruver.docguide.domain;

import com.dcruver.docguide.address.AddressParser;
import com.dcruver.docguide.address.DocumentAddress;
import com.dcruver.docguide.address.SectionAddress;
import com.dcruver.docguide.address.TaskAddress;
import com.dcruver.docguide.cache.AccessContext;
import com.dcruver.docguide.cache.CachedDocument;
import com.dcruver.docguide.cache.DocumentCache;
import com.dcruver.docguide.cache.DocumentWatcher;
import com.dcruver.docguide.exception.DocumentNotFoundException;
import com.dcruver.docguide.exception.SectionNotFoundException;
import com.dcruver.docguide.index.FingerprintIndex;
import com.dcruver.docguide.index.KeywordExtractor;
import com.dcruver.docguide.io.DocumentFileStore;
import com.dcruver.docguide.io.FileSnapshot;
import com.dcruver.docguide.io.SectionDiff;
import com.dcruver.docguide.markdown.InsertMode;
import com.dcruver.docguide.markdown.SectionEdit;
import com.dcruver.docguide.markdown.SectionEngine;
import com.dcruver.docguide.reference.ReferenceForest;
import com.dcruver.docguide.reference.ReferenceLoader;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Entry point for the operations offered to callers: resolve addresses, read documents
 * and sections, edit sections, expand references and search.
 * Owns startup and shutdown of the index and the watcher.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentWorkspace {

    private final AddressParser addressParser;
    private final DocumentCache documentCache;
    private final FingerprintIndex fingerprintIndex;
    private final DocumentWatcher documentWatcher;
    private final SectionEngine sectionEngine;
    private final ReferenceLoader referenceLoader;
    private final DocumentFileStore fileStore;
    private final SectionDiff sectionDiff;

    @PostConstruct
    public void start() {
        try {
            fingerprintIndex.initialize();
        } catch (IOException e) {
            log.error("Failed to build fingerprint index: {}", e.getMessage(), e);
            // Search falls back to an empty candidate set until the next reconcile
        }
        documentWatcher.start();
    }

    @PreDestroy
    public void stop() {
        documentWatcher.stop();
        documentCache.clear();
        addressParser.clearCache();
    }

    /**
     * Resolve {@code /doc.md}, {@code /doc.md#slug}, {@code #slug} or a bare slug.
     * The last two need a context document.
     */
    public ResolvedAddress resolve(String input, String contextDocument) {
        String trimmed = input == null ? "" : input.trim();
        if (trimmed.contains("#")) {
            return ResolvedAddress.of(addressParser.parseSectionAddress(trimmed, contextDocument));
        }
        boolean looksLikePath = trimmed.startsWith("/") || trimmed.toLowerCase(Locale.ROOT).endsWith(".md");
        if (!looksLikePath && contextDocument != null && !contextDocument.isBlank()) {
            return ResolvedAddress.of(addressParser.parseSectionAddress(trimmed, contextDocument));
        }
        return ResolvedAddress.of(addressParser.parseDocumentAddress(trimmed));
    }

    public TaskAddress resolveTask(String input, String contextDocument) {
        return addressParser.parseTaskAddress(input, contextDocument,
            document -> documentCache.getDocument(document, AccessContext.DIRECT).getHeadings());
    }

    public CachedDocument getDocument(String path, AccessContext context) {
        return documentCache.getDocument(path, context);
    }

    public String getSection(String path, String slug) {
        SectionAddress section = addressParser.parseSectionAddress(slug, path);
        CachedDocument document = documentCache.getDocument(section.getDocument(), AccessContext.DIRECT);
        return document.getSection(section.getSlug())
            .orElseThrow(() -> new SectionNotFoundException(section.getSlug(), document.getPath(), document.getSlugs()));
    }

    /**
     * Apply a section edit to the file. The file is read fresh, edited, and written back only
     * if nobody changed it in between; a dry run returns the diff without writing.
     */
    public MutationResult mutateSection(String path, String slug, SectionMutation mutation) {
        DocumentAddress address = addressParser.parseDocumentAddress(path);
        String sectionSlug = addressParser.parseSectionAddress(slug, address.getPath()).getSlug();
        FileSnapshot snapshot = readSnapshot(address);

        SectionEdit edit;
        try {
            edit = apply(snapshot.getContent(), sectionSlug, mutation);
        } catch (SectionNotFoundException e) {
            throw new SectionNotFoundException(e.getSlug(), address.getPath(), e.getAvailableSlugs());
        }
        String diff = sectionDiff.unifiedDiff(snapshot.getContent(), edit.getContent(), address.getPath());

        MutationResult.MutationResultBuilder result = MutationResult.builder()
            .path(address.getPath())
            .operation(mutation.getOperation())
            .slug(edit.getSlug())
            .content(edit.getContent())
            .diff(diff);
        if (mutation.isDryRun()) {
            return result.written(false).lastModified(snapshot.getLastModified()).build();
        }

        Instant expected = mutation.getExpectedModified() != null
            ? mutation.getExpectedModified()
            : snapshot.getLastModified();
        Instant written;
        try {
            written = fileStore.writeIfUnchanged(address, edit.getContent(), expected);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + address.getPath(), e);
        }
        documentCache.invalidate(address.getPath());
        fingerprintIndex.update(address.getPath());
        log.info("{} on {}#{} written", mutation.getOperation(), address.getPath(), sectionSlug);
        return result.written(true).lastModified(written).build();
    }

    public ReferenceForest loadReferenceTree(String content, String baseDocumentPath, Integer depth) {
        String base = baseDocumentPath == null ? null : addressParser.parseDocumentAddress(baseDocumentPath).getPath();
        return referenceLoader.loadReferenceTree(content, base, depth);
    }

    /**
     * Documents matching the query, best first. Candidates come from the fingerprint index
     * and are scored on their full content.
     */
    public List<SearchHit> search(String query) {
        List<String> terms = KeywordExtractor.queryTerms(query);
        List<SearchHit> hits = new ArrayList<>();
        for (String path : fingerprintIndex.findCandidates(query)) {
            CachedDocument document;
            try {
                document = documentCache.getDocument(path, AccessContext.SEARCH);
            } catch (DocumentNotFoundException e) {
                log.debug("Search candidate {} is gone", path);
                fingerprintIndex.remove(path);
                continue;
            } catch (UncheckedIOException e) {
                log.warn("Skipping search candidate {}: {}", path, e.getMessage());
                continue;
            }
            double score = SearchScorer.score(document, terms);
            if (terms.isEmpty() || score > 0) {
                hits.add(new SearchHit(document.getPath(), document.getMetadata().getTitle(), score));
            }
        }
        hits.sort(Comparator.comparingDouble(SearchHit::getScore).reversed()
            .thenComparing(SearchHit::getPath));
        return hits;
    }

    public List<String> searchPaths(String query) {
        return search(query).stream().map(SearchHit::getPath).toList();
    }

    private SectionEdit apply(String content, String slug, SectionMutation mutation) {
        String body = mutation.getBody();
        return switch (mutation.getOperation()) {
            case REPLACE -> sectionEngine.replaceSectionBody(content, slug, body);
            case APPEND -> sectionEngine.appendToSection(content, slug, body);
            case PREPEND -> sectionEngine.prependToSection(content, slug, body);
            case INSERT_BEFORE -> sectionEngine.insertRelative(content, slug, InsertMode.INSERT_BEFORE,
                mutation.getDepth(), mutation.getTitle(), body);
            case INSERT_AFTER -> sectionEngine.insertRelative(content, slug, InsertMode.INSERT_AFTER,
                mutation.getDepth(), mutation.getTitle(), body);
            case APPEND_CHILD -> sectionEngine.insertRelative(content, slug, InsertMode.APPEND_CHILD,
                mutation.getDepth(), mutation.getTitle(), body);
            case RENAME -> sectionEngine.renameHeading(content, slug, mutation.getTitle());
            case REMOVE -> sectionEngine.deleteSection(content, slug);
        };
    }

    private FileSnapshot readSnapshot(DocumentAddress address) {
        try {
            return fileStore.read(address);
        } catch (NoSuchFileException e) {
            throw new DocumentNotFoundException(address.getPath(), fileStore.listSiblings(address));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + address.getPath(), e);
        }
    }
}
