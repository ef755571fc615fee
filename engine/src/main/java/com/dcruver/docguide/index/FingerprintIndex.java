package com.dcruver.docguide.index;

import com.dcruver.docguide.address.AddressParser;
import com.dcruver.docguide.address.DocumentAddress;
import com.dcruver.docguide.config.GuideSettings;
import com.dcruver.docguide.exception.AddressingException;
import com.dcruver.docguide.io.ContentHash;
import com.dcruver.docguide.io.DocumentFileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inverted keyword index over all documents, used to shortlist search candidates
 * without loading whole files. Only the first {@code guide.index.preview-bytes} of each
 * file are read.
 */
@Component
@Slf4j
public class FingerprintIndex {

    private final DocumentFileStore fileStore;
    private final AddressParser addressParser;
    private final int previewBytes;

    private final Map<String, Fingerprint> fingerprints = new HashMap<>();
    private final Map<String, Set<String>> postings = new HashMap<>();

    private boolean initialized;
    private int failedDocuments;
    private long lastBuildMillis;

    public FingerprintIndex(DocumentFileStore fileStore, AddressParser addressParser, GuideSettings settings) {
        this.fileStore = fileStore;
        this.addressParser = addressParser;
        this.previewBytes = settings.getPreviewBytes();
    }

    /**
     * Rebuild from the file system. A document that cannot be read is left out.
     */
    public synchronized void initialize() throws IOException {
        long start = System.currentTimeMillis();
        fingerprints.clear();
        postings.clear();
        failedDocuments = 0;

        for (String path : fileStore.listDocuments()) {
            try {
                put(build(path));
            } catch (IOException | AddressingException e) {
                failedDocuments++;
                log.warn("Skipping {} in fingerprint index: {}", path, e.getMessage());
            }
        }

        initialized = true;
        lastBuildMillis = System.currentTimeMillis() - start;
        log.info("Fingerprint index built: {} documents, {} keywords in {}ms",
            fingerprints.size(), postings.size(), lastBuildMillis);
    }

    /**
     * Documents sharing at least one keyword with the query, in path order.
     * A query with no usable terms returns every document.
     */
    public synchronized List<String> findCandidates(String query) {
        List<String> terms = KeywordExtractor.queryTerms(query);
        if (terms.isEmpty()) {
            return new ArrayList<>(new TreeSet<>(fingerprints.keySet()));
        }

        Set<String> matches = new TreeSet<>();
        for (String term : terms) {
            matches.addAll(postings.getOrDefault(term, Set.of()));
        }
        log.debug("Query '{}' -> terms {} -> {} candidates", query, terms, matches.size());
        return new ArrayList<>(matches);
    }

    public synchronized void invalidateDocument(String path) {
        remove(path);
    }

    public void add(String path) {
        update(path);
    }

    /**
     * Re-derive one document's fingerprint. A missing or unreadable file is removed.
     */
    public synchronized void update(String path) {
        try {
            put(build(path));
        } catch (NoSuchFileException e) {
            remove(path);
        } catch (IOException | AddressingException e) {
            log.warn("Dropping {} from fingerprint index: {}", path, e.getMessage());
            remove(path);
        }
    }

    public synchronized void remove(String path) {
        Fingerprint removed = fingerprints.remove(path);
        if (removed == null) {
            return;
        }
        for (String keyword : removed.getKeywords()) {
            Set<String> paths = postings.get(keyword);
            if (paths != null) {
                paths.remove(path);
                if (paths.isEmpty()) {
                    postings.remove(keyword);
                }
            }
        }
        log.debug("Removed fingerprint for {}", path);
    }

    /**
     * Bring the index in line with the file system: new and changed files are
     * re-fingerprinted, vanished files removed.
     */
    public synchronized void reconcile() throws IOException {
        Set<String> seen = new HashSet<>();
        for (String path : fileStore.listDocuments()) {
            seen.add(path);
            Fingerprint existing = fingerprints.get(path);
            if (existing == null || !existing.getLastModified().equals(lastModified(path))) {
                update(path);
            }
        }
        for (String path : new ArrayList<>(fingerprints.keySet())) {
            if (!seen.contains(path)) {
                remove(path);
            }
        }
    }

    public synchronized boolean contains(String path) {
        return fingerprints.containsKey(path);
    }

    public synchronized Fingerprint getFingerprint(String path) {
        return fingerprints.get(path);
    }

    public synchronized IndexStats getStats() {
        IndexStats stats = new IndexStats();
        stats.setInitialized(initialized);
        stats.setDocumentCount(fingerprints.size());
        stats.setKeywordCount(postings.size());
        stats.setFailedDocuments(failedDocuments);
        stats.setLastBuildMillis(lastBuildMillis);
        return stats;
    }

    private Fingerprint build(String path) throws IOException {
        DocumentAddress address = addressParser.parseDocumentAddress(path);
        Path file = fileStore.toPhysical(address);
        Instant modified = Files.getLastModifiedTime(file).toInstant();
        String preview = fileStore.readPrefix(file, previewBytes);

        return Fingerprint.builder()
            .path(address.getPath())
            .namespace(address.getNamespace())
            .keywords(Collections.unmodifiableSet(
                new LinkedHashSet<>(KeywordExtractor.extract(titleOf(preview, address), preview))))
            .contentHash(ContentHash.of(preview))
            .lastModified(modified)
            .build();
    }

    private void put(Fingerprint fingerprint) {
        remove(fingerprint.getPath());
        fingerprints.put(fingerprint.getPath(), fingerprint);
        for (String keyword : fingerprint.getKeywords()) {
            postings.computeIfAbsent(keyword, k -> new HashSet<>()).add(fingerprint.getPath());
        }
    }

    private Instant lastModified(String path) {
        try {
            return Files.getLastModifiedTime(fileStore.toPhysical(addressParser.parseDocumentAddress(path))).toInstant();
        } catch (IOException | AddressingException e) {
            return Instant.EPOCH;
        }
    }

    private static String titleOf(String preview, DocumentAddress address) {
        for (String line : preview.split("\\R")) {
            if (line.startsWith("#")) {
                return line.replaceFirst("^#+", "").trim();
            }
        }
        return address.getSlug();
    }
}
