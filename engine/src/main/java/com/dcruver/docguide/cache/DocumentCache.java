package com.dcruver.docguide.cache;

import com.dcruver.docguide.address.AddressParser;
import com.dcruver.docguide.address.DocumentAddress;
import com.dcruver.docguide.config.GuideSettings;
import com.dcruver.docguide.exception.DocumentNotFoundException;
import com.dcruver.docguide.exception.InvalidAddressException;
import com.dcruver.docguide.index.FingerprintIndex;
import com.dcruver.docguide.io.ContentHash;
import com.dcruver.docguide.io.DocumentFileStore;
import com.dcruver.docguide.io.FileSnapshot;
import com.dcruver.docguide.io.FileStat;
import com.dcruver.docguide.markdown.Heading;
import com.dcruver.docguide.markdown.MarkdownOutline;
import com.dcruver.docguide.markdown.SectionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Parsed documents keyed by virtual path.
 *
 * Every access stats the file; a changed modification time or size triggers a re-read,
 * and a changed content hash a re-parse. The total number of cached headings is bounded:
 * past the ceiling the entry with the lowest weighted recency is evicted first. Recency is
 * an access tick multiplied by the boost of the access context.
 */
@Component
@Slf4j
public class DocumentCache {

    private final DocumentFileStore fileStore;
    private final SectionEngine sectionEngine;
    private final FingerprintIndex fingerprintIndex;
    private final AddressParser addressParser;
    private final GuideSettings settings;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<CachedDocument>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong clock = new AtomicLong();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong refreshes = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public DocumentCache(DocumentFileStore fileStore, SectionEngine sectionEngine,
                         FingerprintIndex fingerprintIndex, AddressParser addressParser,
                         GuideSettings settings) {
        this.fileStore = fileStore;
        this.sectionEngine = sectionEngine;
        this.fingerprintIndex = fingerprintIndex;
        this.addressParser = addressParser;
        this.settings = settings;
    }

    public CachedDocument getDocument(String path, AccessContext context) {
        return getDocument(addressParser.parseDocumentAddress(path), context);
    }

    /**
     * Cached document for the address, re-read first if the file changed.
     *
     * @throws DocumentNotFoundException if the file does not exist
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public CachedDocument getDocument(DocumentAddress address, AccessContext context) {
        String key = address.getCacheKey();
        FileStat stat = statOrThrow(address);

        Entry entry = entries.get(key);
        if (entry != null && isFresh(entry.document, stat)) {
            hits.incrementAndGet();
            touch(entry, context);
            log.debug("Cache hit for {}", key);
            return entry.document;
        }

        CompletableFuture<CachedDocument> mine = new CompletableFuture<>();
        CompletableFuture<CachedDocument> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            CachedDocument shared = join(running);
            Entry current = entries.get(key);
            if (current != null) {
                touch(current, context);
            }
            return shared;
        }

        try {
            CachedDocument document = refresh(address, entry == null ? null : entry.document);
            Entry fresh = new Entry(document);
            entries.put(key, fresh);
            touch(fresh, context);
            enforceCeiling(key);
            mine.complete(document);
            return document;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Drop one entry and its fingerprint. Unknown or malformed paths are ignored.
     */
    public void invalidate(String path) {
        String key;
        try {
            key = addressParser.parseDocumentAddress(path).getCacheKey();
        } catch (InvalidAddressException e) {
            log.debug("Ignoring invalidation of {}: {}", path, e.getMessage());
            return;
        }
        if (entries.remove(key) != null) {
            log.debug("Invalidated {}", key);
        }
        fingerprintIndex.invalidateDocument(key);
    }

    /**
     * Drop every entry whose path starts with the prefix.
     *
     * @return number of entries removed
     */
    public int invalidateByPrefix(String prefix) {
        List<String> matching = entries.keySet().stream()
            .filter(k -> k.startsWith(prefix))
            .toList();
        matching.forEach(this::invalidate);
        log.debug("Invalidated {} entries under {}", matching.size(), prefix);
        return matching.size();
    }

    /**
     * Compare every entry with its file. Vanished files are dropped with their fingerprint,
     * changed files are dropped and re-fingerprinted. Used while the watcher is unavailable.
     *
     * @return number of entries dropped
     */
    public int validateConsistency() {
        int dropped = 0;
        for (Entry entry : new ArrayList<>(entries.values())) {
            CachedDocument document = entry.document;
            Optional<FileStat> stat;
            try {
                stat = fileStore.stat(document.getAddress());
            } catch (IOException e) {
                log.warn("Could not stat {}: {}", document.getPath(), e.getMessage());
                continue;
            }
            if (stat.isEmpty()) {
                invalidate(document.getPath());
                dropped++;
            } else if (!isFresh(document, stat.get())) {
                entries.remove(document.getCacheKey());
                fingerprintIndex.update(document.getPath());
                dropped++;
            }
        }
        if (dropped > 0) {
            log.info("Consistency check dropped {} stale cache entries", dropped);
        }
        return dropped;
    }

    public boolean isCached(String path) {
        return entries.containsKey(path);
    }

    public List<String> getCachedPaths() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    public CacheStats getStats() {
        CacheStats stats = new CacheStats();
        stats.setDocumentCount(entries.size());
        stats.setTotalHeadings(totalHeadings());
        stats.setMaxTotalHeadings(settings.getMaxTotalHeadings());
        stats.setHits(hits.get());
        stats.setMisses(misses.get());
        stats.setRefreshes(refreshes.get());
        stats.setEvictions(evictions.get());
        return stats;
    }

    public void clear() {
        entries.clear();
        log.info("Cleared document cache");
    }

    private FileStat statOrThrow(DocumentAddress address) {
        Optional<FileStat> stat;
        try {
            stat = fileStore.stat(address);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not stat " + address.getPath(), e);
        }
        if (stat.isEmpty()) {
            throw notFound(address);
        }
        return stat.get();
    }

    private CachedDocument refresh(DocumentAddress address, CachedDocument previous) {
        FileSnapshot snapshot;
        try {
            snapshot = fileStore.read(address);
        } catch (NoSuchFileException e) {
            throw notFound(address);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + address.getPath(), e);
        }

        if (previous != null) {
            String hash = ContentHash.of(snapshot.getContent());
            if (hash.equals(previous.getMetadata().getContentHash())) {
                refreshes.incrementAndGet();
                log.debug("Cache refresh for {}: modified time changed, content did not", address.getPath());
                return previous.withMetadata(previous.getMetadata()
                    .withLastModified(snapshot.getLastModified())
                    .withSize(snapshot.getSize()));
            }
        }

        misses.incrementAndGet();
        log.debug("Cache miss for {}: parsing", address.getPath());
        CachedDocument document = parse(address, snapshot);
        if (previous != null || !fingerprintIndex.contains(address.getPath())) {
            fingerprintIndex.update(address.getPath());
        }
        return document;
    }

    private CachedDocument parse(DocumentAddress address, FileSnapshot snapshot) {
        MarkdownOutline outline = sectionEngine.outline(snapshot.getContent());
        Map<String, String> sections = new LinkedHashMap<>();
        for (Heading heading : outline.getHeadings()) {
            sections.put(heading.getSlug(), outline.sectionText(heading));
        }

        return CachedDocument.builder()
            .address(address)
            .content(snapshot.getContent())
            .headings(outline.getHeadings())
            .sections(Collections.unmodifiableMap(sections))
            .metadata(MetadataExtractor.extract(address.getSlug(), snapshot, outline.getHeadings()))
            .build();
    }

    private void touch(Entry entry, AccessContext context) {
        entry.score = clock.incrementAndGet() * settings.boostFor(context);
    }

    /**
     * Evict lowest scores until the heading total fits. The entry just loaded goes last;
     * a single document larger than the ceiling is returned to its caller but not kept.
     */
    private synchronized void enforceCeiling(String justLoaded) {
        long total = totalHeadings();
        while (total > settings.getMaxTotalHeadings() && !entries.isEmpty()) {
            String victim = null;
            double lowest = Double.MAX_VALUE;
            for (Map.Entry<String, Entry> candidate : entries.entrySet()) {
                if (!candidate.getKey().equals(justLoaded) && candidate.getValue().score < lowest) {
                    lowest = candidate.getValue().score;
                    victim = candidate.getKey();
                }
            }
            if (victim == null) {
                victim = justLoaded;
            }
            Entry removed = entries.remove(victim);
            if (removed == null) {
                break;
            }
            total -= removed.document.getHeadingCount();
            evictions.incrementAndGet();
            log.debug("Evicted {} ({} headings, score {})", victim, removed.document.getHeadingCount(), removed.score);
        }
    }

    private long totalHeadings() {
        return entries.values().stream().mapToLong(e -> e.document.getHeadingCount()).sum();
    }

    private boolean isFresh(CachedDocument document, FileStat stat) {
        DocumentMetadata metadata = document.getMetadata();
        return metadata.getLastModified().equals(stat.getLastModified()) && metadata.getSize() == stat.getSize();
    }

    private DocumentNotFoundException notFound(DocumentAddress address) {
        entries.remove(address.getCacheKey());
        return new DocumentNotFoundException(address.getPath(), fileStore.listSiblings(address));
    }

    private static CachedDocument join(CompletableFuture<CachedDocument> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static final class Entry {
        private final CachedDocument document;
        private volatile double score;

        private Entry(CachedDocument document) {
            this.document = document;
        }
    }
}
