package com.dcruver.docguide.cache;

import com.dcruver.docguide.address.PathResolver;
import com.dcruver.docguide.config.GuideSettings;
import com.dcruver.docguide.index.FingerprintIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the document cache and fingerprint index in step with the file system.
 *
 * A background thread consumes {@link WatchService} events. When the watch loop fails it
 * is restarted after an exponential backoff; after {@code guide.watcher.max-errors}
 * failures the watcher gives up for good and a scheduled poll compares the cache with
 * the files instead.
 */
@Component
@Slf4j
public class DocumentWatcher {

    private static final String EXTENSION = ".md";

    private final PathResolver pathResolver;
    private final DocumentCache documentCache;
    private final FingerprintIndex fingerprintIndex;
    private final GuideSettings settings;

    private final Map<WatchKey, Path> watchedDirectories = new ConcurrentHashMap<>();

    private volatile boolean running;
    private volatile boolean pollingMode;
    private volatile int errorCount;
    private volatile WatchService watchService;
    private Thread thread;

    public DocumentWatcher(PathResolver pathResolver, DocumentCache documentCache,
                           FingerprintIndex fingerprintIndex, GuideSettings settings) {
        this.pathResolver = pathResolver;
        this.documentCache = documentCache;
        this.fingerprintIndex = fingerprintIndex;
        this.settings = settings;
    }

    public synchronized void start() {
        if (running || pollingMode) {
            return;
        }
        if (!settings.isWatcherEnabled()) {
            log.info("File watcher disabled, checking documents by polling");
            pollingMode = true;
            return;
        }
        running = true;
        thread = new Thread(this::watchLoop, "doc-guide-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} for document changes", pathResolver.getRoot());
    }

    public synchronized void stop() {
        running = false;
        closeWatchService();
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
        log.info("File watcher stopped");
    }

    /**
     * Scheduled consistency check. Does nothing until the watcher has fallen back to polling.
     */
    @Scheduled(fixedDelayString = "${guide.watcher.poll-interval-ms:30000}")
    public void poll() {
        if (!pollingMode) {
            return;
        }
        documentCache.validateConsistency();
        try {
            fingerprintIndex.reconcile();
        } catch (IOException e) {
            log.warn("Polling could not list documents: {}", e.getMessage());
        }
    }

    public boolean isPollingMode() {
        return pollingMode;
    }

    public int getErrorCount() {
        return errorCount;
    }

    /**
     * Apply one change to the cache and index.
     */
    void handleChange(WatchEvent.Kind<?> kind, Path file) {
        if (!file.getFileName().toString().endsWith(EXTENSION)) {
            return;
        }
        Optional<String> virtualPath = pathResolver.toVirtual(file);
        if (virtualPath.isEmpty()) {
            return;
        }
        String path = virtualPath.get();
        documentCache.invalidate(path);
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            fingerprintIndex.remove(path);
            log.debug("Document removed: {}", path);
        } else {
            fingerprintIndex.update(path);
            log.debug("Document changed: {}", path);
        }
    }

    /**
     * Apply every document already inside a newly created directory. Files written before the
     * directory was registered produce no events of their own.
     */
    void scanNewDirectory(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(start) && dir.getFileName().toString().startsWith(".")) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                handleChange(StandardWatchEventKinds.ENTRY_CREATE, file);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Count a failure of the watch loop.
     *
     * @return milliseconds to wait before restarting, or -1 once polling has taken over
     */
    long recordFailure(Exception e) {
        errorCount++;
        log.warn("File watcher error {} of {}: {}", errorCount, settings.getWatcherMaxErrors(), e.getMessage());
        if (errorCount >= settings.getWatcherMaxErrors()) {
            enterPollingMode();
            return -1;
        }
        return settings.getWatcherBackoffBaseMs() * (1L << (errorCount - 1));
    }

    private void enterPollingMode() {
        pollingMode = true;
        running = false;
        closeWatchService();
        log.error("File watcher failed {} times, falling back to polling for the rest of this run", errorCount);
    }

    private void watchLoop() {
        while (running) {
            try {
                runWatchService();
            } catch (ClosedWatchServiceException e) {
                if (!running) {
                    return;
                }
                closeWatchService();
                if (!backOff(recordFailure(e))) {
                    return;
                }
            } catch (IOException | RuntimeException e) {
                if (!running) {
                    return;
                }
                closeWatchService();
                if (!backOff(recordFailure(e))) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private boolean backOff(long delayMs) {
        if (delayMs < 0 || !running) {
            return false;
        }
        try {
            Thread.sleep(delayMs);
            return running;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void runWatchService() throws IOException, InterruptedException {
        Path root = pathResolver.getRoot();
        WatchService service = FileSystems.getDefault().newWatchService();
        watchService = service;
        watchedDirectories.clear();
        registerTree(service, root);

        while (running) {
            WatchKey key = service.take();
            Path dir = watchedDirectories.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                WatchEvent.Kind<?> kind = event.kind();
                if (kind == StandardWatchEventKinds.OVERFLOW) {
                    log.warn("Watch events overflowed, re-validating cache");
                    documentCache.validateConsistency();
                    fingerprintIndex.reconcile();
                    continue;
                }
                if (dir == null) {
                    continue;
                }
                Path changed = dir.resolve((Path) event.context());
                if (kind == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(changed)) {
                    registerTree(service, changed);
                    scanNewDirectory(changed);
                } else {
                    handleChange(kind, changed);
                }
            }
            if (!key.reset()) {
                watchedDirectories.remove(key);
            }
        }
    }

    private void registerTree(WatchService service, Path start) throws IOException {
        if (!Files.isDirectory(start)) {
            throw new IOException("Not a directory: " + start);
        }
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(start) && dir.getFileName().toString().startsWith(".")) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(service,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
                watchedDirectories.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void closeWatchService() {
        WatchService current = watchService;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (IOException e) {
            log.warn("Could not close watch service: {}", e.getMessage());
        }
        watchService = null;
    }
}
