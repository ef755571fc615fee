package com.dcruver.docguide.io;

import com.dcruver.docguide.address.DocumentAddress;
import com.dcruver.docguide.address.PathResolver;
import com.dcruver.docguide.exception.PreconditionFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File system access for documents, by virtual path.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentFileStore {

    private static final String EXTENSION = ".md";

    private final PathResolver pathResolver;

    public Path toPhysical(DocumentAddress address) {
        return pathResolver.toPhysical(address.getPath());
    }

    public Optional<FileStat> stat(DocumentAddress address) throws IOException {
        Path file = toPhysical(address);
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            if (!attributes.isRegularFile()) {
                return Optional.empty();
            }
            return Optional.of(new FileStat(attributes.lastModifiedTime().toInstant(), attributes.size()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    /**
     * Read the whole document.
     *
     * @throws NoSuchFileException if the document does not exist
     */
    public FileSnapshot read(DocumentAddress address) throws IOException {
        Path file = toPhysical(address);
        Instant lastModified = Files.getLastModifiedTime(file).toInstant();
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return new FileSnapshot(address.getPath(), content, lastModified, Files.size(file));
    }

    /**
     * Read at most {@code maxBytes} from the start of a file. A multi-byte character cut at the
     * boundary decodes as a replacement character.
     */
    public String readPrefix(Path file, int maxBytes) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] bytes = in.readNBytes(maxBytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    /**
     * Write new content only if the file still has the given modification time.
     * Content goes to a temporary sibling first and is then moved over the original.
     *
     * @return modification time after the write
     */
    public Instant writeIfUnchanged(DocumentAddress address, String content, Instant expectedModified)
            throws IOException {
        Path file = toPhysical(address);
        Instant actual = Files.exists(file) ? Files.getLastModifiedTime(file).toInstant() : null;
        if (expectedModified != null && !expectedModified.equals(actual)) {
            throw new PreconditionFailedException(address.getPath(), expectedModified, actual);
        }

        Files.createDirectories(file.getParent());
        Path temp = Files.createTempFile(file.getParent(), "." + file.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Wrote {} ({} chars)", address.getPath(), content.length());
        return Files.getLastModifiedTime(file).toInstant();
    }

    /**
     * Physical paths of every Markdown document under the root, skipping dot-directories.
     */
    public List<Path> listDocumentFiles() throws IOException {
        Path root = pathResolver.getRoot();
        if (!Files.isDirectory(root)) {
            log.warn("Document root does not exist: {}", root);
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                .filter(p -> !isHidden(root.relativize(p)))
                .sorted()
                .toList();
        }
    }

    /**
     * Virtual paths of every Markdown document under the root.
     */
    public List<String> listDocuments() throws IOException {
        List<String> paths = new ArrayList<>();
        for (Path file : listDocumentFiles()) {
            pathResolver.toVirtual(file).ifPresent(paths::add);
        }
        return paths;
    }

    /**
     * Virtual paths of the documents in the same folder as the given one.
     */
    public List<String> listSiblings(DocumentAddress address) {
        Path dir = toPhysical(address).getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                .sorted()
                .map(pathResolver::toVirtual)
                .flatMap(Optional::stream)
                .toList();
        } catch (IOException e) {
            log.warn("Could not list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
