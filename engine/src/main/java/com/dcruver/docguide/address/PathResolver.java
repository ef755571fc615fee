package com.dcruver.docguide.address;

import com.dcruver.docguide.exception.InvalidAddressException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps virtual document paths to files below the document root and back.
 * Holds nothing but the root.
 */
public class PathResolver {

    private final Path root;

    public PathResolver(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    public Namespace classify(String virtualPath) {
        if (virtualPath.equals("/coordinator") || virtualPath.startsWith("/coordinator/")) {
            return Namespace.COORDINATOR;
        }
        if (virtualPath.equals("/archived") || virtualPath.startsWith("/archived/")) {
            return Namespace.ARCHIVED;
        }
        return Namespace.DOCS;
    }

    /**
     * Physical file for a normalized virtual path. Fails if the result escapes the root.
     */
    public Path toPhysical(String virtualPath) {
        Namespace namespace = classify(virtualPath);
        String relative = virtualPath.startsWith("/") ? virtualPath.substring(1) : virtualPath;
        Path base = root.resolve(Namespace.DOCS.getFolder());
        if (namespace != Namespace.DOCS) {
            base = root;
        }
        Path physical = base.resolve(relative).normalize();
        if (!physical.startsWith(root)) {
            throw new InvalidAddressException(virtualPath, "resolves outside the document root");
        }
        return physical;
    }

    /**
     * Virtual path of a physical file, or empty if the file is outside every namespace folder.
     */
    public Optional<String> toVirtual(Path physical) {
        Path normalized = physical.toAbsolutePath().normalize();
        if (!normalized.startsWith(root) || normalized.equals(root)) {
            return Optional.empty();
        }
        Path relative = root.relativize(normalized);
        String first = relative.getName(0).toString();
        String rest = relative.getNameCount() > 1
            ? relative.subpath(1, relative.getNameCount()).toString().replace('\\', '/')
            : "";

        if (first.equals(Namespace.DOCS.getFolder())) {
            return rest.isEmpty() ? Optional.empty() : Optional.of("/" + rest);
        }
        if (first.equals(Namespace.COORDINATOR.getFolder()) || first.equals(Namespace.ARCHIVED.getFolder())) {
            return Optional.of("/" + first + (rest.isEmpty() ? "" : "/" + rest));
        }
        return Optional.empty();
    }
}
