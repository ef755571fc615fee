package com.dcruver.docguide.config;

import com.dcruver.docguide.address.PathResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Binds {@code guide.*} properties into {@link GuideSettings}.
 */
@Configuration
@Slf4j
public class GuideConfiguration {

    @Value("${guide.docs-path:./docs-root}")
    private String docsPath;

    @Value("${guide.reference-depth:3}")
    private int referenceDepth;

    @Value("${guide.cache.max-total-headings:100000}")
    private int maxTotalHeadings;

    @Value("${guide.cache.boost.direct:1.0}")
    private double directBoost;

    @Value("${guide.cache.boost.search:3.0}")
    private double searchBoost;

    @Value("${guide.cache.boost.reference:2.0}")
    private double referenceBoost;

    @Value("${guide.references.max-nodes:1000}")
    private int maxReferenceNodes;

    @Value("${guide.references.timeout-ms:30000}")
    private long referenceTimeoutMs;

    @Value("${guide.address-cache.max-entries:1000}")
    private int addressCacheSize;

    @Value("${guide.index.preview-bytes:1500}")
    private int previewBytes;

    @Value("${guide.watcher.enabled:true}")
    private boolean watcherEnabled;

    @Value("${guide.watcher.max-errors:3}")
    private int watcherMaxErrors;

    @Value("${guide.watcher.backoff-base-ms:1000}")
    private long watcherBackoffBaseMs;

    @Bean
    public GuideSettings guideSettings() {
        int depth = GuideSettings.normalizeDepth(referenceDepth);
        if (depth != referenceDepth) {
            log.debug("guide.reference-depth {} out of range, using {}", referenceDepth, depth);
        }
        Path root = Path.of(docsPath).toAbsolutePath().normalize();
        log.info("Document root: {}", root);

        return GuideSettings.builder()
            .docsRoot(root)
            .referenceDepth(depth)
            .maxTotalHeadings(maxTotalHeadings)
            .directBoost(directBoost)
            .searchBoost(searchBoost)
            .referenceBoost(referenceBoost)
            .maxReferenceNodes(maxReferenceNodes)
            .referenceTimeoutMs(referenceTimeoutMs)
            .addressCacheSize(addressCacheSize)
            .previewBytes(previewBytes)
            .watcherEnabled(watcherEnabled)
            .watcherMaxErrors(watcherMaxErrors)
            .watcherBackoffBaseMs(watcherBackoffBaseMs)
            .build();
    }

    @Bean
    public PathResolver pathResolver(GuideSettings settings) {
        return new PathResolver(settings.getDocsRoot());
    }
}
