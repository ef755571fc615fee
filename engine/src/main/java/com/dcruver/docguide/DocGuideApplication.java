package com.dcruver.docguide;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Doc Guide engine.
 *
 * Serves a tree of Markdown documents by virtual path: documents are parsed into
 * addressable sections, cached with a bounded heading budget, and cross-document
 * {@code @references} are expanded into bounded trees.
 */
@SpringBootApplication
@EnableScheduling
@Slf4j
public class DocGuideApplication {

    public static void main(String[] args) {
        log.info("Starting Doc Guide...");
        SpringApplication.run(DocGuideApplication.class, args);
    }
}
