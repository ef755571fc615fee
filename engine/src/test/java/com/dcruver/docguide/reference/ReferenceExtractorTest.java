package com.dcruver.docguide.reference;

import com.dcruver.docguide.GuideFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceExtractorTest {

    @TempDir
    Path tempDir;

    private ReferenceExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new GuideFixture(tempDir).referenceExtractor;
    }

    @Test
    void testExtractsDocumentAndSectionReferences() {
        String content = """
            See @/api/auth.md and @/guides/deploy#Rollout. Also @#local-notes!
            Mail user@example.com, not a reference.
            (@/api/users.md) @/api/auth.md
            """;

        assertEquals(List.of("@/api/auth.md", "@/guides/deploy#Rollout", "@#local-notes", "@/api/users.md"),
            extractor.extractReferences(content));
    }

    @Test
    void testBareMarkersAreIgnored() {
        assertTrue(extractor.extractReferences("an @ sign, a lone @# and @/ here").isEmpty());
    }

    @Test
    void testNormalizesAgainstBaseDocument() {
        List<NormalizedReference> refs = extractor.normalizeReferences(
            List.of("@/guides/deploy#Rollout", "@#Local-Notes", "@//api//auth.md"), "/guide.md");

        assertEquals(List.of("/guides/deploy.md#rollout", "/guide.md#local-notes", "/api/auth.md"),
            refs.stream().map(NormalizedReference::getTarget).toList());
        assertEquals("@#Local-Notes", refs.get(1).getOriginalReference());
        assertNull(refs.get(2).getSectionSlug());
    }

    @Test
    void testUnusableReferencesAreDropped() {
        List<NormalizedReference> refs = extractor.normalizeReferences(
            List.of("@/../etc/passwd", "@#intro", "@/ok.md"), null);

        assertEquals(List.of("/ok.md"), refs.stream().map(NormalizedReference::getTarget).toList());
    }

    @Test
    void testDuplicateTargetsCollapse() {
        List<NormalizedReference> refs = extractor.normalizeReferences(
            List.of("@/api/auth", "@/api/auth.md", "@#Intro", "@/guide.md#intro"), "/guide.md");

        assertEquals(List.of("/api/auth.md", "/guide.md#intro"),
            refs.stream().map(NormalizedReference::getTarget).toList());
    }
}
