package com.dcruver.docguide.cache;

import com.dcruver.docguide.GuideFixture;
import com.dcruver.docguide.config.GuideSettings;
import com.dcruver.docguide.exception.DocumentNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentCacheTest {

    private static final String THREE_HEADINGS = "# One\n\n## Two\n\n## Three\n";

    @TempDir
    Path tempDir;

    private GuideFixture fixture(int maxTotalHeadings) {
        return new GuideFixture(GuideSettings.builder()
            .docsRoot(tempDir)
            .watcherEnabled(false)
            .maxTotalHeadings(maxTotalHeadings)
            .build());
    }

    @Test
    void testGetDocumentParsesHeadingsSectionsAndMetadata() throws Exception {
        GuideFixture fixture = fixture(1000);
        fixture.write("/guide.md", """
            # Title

            Some [link](http://x) and [another](y).

            ## Code

            ```java
            code
            ```
            """);

        CachedDocument document = fixture.documentCache.getDocument("/guide.md", AccessContext.DIRECT);

        assertEquals("/guide.md", document.getPath());
        assertEquals(List.of("title", "code"), document.getSlugs());
        assertEquals("## Code\n\n```java\ncode\n```\n", document.getSection("code").orElseThrow());
        DocumentMetadata metadata = document.getMetadata();
        assertEquals("Title", metadata.getTitle());
        assertEquals(11, metadata.getWordCount());
        assertEquals(2, metadata.getLinkCount());
        assertEquals(1, metadata.getCodeBlockCount());
        assertEquals(16, metadata.getContentHash().length());
    }

    @Test
    void testTitleFallsBackToFileName() throws Exception {
        GuideFixture fixture = fixture(1000);
        fixture.write("/notes/plain.md", "Just text.\n");

        assertEquals("plain", fixture.documentCache.getDocument("/notes/plain.md", AccessContext.DIRECT)
            .getMetadata().getTitle());
    }

    @Test
    void testSecondAccessIsAHit() throws Exception {
        GuideFixture fixture = fixture(1000);
        fixture.write("/a.md", THREE_HEADINGS);

        CachedDocument first = fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT);
        CachedDocument second = fixture.documentCache.getDocument("a.md", AccessContext.SEARCH);

        assertSame(first, second);
        CacheStats stats = fixture.documentCache.getStats();
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getHits());
        assertEquals(3, stats.getTotalHeadings());
    }

    @Test
    void testChangedContentIsReparsed() throws Exception {
        GuideFixture fixture = fixture(1000);
        Path file = fixture.write("/a.md", "# A\n");
        CachedDocument first = fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT);

        Files.writeString(file, "# B\n");
        Files.setLastModifiedTime(file, FileTime.from(first.getMetadata().getLastModified().plusSeconds(10)));
        CachedDocument second = fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT);

        assertEquals("B", second.getMetadata().getTitle());
        assertNotEquals(first.getMetadata().getContentHash(), second.getMetadata().getContentHash());
        assertEquals(2, fixture.documentCache.getStats().getMisses());
    }

    @Test
    void testTouchedButUnchangedFileKeepsParse() throws Exception {
        GuideFixture fixture = fixture(1000);
        Path file = fixture.write("/a.md", THREE_HEADINGS);
        CachedDocument first = fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT);

        Files.setLastModifiedTime(file, FileTime.from(first.getMetadata().getLastModified().plusSeconds(10)));
        CachedDocument second = fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT);

        assertSame(first.getHeadings(), second.getHeadings());
        assertEquals(first.getMetadata().getLastModified().plusSeconds(10), second.getMetadata().getLastModified());
        assertEquals(1, fixture.documentCache.getStats().getRefreshes());
        assertEquals(1, fixture.documentCache.getStats().getMisses());
    }

    @Test
    void testMissingDocumentListsSiblings() throws Exception {
        GuideFixture fixture = fixture(1000);
        fixture.write("/api/auth.md", "# Auth\n");

        DocumentNotFoundException e = assertThrows(DocumentNotFoundException.class,
            () -> fixture.documentCache.getDocument("/api/session.md", AccessContext.DIRECT));

        assertEquals("/api/session.md", e.getPath());
        assertEquals(List.of("/api/auth.md"), e.getSiblingDocuments());
    }

    @Test
    void testDeletedDocumentDropsEntry() throws Exception {
        GuideFixture fixture = fixture(1000);
        Path file = fixture.write("/a.md", "# A\n");
        fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT);

        Files.delete(file);

        assertThrows(DocumentNotFoundException.class,
            () -> fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT));
        assertFalse(fixture.documentCache.isCached("/a.md"));
    }

    @Test
    void testInvalidateRemovesEntryAndFingerprint() throws Exception {
        GuideFixture fixture = fixture(1000);
        fixture.write("/a.md", "# Alpha\n");
        fixture.fingerprintIndex.initialize();
        fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT);

        fixture.documentCache.invalidate("/a.md");

        assertFalse(fixture.documentCache.isCached("/a.md"));
        assertFalse(fixture.fingerprintIndex.contains("/a.md"));
        assertDoesNotThrow(() -> fixture.documentCache.invalidate("/never-loaded.md"));
        assertDoesNotThrow(() -> fixture.documentCache.invalidate("/../bad.md"));
    }

    @Test
    void testInvalidateByPrefix() throws Exception {
        GuideFixture fixture = fixture(1000);
        fixture.write("/api/a.md", "# A\n");
        fixture.write("/api/b.md", "# B\n");
        fixture.write("/other.md", "# O\n");
        for (String path : List.of("/api/a.md", "/api/b.md", "/other.md")) {
            fixture.documentCache.getDocument(path, AccessContext.DIRECT);
        }

        assertEquals(2, fixture.documentCache.invalidateByPrefix("/api/"));
        assertEquals(List.of("/other.md"), fixture.documentCache.getCachedPaths());
    }

    @Test
    void testCeilingEvictsLeastRecentlyUsed() throws Exception {
        GuideFixture fixture = fixture(5);
        fixture.write("/a.md", THREE_HEADINGS);
        fixture.write("/b.md", THREE_HEADINGS);

        fixture.documentCache.getDocument("/a.md", AccessContext.DIRECT);
        fixture.documentCache.getDocument("/b.md", AccessContext.DIRECT);

        assertFalse(fixture.documentCache.isCached("/a.md"));
        assertTrue(fixture.documentCache.isCached("/b.md"));
        CacheStats stats = fixture.documentCache.getStats();
        assertTrue(stats.getTotalHeadings() <= 5);
        assertEquals(1, stats.getEvictions());
    }

    @Test
    void testSearchAccessOutlivesNewerDirectAccess() throws Exception {
        GuideFixture fixture = fixture(6);
        fixture.write("/a.md", THREE_HEADINGS);
        fixture.write("/b.md", THREE_HEADINGS);
        fixture.write("/c.md", THREE_HEADINGS);

        fixture.documentCache.getDocument("/a.md", AccessContext.SEARCH);
        fixture.documentCache.getDocument("/b.md", AccessContext.DIRECT);
        fixture.documentCache.getDocument("/c.md", AccessContext.DIRECT);

        assertTrue(fixture.documentCache.isCached("/a.md"), "Search access should weigh more than recency");
        assertFalse(fixture.documentCache.isCached("/b.md"));
        assertTrue(fixture.documentCache.isCached("/c.md"));
        assertEquals(6, fixture.documentCache.getStats().getTotalHeadings());
    }

    @Test
    void testDocumentLargerThanCeilingIsServedButNotKept() throws Exception {
        GuideFixture fixture = fixture(2);
        fixture.write("/big.md", THREE_HEADINGS);

        CachedDocument document = fixture.documentCache.getDocument("/big.md", AccessContext.DIRECT);

        assertEquals(3, document.getHeadingCount());
        assertFalse(fixture.documentCache.isCached("/big.md"));
        assertEquals(0, fixture.documentCache.getStats().getTotalHeadings());
    }

    @Test
    void testValidateConsistencyDropsVanishedAndChangedFiles() throws Exception {
        GuideFixture fixture = fixture(1000);
        Path gone = fixture.write("/gone.md", "# Gone\n");
        Path changed = fixture.write("/changed.md", "# Changed\n");
        fixture.write("/same.md", "# Same\n");
        for (String path : List.of("/gone.md", "/changed.md", "/same.md")) {
            fixture.documentCache.getDocument(path, AccessContext.DIRECT);
        }

        Files.delete(gone);
        Files.writeString(changed, "# Changed again\n");

        assertEquals(2, fixture.documentCache.validateConsistency());
        assertEquals(List.of("/same.md"), fixture.documentCache.getCachedPaths());
        assertTrue(fixture.fingerprintIndex.contains("/changed.md"));
    }
}
