package com.dcruver.docguide.reference;

import com.dcruver.docguide.GuideFixture;
import com.dcruver.docguide.cache.AccessContext;
import com.dcruver.docguide.config.GuideSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceLoaderTest {

    @TempDir
    Path tempDir;

    private GuideFixture chain() throws Exception {
        GuideFixture fixture = new GuideFixture(tempDir);
        fixture.write("/base.md", "# Base\n\nStart at @/a.md\n");
        fixture.write("/a.md", "# A\n\nNext @/b.md\n");
        fixture.write("/b.md", "# B\n\nNext @/c.md\n");
        fixture.write("/c.md", "# C\n\nThe end.\n");
        return fixture;
    }

    private ReferenceForest loadBase(GuideFixture fixture, Integer depth) {
        String content = fixture.documentCache.getDocument("/base.md", AccessContext.DIRECT).getContent();
        return fixture.referenceLoader.loadReferenceTree(content, "/base.md", depth);
    }

    @Test
    void testChainResolvesToFullDepth() throws Exception {
        ReferenceForest forest = loadBase(chain(), 3);

        ReferenceNode a = forest.getRoots().get(0);
        ReferenceNode b = a.getChildren().get(0);
        ReferenceNode c = b.getChildren().get(0);
        assertEquals(List.of("/a.md", "/b.md", "/c.md"), List.of(a.getTarget(), b.getTarget(), c.getTarget()));
        assertEquals(List.of(1, 2, 3), List.of(a.getDepth(), b.getDepth(), c.getDepth()));
        assertEquals(ResolutionState.RESOLVED, c.getState());
        assertEquals("C", c.getTitle());
        assertEquals(3, forest.getResolvedCount());
        assertEquals(3, forest.getMaxDepthReached());
        assertFalse(forest.isTruncated());
    }

    @Test
    void testDepthOneLeavesDeeperNodesOut() throws Exception {
        ReferenceForest forest = loadBase(chain(), 1);

        assertEquals(1, forest.getTotalNodes());
        ReferenceNode a = forest.getRoots().get(0);
        assertEquals(ResolutionState.RESOLVED, a.getState());
        assertTrue(a.getChildren().isEmpty());
    }

    @Test
    void testOutOfRangeDepthUsesDefault() throws Exception {
        GuideFixture fixture = chain();
        fixture.write("/c.md", "# C\n\nOn to @/d.md\n");
        fixture.write("/d.md", "# D\n");

        ReferenceForest forest = loadBase(fixture, 9);

        assertEquals(3, forest.getMaxDepthReached());
        assertEquals(3, forest.getTotalNodes());
    }

    @Test
    void testSelfReferenceIsACycle() throws Exception {
        GuideFixture fixture = new GuideFixture(tempDir);
        fixture.write("/self.md", "# Self\n\nSee @/self.md again.\n");

        ReferenceForest fromDocument = fixture.referenceLoader.loadReferenceTree(
            "See @/self.md again.", "/self.md", 5);
        assertEquals(ResolutionState.CYCLE_DETECTED, fromDocument.getRoots().get(0).getState());

        ReferenceForest fromList = fixture.referenceLoader.loadReferences(
            fixture.referenceExtractor.normalizeReferences(List.of("@/self.md"), null), 5);
        ReferenceNode root = fromList.getRoots().get(0);
        assertEquals(ResolutionState.RESOLVED, root.getState());
        assertEquals(ResolutionState.CYCLE_DETECTED, root.getChildren().get(0).getState());
        assertEquals(1, fromList.getCycleCount());
    }

    @Test
    void testMutualSectionReferencesStopAtTheCycle() throws Exception {
        GuideFixture fixture = new GuideFixture(tempDir);
        fixture.write("/a.md", "# Top\n\nSee @/b.md#intro\n");
        fixture.write("/b.md", "# Intro\n\nBack to @/a.md#top\n");

        ReferenceForest forest = fixture.referenceLoader.loadReferenceTree(
            "See @/b.md#intro", "/a.md", 5);

        ReferenceNode intro = forest.getRoots().get(0);
        assertEquals("/b.md#intro", intro.getTarget());
        assertEquals(ResolutionState.RESOLVED, intro.getState());
        assertEquals("Intro", intro.getTitle());
        ReferenceNode back = intro.getChildren().get(0);
        assertEquals("/a.md#top", back.getTarget());
        assertEquals(ResolutionState.CYCLE_DETECTED, back.getState());
        assertTrue(back.getChildren().isEmpty());
    }

    @Test
    void testSameDocumentExpandsInSeparateBranches() throws Exception {
        GuideFixture fixture = new GuideFixture(tempDir);
        fixture.write("/left.md", "# Left\n\n@/shared.md\n");
        fixture.write("/right.md", "# Right\n\n@/shared.md\n");
        fixture.write("/shared.md", "# Shared\n");

        ReferenceForest forest = fixture.referenceLoader.loadReferenceTree("@/left.md @/right.md", null, 3);

        assertEquals(4, forest.getResolvedCount());
        assertEquals(0, forest.getCycleCount());
    }

    @Test
    void testFailuresStayOnTheirNode() throws Exception {
        GuideFixture fixture = new GuideFixture(tempDir);
        fixture.write("/ok.md", "# Ok\n\n## Present\n");

        ReferenceForest forest = fixture.referenceLoader.loadReferenceTree(
            "@/missing.md @/ok.md#absent @/ok.md#present", null, 3);

        List<ReferenceNode> roots = forest.getRoots();
        assertEquals(ResolutionState.DOCUMENT_NOT_FOUND, roots.get(0).getState());
        assertEquals(ResolutionState.SECTION_NOT_FOUND, roots.get(1).getState());
        assertTrue(roots.get(1).getMessage().contains("present"));
        assertEquals(ResolutionState.RESOLVED, roots.get(2).getState());
        assertEquals("## Present\n", roots.get(2).getContent());
        assertEquals(2, forest.getFailedCount());
        assertEquals(1, forest.getResolvedCount());
    }

    @Test
    void testNodeBudgetTruncates() throws Exception {
        GuideFixture fixture = new GuideFixture(GuideSettings.builder()
            .docsRoot(tempDir)
            .watcherEnabled(false)
            .maxReferenceNodes(2)
            .build());
        fixture.write("/hub.md", "# Hub\n\n@/x.md @/y.md\n");
        fixture.write("/x.md", "# X\n");
        fixture.write("/y.md", "# Y\n");

        ReferenceForest forest = fixture.referenceLoader.loadReferenceTree("@/hub.md", null, 3);

        assertTrue(forest.isTruncated());
        assertEquals(2, forest.getTotalNodes());
        ReferenceNode hub = forest.getRoots().get(0);
        assertTrue(hub.isChildrenTruncated());
        assertEquals(List.of("/x.md"), hub.getChildren().stream().map(ReferenceNode::getTarget).toList());
    }

    @Test
    void testTimeBudgetLeavesRemainingNodesTruncated() throws Exception {
        GuideSettings settings = GuideSettings.builder()
            .docsRoot(tempDir)
            .watcherEnabled(false)
            .referenceTimeoutMs(5)
            .build();
        GuideFixture fixture = new GuideFixture(settings);
        fixture.write("/one.md", "# One\n");
        fixture.write("/two.md", "# Two\n");
        fixture.write("/three.md", "# Three\n");
        ReferenceLoader loader = new ReferenceLoader(fixture.documentCache, fixture.referenceExtractor,
            settings, new SteppingClock(3));

        ReferenceForest forest = loader.loadReferenceTree("@/one.md @/two.md @/three.md", null, 3);

        List<ReferenceNode> roots = forest.getRoots();
        assertEquals(ResolutionState.RESOLVED, roots.get(0).getState());
        assertEquals(ResolutionState.TRUNCATED, roots.get(1).getState());
        assertEquals(ResolutionState.TRUNCATED, roots.get(2).getState());
        assertTrue(forest.isTruncated());
        assertEquals(2, forest.getTruncatedCount());
    }

    /**
     * Moves forward a fixed step every time it is read.
     */
    private static final class SteppingClock extends Clock {
        private final long stepMillis;
        private long now;

        SteppingClock(long stepMillis) {
            this.stepMillis = stepMillis;
            this.now = -stepMillis;
        }

        @Override
        public long millis() {
            now += stepMillis;
            return now;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis());
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
