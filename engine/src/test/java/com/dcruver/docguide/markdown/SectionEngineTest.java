package com.dcruver.docguide.markdown;

import com.dcruver.docguide.exception.SectionNotFoundException;
import com.dcruver.docguide.exception.SectionOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SectionEngineTest {

    private static final String GUIDE = """
        # Guide

        Intro text.

        ## Setup

        Install things.

        ### Linux

        Use apt.

        ## Usage

        Run it.
        """;

    private SectionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SectionEngine();
    }

    @Test
    void testListHeadingsAssignsDepthSlugAndParent() {
        List<Heading> headings = engine.listHeadings(GUIDE);

        assertEquals(List.of("guide", "setup", "linux", "usage"),
            headings.stream().map(Heading::getSlug).toList());
        assertEquals(List.of(1, 2, 3, 2), headings.stream().map(Heading::getDepth).toList());
        assertTrue(headings.get(0).isTopLevel());
        assertEquals(0, headings.get(1).getParentIndex());
        assertEquals(1, headings.get(2).getParentIndex());
        assertEquals(0, headings.get(3).getParentIndex());
    }

    @Test
    void testReadSectionStopsAtNextHeadingOfSameOrLowerDepth() {
        assertEquals("## Setup\n\nInstall things.\n\n### Linux\n\nUse apt.\n\n", engine.readSection(GUIDE, "setup"));
        assertEquals("### Linux\n\nUse apt.\n\n", engine.readSection(GUIDE, "linux"));
        assertEquals("## Usage\n\nRun it.\n", engine.readSection(GUIDE, "usage"));
        assertEquals(GUIDE, engine.readSection(GUIDE, "guide"));
    }

    @Test
    void testSectionsPartitionTheDocument() {
        String content = """
            Preamble line.

            # One

            a

            ## One A

            b

            ## One B

            c

            # Two

            d
            """;
        MarkdownOutline outline = engine.outline(content);
        List<Heading> headings = outline.getHeadings();

        StringBuilder topLevel = new StringBuilder(outline.preamble());
        for (Heading heading : headings) {
            if (heading.isTopLevel()) {
                topLevel.append(engine.readSection(content, heading.getSlug()));
            }
        }
        assertEquals(content, topLevel.toString(), "Top-level sections and preamble should rebuild the document");

        for (Heading parent : headings) {
            StringBuilder children = new StringBuilder();
            for (Heading child : headings) {
                if (child.getParentIndex() == parent.getIndex()) {
                    children.append(engine.readSection(content, child.getSlug()));
                }
            }
            assertTrue(engine.readSection(content, parent.getSlug()).endsWith(children.toString()),
                "Children of " + parent.getSlug() + " should tile the end of its section");
        }
    }

    @Test
    void testReplaceWithCurrentBodyKeepsDocumentByteIdentical() {
        for (String slug : List.of("guide", "setup", "linux", "usage")) {
            String body = engine.readSectionBody(GUIDE, slug);
            assertEquals(GUIDE, engine.replaceSectionBody(GUIDE, slug, body).getContent(),
                "Round trip of " + slug + " should not change the document");
        }
    }

    @Test
    void testReplaceIsIdempotent() {
        String messy = "# A\nno blank line\n## B\ntext\n## C\nlast";

        String once = engine.replaceSectionBody(messy, "b", "\n\nNew body\n\n").getContent();
        String twice = engine.replaceSectionBody(once, "b", "\n\nNew body\n\n").getContent();

        assertEquals(once, twice);
        assertEquals("# A\nno blank line\n## B\n\nNew body\n\n## C\nlast", once);
    }

    @Test
    void testReplaceRejectsHeadingsAtOrAboveSectionDepth() {
        SectionOperationException e = assertThrows(SectionOperationException.class,
            () -> engine.replaceSectionBody(GUIDE, "setup", "text\n\n## Sneaky\n\nmore"));
        assertEquals("INVALID_BODY", e.getCode());

        String nested = engine.replaceSectionBody(GUIDE, "setup", "text\n\n### Nested\n\nmore").getContent();
        assertTrue(nested.contains("## Setup\n\ntext\n\n### Nested\n\nmore\n\n## Usage"));
    }

    @Test
    void testUnclosedFenceInBodyIsRejected() {
        String content = "# A\n\nalpha\n\n# B\n\nbeta\n";

        SectionOperationException e = assertThrows(SectionOperationException.class,
            () -> engine.replaceSectionBody(content, "a", "```\ncode"));
        assertEquals("INVALID_BODY", e.getCode());
        assertThrows(SectionOperationException.class, () -> engine.appendToSection(content, "a", "```java\nint x;"));
        assertThrows(SectionOperationException.class,
            () -> engine.insertRelative(content, "a", InsertMode.INSERT_AFTER, "Middle", "~~~\nopen"));

        String closed = engine.replaceSectionBody(content, "a", "```\ncode\n```").getContent();
        assertEquals(List.of("a", "b"), engine.outline(closed).getSlugs());
    }

    @Test
    void testInsertAfterSectionEndingInOpenFenceIsRejected() {
        String content = "# A\n\n```\nstill code\n";

        SectionOperationException e = assertThrows(SectionOperationException.class,
            () -> engine.insertRelative(content, "a", InsertMode.APPEND_CHILD, "Child", "x"));
        assertEquals("INVALID_BODY", e.getCode());
    }

    @Test
    void testAppendChildUsesNextDepth() {
        SectionEdit edit = engine.insertRelative(GUIDE, "linux", InsertMode.APPEND_CHILD, "Debian", "Use apt-get.");

        assertEquals("debian", edit.getSlug());
        assertTrue(edit.getContent().contains("### Linux\n\nUse apt.\n\n#### Debian\n\nUse apt-get.\n\n## Usage"));
        Heading debian = engine.outline(edit.getContent()).find("debian");
        assertEquals(4, debian.getDepth());
    }

    @Test
    void testAppendChildDepthIsCappedAtSix() {
        String deep = "###### Deep\n\ntext\n";

        SectionEdit edit = engine.insertRelative(deep, "deep", InsertMode.APPEND_CHILD, "Deeper", null);

        assertEquals("###### Deep\n\ntext\n\n###### Deeper\n", edit.getContent());
        assertEquals(6, engine.outline(edit.getContent()).find("deeper").getDepth());
    }

    @Test
    void testInsertBeforeAddsSiblingAtReferenceDepth() {
        SectionEdit edit = engine.insertRelative(GUIDE, "usage", InsertMode.INSERT_BEFORE, "Config", "Set options.");

        assertEquals("config", edit.getSlug());
        assertTrue(edit.getContent().contains("Use apt.\n\n## Config\n\nSet options.\n\n## Usage\n"));
    }

    @Test
    void testInsertAfterLastSectionAppendsToDocument() {
        SectionEdit edit = engine.insertRelative(GUIDE, "usage", InsertMode.INSERT_AFTER, "Next", "Done.");

        assertEquals(GUIDE + "\n## Next\n\nDone.\n", edit.getContent());
    }

    @Test
    void testInsertWithExplicitDepthOutOfRangeFails() {
        SectionOperationException e = assertThrows(SectionOperationException.class,
            () -> engine.insertRelative(GUIDE, "usage", InsertMode.INSERT_AFTER, 7, "Too deep", null));
        assertEquals("INVALID_DEPTH", e.getCode());
    }

    @Test
    void testRepeatedTitlesGetSuffixes() {
        String content = "## Task\n\na\n\n## Task\n\nb\n\n## Task\n\nc\n";

        assertEquals(List.of("task", "task-1", "task-2"),
            engine.listHeadings(content).stream().map(Heading::getSlug).toList());
    }

    @Test
    void testRenameCollisionsProduceSameSuffixSequence() {
        String first = "## Alpha\n\n## Task\n\n## Task\n";
        String second = "## Task\n\n## Task\n\n## Alpha\n";

        SectionEdit renamedFirst = engine.renameHeading(first, "alpha", "Task");
        SectionEdit renamedSecond = engine.renameHeading(second, "alpha", "Task");

        List<String> expected = List.of("task", "task-1", "task-2");
        assertEquals(expected, engine.listHeadings(renamedFirst.getContent()).stream().map(Heading::getSlug).toList());
        assertEquals(expected, engine.listHeadings(renamedSecond.getContent()).stream().map(Heading::getSlug).toList());
        assertEquals("task", renamedFirst.getSlug());
        assertEquals("task-2", renamedSecond.getSlug());
    }

    @Test
    void testRenameKeepsDepthAndBody() {
        SectionEdit edit = engine.renameHeading(GUIDE, "linux", "Linux & BSD");

        assertEquals("linux--bsd", edit.getSlug());
        assertTrue(edit.getContent().contains("### Linux & BSD\n\nUse apt.\n"));
    }

    @Test
    void testDeleteSectionKeepsFollowingHeading() {
        String result = engine.deleteSection(GUIDE, "setup").getContent();

        assertEquals("# Guide\n\nIntro text.\n\n## Usage\n\nRun it.\n", result);
    }

    @Test
    void testDeleteLastSectionTrimsTrailingBlankLines() {
        String result = engine.deleteSection(GUIDE, "usage").getContent();

        assertTrue(result.endsWith("### Linux\n\nUse apt.\n"));
    }

    @Test
    void testDeleteOfEverythingFails() {
        SectionOperationException e = assertThrows(SectionOperationException.class,
            () -> engine.deleteSection(GUIDE, "guide"));
        assertEquals("EMPTY_DOCUMENT", e.getCode());
    }

    @Test
    void testMissingSlugReportsAvailableSlugs() {
        SectionNotFoundException e = assertThrows(SectionNotFoundException.class,
            () -> engine.readSection(GUIDE, "install"));
        assertEquals(List.of("guide", "setup", "linux", "usage"), e.getAvailableSlugs());
    }

    @Test
    void testHeadingsInsideCodeBlocksAreIgnored() {
        String content = """
            # Real

            ```
            # Not a heading
            ```

            ## Also real
            """;

        assertEquals(List.of("real", "also-real"),
            engine.listHeadings(content).stream().map(Heading::getSlug).toList());
        assertTrue(engine.readSection(content, "real").contains("# Not a heading"));
    }

    @Test
    void testSetextHeadings() {
        String content = "Title\n=====\n\nBody\n\nSub\n---\n\nText\n";

        List<Heading> headings = engine.listHeadings(content);
        assertEquals(List.of("title", "sub"), headings.stream().map(Heading::getSlug).toList());
        assertEquals("Sub\n---\n\nText\n", engine.readSection(content, "sub"));
        assertEquals("Title\n=====\n\nBody\n\n## Renamed\n\nText\n",
            engine.renameHeading(content, "sub", "Renamed").getContent());
    }

    @Test
    void testWindowsLineEndingsArePreserved() {
        String content = "# A\r\n\r\ntext\r\n\r\n## B\r\n\r\nmore\r\n";

        assertEquals("## B\r\n\r\nmore\r\n", engine.readSection(content, "b"));
        assertTrue(engine.replaceSectionBody(content, "b", "new").getContent()
            .startsWith("# A\r\n\r\ntext\r\n\r\n## B\r\n"));
    }

    @Test
    void testTaskSectionIsDecidedByParentHeading() {
        String content = """
            # Project

            ## Tasks

            ### Write docs

            #### Notes

            ## Tasks Done

            ### Old item
            """;
        List<Heading> headings = engine.listHeadings(content);

        assertTrue(engine.isTaskSection("write-docs", headings));
        assertFalse(engine.isTaskSection("notes", headings));
        assertFalse(engine.isTaskSection("old-item", headings));
        assertFalse(engine.isTaskSection("tasks", headings));
    }
}
