package com.dcruver.docguide.io;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Unified diffs for previewing a section edit before it is written.
 */
@Component
public class SectionDiff {

    private static final int CONTEXT_LINES = 3;

    public String unifiedDiff(String original, String revised, String path) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "a" + path,
            "b" + path,
            originalLines,
            patch,
            CONTEXT_LINES
        );
        return String.join("\n", unifiedDiff);
    }
}
