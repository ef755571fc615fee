package com.dcruver.docguide.markdown;

import java.util.List;

/**
 * Decides which headings are tasks from document structure alone.
 * A task is a heading whose parent heading is titled "Tasks". Nothing is stored,
 * so the answer always reflects the current heading list.
 */
public final class TaskClassifier {

    private static final String CONTAINER_TITLE = "tasks";

    private TaskClassifier() {
    }

    public static boolean isTasksContainer(Heading heading) {
        return heading.getTitle().trim().equalsIgnoreCase(CONTAINER_TITLE)
            || heading.getSlug().equals(CONTAINER_TITLE);
    }

    public static boolean isTask(List<Heading> headings, String slug) {
        for (Heading heading : headings) {
            if (heading.getSlug().equals(slug)) {
                return isTask(headings, heading);
            }
        }
        return false;
    }

    public static boolean isTask(List<Heading> headings, Heading heading) {
        return !heading.isTopLevel() && isTasksContainer(headings.get(heading.getParentIndex()));
    }

    public static List<String> taskSlugs(List<Heading> headings) {
        return headings.stream()
            .filter(h -> isTask(headings, h))
            .map(Heading::getSlug)
            .toList();
    }
}
