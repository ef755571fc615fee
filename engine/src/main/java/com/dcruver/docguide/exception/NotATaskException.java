package com.dcruver.docguide.exception;

import java.util.List;

/** Exception thrown when a section exists but is not placed under a tasks heading. */
public class NotATaskException extends AddressingException {

    private final String slug;
    private final String documentPath;
    private final List<String> taskSlugs;

    public NotATaskException(String slug, String documentPath, List<String> taskSlugs) {
        super("NOT_A_TASK", "Section '" + slug + "' in " + documentPath + " is not a task");
        this.slug = slug;
        this.documentPath = documentPath;
        this.taskSlugs = List.copyOf(taskSlugs);
    }

    public String getSlug() {
        return slug;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public List<String> getTaskSlugs() {
        return taskSlugs;
    }
}
