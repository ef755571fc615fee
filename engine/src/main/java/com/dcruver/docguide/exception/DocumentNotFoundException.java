package com.dcruver.docguide.exception;

import java.util.List;

/** Exception thrown when a document path does not exist. */
public class DocumentNotFoundException extends AddressingException {

    private final String path;
    private final List<String> siblingDocuments;

    public DocumentNotFoundException(String path, List<String> siblingDocuments) {
        super("DOCUMENT_NOT_FOUND", "Document not found: " + path);
        this.path = path;
        this.siblingDocuments = List.copyOf(siblingDocuments);
    }

    public String getPath() {
        return path;
    }

    /** Documents that do exist next to the requested path. */
    public List<String> getSiblingDocuments() {
        return siblingDocuments;
    }
}
