package com.dcruver.docguide.exception;

/** Exception thrown when a section edit would leave the document in an invalid state. */
public class SectionOperationException extends AddressingException {

    public SectionOperationException(String code, String message) {
        super(code, message);
    }

    public static SectionOperationException emptyDocument(String slug) {
        return new SectionOperationException("EMPTY_DOCUMENT",
            "Removing section '" + slug + "' would leave the document empty");
    }

    public static SectionOperationException invalidDepth(int depth) {
        return new SectionOperationException("INVALID_DEPTH",
            "Heading depth must be between 1 and 6, got " + depth);
    }

    public static SectionOperationException invalidTitle(String reason) {
        return new SectionOperationException("INVALID_TITLE", "Invalid heading title: " + reason);
    }

    public static SectionOperationException bodyTooLarge(int length, int max) {
        return new SectionOperationException("BODY_TOO_LARGE",
            "Section body has " + length + " characters, limit is " + max);
    }

    public static SectionOperationException structureChanged(String slug, String detail) {
        return new SectionOperationException("INVALID_BODY",
            "Edit of section '" + slug + "' would change headings outside it: " + detail);
    }

    public static SectionOperationException tooManyHeadings(int count, int max) {
        return new SectionOperationException("TOO_MANY_HEADINGS",
            "Document has " + count + " headings, limit is " + max);
    }
}
