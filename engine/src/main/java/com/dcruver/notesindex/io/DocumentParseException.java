package com.dcruver.notesindex.io;

/** Thrown when a document's frontmatter block is malformed. */
public class DocumentParseException extends RuntimeException {

    private final int line;

    public DocumentParseException(String message, int line) {
        super(message);
        this.line = line;
    }

    public DocumentParseException(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /** One-based line of the problem, or 0 when unknown. */
    public int getLine() {
        return line;
    }
}
