package com.dcruver.notesindex.domain;

/**
 * Kind of a link between documents.
 */
public enum LinkKind {
    /** {@code [[target]]} */
    REFERENCE,
    /** {@code ![[target]]} */
    EMBED,
    /** Derived from shared links and tags; computed on query, never stored. */
    SIMILARITY
}
