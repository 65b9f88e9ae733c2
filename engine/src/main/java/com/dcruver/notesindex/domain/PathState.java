package com.dcruver.notesindex.domain;

/**
 * Lifecycle of a tracked workspace path:
 * UNSEEN -> INDEXED -> (MODIFIED -> INDEXED)* -> REMOVED.
 */
public enum PathState {
    UNSEEN,
    INDEXED,
    MODIFIED,
    REMOVED
}
