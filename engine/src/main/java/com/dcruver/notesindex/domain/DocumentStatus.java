package com.dcruver.notesindex.domain;

import java.util.Locale;

/**
 * Publication status declared in a document's frontmatter.
 */
public enum DocumentStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED;

    /**
     * Map a frontmatter value to a status; unknown or missing values are drafts.
     */
    public static DocumentStatus fromFrontmatter(String value) {
        if (value == null || value.isBlank()) {
            return DRAFT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DRAFT;
        }
    }
}
