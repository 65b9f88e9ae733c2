package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * An indexed document.
 * The id is the workspace-relative path with {@code /} separators.
 */
@Data
@Builder
@With
public class Document {
    private final String id;
    private final String title;

    // Content
    private final String content;       // raw file text
    private final String body;          // text after the frontmatter block
    private final Map<String, Object> frontmatter;

    // Recognised frontmatter fields
    private final LocalDate date;
    private final List<String> tags;    // as declared, without implied ancestors
    private final List<String> aliases;
    private final DocumentStatus status;

    // Derived
    private final int wordCount;
    private final int readingTimeMinutes;

    // File state
    private final Instant modifiedAt;
    private final long fileSize;
    private final String contentHash;

    // Set when the file could not be read or parsed cleanly
    private final boolean degraded;
    private final String parseProblem;

    /**
     * File name without directories or extension.
     */
    public String getFileStem() {
        String name = id.substring(id.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
