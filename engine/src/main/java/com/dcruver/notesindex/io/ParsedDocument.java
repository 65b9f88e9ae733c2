package com.dcruver.notesindex.io;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of parsing one markdown document.
 */
@Data
@Builder
public class ParsedDocument {
    private final Frontmatter frontmatter;
    private final String body;              // content after the frontmatter block
    private final String title;             // frontmatter title or first H1, may be null
    private final List<ExtractedLink> links;
    private final List<String> tags;        // normalised, deduplicated, without ancestors
    private final int wordCount;
    private final int readingTimeMinutes;

    // Set when the frontmatter block was malformed and the whole text was used as body
    private final String frontmatterProblem;

    public boolean hasFrontmatterProblem() {
        return frontmatterProblem != null;
    }
}
