package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

/**
 * A full-text search hit. Higher scores are more relevant.
 */
@Data
@Builder
public class RankedResult {
    private final String documentId;
    private final String title;
    private final double score;
    private final String snippet;
}
