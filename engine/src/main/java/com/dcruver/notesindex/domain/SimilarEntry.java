package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SimilarEntry {
    private final String documentId;
    private final String title;
    private final double score;             // 0.0-1.0
    private final List<String> sharedLinks; // target ids both documents link to
    private final List<String> sharedTags;
}
