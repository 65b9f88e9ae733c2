package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TagStatistics {
    private final int totalTags;
    private final int rootTags;
    private final int maxDepth;
    private final double averageChildren;
    private final String mostUsedTag;
}
