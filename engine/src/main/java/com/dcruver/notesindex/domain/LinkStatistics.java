package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LinkStatistics {
    private final int totalDocuments;
    private final int totalLinks;
    private final int brokenLinks;
    private final int orphanedDocuments;
}
