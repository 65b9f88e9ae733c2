package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BacklinkEntry {
    private final String sourceId;
    private final String sourceTitle;
    private final LinkKind kind;
    private final String context;
    private final int lineNumber;
    private final int occurrenceCount;
}
