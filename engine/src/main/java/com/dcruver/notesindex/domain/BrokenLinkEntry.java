package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A reference whose target matches no document, with repair suggestions.
 */
@Data
@Builder
public class BrokenLinkEntry {
    private final String sourceId;
    private final String target;
    private final LinkKind kind;
    private final String context;
    private final int lineNumber;
    private final int occurrenceCount;
    private final List<String> suggestions;
}
