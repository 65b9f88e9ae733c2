package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.Locale;

/**
 * An aggregated explicit edge from a document to a target reference.
 * Repeated references to the same target with the same kind share one edge.
 */
@Data
@Builder
@With
public class Link {
    private final String sourceId;
    private final String targetRef;     // target text as first written
    private final String targetId;      // null when the target does not resolve
    private final LinkKind kind;
    private final String heading;
    private final String context;
    private final int lineNumber;       // first occurrence
    private final int occurrenceCount;

    public boolean isResolved() {
        return targetId != null;
    }

    /**
     * Aggregation key within one source: the resolved id, or the folded target text.
     */
    public String getTargetKey() {
        return targetKey(targetId, targetRef);
    }

    public static String targetKey(String targetId, String targetRef) {
        return targetId != null ? targetId : "?" + targetRef.toLowerCase(Locale.ROOT);
    }
}
