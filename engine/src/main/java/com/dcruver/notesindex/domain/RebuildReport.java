package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of a full index rebuild.
 */
@Data
@Builder
public class RebuildReport {
    private final int scanned;
    private final int indexed;
    private final int degraded;         // indexed as empty or partially parsed
    private final int removed;          // index entries whose file is gone
    private final int relinked;         // sources re-indexed because a broken link now resolves
    private final boolean cancelled;
    private final Map<String, String> failures; // document id -> problem
    private final Duration elapsed;
}
