package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Criteria for listing documents. Unset fields do not filter.
 */
@Data
@Builder
public class DocumentFilter {

    public static final DocumentFilter ALL = DocumentFilter.builder().build();

    private final String pathPrefix;
    private final String tag;               // also matches documents carrying a descendant tag
    private final DocumentStatus status;
    private final Boolean degraded;
    private final Instant modifiedSince;
    private final Integer limit;
    private final Integer offset;
}
