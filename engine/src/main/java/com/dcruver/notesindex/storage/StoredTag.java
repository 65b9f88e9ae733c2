package com.dcruver.notesindex.storage;

import lombok.Builder;
import lombok.Data;

/**
 * A row of the tags table with its usage count computed from document_tags.
 */
@Data
@Builder
public class StoredTag {
    private final String name;
    private final String parent;
    private final int depth;
    private final int usageCount;
}
