package com.dcruver.notesindex.storage;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * File state recorded when a document was last indexed.
 */
@Data
@Builder
public class FileStamp {
    private final Instant modifiedAt;
    private final long fileSize;
    private final String contentHash;
}
