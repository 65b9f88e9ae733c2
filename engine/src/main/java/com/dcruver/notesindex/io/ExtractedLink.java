package com.dcruver.notesindex.io;

import lombok.Builder;
import lombok.Data;

/**
 * A {@code [[target]]} reference as written in a document, not yet resolved.
 */
@Data
@Builder
public class ExtractedLink {
    private final String raw;        // [[target#heading|alias]] as written
    private final String target;     // target text without heading or alias
    private final String alias;
    private final String heading;
    private final boolean embed;     // ![[...]]
    private final int lineNumber;    // 1-based, within the body
    private final String context;    // the line containing the link
}
