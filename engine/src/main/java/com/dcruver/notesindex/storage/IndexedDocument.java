package com.dcruver.notesindex.storage;

import com.dcruver.notesindex.domain.Document;
import com.dcruver.notesindex.domain.Link;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Everything written for one document in a single transaction.
 */
@Data
@Builder
public class IndexedDocument {
    private final Document document;
    private final List<Link> links;     // aggregated explicit edges, resolved or broken
    private final List<String> tags;    // canonical names, ancestors included
}
