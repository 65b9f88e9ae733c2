package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * The parts of a document a link target string can match against.
 */
@Data
@Builder
public class LinkTarget {
    private final String id;
    private final String title;
    private final List<String> aliases;
}
