package com.dcruver.notesindex.storage;

import lombok.Builder;
import lombok.Data;

import java.util.Map;
import java.util.Set;

/**
 * Link targets and tags of a document and of every document sharing at least
 * one of them. Read in one transaction.
 */
@Data
@Builder
public class Neighbourhood {
    private final String documentId;
    private final Set<String> targets;
    private final Set<String> tags;
    private final Map<String, Set<String>> candidateTargets;
    private final Map<String, Set<String>> candidateTags;
    private final Map<String, String> candidateTitles;
}
