package com.dcruver.notesindex.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A node of the tag hierarchy.
 */
@Data
@Builder
public class Tag {
    private final String name;          // full path, e.g. project/backend
    private final int level;            // 0 for root tags
    private final String parent;        // null for root tags
    private final List<String> children; // full names of direct children
    private final int usageCount;       // documents carrying this tag or a descendant

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isLeaf() {
        return children == null || children.isEmpty();
    }
}
