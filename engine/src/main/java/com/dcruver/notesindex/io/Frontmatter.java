package com.dcruver.notesindex.io;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML frontmatter of a document.
 * Keeps every field in source order alongside the recognised ones.
 */
@Data
@Builder
public class Frontmatter {

    public static final Frontmatter EMPTY = Frontmatter.builder()
        .fields(new LinkedHashMap<>())
        .tags(List.of())
        .aliases(List.of())
        .build();

    private final Map<String, Object> fields;

    // Recognised fields
    private final String title;
    private final LocalDate date;
    private final List<String> tags;
    private final List<String> aliases;
    private final String status;

    public boolean isEmpty() {
        return fields == null || fields.isEmpty();
    }

    public Object get(String key) {
        return fields != null ? fields.get(key) : null;
    }
}
