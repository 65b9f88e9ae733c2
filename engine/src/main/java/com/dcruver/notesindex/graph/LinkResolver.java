package com.dcruver.notesindex.graph;

import com.dcruver.notesindex.domain.LinkTarget;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolves link target text against a snapshot of the document namespace.
 *
 * Matching is case-insensitive and stops at the first rule that matches:
 * exact id, id without extension, path suffix, file stem, title, alias.
 * When a rule matches several documents the first id wins.
 */
public class LinkResolver {

    public enum Rule {
        ID,
        ID_WITHOUT_EXTENSION,
        PATH_SUFFIX,
        FILE_STEM,
        TITLE,
        ALIAS
    }

    @Data
    public static class Resolution {
        private final String targetId;          // null when unresolved
        private final Rule rule;
        private final List<String> candidates;  // every id the winning rule matched

        public boolean isResolved() {
            return targetId != null;
        }

        public boolean isAmbiguous() {
            return candidates.size() > 1;
        }

        static Resolution unresolved() {
            return new Resolution(null, null, List.of());
        }
    }

    private final Map<String, Set<String>> byId = new TreeMap<>();
    private final Map<String, Set<String>> byIdWithoutExtension = new TreeMap<>();
    private final Map<String, Set<String>> byStem = new TreeMap<>();
    private final Map<String, Set<String>> byTitle = new TreeMap<>();
    private final Map<String, Set<String>> byAlias = new TreeMap<>();

    public LinkResolver(Collection<LinkTarget> targets) {
        for (LinkTarget target : targets) {
            add(target);
        }
    }

    /**
     * Add or replace a document in the namespace, e.g. the one being indexed.
     */
    public void add(LinkTarget target) {
        String id = target.getId();
        String lowerId = fold(id);
        String withoutExtension = stripExtension(lowerId);
        index(byId, lowerId, id);
        index(byIdWithoutExtension, withoutExtension, id);
        index(byStem, withoutExtension.substring(withoutExtension.lastIndexOf('/') + 1), id);
        if (target.getTitle() != null && !target.getTitle().isBlank()) {
            index(byTitle, fold(target.getTitle()), id);
        }
        if (target.getAliases() != null) {
            for (String alias : target.getAliases()) {
                if (alias != null && !alias.isBlank()) {
                    index(byAlias, fold(alias), id);
                }
            }
        }
    }

    public Resolution resolve(String targetRef) {
        String key = normalizeRef(targetRef);
        if (key.isEmpty()) {
            return Resolution.unresolved();
        }

        Set<String> matches = byId.get(key);
        if (matches != null) {
            return resolution(Rule.ID, matches);
        }
        matches = byIdWithoutExtension.get(stripExtension(key));
        if (matches != null) {
            return resolution(Rule.ID_WITHOUT_EXTENSION, matches);
        }
        if (key.indexOf('/') >= 0) {
            Set<String> suffixMatches = new TreeSet<>();
            String suffix = "/" + stripExtension(key);
            for (Map.Entry<String, Set<String>> entry : byIdWithoutExtension.entrySet()) {
                if (entry.getKey().endsWith(suffix)) {
                    suffixMatches.addAll(entry.getValue());
                }
            }
            if (!suffixMatches.isEmpty()) {
                return resolution(Rule.PATH_SUFFIX, suffixMatches);
            }
        }
        matches = byStem.get(stripExtension(key));
        if (matches != null) {
            return resolution(Rule.FILE_STEM, matches);
        }
        matches = byTitle.get(key);
        if (matches != null) {
            return resolution(Rule.TITLE, matches);
        }
        matches = byAlias.get(key);
        if (matches != null) {
            return resolution(Rule.ALIAS, matches);
        }
        return Resolution.unresolved();
    }

    /**
     * Fold target text to its comparison form: heading anchor removed,
     * leading slashes and surrounding whitespace trimmed, lower case.
     */
    static String normalizeRef(String targetRef) {
        if (targetRef == null) {
            return "";
        }
        String ref = targetRef;
        int hash = ref.indexOf('#');
        if (hash >= 0) {
            ref = ref.substring(0, hash);
        }
        ref = ref.trim().replace('\\', '/');
        while (ref.startsWith("/")) {
            ref = ref.substring(1);
        }
        return fold(ref);
    }

    private static Resolution resolution(Rule rule, Set<String> ids) {
        List<String> candidates = new ArrayList<>(ids);
        return new Resolution(candidates.get(0), rule, candidates);
    }

    private static void index(Map<String, Set<String>> map, String key, String id) {
        map.computeIfAbsent(key, k -> new TreeSet<>()).add(id);
    }

    private static String fold(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }

    private static String stripExtension(String path) {
        if (path.endsWith(".md")) {
            return path.substring(0, path.length() - 3);
        }
        if (path.endsWith(".markdown")) {
            return path.substring(0, path.length() - 9);
        }
        return path;
    }
}
