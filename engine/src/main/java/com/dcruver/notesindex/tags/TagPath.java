package com.dcruver.notesindex.tags;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Naming rules for hierarchical tags ({@code project/backend/api}).
 */
public final class TagPath {

    public static final char DELIMITER = '/';

    private TagPath() {
    }

    /**
     * Normalise a tag string: drop a leading {@code #}, trim each segment and
     * drop empty segments. Returns an empty string when nothing is left.
     */
    public static String normalize(String tag) {
        if (tag == null) {
            return "";
        }
        String trimmed = tag.trim();
        while (trimmed.startsWith("#")) {
            trimmed = trimmed.substring(1);
        }

        StringBuilder sb = new StringBuilder();
        for (String segment : trimmed.split(String.valueOf(DELIMITER))) {
            String part = segment.trim();
            if (part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(DELIMITER);
            }
            sb.append(part);
        }
        return sb.toString();
    }

    /**
     * The tag and all of its ancestors, root first: {@code a/b/c -> [a, a/b, a/b/c]}.
     */
    public static List<String> withAncestors(String tag) {
        String normalized = normalize(tag);
        List<String> result = new ArrayList<>();
        if (normalized.isEmpty()) {
            return result;
        }
        int idx = normalized.indexOf(DELIMITER);
        while (idx >= 0) {
            result.add(normalized.substring(0, idx));
            idx = normalized.indexOf(DELIMITER, idx + 1);
        }
        result.add(normalized);
        return result;
    }

    /**
     * Canonical names for a collection of tag strings, ancestors included,
     * deduplicated in first-seen order.
     */
    public static List<String> canonicalize(Collection<String> tags) {
        Set<String> canonical = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                canonical.addAll(withAncestors(tag));
            }
        }
        return new ArrayList<>(canonical);
    }

    public static Optional<String> parentOf(String tag) {
        int idx = tag.lastIndexOf(DELIMITER);
        return idx < 0 ? Optional.empty() : Optional.of(tag.substring(0, idx));
    }

    public static int depthOf(String tag) {
        int depth = 0;
        for (int i = 0; i < tag.length(); i++) {
            if (tag.charAt(i) == DELIMITER) {
                depth++;
            }
        }
        return depth;
    }

    /** True when {@code tag} equals {@code ancestor} or sits below it. */
    public static boolean isSelfOrDescendant(String tag, String ancestor) {
        return tag.equals(ancestor) || tag.startsWith(ancestor + DELIMITER);
    }
}
