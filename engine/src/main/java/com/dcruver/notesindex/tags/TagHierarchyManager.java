package com.dcruver.notesindex.tags;

import com.dcruver.notesindex.domain.Tag;
import com.dcruver.notesindex.domain.TagStatistics;
import com.dcruver.notesindex.storage.IndexStore;
import com.dcruver.notesindex.storage.StoredTag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Hierarchical tags ({@code project/backend/api}) and their usage.
 *
 * The hierarchy lives in the index store; every read works on a fresh
 * snapshot so usage counts always match the current associations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TagHierarchyManager {

    private final IndexStore store;

    /**
     * Canonical names for raw tag strings, ancestors included, without persisting.
     */
    public List<String> canonicalize(Collection<String> tagStrings) {
        return TagPath.canonicalize(tagStrings);
    }

    /**
     * Canonicalize and create any tags that do not exist yet.
     *
     * @return canonical names, ancestors included
     */
    public List<String> parseAndRegister(Collection<String> tagStrings) {
        List<String> canonical = TagPath.canonicalize(tagStrings);
        store.registerTags(canonical);
        return canonical;
    }

    public List<Tag> all() {
        return new ArrayList<>(snapshot().values());
    }

    public List<Tag> roots() {
        return snapshot().values().stream()
            .filter(Tag::isRoot)
            .collect(Collectors.toList());
    }

    public Optional<Tag> get(String name) {
        return Optional.ofNullable(snapshot().get(TagPath.normalize(name)));
    }

    public List<Tag> children(String name) {
        Map<String, Tag> tags = snapshot();
        Tag tag = tags.get(TagPath.normalize(name));
        if (tag == null) {
            return List.of();
        }
        return tag.getChildren().stream()
            .map(tags::get)
            .collect(Collectors.toList());
    }

    /**
     * Ancestors ordered root first, excluding the tag itself.
     */
    public List<Tag> ancestors(String name) {
        Map<String, Tag> tags = snapshot();
        String normalized = TagPath.normalize(name);
        if (!tags.containsKey(normalized)) {
            return List.of();
        }
        List<Tag> result = new ArrayList<>();
        for (String ancestor : TagPath.withAncestors(normalized)) {
            if (!ancestor.equals(normalized) && tags.containsKey(ancestor)) {
                result.add(tags.get(ancestor));
            }
        }
        return result;
    }

    /**
     * Every tag below {@code name}, in name order.
     */
    public List<Tag> descendants(String name) {
        Map<String, Tag> tags = snapshot();
        String normalized = TagPath.normalize(name);
        if (!tags.containsKey(normalized)) {
            return List.of();
        }
        return tags.values().stream()
            .filter(t -> !t.getName().equals(normalized) && TagPath.isSelfOrDescendant(t.getName(), normalized))
            .collect(Collectors.toList());
    }

    public List<Tag> mostUsed(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return snapshot().values().stream()
            .filter(t -> t.getUsageCount() > 0)
            .sorted(Comparator.comparingInt(Tag::getUsageCount).reversed()
                .thenComparing(Tag::getName))
            .limit(limit)
            .collect(Collectors.toList());
    }

    /**
     * Tags whose full name contains {@code query}, ignoring case.
     */
    public List<Tag> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return snapshot().values().stream()
            .filter(t -> t.getName().toLowerCase(Locale.ROOT).contains(needle))
            .collect(Collectors.toList());
    }

    /**
     * Parent, siblings and children of a tag.
     */
    public List<Tag> related(String name) {
        Map<String, Tag> tags = snapshot();
        Tag tag = tags.get(TagPath.normalize(name));
        if (tag == null) {
            return List.of();
        }

        Set<String> names = new LinkedHashSet<>();
        if (tag.getParent() != null) {
            names.add(tag.getParent());
            names.addAll(tags.get(tag.getParent()).getChildren());
        } else {
            tags.values().stream().filter(Tag::isRoot).forEach(t -> names.add(t.getName()));
        }
        names.addAll(tag.getChildren());
        names.remove(tag.getName());

        return names.stream()
            .map(tags::get)
            .collect(Collectors.toList());
    }

    public TagStatistics statistics() {
        Map<String, Tag> tags = snapshot();
        int roots = 0;
        int maxDepth = 0;
        int parents = 0;
        int childLinks = 0;
        for (Tag tag : tags.values()) {
            if (tag.isRoot()) {
                roots++;
            }
            maxDepth = Math.max(maxDepth, tag.getLevel());
            if (!tag.isLeaf()) {
                parents++;
                childLinks += tag.getChildren().size();
            }
        }
        List<Tag> top = mostUsed(1);
        return TagStatistics.builder()
            .totalTags(tags.size())
            .rootTags(roots)
            .maxDepth(maxDepth)
            .averageChildren(parents == 0 ? 0.0 : (double) childLinks / parents)
            .mostUsedTag(top.isEmpty() ? null : top.get(0).getName())
            .build();
    }

    /**
     * Replace the whole hierarchy from a full enumeration of document tags.
     * Running it twice with the same input leaves the same state.
     */
    public void rebuild(Map<String, ? extends Collection<String>> tagsByDocument) {
        Map<String, List<String>> canonical = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : tagsByDocument.entrySet()) {
            canonical.put(entry.getKey(), TagPath.canonicalize(entry.getValue()));
        }
        int associations = store.replaceAllTags(canonical);
        log.info("Rebuilt tag hierarchy from {} documents ({} associations)", canonical.size(), associations);
    }

    /**
     * Remove tags no document uses, leaves first, until nothing is left to remove.
     *
     * @return removed tag names
     */
    public List<String> cleanupUnused() {
        List<String> removed = store.removeUnusedLeafTags();
        if (!removed.isEmpty()) {
            log.info("Removed {} unused tags", removed.size());
        }
        return removed;
    }

    private Map<String, Tag> snapshot() {
        List<StoredTag> stored = store.loadTags();

        Map<String, List<String>> children = new TreeMap<>();
        for (StoredTag tag : stored) {
            if (tag.getParent() != null) {
                children.computeIfAbsent(tag.getParent(), k -> new ArrayList<>()).add(tag.getName());
            }
        }

        Map<String, Tag> tags = new TreeMap<>();
        for (StoredTag tag : stored) {
            tags.put(tag.getName(), Tag.builder()
                .name(tag.getName())
                .level(tag.getDepth())
                .parent(tag.getParent())
                .children(children.getOrDefault(tag.getName(), List.of()))
                .usageCount(tag.getUsageCount())
                .build());
        }
        return tags;
    }
}
