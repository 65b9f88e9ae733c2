package com.dcruver.notesindex.graph;

import com.dcruver.notesindex.app.NotesIndexProperties;
import com.dcruver.notesindex.domain.BacklinkEntry;
import com.dcruver.notesindex.domain.BrokenLinkEntry;
import com.dcruver.notesindex.domain.Document;
import com.dcruver.notesindex.domain.Link;
import com.dcruver.notesindex.domain.LinkKind;
import com.dcruver.notesindex.domain.LinkStatistics;
import com.dcruver.notesindex.domain.LinkTarget;
import com.dcruver.notesindex.domain.SimilarEntry;
import com.dcruver.notesindex.io.ExtractedLink;
import com.dcruver.notesindex.storage.IndexStore;
import com.dcruver.notesindex.storage.Neighbourhood;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Views over the link table: resolution of extracted links, backlinks,
 * broken links with repair suggestions, orphans and similarity.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LinkGraph {

    private static final int MAX_SUGGESTIONS = 5;
    private static final double MIN_SUGGESTION_SIMILARITY = 0.6;

    private final IndexStore store;
    private final NotesIndexProperties properties;

    /**
     * Resolve a document's extracted links against the current namespace and
     * aggregate them into one edge per target and kind.
     */
    public List<Link> resolveLinks(Document document, List<ExtractedLink> extracted) {
        LinkResolver resolver = resolverFor(document);

        Map<String, Link> aggregated = new LinkedHashMap<>();
        for (ExtractedLink link : extracted) {
            LinkResolver.Resolution resolution = resolver.resolve(link.getTarget());
            if (resolution.isAmbiguous()) {
                log.warn("Ambiguous link [[{}]] in {} matches {} by {}, using {}",
                    link.getTarget(), document.getId(), resolution.getCandidates(),
                    resolution.getRule(), resolution.getTargetId());
            }

            LinkKind kind = link.isEmbed() ? LinkKind.EMBED : LinkKind.REFERENCE;
            String key = Link.targetKey(resolution.getTargetId(), link.getTarget()) + "|" + kind;
            Link existing = aggregated.get(key);
            if (existing != null) {
                aggregated.put(key, existing.withOccurrenceCount(existing.getOccurrenceCount() + 1));
                continue;
            }
            aggregated.put(key, Link.builder()
                .sourceId(document.getId())
                .targetRef(link.getTarget())
                .targetId(resolution.getTargetId())
                .kind(kind)
                .heading(link.getHeading())
                .context(link.getContext())
                .lineNumber(link.getLineNumber())
                .occurrenceCount(1)
                .build());
        }
        return new ArrayList<>(aggregated.values());
    }

    private LinkResolver resolverFor(Document document) {
        List<LinkTarget> targets = store.loadLinkTargets().stream()
            .filter(t -> !t.getId().equals(document.getId()))
            .collect(Collectors.toList());
        LinkResolver resolver = new LinkResolver(targets);
        resolver.add(LinkTarget.builder()
            .id(document.getId())
            .title(document.getTitle())
            .aliases(document.getAliases())
            .build());
        return resolver;
    }

    public List<BacklinkEntry> backlinks(String documentId) {
        return store.backlinks(documentId);
    }

    public List<Link> outgoingLinks(String documentId) {
        return store.outgoingLinks(documentId);
    }

    public List<String> orphanedDocuments() {
        return store.orphanIds();
    }

    public List<BrokenLinkEntry> brokenLinks() {
        List<Link> broken = store.brokenLinks();
        if (broken.isEmpty()) {
            return List.of();
        }

        List<LinkTarget> targets = store.loadLinkTargets();
        List<BrokenLinkEntry> entries = new ArrayList<>();
        for (Link link : broken) {
            entries.add(BrokenLinkEntry.builder()
                .sourceId(link.getSourceId())
                .target(link.getTargetRef())
                .kind(link.getKind())
                .context(link.getContext())
                .lineNumber(link.getLineNumber())
                .occurrenceCount(link.getOccurrenceCount())
                .suggestions(suggest(link.getTargetRef(), targets))
                .build());
        }
        return entries;
    }

    /**
     * Sources holding a link that the current namespace resolves differently
     * from what is stored: broken links that now resolve, and resolved links
     * that now point elsewhere or nowhere. Re-indexing them brings their
     * edges up to date.
     */
    public Set<String> staleSources() {
        List<Link> links = store.explicitLinks();
        if (links.isEmpty()) {
            return Set.of();
        }
        LinkResolver resolver = new LinkResolver(store.loadLinkTargets());
        Set<String> sources = new TreeSet<>();
        for (Link link : links) {
            String current = resolver.resolve(link.getTargetRef()).getTargetId();
            if (!Objects.equals(current, link.getTargetId())) {
                sources.add(link.getSourceId());
            }
        }
        return sources;
    }

    /**
     * Documents related to {@code documentId} through shared link targets and
     * tags, best first. Only documents sharing at least one of either are
     * considered.
     */
    public List<SimilarEntry> similar(String documentId, int limit) {
        if (limit <= 0 || !store.exists(documentId)) {
            return List.of();
        }

        NotesIndexProperties.Similarity weights = properties.getSimilarity();
        double linkWeight = Math.max(0.0, weights.getLinkWeight());
        double tagWeight = Math.max(0.0, weights.getTagWeight());
        double total = linkWeight + tagWeight;
        if (total == 0.0) {
            linkWeight = 0.5;
            tagWeight = 0.5;
            total = 1.0;
        }
        linkWeight /= total;
        tagWeight /= total;

        Neighbourhood hood = store.neighbourhood(documentId);
        List<SimilarEntry> entries = new ArrayList<>();
        for (Map.Entry<String, String> candidate : hood.getCandidateTitles().entrySet()) {
            String id = candidate.getKey();
            if (id.equals(documentId)) {
                continue;
            }
            Set<String> targets = hood.getCandidateTargets().getOrDefault(id, Set.of());
            Set<String> tags = hood.getCandidateTags().getOrDefault(id, Set.of());

            List<String> sharedLinks = intersection(hood.getTargets(), targets);
            List<String> sharedTags = intersection(hood.getTags(), tags);
            double score = linkWeight * jaccard(hood.getTargets(), targets, sharedLinks.size())
                + tagWeight * jaccard(hood.getTags(), tags, sharedTags.size());

            if (score <= 0.0 || score < weights.getMinScore()) {
                continue;
            }
            entries.add(SimilarEntry.builder()
                .documentId(id)
                .title(candidate.getValue())
                .score(Math.min(1.0, score))
                .sharedLinks(sharedLinks)
                .sharedTags(sharedTags)
                .build());
        }

        entries.sort(Comparator.comparingDouble(SimilarEntry::getScore).reversed()
            .thenComparing(SimilarEntry::getDocumentId));
        return entries.size() > limit ? new ArrayList<>(entries.subList(0, limit)) : entries;
    }

    public LinkStatistics statistics() {
        int resolved = store.countLinks(true);
        int broken = store.countLinks(false);
        return LinkStatistics.builder()
            .totalDocuments(store.countDocuments())
            .totalLinks(resolved + broken)
            .brokenLinks(broken)
            .orphanedDocuments(store.orphanIds().size())
            .build();
    }

    private static List<String> intersection(Set<String> a, Set<String> b) {
        List<String> shared = new ArrayList<>();
        for (String s : a) {
            if (b.contains(s)) {
                shared.add(s);
            }
        }
        return shared;
    }

    private static double jaccard(Set<String> a, Set<String> b, int shared) {
        int union = a.size() + b.size() - shared;
        return union == 0 ? 0.0 : (double) shared / union;
    }

    /**
     * Titles and file stems close to the broken target text, most similar first.
     */
    List<String> suggest(String targetRef, List<LinkTarget> targets) {
        String wanted = LinkResolver.normalizeRef(targetRef);
        if (wanted.isEmpty()) {
            return List.of();
        }

        Map<String, Double> bestById = new LinkedHashMap<>();
        for (LinkTarget target : targets) {
            Set<String> names = new HashSet<>();
            names.add(stem(target.getId()));
            if (target.getTitle() != null) {
                names.add(target.getTitle().toLowerCase(Locale.ROOT));
            }
            for (String name : names) {
                double similarity = similarity(wanted, name);
                if (similarity >= MIN_SUGGESTION_SIMILARITY) {
                    bestById.merge(target.getId(), similarity, Math::max);
                }
            }
        }

        return bestById.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Double>comparingByKey()))
            .limit(MAX_SUGGESTIONS)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    private static String stem(String id) {
        String name = id.substring(id.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    private static int levenshtein(String a, String b) {
        int[][] dp = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) dp[i][0] = i;
        for (int j = 0; j <= b.length(); j++) dp[0][j] = j;
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = (a.charAt(i - 1) == b.charAt(j - 1)) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }
        return dp[a.length()][b.length()];
    }
}
