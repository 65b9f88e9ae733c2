package com.dcruver.notesindex.service;

import com.dcruver.notesindex.app.NotesIndexProperties;
import com.dcruver.notesindex.coordinator.IndexCoordinator;
import com.dcruver.notesindex.domain.BacklinkEntry;
import com.dcruver.notesindex.domain.BrokenLinkEntry;
import com.dcruver.notesindex.domain.Document;
import com.dcruver.notesindex.domain.DocumentFilter;
import com.dcruver.notesindex.domain.Link;
import com.dcruver.notesindex.domain.LinkStatistics;
import com.dcruver.notesindex.domain.RankedResult;
import com.dcruver.notesindex.domain.RebuildReport;
import com.dcruver.notesindex.domain.SimilarEntry;
import com.dcruver.notesindex.domain.Tag;
import com.dcruver.notesindex.domain.TagStatistics;
import com.dcruver.notesindex.graph.LinkGraph;
import com.dcruver.notesindex.io.MarkdownDocumentParser;
import com.dcruver.notesindex.storage.IndexStore;
import com.dcruver.notesindex.storage.StorageException;
import com.dcruver.notesindex.tags.TagHierarchyManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for callers outside the engine.
 *
 * Queries never throw for unknown ids or tags and degrade to empty results
 * when the index is unavailable. Mutating operations surface their failures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeBaseService {

    private final IndexStore store;
    private final LinkGraph linkGraph;
    private final TagHierarchyManager tagHierarchy;
    private final IndexCoordinator coordinator;
    private final MarkdownDocumentParser parser;
    private final NotesIndexProperties properties;

    // Documents

    public Optional<Document> getDocument(String id) {
        return query("getDocument", Optional::empty, () -> store.get(id));
    }

    public List<Document> listDocuments(DocumentFilter filter) {
        return query("listDocuments", List::of, () -> store.list(filter));
    }

    /**
     * Ranked full-text search. A limit of zero or less uses the configured default.
     */
    public List<RankedResult> search(String query, int limit) {
        NotesIndexProperties.Search search = properties.getSearch();
        int effective = limit <= 0 ? search.getDefaultLimit() : Math.min(limit, search.getMaxLimit());
        return query("search", List::of, () -> store.search(query, effective));
    }

    // Links

    public List<BacklinkEntry> getBacklinks(String id) {
        return query("getBacklinks", List::of, () -> linkGraph.backlinks(id));
    }

    public List<Link> getOutgoingLinks(String id) {
        return query("getOutgoingLinks", List::of, () -> linkGraph.outgoingLinks(id));
    }

    public List<SimilarEntry> getSimilarDocuments(String id, int limit) {
        int effective = limit <= 0 ? properties.getSimilarity().getDefaultLimit() : limit;
        return query("getSimilarDocuments", List::of, () -> linkGraph.similar(id, effective));
    }

    public List<BrokenLinkEntry> getBrokenLinks() {
        return query("getBrokenLinks", List::of, linkGraph::brokenLinks);
    }

    public List<String> getOrphanedDocuments() {
        return query("getOrphanedDocuments", List::of, linkGraph::orphanedDocuments);
    }

    public LinkStatistics getLinkStatistics() {
        return query("getLinkStatistics", () -> LinkStatistics.builder().build(), linkGraph::statistics);
    }

    // Tags

    public List<Tag> getAllTags() {
        return query("getAllTags", List::of, tagHierarchy::all);
    }

    public List<Tag> getRootTags() {
        return query("getRootTags", List::of, tagHierarchy::roots);
    }

    public List<Tag> getPopularTags(int limit) {
        return query("getPopularTags", List::of, () -> tagHierarchy.mostUsed(limit));
    }

    public List<Tag> getTagChildren(String name) {
        return query("getTagChildren", List::of, () -> tagHierarchy.children(name));
    }

    public List<Tag> getTagAncestors(String name) {
        return query("getTagAncestors", List::of, () -> tagHierarchy.ancestors(name));
    }

    public List<Tag> getTagDescendants(String name) {
        return query("getTagDescendants", List::of, () -> tagHierarchy.descendants(name));
    }

    public List<Tag> searchTags(String query) {
        return query("searchTags", List::of, () -> tagHierarchy.search(query));
    }

    public TagStatistics getTagStatistics() {
        return query("getTagStatistics", () -> TagStatistics.builder().build(), tagHierarchy::statistics);
    }

    public List<String> parseAndRegisterTags(Collection<String> tagStrings) {
        return tagHierarchy.parseAndRegister(tagStrings);
    }

    public void rebuildTagHierarchy(Map<String, ? extends Collection<String>> tagsByDocument) {
        tagHierarchy.rebuild(tagsByDocument);
    }

    public List<String> cleanupUnusedTags() {
        return tagHierarchy.cleanupUnused();
    }

    /**
     * Tags of a piece of text as the parser sees them, without touching the index.
     */
    public List<String> extractTagsFromContent(String content) {
        return parser.extractTags(content);
    }

    // Index maintenance

    public RebuildReport rebuildIndex(Path workspace) throws IOException {
        return coordinator.rebuildIndex(workspace);
    }

    public boolean cancelRebuild() {
        return coordinator.cancelRebuild();
    }

    private <T> T query(String operation, Supplier<T> fallback, Supplier<T> query) {
        try {
            return query.get();
        } catch (StorageException e) {
            log.error("{} failed: {}", operation, e.getMessage(), e);
            return fallback.get();
        }
    }
}
