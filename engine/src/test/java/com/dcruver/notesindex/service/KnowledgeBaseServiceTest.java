package com.dcruver.notesindex.service;

import com.dcruver.notesindex.EngineFixture;
import com.dcruver.notesindex.domain.Document;
import com.dcruver.notesindex.domain.DocumentFilter;
import com.dcruver.notesindex.domain.LinkStatistics;
import com.dcruver.notesindex.domain.RankedResult;
import com.dcruver.notesindex.domain.RebuildReport;
import com.dcruver.notesindex.domain.SimilarEntry;
import com.dcruver.notesindex.domain.Tag;
import com.dcruver.notesindex.domain.TagStatistics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseServiceTest {

    @TempDir
    Path tempDir;

    private EngineFixture engine;
    private KnowledgeBaseService service;

    @BeforeEach
    void setUp() throws Exception {
        engine = EngineFixture.create(tempDir);
        service = engine.service;

        engine.write("projects/alpha.md", """
            ---
            title: Alpha Project
            tags: [work/projects]
            status: published
            ---
            Alpha links to [[Beta]] and [[Missing Page]].
            #work/meetings
            """);
        engine.write("projects/beta.md", """
            ---
            title: Beta
            tags: [work/projects]
            ---
            The beta project covers telescopes.
            """);
        engine.write("journal/today.md", "Nothing linked here. #personal");

        RebuildReport report = service.rebuildIndex(engine.workspace);
        assertEquals(3, report.getIndexed());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static List<String> names(List<Tag> tags) {
        return tags.stream().map(Tag::getName).collect(Collectors.toList());
    }

    @Test
    void testDocumentQueries() {
        Document alpha = service.getDocument("projects/alpha.md").orElseThrow();
        assertEquals("Alpha Project", alpha.getTitle());

        assertTrue(service.getDocument("nope.md").isEmpty());
        assertEquals(3, service.listDocuments(DocumentFilter.ALL).size());
        assertEquals(2, service.listDocuments(DocumentFilter.builder().tag("work").build()).size());
    }

    @Test
    void testSearch() {
        List<RankedResult> hits = service.search("telescopes", 5);

        assertEquals(1, hits.size());
        assertEquals("projects/beta.md", hits.get(0).getDocumentId());
        assertTrue(service.search("", 5).isEmpty());
        assertEquals(1, service.search("telescopes", 0).size());
    }

    @Test
    void testLinkQueries() {
        assertEquals(List.of("projects/alpha.md"), service.getBacklinks("projects/beta.md").stream()
            .map(b -> b.getSourceId()).collect(Collectors.toList()));
        assertEquals(2, service.getOutgoingLinks("projects/alpha.md").size());
        assertEquals(1, service.getBrokenLinks().size());
        assertEquals("Missing Page", service.getBrokenLinks().get(0).getTarget());
        assertEquals(List.of("journal/today.md"), service.getOrphanedDocuments());
        assertTrue(service.getBacklinks("nope.md").isEmpty());

        LinkStatistics stats = service.getLinkStatistics();
        assertEquals(3, stats.getTotalDocuments());
        assertEquals(1, stats.getBrokenLinks());
    }

    @Test
    void testSimilarDocuments() {
        List<SimilarEntry> similar = service.getSimilarDocuments("projects/beta.md", 0);

        assertEquals(1, similar.size());
        assertEquals("projects/alpha.md", similar.get(0).getDocumentId());
        assertTrue(similar.get(0).getSharedTags().contains("work/projects"));
    }

    @Test
    void testTagQueries() {
        assertEquals(List.of("personal", "work"), names(service.getRootTags()));
        assertEquals(List.of("work/meetings", "work/projects"), names(service.getTagChildren("work")));
        assertEquals(List.of("work"), names(service.getTagAncestors("work/projects")));
        assertEquals(List.of("work/meetings", "work/projects"), names(service.getTagDescendants("work")));
        assertEquals("work", service.getPopularTags(1).get(0).getName());
        assertEquals(List.of("work/meetings"), names(service.searchTags("meet")));
        assertEquals(4, service.getAllTags().size());

        TagStatistics stats = service.getTagStatistics();
        assertEquals(2, stats.getRootTags());
        assertEquals("work", stats.getMostUsedTag());
    }

    @Test
    void testTagMaintenance() {
        assertEquals(List.of("ideas", "ideas/later"), service.parseAndRegisterTags(List.of("ideas/later")));
        assertEquals(List.of("ideas/later", "ideas"), service.cleanupUnusedTags());

        service.rebuildTagHierarchy(Map.of("journal/today.md", List.of("daily")));
        assertEquals(List.of("daily"), names(service.getAllTags()));
    }

    @Test
    void testExtractTagsFromContent() {
        assertEquals(List.of("draft", "a/b"), service.extractTagsFromContent("#draft and #a/b"));
    }

    @Test
    void testCancelWithoutRunningRebuild() {
        assertFalse(service.cancelRebuild());
    }
}
