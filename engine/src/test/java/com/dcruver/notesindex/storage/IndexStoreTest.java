package com.dcruver.notesindex.storage;

import com.dcruver.notesindex.app.DataSourceConfig;
import com.dcruver.notesindex.app.NotesIndexProperties;
import com.dcruver.notesindex.domain.BacklinkEntry;
import com.dcruver.notesindex.domain.Document;
import com.dcruver.notesindex.domain.DocumentFilter;
import com.dcruver.notesindex.domain.DocumentStatus;
import com.dcruver.notesindex.domain.Link;
import com.dcruver.notesindex.domain.LinkKind;
import com.dcruver.notesindex.domain.RankedResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IndexStoreTest {

    @TempDir
    Path tempDir;

    private NotesIndexProperties properties;
    private DataSource dataSource;
    private IndexStore store;

    @BeforeEach
    void setUp() throws Exception {
        properties = new NotesIndexProperties();
        store = openStore();
    }

    private IndexStore openStore() throws Exception {
        dataSource = DataSourceConfig.sqliteDataSource(tempDir.resolve("index.db"), properties.getStorage());
        IndexStore s = new IndexStore(dataSource, properties);
        s.init();
        return s;
    }

    private static Document doc(String id, String title, String body, List<String> tags) {
        return Document.builder()
            .id(id)
            .title(title)
            .content(body)
            .body(body)
            .frontmatter(Map.of("title", title))
            .date(LocalDate.of(2024, 1, 15))
            .tags(tags)
            .aliases(List.of())
            .status(DocumentStatus.DRAFT)
            .wordCount(body.split("\\s+").length)
            .readingTimeMinutes(1)
            .modifiedAt(Instant.ofEpochMilli(1_700_000_000_000L))
            .fileSize(body.length())
            .contentHash("hash-" + id)
            .build();
    }

    private static Link link(String source, String ref, String targetId) {
        return Link.builder()
            .sourceId(source)
            .targetRef(ref)
            .targetId(targetId)
            .kind(LinkKind.REFERENCE)
            .context("see [[" + ref + "]]")
            .lineNumber(1)
            .occurrenceCount(1)
            .build();
    }

    private void put(Document document, List<Link> links, List<String> tags) {
        store.upsert(IndexedDocument.builder().document(document).links(links).tags(tags).build());
    }

    @Test
    void testUpsertAndGet() {
        Document a = doc("notes/A.md", "Alpha", "alpha body text", List.of("proj/x"));
        boolean created = store.upsert(IndexedDocument.builder()
            .document(a).links(List.of()).tags(List.of("proj", "proj/x")).build());

        assertTrue(created);
        Document loaded = store.get("notes/A.md").orElseThrow();
        assertEquals("Alpha", loaded.getTitle());
        assertEquals("alpha body text", loaded.getBody());
        assertEquals(List.of("proj/x"), loaded.getTags());
        assertEquals(LocalDate.of(2024, 1, 15), loaded.getDate());
        assertEquals("Alpha", loaded.getFrontmatter().get("title"));
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), loaded.getModifiedAt());
        assertEquals(List.of("proj", "proj/x"), store.tagsOf("notes/A.md"));
        assertTrue(store.get("missing.md").isEmpty());
    }

    @Test
    void testUpsertIsIdempotent() {
        Document a = doc("A.md", "Alpha", "body", List.of("t"));
        put(a, List.of(link("A.md", "B", null)), List.of("t"));
        boolean createdAgain = store.upsert(IndexedDocument.builder()
            .document(a).links(List.of(link("A.md", "B", null))).tags(List.of("t")).build());

        assertFalse(createdAgain);
        assertEquals(1, store.countDocuments());
        assertEquals(1, store.outgoingLinks("A.md").size());
        assertEquals(1, store.search("body", 10).size());
        assertEquals(List.of("t"), store.tagsOf("A.md"));
    }

    @Test
    void testDataSurvivesReopen() throws Exception {
        put(doc("A.md", "Alpha", "persistent words", List.of()), List.of(), List.of());

        IndexStore reopened = openStore();

        assertTrue(reopened.get("A.md").isPresent());
        assertEquals(1, reopened.search("persistent", 10).size());
    }

    @Test
    void testSearchFindsAndForgetsKeyword() {
        put(doc("A.md", "Alpha", "the zebra crossing", List.of()), List.of(), List.of());

        List<RankedResult> hits = store.search("zebra", 10);
        assertEquals(1, hits.size());
        assertEquals("A.md", hits.get(0).getDocumentId());
        assertTrue(hits.get(0).getSnippet().contains("<mark>zebra</mark>"));

        put(doc("A.md", "Alpha", "the horse crossing", List.of()), List.of(), List.of());

        assertTrue(store.search("zebra", 10).isEmpty());
        assertEquals(1, store.search("horse", 10).size());
    }

    @Test
    void testSearchRanksTitleMatchesFirst() {
        put(doc("body.md", "Something", "gardening tips and more gardening", List.of()), List.of(), List.of());
        put(doc("title.md", "Gardening", "unrelated words here", List.of()), List.of(), List.of());

        List<RankedResult> hits = store.search("gardening", 10);

        assertEquals(2, hits.size());
        assertEquals("title.md", hits.get(0).getDocumentId());
        assertTrue(hits.get(0).getScore() >= hits.get(1).getScore());
    }

    @Test
    void testSearchTreatsQuerySyntaxAsText() {
        put(doc("A.md", "Alpha", "apples and oranges", List.of()), List.of(), List.of());

        assertEquals(1, store.search("apples AND", 10).size());
        assertTrue(store.search("\"apples\" NEAR(", 10).isEmpty());
        assertTrue(store.search("   ", 10).isEmpty());
        assertTrue(store.search("***", 10).isEmpty());
        assertEquals(1, store.search("appl*", 10).size());
    }

    @Test
    void testMatchExpressionQuotesTokens() {
        assertEquals("\"foo\" \"bar\"*", IndexStore.toMatchExpression(" foo  bar* "));
        assertEquals("\"OR\"", IndexStore.toMatchExpression("OR - \""));
        assertEquals("", IndexStore.toMatchExpression(null));
    }

    @Test
    void testSearchMatchesTagSegments() {
        put(doc("A.md", "Alpha", "nothing", List.of("project/backend")), List.of(), List.of());

        assertEquals(1, store.search("backend", 10).size());
    }

    @Test
    void testDeleteTurnsIncomingLinksIntoBrokenLinks() {
        put(doc("B.md", "Beta", "target", List.of()), List.of(), List.of());
        put(doc("A.md", "Alpha", "source", List.of()), List.of(link("A.md", "B", "B.md")), List.of());

        List<BacklinkEntry> backlinks = store.backlinks("B.md");
        assertEquals(1, backlinks.size());
        assertEquals("A.md", backlinks.get(0).getSourceId());
        assertEquals("Alpha", backlinks.get(0).getSourceTitle());

        assertTrue(store.delete("B.md"));

        assertTrue(store.backlinks("B.md").isEmpty());
        List<Link> broken = store.brokenLinks();
        assertEquals(1, broken.size());
        assertEquals("B", broken.get(0).getTargetRef());
        assertEquals("A.md", broken.get(0).getSourceId());
        assertNull(broken.get(0).getTargetId());
        assertTrue(store.search("target", 10).isEmpty());
        assertFalse(store.delete("B.md"));
    }

    @Test
    void testDeleteMergesIntoExistingBrokenLink() {
        put(doc("B.md", "Beta", "target", List.of()), List.of(), List.of());
        put(doc("A.md", "Alpha", "source", List.of()), List.of(
            link("A.md", "B", "B.md"),
            link("A.md", "b", null).withOccurrenceCount(2)), List.of());

        store.delete("B.md");

        List<Link> broken = store.brokenLinks();
        assertEquals(1, broken.size());
        assertEquals(3, broken.get(0).getOccurrenceCount());
    }

    @Test
    void testOrphans() {
        put(doc("A.md", "Alpha", "a", List.of()), List.of(link("A.md", "B", "B.md")), List.of());
        put(doc("B.md", "Beta", "b", List.of()), List.of(), List.of());
        put(doc("C.md", "Gamma", "c", List.of()), List.of(link("C.md", "Nowhere", null)), List.of());

        assertEquals(List.of("C.md"), store.orphanIds());
    }

    @Test
    void testListFilters() {
        put(doc("notes/A.md", "Alpha", "a", List.of()), List.of(), List.of("proj", "proj/x"));
        put(doc("notes/B.md", "Beta", "b", List.of()).withStatus(DocumentStatus.PUBLISHED), List.of(), List.of("other"));
        put(doc("journal/C.md", "Gamma", "c", List.of()).withDegraded(true), List.of(), List.of());

        assertEquals(3, store.list(DocumentFilter.ALL).size());
        assertEquals(List.of("notes/A.md", "notes/B.md"), ids(store.list(DocumentFilter.builder().pathPrefix("notes/").build())));
        assertEquals(List.of("notes/A.md"), ids(store.list(DocumentFilter.builder().tag("proj").build())));
        assertEquals(List.of("notes/B.md"), ids(store.list(DocumentFilter.builder().status(DocumentStatus.PUBLISHED).build())));
        assertEquals(List.of("journal/C.md"), ids(store.list(DocumentFilter.builder().degraded(true).build())));
        assertEquals(List.of("notes/A.md"), ids(store.list(DocumentFilter.builder().limit(1).offset(1).build())));
    }

    @Test
    void testTagUsageIncludesDescendants() {
        put(doc("A.md", "Alpha", "a", List.of()), List.of(), List.of("proj", "proj/x"));
        put(doc("B.md", "Beta", "b", List.of()), List.of(), List.of("proj", "proj/y"));

        Map<String, Integer> usage = store.loadTags().stream()
            .collect(Collectors.toMap(StoredTag::getName, StoredTag::getUsageCount));

        assertEquals(2, usage.get("proj"));
        assertEquals(1, usage.get("proj/x"));
        assertEquals(1, usage.get("proj/y"));
    }

    @Test
    void testRemoveUnusedLeafTagsCascades() {
        store.registerTags(List.of("a", "a/b", "a/b/c", "keep"));
        put(doc("A.md", "Alpha", "a", List.of()), List.of(), List.of("keep"));

        List<String> removed = store.removeUnusedLeafTags();

        assertEquals(List.of("a/b/c", "a/b", "a"), removed);
        assertEquals(List.of("keep"), store.loadTags().stream().map(StoredTag::getName).collect(Collectors.toList()));
    }

    @Test
    void testNeighbourhoodCollectsCandidates() {
        put(doc("T.md", "Target", "t", List.of()), List.of(), List.of());
        put(doc("A.md", "Alpha", "a", List.of()), List.of(link("A.md", "T", "T.md")), List.of("x"));
        put(doc("B.md", "Beta", "b", List.of()), List.of(link("B.md", "T", "T.md")), List.of());
        put(doc("C.md", "Gamma", "c", List.of()), List.of(), List.of("x"));
        put(doc("D.md", "Delta", "d", List.of()), List.of(), List.of("y"));

        Neighbourhood hood = store.neighbourhood("A.md");

        assertEquals(List.of("T.md"), List.copyOf(hood.getTargets()));
        assertEquals(List.of("x"), List.copyOf(hood.getTags()));
        assertEquals(List.of("B.md", "C.md"), List.copyOf(hood.getCandidateTitles().keySet()));
    }

    @Test
    void testFailedUpsertRollsBackToPreviousState() {
        put(doc("A.md", "Alpha", "original words", List.of("t")), List.of(link("A.md", "B", null)), List.of("t"));

        // two edges with the same target and kind violate the links primary key after
        // the document row and full-text entry were already rewritten
        Document replacement = doc("A.md", "Replaced", "replacement words", List.of("u"));
        List<Link> clashing = List.of(link("A.md", "C", null), link("A.md", "C", null));
        assertThrows(StorageException.class, () -> put(replacement, clashing, List.of("u")));

        Document loaded = store.get("A.md").orElseThrow();
        assertEquals("Alpha", loaded.getTitle());
        assertEquals("original words", loaded.getBody());
        assertEquals(1, store.search("original", 10).size());
        assertTrue(store.search("replacement", 10).isEmpty());
        assertEquals(List.of("B"), store.outgoingLinks("A.md").stream()
            .map(Link::getTargetRef).collect(Collectors.toList()));
        assertEquals(List.of("t"), store.tagsOf("A.md"));
    }

    @Test
    void testReadsSeeCommittedStateWhileWriteIsInFlight() throws Exception {
        properties.getStorage().setLockTimeout(Duration.ofMillis(200));
        store = openStore();
        put(doc("A.md", "Alpha", "body", List.of()), List.of(), List.of());

        CountDownLatch updated = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<Throwable> writerFailure = new AtomicReference<>();
        Thread writer = new Thread(() -> {
            try {
                store.write("slow rename", status -> {
                    new JdbcTemplate(dataSource).update("UPDATE documents SET title = 'Renamed' WHERE id = 'A.md'");
                    updated.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return null;
                });
            } catch (Throwable t) {
                writerFailure.set(t);
            }
        });
        writer.start();
        try {
            assertTrue(updated.await(10, TimeUnit.SECONDS));

            assertEquals("Alpha", store.get("A.md").orElseThrow().getTitle());
            StorageException timeout = assertThrows(StorageException.class,
                () -> put(doc("B.md", "Beta", "body", List.of()), List.of(), List.of()));
            assertTrue(timeout.getMessage().contains("write lock"));
        } finally {
            release.countDown();
            writer.join(10_000);
        }

        assertNull(writerFailure.get());
        assertEquals("Renamed", store.get("A.md").orElseThrow().getTitle());
        assertTrue(store.get("B.md").isEmpty());
    }

    private static List<String> ids(List<Document> documents) {
        return documents.stream().map(Document::getId).collect(Collectors.toList());
    }
}
