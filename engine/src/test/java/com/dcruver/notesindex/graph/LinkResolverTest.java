package com.dcruver.notesindex.graph;

import com.dcruver.notesindex.domain.LinkTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkResolverTest {

    private LinkResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new LinkResolver(List.of(
            target("Index.md", "Home", List.of()),
            target("notes/Design Doc.md", "System Design", List.of("architecture")),
            target("archive/notes/Design Doc.md", "Old Design", List.of()),
            target("journal/2024-01-15.md", "Monday", List.of("first day"))
        ));
    }

    private static LinkTarget target(String id, String title, List<String> aliases) {
        return LinkTarget.builder().id(id).title(title).aliases(aliases).build();
    }

    @Test
    void testExactIdIgnoringCase() {
        LinkResolver.Resolution r = resolver.resolve("index.MD");

        assertEquals("Index.md", r.getTargetId());
        assertEquals(LinkResolver.Rule.ID, r.getRule());
        assertFalse(r.isAmbiguous());
    }

    @Test
    void testIdWithoutExtension() {
        assertEquals("notes/Design Doc.md", resolver.resolve("notes/design doc").getTargetId());
    }

    @Test
    void testFullPathBeatsPathSuffix() {
        LinkResolver.Resolution r = resolver.resolve("notes/Design Doc");

        assertEquals("notes/Design Doc.md", r.getTargetId());
        assertEquals(LinkResolver.Rule.ID_WITHOUT_EXTENSION, r.getRule());
        assertFalse(r.isAmbiguous());
    }

    @Test
    void testPathSuffixAtSegmentBoundary() {
        LinkResolver nested = new LinkResolver(List.of(
            target("a/projects/plan.md", "Plan A", List.of()),
            target("b/myprojects/plan.md", "Plan B", List.of())));

        LinkResolver.Resolution r = nested.resolve("projects/plan");

        assertEquals("a/projects/plan.md", r.getTargetId());
        assertEquals(LinkResolver.Rule.PATH_SUFFIX, r.getRule());
        assertFalse(r.isAmbiguous());
    }

    @Test
    void testFileStemIsAmbiguousAndFirstIdWins() {
        LinkResolver.Resolution r = resolver.resolve("Design Doc");

        assertEquals(LinkResolver.Rule.FILE_STEM, r.getRule());
        assertTrue(r.isAmbiguous());
        assertEquals(List.of("archive/notes/Design Doc.md", "notes/Design Doc.md"), r.getCandidates());
        assertEquals("archive/notes/Design Doc.md", r.getTargetId());
    }

    @Test
    void testTitleAndAlias() {
        assertEquals("Index.md", resolver.resolve("home").getTargetId());
        assertEquals(LinkResolver.Rule.TITLE, resolver.resolve("home").getRule());

        assertEquals("notes/Design Doc.md", resolver.resolve("Architecture").getTargetId());
        assertEquals(LinkResolver.Rule.ALIAS, resolver.resolve("Architecture").getRule());
    }

    @Test
    void testHeadingAnchorIsIgnored() {
        assertEquals("Index.md", resolver.resolve("Index#Getting started").getTargetId());
    }

    @Test
    void testUnresolved() {
        LinkResolver.Resolution r = resolver.resolve("Nowhere");

        assertFalse(r.isResolved());
        assertNull(r.getTargetId());
        assertTrue(resolver.resolve("  ").getCandidates().isEmpty());
    }

    @Test
    void testNoFuzzyMatching() {
        assertFalse(resolver.resolve("Indx").isResolved());
    }
}
