package com.dcruver.vaultgraph.graph;

import com.dcruver.vaultgraph.domain.NoteEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoteSelectorTest {

    private final NoteEntry project = NoteEntry.builder()
        .path("Projects/Graph Work.md")
        .title("Graph Work")
        .tag("work/graph")
        .tag("Active")
        .frontmatterValue("status", "draft")
        .frontmatterValue("aliases", List.of("gw", "graphs"))
        .build();

    @Test
    void acceptsEverythingWithoutPatterns() {
        assertTrue(NoteSelector.of(List.of(), List.of()).accepts(project));
        assertTrue(NoteSelector.all().accepts(project));
    }

    @Test
    void matchesTagsIgnoringCaseAndHash() {
        assertTrue(accepts("tag:#active"));
        assertTrue(accepts("tag:work"));
        assertTrue(accepts("tag:WORK/graph"));
        assertFalse(accepts("tag:wor"));
    }

    @Test
    void findSearchesPathAndTitle() {
        assertTrue(accepts("find:graph work"));
        assertTrue(accepts("find:projects/"));
        assertFalse(accepts("find:journal"));
    }

    @Test
    void matchesFrontmatterScalarsAndLists() {
        assertTrue(accepts("status:DRAFT"));
        assertTrue(accepts("aliases:gw"));
        assertFalse(accepts("status:done"));
        assertFalse(accepts("missing:draft"));
    }

    @Test
    void matchesPathsExactlyOrAsDirectoryPrefix() {
        assertTrue(accepts("projects"));
        assertTrue(accepts("Projects/"));
        assertTrue(accepts("projects/graph work"));
        assertTrue(accepts("Projects/Graph Work.md"));
        assertFalse(accepts("Proj"));
    }

    @Test
    void matchesGlobs() {
        assertTrue(accepts("Projects/*"));
        assertTrue(accepts("**/*work.md"));
        assertTrue(accepts("projects/graph?work"));
        assertFalse(accepts("*.md"));
    }

    @Test
    void excludeWinsOverInclude() {
        NoteSelector selector = NoteSelector.of(List.of("projects/"), List.of("tag:active"));

        assertFalse(selector.accepts(project));
    }

    @Test
    void rejectsEmptyOrWildcardValues() {
        assertThrows(IllegalArgumentException.class, () -> NoteSelector.of(List.of("tag:"), List.of()));
        assertThrows(IllegalArgumentException.class, () -> NoteSelector.of(List.of(), List.of("find:*")));
        assertThrows(IllegalArgumentException.class, () -> NoteSelector.of(List.of("status:"), List.of()));
    }

    @Test
    void globTranslation() {
        assertEquals(".*\\Q/\\E[^/]*", NoteSelector.globToRegex("**/*"));
    }

    private boolean accepts(String include) {
        return NoteSelector.of(List.of(include), List.of()).accepts(project);
    }
}
