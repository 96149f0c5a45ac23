package com.dcruver.vaultgraph.io;

import com.dcruver.vaultgraph.domain.NoteEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownNoteParserTest {

    private static final Instant FILE_TIME = Instant.parse("2025-03-01T08:00:00Z");

    private MarkdownNoteParser parser;
    private NotePathIndex index;

    @BeforeEach
    void setUp() {
        parser = new MarkdownNoteParser();
        index = NotePathIndex.of(List.of("a.md", "b.md", "notes/c.md", "img.md", "self.md"));
    }

    @Test
    void parsesFrontmatterTitleTagsAndDate() {
        String content = """
            ---
            title: Graph Notes
            tags: [Research, graphs]
            status: draft
            updated: 2025-01-15
            ---
            # Heading Title

            Body with #inline-tag and #Research again.
            """;

        NoteEntry note = parser.parse("a.md", content, FILE_TIME, NoteLoadOptions.defaults(), index);

        assertEquals("Graph Notes", note.getTitle());
        assertEquals(List.of("Research", "graphs", "inline-tag"), note.getTags());
        assertEquals("draft", note.getFrontmatter().get("status"));
        assertEquals(Instant.parse("2025-01-15T00:00:00Z"), note.getLastModified());
    }

    @Test
    void fallsBackToHeadingThenFileName() {
        NoteEntry withHeading = parser.parse("notes/c.md", "intro\n# The Heading\ntext\n", FILE_TIME,
            NoteLoadOptions.defaults(), index);
        NoteEntry bare = parser.parse("notes/c.md", "just text\n", FILE_TIME, NoteLoadOptions.defaults(), index);

        assertEquals("The Heading", withHeading.getTitle());
        assertEquals("c", bare.getTitle());
        assertEquals(FILE_TIME, bare.getLastModified());
    }

    @Test
    void extractsAndResolvesWikilinks() {
        String content = "See [[b]], [[c|alias]], [[b#Section]], ![[img]], [[missing]] and [[self]].\n";

        NoteEntry note = parser.parse("self.md", content, FILE_TIME, NoteLoadOptions.defaults(), index);

        assertEquals(List.of("b.md", "notes/c.md", "img.md"), note.getOutboundLinks());
    }

    @Test
    void skipsAnchorsAndEmbedsWhenAsked() {
        String content = "[[a#Part]] ![[img]] [[notes/c]]\n";
        NoteLoadOptions options = NoteLoadOptions.builder().skipAnchors(true).skipEmbeds(true).build();

        NoteEntry note = parser.parse("b.md", content, FILE_TIME, options, index);

        assertEquals(List.of("notes/c.md"), note.getOutboundLinks());
    }

    @Test
    void ignoresHashtagsInCode() {
        String content = """
            Real #kept tag.
            `#inline-code`
            ```
            #fenced
            ```
            Issue #123 is not a tag, and neither is a [[b#heading]] anchor.
            """;

        NoteEntry note = parser.parse("a.md", content, FILE_TIME, NoteLoadOptions.defaults(), index);

        assertEquals(List.of("kept"), note.getTags());
    }

    @Test
    void malformedFrontmatterIsIgnored() {
        String content = "---\ntitle: [unclosed\n---\nBody [[b]]\n";

        NoteEntry note = parser.parse("a.md", content, FILE_TIME, NoteLoadOptions.defaults(), index);

        assertTrue(note.getFrontmatter().isEmpty());
        assertEquals(List.of("b.md"), note.getOutboundLinks());
        assertEquals("a", note.getTitle());
    }

    @Test
    void parsesTimestampFormats() {
        assertEquals(Instant.parse("2024-05-01T10:30:00Z"), MarkdownNoteParser.parseTimestamp("2024-05-01T10:30:00Z"));
        assertEquals(Instant.parse("2024-05-01T08:30:00Z"), MarkdownNoteParser.parseTimestamp("2024-05-01T10:30:00+02:00"));
        assertEquals(Instant.parse("2024-05-01T10:30:00Z"), MarkdownNoteParser.parseTimestamp("2024-05-01 10:30"));
        assertEquals(Instant.parse("2024-05-01T00:00:00Z"), MarkdownNoteParser.parseTimestamp("2024-05-01"));
        assertNull(MarkdownNoteParser.parseTimestamp("someday"));
    }
}
