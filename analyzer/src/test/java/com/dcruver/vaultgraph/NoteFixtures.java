package com.dcruver.vaultgraph;

import com.dcruver.vaultgraph.domain.NoteEntry;
import com.dcruver.vaultgraph.graph.CommunitySummarizer;
import com.dcruver.vaultgraph.graph.ComponentFinder;
import com.dcruver.vaultgraph.graph.GraphAnalyzer;
import com.dcruver.vaultgraph.graph.GraphBuilder;
import com.dcruver.vaultgraph.graph.HitsScorer;
import com.dcruver.vaultgraph.graph.LabelPropagation;
import com.dcruver.vaultgraph.graph.RecencyPropagator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

/**
 * Shared builders for engine tests.
 */
public final class NoteFixtures {

    public static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private NoteFixtures() {
    }

    public static NoteEntry note(String path, String... links) {
        return NoteEntry.builder()
            .path(path)
            .title(path.replace(".md", ""))
            .outboundLinks(Arrays.asList(links))
            .build();
    }

    public static NoteEntry datedNote(String path, int ageDays, String... links) {
        return note(path, links).toBuilder()
            .lastModified(NOW.minus(Duration.ofDays(ageDays)))
            .build();
    }

    public static GraphAnalyzer analyzer() {
        return new GraphAnalyzer(
            new GraphBuilder(),
            new HitsScorer(),
            new ComponentFinder(),
            new LabelPropagation(),
            new RecencyPropagator(),
            new CommunitySummarizer(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
