package com.dcruver.vaultgraph.graph;

import com.dcruver.vaultgraph.domain.AnalysisResult;
import com.dcruver.vaultgraph.domain.CommunitySummary;
import com.dcruver.vaultgraph.domain.GraphNode;
import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.GraphStatsSummary;
import com.dcruver.vaultgraph.domain.GraphTimings;
import com.dcruver.vaultgraph.domain.NoteEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Runs the full analysis pipeline over already loaded notes:
 * build, HITS, components, communities, recency.
 *
 * Stateless; every call works on its own maps and returns a fresh result.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GraphAnalyzer {

    private final GraphBuilder graphBuilder;
    private final HitsScorer hitsScorer;
    private final ComponentFinder componentFinder;
    private final LabelPropagation labelPropagation;
    private final RecencyPropagator recencyPropagator;
    private final CommunitySummarizer communitySummarizer;
    private final Clock clock;

    public AnalysisResult analyze(List<NoteEntry> notes, GraphOptions options) {
        return analyze(notes, options, Duration.ZERO);
    }

    /**
     * Analyze the notes. {@code loadTime} is how long the caller spent loading
     * them and is only reported back in the timings.
     *
     * @throws IllegalArgumentException if a note has no path
     */
    public AnalysisResult analyze(List<NoteEntry> notes, GraphOptions options, Duration loadTime) {
        List<NoteEntry> input = notes == null ? List.of() : notes;
        GraphOptions effective = options == null ? GraphOptions.defaults() : options;
        Instant now = clock.instant();
        long started = System.nanoTime();

        enter(AnalysisPhase.IDLE, input.size());
        validate(input);
        enter(AnalysisPhase.LOADED, input.size());

        long mark = System.nanoTime();
        BuiltGraph built = graphBuilder.build(input, effective);
        LinkGraph graph = built.getGraph();
        Duration buildTime = since(mark);
        enter(AnalysisPhase.BUILT, graph.size());

        mark = System.nanoTime();
        HitsScores scores = hitsScorer.score(graph, effective.getHitsMaxIterations(), effective.getHitsTolerance());
        Duration hitsTime = since(mark);
        enter(AnalysisPhase.SCORED, scores.getIterations());

        List<List<String>> weak = componentFinder.weakComponents(graph);
        List<List<String>> strong = componentFinder.strongComponents(graph);
        enter(AnalysisPhase.PARTITIONED, weak.size());

        mark = System.nanoTime();
        Map<String, String> labels = labelPropagation.detect(graph, effective.getLabelPropagationMaxRounds());
        Duration labelTime = since(mark);

        mark = System.nanoTime();
        Map<String, Instant> baseTimes = new HashMap<>();
        built.getEntries().forEach((path, entry) -> {
            if (entry.getLastModified() != null) {
                baseTimes.put(path, entry.getLastModified());
            }
        });
        Map<String, Instant> effectiveTimes = recencyPropagator.propagate(graph, baseTimes, now, effective);
        Duration recencyTime = since(mark);

        List<CommunitySummary> communities = communitySummarizer.summarize(
            graph, labels, scores, built.getEntries(), effectiveTimes, now, effective);
        enter(AnalysisPhase.DETECTED, communities.size());

        SortedMap<String, GraphNode> nodes = nodes(graph, built.getEntries(), scores, communities,
            ComponentFinder.assignIds(weak, "comp"), ComponentFinder.assignIds(strong, "scc"));

        List<String> orphans = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (node.isOrphan()) {
                orphans.add(node.getPath());
            }
        }

        GraphTimings timings = GraphTimings.builder()
            .loadEntries(loadTime == null ? Duration.ZERO : loadTime)
            .buildGraph(buildTime)
            .hits(hitsTime)
            .labelPropagation(labelTime)
            .recency(recencyTime)
            .total(since(started).plus(loadTime == null ? Duration.ZERO : loadTime))
            .build();

        enter(AnalysisPhase.DONE, nodes.size());
        log.info("Analyzed {} notes: {} edges, {} communities, {} orphans",
            graph.size(), graph.edgeCount(), communities.size(), orphans.size());

        return AnalysisResult.builder()
            .nodes(Collections.unmodifiableSortedMap(nodes))
            .communities(communities)
            .weakComponents(weak)
            .strongComponents(strong)
            .orphans(List.copyOf(orphans))
            .filteredOut(built.getFilteredOut())
            .pruned(built.getPruned())
            .stats(new GraphStatsSummary(graph.size(), graph.edgeCount()))
            .effectiveTimes(Collections.unmodifiableMap(new TreeMap<>(effectiveTimes)))
            .timings(timings)
            .options(effective)
            .build();
    }

    private static void validate(List<NoteEntry> notes) {
        Set<String> seen = new HashSet<>();
        for (NoteEntry note : notes) {
            if (note == null || note.getPath() == null || note.getPath().isBlank()) {
                throw new IllegalArgumentException("Note entry without a path");
            }
            if (!seen.add(note.getPath())) {
                log.warn("Duplicate note path {}, last entry wins", note.getPath());
            }
        }
    }

    private static SortedMap<String, GraphNode> nodes(LinkGraph graph,
                                                      Map<String, NoteEntry> entries,
                                                      HitsScores scores,
                                                      List<CommunitySummary> communities,
                                                      Map<String, String> weakIds,
                                                      Map<String, String> strongIds) {
        Map<String, String> communityIds = new HashMap<>();
        for (CommunitySummary community : communities) {
            for (String member : community.getMembers()) {
                communityIds.put(member, community.getId());
            }
        }

        SortedMap<String, GraphNode> nodes = new TreeMap<>();
        for (String path : graph.nodes()) {
            NoteEntry entry = entries.get(path);
            nodes.put(path, GraphNode.builder()
                .path(path)
                .title(entry == null ? null : entry.getTitle())
                .tags(entry == null ? List.of() : entry.getTags())
                .frontmatter(entry == null ? Map.of() : entry.getFrontmatter())
                .neighbors(linkOrder(entry, graph.outbound(path)))
                .inbound(graph.inDegree(path))
                .outbound(graph.outDegree(path))
                .hub(scores.hub(path))
                .authority(scores.authority(path))
                .community(communityIds.get(path))
                .weakComponent(weakIds.get(path))
                .strongComponent(strongIds.get(path))
                .build());
        }
        return nodes;
    }

    /**
     * Surviving outbound targets in the order the note links to them, each once.
     */
    static List<String> linkOrder(NoteEntry entry, Set<String> targets) {
        Set<String> ordered = new LinkedHashSet<>();
        if (entry != null) {
            for (String link : entry.getOutboundLinks()) {
                if (targets.contains(link)) {
                    ordered.add(link);
                }
            }
        }
        ordered.addAll(targets);
        return List.copyOf(ordered);
    }

    private static void enter(AnalysisPhase phase, int size) {
        log.debug("Analysis phase {} ({})", phase, size);
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
