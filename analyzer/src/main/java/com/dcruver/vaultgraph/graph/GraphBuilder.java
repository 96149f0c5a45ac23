package com.dcruver.vaultgraph.graph;

import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.NoteEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns note entries into the directed link graph the rest of the engine works on.
 *
 * Order of operations: pattern filtering, adjacency, mutual-only filtering,
 * then one min-degree pruning pass.
 */
@Component
@Slf4j
public class GraphBuilder {

    public BuiltGraph build(List<NoteEntry> notes, GraphOptions options) {
        if (notes == null || notes.isEmpty()) {
            return BuiltGraph.empty();
        }

        NoteSelector selector = NoteSelector.of(options.getIncludePatterns(), options.getExcludePatterns());

        Map<String, NoteEntry> entries = new TreeMap<>();
        Set<String> filteredOut = new TreeSet<>();
        for (NoteEntry note : notes) {
            if (selector.accepts(note)) {
                entries.put(note.getPath(), note);
            } else {
                filteredOut.add(note.getPath());
            }
        }
        if (!filteredOut.isEmpty()) {
            log.debug("Pattern filters dropped {} of {} notes", filteredOut.size(), notes.size());
        }

        // Links to filtered or unknown notes are dropped by LinkGraph
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        entries.forEach((path, note) -> adjacency.put(path, note.getOutboundLinks()));
        LinkGraph graph = LinkGraph.of(adjacency);

        if (options.isMutualOnly()) {
            int before = graph.edgeCount();
            graph = graph.mutualOnly();
            log.debug("Mutual-only filter kept {} of {} edges", graph.edgeCount(), before);
        }

        Set<String> pruned = Collections.emptySet();
        if (options.getMinDegree() > 0) {
            pruned = belowMinDegree(graph, options.getMinDegree());
            if (!pruned.isEmpty()) {
                graph = graph.without(pruned);
                pruned.forEach(entries::remove);
                log.debug("Min-degree {} pruned {} notes", options.getMinDegree(), pruned.size());
            }
        }

        return BuiltGraph.builder()
            .graph(graph)
            .entries(Collections.unmodifiableMap(entries))
            .filteredOut(Collections.unmodifiableSet(filteredOut))
            .pruned(Collections.unmodifiableSet(pruned))
            .build();
    }

    /**
     * Nodes whose degree is under the threshold. Evaluated once against the
     * graph as given; removing them does not trigger a second round.
     */
    Set<String> belowMinDegree(LinkGraph graph, int minDegree) {
        Set<String> below = new TreeSet<>();
        for (String node : graph.nodes()) {
            if (graph.degree(node) < minDegree) {
                below.add(node);
            }
        }
        return below;
    }
}
