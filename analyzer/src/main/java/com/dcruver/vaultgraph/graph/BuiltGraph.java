package com.dcruver.vaultgraph.graph;

import com.dcruver.vaultgraph.domain.NoteEntry;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Output of the build phase: the final adjacency plus the notes behind it.
 */
@Value
@Builder
public class BuiltGraph {
    LinkGraph graph;
    Map<String, NoteEntry> entries;  // surviving notes only
    Set<String> filteredOut;         // dropped by include/exclude patterns
    Set<String> pruned;              // dropped by min-degree

    public static BuiltGraph empty() {
        return BuiltGraph.builder()
            .graph(LinkGraph.empty())
            .entries(Map.of())
            .filteredOut(Set.of())
            .pruned(Set.of())
            .build();
    }
}
