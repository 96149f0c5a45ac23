package com.dcruver.vaultgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;

/**
 * Everything one analysis run produced. Shared by all reports, never modified.
 */
@Value
@Builder
public class AnalysisResult {
    SortedMap<String, GraphNode> nodes;
    List<CommunitySummary> communities;
    List<List<String>> weakComponents;
    List<List<String>> strongComponents;  // full partition, singletons included
    List<String> orphans;
    Set<String> filteredOut;  // notes dropped by include/exclude patterns
    Set<String> pruned;       // notes dropped by min-degree
    GraphStatsSummary stats;
    Map<String, Instant> effectiveTimes;
    GraphTimings timings;
    GraphOptions options;

    public Optional<GraphNode> findNode(String path) {
        return Optional.ofNullable(nodes.get(path));
    }

    public Optional<CommunitySummary> findCommunity(String id) {
        return communities.stream()
            .filter(c -> c.getId().equals(id))
            .findFirst();
    }

    /**
     * Community the given note belongs to, if it has one.
     */
    public Optional<CommunitySummary> communityOf(String path) {
        GraphNode node = nodes.get(path);
        if (node == null || node.getCommunity() == null) {
            return Optional.empty();
        }
        return findCommunity(node.getCommunity());
    }

    /**
     * Strong components with more than one member.
     */
    public List<List<String>> getMutualClusters() {
        return strongComponents.stream()
            .filter(c -> c.size() > 1)
            .toList();
    }

    /**
     * Notes that link to the given note, sorted by path.
     */
    public List<String> linksInto(String path) {
        List<String> sources = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (node.getNeighbors().contains(path)) {
                sources.add(node.getPath());
            }
        }
        return sources;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
