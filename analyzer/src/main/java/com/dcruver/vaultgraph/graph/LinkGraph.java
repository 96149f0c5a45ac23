package com.dcruver.vaultgraph.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed wikilink adjacency over a fixed node set.
 *
 * Nodes and neighbor sets are kept sorted so that every algorithm walking the
 * graph visits nodes in the same order regardless of how the graph was built.
 * Self links and edges to unknown nodes are dropped on construction.
 */
public final class LinkGraph {

    private static final LinkGraph EMPTY = new LinkGraph(new TreeMap<>());

    private final SortedMap<String, SortedSet<String>> outbound;
    private final Map<String, SortedSet<String>> inbound;
    private final int edgeCount;

    private LinkGraph(SortedMap<String, SortedSet<String>> outbound) {
        this.outbound = outbound;
        this.inbound = new TreeMap<>();
        int edges = 0;
        for (String node : outbound.keySet()) {
            inbound.put(node, new TreeSet<>());
        }
        for (Map.Entry<String, SortedSet<String>> entry : outbound.entrySet()) {
            for (String target : entry.getValue()) {
                inbound.get(target).add(entry.getKey());
                edges++;
            }
        }
        this.edgeCount = edges;
    }

    public static LinkGraph empty() {
        return EMPTY;
    }

    /**
     * Build a graph from an adjacency map. Every key becomes a node; targets that
     * are not keys, and self links, are ignored.
     */
    public static LinkGraph of(Map<String, ? extends Collection<String>> adjacency) {
        SortedMap<String, SortedSet<String>> outbound = new TreeMap<>();
        for (String node : adjacency.keySet()) {
            outbound.put(node, new TreeSet<>());
        }
        for (Map.Entry<String, ? extends Collection<String>> entry : adjacency.entrySet()) {
            String source = entry.getKey();
            Collection<String> targets = entry.getValue();
            if (targets == null) {
                continue;
            }
            for (String target : targets) {
                if (target != null && !target.equals(source) && outbound.containsKey(target)) {
                    outbound.get(source).add(target);
                }
            }
        }
        return new LinkGraph(outbound);
    }

    /**
     * Nodes in path order.
     */
    public List<String> nodes() {
        return List.copyOf(outbound.keySet());
    }

    public boolean contains(String node) {
        return outbound.containsKey(node);
    }

    public int size() {
        return outbound.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return outbound.isEmpty();
    }

    public SortedSet<String> outbound(String node) {
        SortedSet<String> targets = outbound.get(node);
        return targets == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(targets);
    }

    public SortedSet<String> inbound(String node) {
        SortedSet<String> sources = inbound.get(node);
        return sources == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(sources);
    }

    /**
     * Neighbors ignoring edge direction.
     */
    public SortedSet<String> undirectedNeighbors(String node) {
        SortedSet<String> all = new TreeSet<>(outbound(node));
        all.addAll(inbound(node));
        return all;
    }

    public int outDegree(String node) {
        return outbound(node).size();
    }

    public int inDegree(String node) {
        return inbound(node).size();
    }

    public int degree(String node) {
        return outDegree(node) + inDegree(node);
    }

    public boolean hasEdge(String source, String target) {
        return outbound(source).contains(target);
    }

    /**
     * Copy keeping only edges whose reverse edge also exists.
     */
    public LinkGraph mutualOnly() {
        SortedMap<String, SortedSet<String>> mutual = new TreeMap<>();
        for (Map.Entry<String, SortedSet<String>> entry : outbound.entrySet()) {
            SortedSet<String> kept = new TreeSet<>();
            for (String target : entry.getValue()) {
                if (hasEdge(target, entry.getKey())) {
                    kept.add(target);
                }
            }
            mutual.put(entry.getKey(), kept);
        }
        return new LinkGraph(mutual);
    }

    /**
     * Copy without the given nodes and without every edge touching them.
     */
    public LinkGraph without(Set<String> removed) {
        if (removed.isEmpty()) {
            return this;
        }
        SortedMap<String, SortedSet<String>> remaining = new TreeMap<>();
        for (Map.Entry<String, SortedSet<String>> entry : outbound.entrySet()) {
            if (removed.contains(entry.getKey())) {
                continue;
            }
            SortedSet<String> kept = new TreeSet<>(entry.getValue());
            kept.removeAll(removed);
            remaining.put(entry.getKey(), kept);
        }
        return new LinkGraph(remaining);
    }
}
