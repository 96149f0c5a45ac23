package com.dcruver.vaultgraph.graph;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Weak and strong components of the link graph.
 *
 * Components come back sorted internally by path, and as a list ordered by
 * size (largest first) then by their first path.
 */
@Component
public class ComponentFinder {

    static final Comparator<List<String>> LARGEST_FIRST = Comparator
        .<List<String>>comparingInt(List::size).reversed()
        .thenComparing(c -> c.get(0));

    /**
     * Nodes connected when edge direction is ignored. Every node, including an
     * isolated one, lands in exactly one component.
     */
    public List<List<String>> weakComponents(LinkGraph graph) {
        UnionFind unionFind = new UnionFind(graph.nodes());
        for (String node : graph.nodes()) {
            for (String target : graph.outbound(node)) {
                unionFind.union(node, target);
            }
        }

        Map<String, List<String>> grouped = new TreeMap<>();
        for (String node : graph.nodes()) {
            grouped.computeIfAbsent(unionFind.find(node), k -> new ArrayList<>()).add(node);
        }
        return sorted(grouped.values());
    }

    /**
     * Nodes mutually reachable along edge direction (Tarjan). The full partition
     * is returned; callers wanting only mutual-link clusters filter on size.
     */
    public List<List<String>> strongComponents(LinkGraph graph) {
        return new Tarjan(graph).run();
    }

    /**
     * Component ID per node, numbered by position in the list.
     */
    public static Map<String, String> assignIds(List<List<String>> components, String prefix) {
        Map<String, String> ids = new HashMap<>();
        for (int i = 0; i < components.size(); i++) {
            String id = prefix + i;
            for (String node : components.get(i)) {
                ids.put(node, id);
            }
        }
        return ids;
    }

    private static List<List<String>> sorted(Iterable<List<String>> components) {
        List<List<String>> result = new ArrayList<>();
        for (List<String> component : components) {
            List<String> members = new ArrayList<>(component);
            Collections.sort(members);
            result.add(List.copyOf(members));
        }
        result.sort(LARGEST_FIRST);
        return List.copyOf(result);
    }

    private static final class UnionFind {
        private final Map<String, String> parent = new HashMap<>();
        private final Map<String, Integer> rank = new HashMap<>();

        UnionFind(List<String> nodes) {
            for (String node : nodes) {
                parent.put(node, node);
                rank.put(node, 0);
            }
        }

        String find(String node) {
            String root = node;
            while (!parent.get(root).equals(root)) {
                root = parent.get(root);
            }
            // path compression
            String current = node;
            while (!current.equals(root)) {
                String next = parent.get(current);
                parent.put(current, root);
                current = next;
            }
            return root;
        }

        void union(String a, String b) {
            String rootA = find(a);
            String rootB = find(b);
            if (rootA.equals(rootB)) {
                return;
            }
            int rankA = rank.get(rootA);
            int rankB = rank.get(rootB);
            if (rankA < rankB) {
                parent.put(rootA, rootB);
            } else if (rankA > rankB) {
                parent.put(rootB, rootA);
            } else {
                parent.put(rootB, rootA);
                rank.put(rootA, rankA + 1);
            }
        }
    }

    /**
     * Iterative Tarjan so long link chains cannot exhaust the call stack.
     */
    private static final class Tarjan {
        private final LinkGraph graph;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Map<String, Boolean> onStack = new HashMap<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter = 0;

        Tarjan(LinkGraph graph) {
            this.graph = graph;
        }

        List<List<String>> run() {
            for (String node : graph.nodes()) {
                if (!index.containsKey(node)) {
                    visit(node);
                }
            }
            return sorted(components);
        }

        private void visit(String root) {
            Deque<Frame> callStack = new ArrayDeque<>();
            open(root);
            callStack.push(new Frame(root, graph.outbound(root).iterator()));

            while (!callStack.isEmpty()) {
                Frame frame = callStack.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        open(next);
                        callStack.push(new Frame(next, graph.outbound(next).iterator()));
                    } else if (onStack.getOrDefault(next, false)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(next)));
                    }
                    continue;
                }

                callStack.pop();
                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    closeComponent(frame.node);
                }
                Frame parent = callStack.peek();
                if (parent != null) {
                    lowLink.put(parent.node, Math.min(lowLink.get(parent.node), lowLink.get(frame.node)));
                }
            }
        }

        private void open(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.put(node, true);
        }

        private void closeComponent(String root) {
            List<String> component = new ArrayList<>();
            String member;
            do {
                member = stack.pop();
                onStack.put(member, false);
                component.add(member);
            } while (!member.equals(root));
            components.add(component);
        }

        private record Frame(String node, Iterator<String> successors) {
        }
    }
}
