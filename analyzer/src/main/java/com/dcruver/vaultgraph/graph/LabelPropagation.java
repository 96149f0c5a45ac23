package com.dcruver.vaultgraph.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Community labels by label propagation on the undirected view of the graph.
 *
 * Every node starts with its own path as label. Each round visits nodes in path
 * order and lets each one adopt the label most common among its neighbors;
 * ties go to the lexicographically lowest label. Stops after a round without
 * changes or at the round cap. Isolated nodes keep their own label.
 */
@Component
@Slf4j
public class LabelPropagation {

    public Map<String, String> detect(LinkGraph graph, int maxRounds) {
        List<String> nodes = graph.nodes();
        Map<String, SortedSet<String>> neighbors = new HashMap<>();
        Map<String, String> labels = new TreeMap<>();
        for (String node : nodes) {
            neighbors.put(node, graph.undirectedNeighbors(node));
            labels.put(node, node);
        }

        int round = 0;
        boolean changed = true;
        while (changed && round < maxRounds) {
            changed = false;
            round++;
            for (String node : nodes) {
                String best = dominantLabel(neighbors.get(node), labels);
                if (best != null && !best.equals(labels.get(node))) {
                    labels.put(node, best);
                    changed = true;
                }
            }
        }

        if (changed) {
            log.debug("Label propagation stopped at round cap {} with labels still moving", maxRounds);
        } else {
            log.debug("Label propagation settled after {} rounds", round);
        }
        return labels;
    }

    private static String dominantLabel(SortedSet<String> neighbors, Map<String, String> labels) {
        if (neighbors.isEmpty()) {
            return null;
        }
        Map<String, Integer> counts = new TreeMap<>();
        for (String neighbor : neighbors) {
            counts.merge(labels.get(neighbor), 1, Integer::sum);
        }
        String best = null;
        int bestCount = -1;
        // TreeMap iteration is ascending, so the first label reaching the top count wins ties
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
