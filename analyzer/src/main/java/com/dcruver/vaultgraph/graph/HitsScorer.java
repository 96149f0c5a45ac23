package com.dcruver.vaultgraph.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HITS (Hyperlink-Induced Topic Search) over the link graph.
 *
 * Authority measures how often a note is referenced by good hubs; hub measures
 * how well a note curates links to good authorities. Both vectors are
 * L2-normalized after every iteration.
 */
@Component
@Slf4j
public class HitsScorer {

    public HitsScores score(LinkGraph graph, int maxIterations, double tolerance) {
        List<String> nodes = graph.nodes();
        if (nodes.isEmpty()) {
            return HitsScores.builder()
                .hubs(Map.of())
                .authorities(Map.of())
                .iterations(0)
                .converged(true)
                .build();
        }

        Map<String, Double> hubs = new HashMap<>();
        Map<String, Double> authorities = new HashMap<>();
        for (String node : nodes) {
            hubs.put(node, 1.0);
            authorities.put(node, 1.0);
        }

        int iterations = 0;
        boolean converged = false;
        while (iterations < maxIterations) {
            HitsScores next = iterate(graph, hubs, authorities);
            iterations++;

            double delta = Math.max(
                maxDelta(hubs, next.getHubs()),
                maxDelta(authorities, next.getAuthorities()));

            hubs = next.getHubs();
            authorities = next.getAuthorities();

            if (delta < tolerance) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.debug("HITS stopped at iteration cap {} without converging", maxIterations);
        }

        return HitsScores.builder()
            .hubs(Map.copyOf(hubs))
            .authorities(Map.copyOf(authorities))
            .iterations(iterations)
            .converged(converged)
            .build();
    }

    /**
     * One full update: authorities from the current hubs, then hubs from the new
     * authorities, then normalization.
     */
    HitsScores iterate(LinkGraph graph, Map<String, Double> hubs, Map<String, Double> authorities) {
        Map<String, Double> newAuthorities = new HashMap<>();
        for (String node : graph.nodes()) {
            double sum = 0.0;
            for (String source : graph.inbound(node)) {
                sum += hubs.getOrDefault(source, 0.0);
            }
            newAuthorities.put(node, sum);
        }

        Map<String, Double> newHubs = new HashMap<>();
        for (String node : graph.nodes()) {
            double sum = 0.0;
            for (String target : graph.outbound(node)) {
                sum += newAuthorities.get(target);
            }
            newHubs.put(node, sum);
        }

        normalize(newAuthorities);
        normalize(newHubs);

        return HitsScores.builder()
            .hubs(newHubs)
            .authorities(newAuthorities)
            .build();
    }

    private static void normalize(Map<String, Double> vector) {
        double norm = 0.0;
        for (double value : vector.values()) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            final double divisor = norm;
            vector.replaceAll((node, value) -> value / divisor);
        }
    }

    private static double maxDelta(Map<String, Double> previous, Map<String, Double> next) {
        double max = 0.0;
        for (Map.Entry<String, Double> entry : next.entrySet()) {
            double delta = Math.abs(entry.getValue() - previous.getOrDefault(entry.getKey(), 0.0));
            if (delta > max) {
                max = delta;
            }
        }
        return max;
    }
}
