package com.dcruver.vaultgraph.graph;

import com.dcruver.vaultgraph.domain.GraphOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Effective "last touched" time per note.
 *
 * Without cascade a note's effective time is its own timestamp. With cascade,
 * freshness flows along links for a bounded number of synchronous passes: a
 * note may take the time of its freshest neighbors minus a fixed offset per hop,
 * so a note linking into recently edited notes counts as recently active too.
 * Each pass reads only the previous pass's times.
 */
@Component
@Slf4j
public class RecencyPropagator {

    public Map<String, Instant> propagate(LinkGraph graph, Map<String, Instant> baseTimes,
                                          Instant now, GraphOptions options) {
        Map<String, Instant> current = new HashMap<>();
        for (String node : graph.nodes()) {
            Instant ts = baseTimes.get(node);
            if (ts != null) {
                current.put(node, ts.isAfter(now) ? now : ts);
            }
        }

        if (!options.isRecencyCascadeEnabled()) {
            return current;
        }

        Duration hopOffset = Duration.ofDays(options.getRecencyHopOffsetDays());
        Duration freshWindow = Duration.ofDays(options.getRecencyFreshWindowDays());
        for (int pass = 0; pass < options.getRecencyCascadeHops(); pass++) {
            current = cascadeOnce(graph, current, now, hopOffset, freshWindow,
                options.getRecencyNeighborSampleLimit());
        }
        log.debug("Recency cascade ran {} passes over {} notes", options.getRecencyCascadeHops(), graph.size());
        return current;
    }

    private Map<String, Instant> cascadeOnce(LinkGraph graph, Map<String, Instant> previous, Instant now,
                                             Duration hopOffset, Duration freshWindow, int sampleLimit) {
        Map<String, Instant> next = new HashMap<>();
        for (String node : graph.nodes()) {
            Instant best = previous.get(node);

            List<Map.Entry<String, Instant>> dated = new ArrayList<>();
            for (String neighbor : graph.undirectedNeighbors(node)) {
                Instant ts = previous.get(neighbor);
                if (ts != null) {
                    dated.add(Map.entry(neighbor, ts));
                }
            }
            dated.sort(Map.Entry.<String, Instant>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()));

            int considered = 0;
            for (Map.Entry<String, Instant> neighbor : dated) {
                if (considered++ >= sampleLimit) {
                    break;
                }
                if (Duration.between(neighbor.getValue(), now).compareTo(freshWindow) > 0) {
                    continue;
                }
                Instant inferred = neighbor.getValue().minus(hopOffset);
                if (best == null || inferred.isAfter(best)) {
                    best = inferred;
                }
            }

            if (best != null) {
                next.put(node, best);
            }
        }
        return next;
    }
}
