package com.dcruver.vaultgraph.graph;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Hub and authority vectors from one HITS run.
 */
@Value
@Builder
public class HitsScores {
    Map<String, Double> hubs;
    Map<String, Double> authorities;
    int iterations;
    boolean converged;

    public double hub(String node) {
        return hubs.getOrDefault(node, 0.0);
    }

    public double authority(String node) {
        return authorities.getOrDefault(node, 0.0);
    }
}
