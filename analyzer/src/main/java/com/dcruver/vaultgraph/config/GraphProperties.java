package com.dcruver.vaultgraph.config;

import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.Toggle;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for every analysis, bound from {@code vault-graph.*}.
 * Command options override these per invocation.
 */
@ConfigurationProperties(prefix = "vault-graph")
@Data
public class GraphProperties {

    private String vaultPath;

    private int minDegree = 2;
    private boolean mutualOnly = false;
    private boolean includeTags = true;
    private Boolean recencyCascade;  // null: not configured, cascade stays on
    private boolean includeSingletonCommunities = true;
    private int limit = 100;

    private Hits hits = new Hits();
    private LabelPropagation labelPropagation = new LabelPropagation();
    private Recency recency = new Recency();
    private Community community = new Community();

    @Data
    public static class Hits {
        private int maxIterations = 100;
        private double tolerance = 1e-9;
    }

    @Data
    public static class LabelPropagation {
        private int maxRounds = 20;
    }

    @Data
    public static class Recency {
        private int windowDays = 30;
        private int cascadeHops = 2;
        private int hopOffsetDays = 7;
        private int freshWindowDays = 180;
        private int neighborSampleLimit = 5;
    }

    @Data
    public static class Community {
        private int topTags = 5;
        private int topAuthority = 5;
    }

    /**
     * Analysis options carrying the configured defaults.
     */
    public GraphOptions toOptions() {
        return GraphOptions.builder()
            .minDegree(minDegree)
            .mutualOnly(mutualOnly)
            .includeTags(includeTags)
            .recencyCascade(Toggle.of(recencyCascade))
            .includeSingletonCommunities(includeSingletonCommunities)
            .topTagsLimit(community.getTopTags())
            .topAuthorityLimit(community.getTopAuthority())
            .hitsMaxIterations(hits.getMaxIterations())
            .hitsTolerance(hits.getTolerance())
            .labelPropagationMaxRounds(labelPropagation.getMaxRounds())
            .recencyWindowDays(recency.getWindowDays())
            .recencyCascadeHops(recency.getCascadeHops())
            .recencyHopOffsetDays(recency.getHopOffsetDays())
            .recencyFreshWindowDays(recency.getFreshWindowDays())
            .recencyNeighborSampleLimit(recency.getNeighborSampleLimit())
            .build();
    }
}
