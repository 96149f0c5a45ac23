package com.dcruver.vaultgraph.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Immutable settings for one analysis run.
 * Every toggle the engine honours lives here; nothing is read from global state.
 */
@Value
@Builder(toBuilder = true)
@With
public class GraphOptions {

    // Link filtering (applied by the note loader)
    boolean skipAnchors;
    boolean skipEmbeds;

    // Node selection
    @Singular
    List<String> includePatterns;
    @Singular
    List<String> excludePatterns;

    // Graph shaping
    @Builder.Default
    int minDegree = 2;
    boolean mutualOnly;

    // Community annotation
    @Builder.Default
    boolean includeTags = true;
    @Builder.Default
    Toggle recencyCascade = Toggle.UNSET;
    @Builder.Default
    boolean includeSingletonCommunities = true;
    @Builder.Default
    int topTagsLimit = 5;
    @Builder.Default
    int topAuthorityLimit = 5;

    // HITS
    @Builder.Default
    int hitsMaxIterations = 100;
    @Builder.Default
    double hitsTolerance = 1e-9;

    // Label propagation
    @Builder.Default
    int labelPropagationMaxRounds = 20;

    // Recency
    @Builder.Default
    int recencyWindowDays = 30;
    @Builder.Default
    int recencyCascadeHops = 2;
    @Builder.Default
    int recencyHopOffsetDays = 7;
    @Builder.Default
    int recencyFreshWindowDays = 180;
    @Builder.Default
    int recencyNeighborSampleLimit = 5;

    public static GraphOptions defaults() {
        return GraphOptions.builder().build();
    }

    /**
     * Cascade is on unless the caller explicitly turned it off.
     */
    public boolean isRecencyCascadeEnabled() {
        return recencyCascade.resolve(true);
    }
}
