package com.dcruver.vaultgraph.graph;

/**
 * Phases of one analysis run, in order.
 */
public enum AnalysisPhase {
    IDLE,
    LOADED,
    BUILT,
    SCORED,
    PARTITIONED,
    DETECTED,
    DONE
}
