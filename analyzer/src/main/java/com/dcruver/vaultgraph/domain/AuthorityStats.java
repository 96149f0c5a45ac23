package com.dcruver.vaultgraph.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Coarse percentiles of authority scores within a community.
 */
@Value
@Builder
public class AuthorityStats {
    double mean;
    double p50;
    double p75;
    double p90;
    double p95;
    double p99;
    double max;
}
