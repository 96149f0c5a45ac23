package com.dcruver.vaultgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * How recently the members of a community were touched.
 */
@Value
@Builder
public class CommunityRecency {
    String latestPath;
    double latestAgeDays;
    Instant latestTimestamp;
    int recentCount;
    int windowDays;
}
