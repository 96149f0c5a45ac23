package com.dcruver.vaultgraph.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * A detected community and everything the reports show about it.
 */
@Value
@Builder
@With
public class CommunitySummary {
    String id;
    List<String> members;  // sorted by path
    String anchor;         // highest-authority member
    double density;
    int internalEdges;
    List<TagCount> topTags;
    List<AuthorityScore> topAuthority;
    List<AuthorityBucket> authorityBuckets;
    AuthorityStats authorityStats;
    CommunityRecency recency;  // null when no member has a timestamp
    List<String> bridges;

    public int size() {
        return members.size();
    }

    public boolean contains(String path) {
        return members.contains(path);
    }
}
