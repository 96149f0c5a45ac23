package com.dcruver.vaultgraph.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Map;

/**
 * A note as it appears in the analyzed graph.
 * Produced once per analysis and never changed afterwards.
 */
@Value
@Builder
@With
public class GraphNode {
    String path;
    String title;
    List<String> tags;
    Map<String, Object> frontmatter;
    List<String> neighbors;  // outbound, in link order

    int inbound;
    int outbound;

    double hub;        // how well the note curates links to good authorities
    double authority;  // how often the note is referenced by good hubs

    String community;         // null when the node has no community
    String strongComponent;
    String weakComponent;

    public int getDegree() {
        return inbound + outbound;
    }

    public boolean isOrphan() {
        return inbound == 0 && outbound == 0;
    }
}
