package com.dcruver.vaultgraph.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A parsed note as handed to the graph engine.
 * Outbound links are already resolved to normalized vault-relative paths.
 */
@Value
@Builder(toBuilder = true)
public class NoteEntry {
    String path;  // vault-relative, always ends in .md
    String title;
    @Singular
    List<String> tags;
    @Singular
    List<String> outboundLinks;
    Instant lastModified;  // null when unknown
    @Singular("frontmatterValue")
    Map<String, Object> frontmatter;
}
