package com.dcruver.vaultgraph.domain;

/**
 * A note with its HITS scores, used in per-community rankings.
 */
public record AuthorityScore(String path, double authority, double hub) {
}
