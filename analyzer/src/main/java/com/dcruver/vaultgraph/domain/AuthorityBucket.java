package com.dcruver.vaultgraph.domain;

/**
 * One slice of a community's authority distribution, highest slice first.
 */
public record AuthorityBucket(double low, double high, int count, String example) {
}
