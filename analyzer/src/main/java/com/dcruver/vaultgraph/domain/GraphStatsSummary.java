package com.dcruver.vaultgraph.domain;

public record GraphStatsSummary(int nodeCount, int edgeCount) {
}
