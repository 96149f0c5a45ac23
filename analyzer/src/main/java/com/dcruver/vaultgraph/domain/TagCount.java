package com.dcruver.vaultgraph.domain;

public record TagCount(String tag, int count) {
}
