package com.dcruver.vaultgraph.reporting;

import lombok.Builder;
import lombok.Value;

/**
 * Which sections a note context carries and how long its link lists may get.
 * A limit of 0 or less means no limit.
 */
@Value
@Builder
public class NoteContextOptions {
    @Builder.Default
    boolean backlinks = true;
    @Builder.Default
    boolean neighbors = true;
    boolean frontmatter;
    @Builder.Default
    boolean tags = true;
    @Builder.Default
    int neighborLimit = 50;
    @Builder.Default
    int backlinksLimit = 50;

    public static NoteContextOptions defaults() {
        return NoteContextOptions.builder().build();
    }
}
