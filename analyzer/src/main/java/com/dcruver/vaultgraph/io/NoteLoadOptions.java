package com.dcruver.vaultgraph.io;

import com.dcruver.vaultgraph.domain.GraphOptions;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What the loader keeps and drops while reading a vault.
 */
@Value
@Builder
public class NoteLoadOptions {
    boolean skipAnchors;  // drop [[note#heading]] links
    boolean skipEmbeds;   // drop ![[note]] links
    @Singular
    List<String> ignorePrefixes;  // in addition to the vault's own graphIgnore list

    public static NoteLoadOptions defaults() {
        return NoteLoadOptions.builder().build();
    }

    public static NoteLoadOptions from(GraphOptions options) {
        return NoteLoadOptions.builder()
            .skipAnchors(options.isSkipAnchors())
            .skipEmbeds(options.isSkipEmbeds())
            .build();
    }
}
