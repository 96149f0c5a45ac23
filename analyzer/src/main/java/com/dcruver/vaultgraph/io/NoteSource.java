package com.dcruver.vaultgraph.io;

import com.dcruver.vaultgraph.domain.NoteEntry;

import java.nio.file.Path;
import java.util.List;

/**
 * Supplies the notes of a vault with links already resolved to note paths.
 */
public interface NoteSource {

    List<NoteEntry> loadNotes(Path vaultRoot, NoteLoadOptions options) throws VaultAccessException;
}
