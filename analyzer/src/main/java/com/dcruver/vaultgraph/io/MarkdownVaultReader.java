package com.dcruver.vaultgraph.io;

import com.dcruver.vaultgraph.domain.NoteEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads every Markdown note of a vault directory.
 *
 * Hidden files and directories are skipped, as is anything under a prefix from
 * the vault's {@code graphIgnore} list or the caller's extra ignore prefixes.
 * Any note that cannot be read fails the whole load, as does a missing or
 * unwalkable vault.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MarkdownVaultReader implements NoteSource {

    private final MarkdownNoteParser parser;
    private final VaultConfigReader configReader;

    @Override
    public List<NoteEntry> loadNotes(Path vaultRoot, NoteLoadOptions options) throws VaultAccessException {
        Path root = vaultRoot.toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            throw new VaultAccessException("Vault does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new VaultAccessException("Vault path is not a directory: " + root);
        }

        List<String> ignored = new ArrayList<>();
        configReader.read(root).getGraphIgnore().forEach(prefix -> addPrefix(ignored, prefix));
        options.getIgnorePrefixes().forEach(prefix -> addPrefix(ignored, prefix));

        List<String> notePaths = scan(root, ignored);
        log.info("Found {} notes in {}", notePaths.size(), root);

        NotePathIndex index = NotePathIndex.of(notePaths);
        List<NoteEntry> notes = new ArrayList<>(notePaths.size());
        for (String notePath : notePaths) {
            Path file = root.resolve(notePath);
            try {
                String content = Files.readString(file);
                Instant fileTime = Files.getLastModifiedTime(file).toInstant();
                notes.add(parser.parse(notePath, content, fileTime, options, index));
            } catch (IOException e) {
                throw new VaultAccessException("Cannot read note " + notePath + ": " + e.getMessage(), e);
            }
        }
        return notes;
    }

    private List<String> scan(Path root, List<String> ignored) throws VaultAccessException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .map(p -> VaultPaths.relativize(root, p))
                .filter(VaultPaths::isNote)
                .filter(rel -> !isIgnored(rel, ignored))
                .sorted()
                .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new VaultAccessException("Failed to scan vault " + root + ": " + e.getMessage(), e);
        }
    }

    /**
     * True for hidden entries anywhere along the path and for ignored prefixes.
     */
    static boolean isIgnored(String relativePath, List<String> ignoredPrefixes) {
        for (String segment : relativePath.split("/")) {
            if (segment.startsWith(".")) {
                return true;
            }
        }
        for (String prefix : ignoredPrefixes) {
            if (relativePath.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static void addPrefix(List<String> prefixes, String prefix) {
        if (prefix == null) {
            return;
        }
        String normalized = VaultPaths.normalize(prefix);
        if (!normalized.isEmpty()) {
            prefixes.add(normalized);
        }
    }
}
