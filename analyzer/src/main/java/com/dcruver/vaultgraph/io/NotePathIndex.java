package com.dcruver.vaultgraph.io;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves wikilink targets to note paths.
 *
 * A target matches a note by its full vault-relative path or by its bare file
 * name; when several notes share a file name the one with the shortest path wins.
 */
public final class NotePathIndex {

    private final Map<String, String> byKey = new HashMap<>();

    private NotePathIndex() {
    }

    public static NotePathIndex of(Collection<String> notePaths) {
        NotePathIndex index = new NotePathIndex();
        // full paths first so a bare name can never shadow one
        for (String path : notePaths) {
            index.byKey.put(VaultPaths.stripSuffix(path), path);
        }
        for (String path : notePaths) {
            String name = VaultPaths.baseName(path);
            String existing = index.byKey.get(name);
            if (existing == null
                || (!VaultPaths.stripSuffix(existing).equals(name) && shorter(path, existing))) {
                index.byKey.put(name, path);
            }
        }
        return index;
    }

    /**
     * Note path for a link target such as {@code folder/Note}, {@code Note.md} or
     * {@code Note#Heading}.
     */
    public Optional<String> resolve(String target) {
        if (target == null) {
            return Optional.empty();
        }
        String link = target;
        int hash = link.indexOf('#');
        if (hash >= 0) {
            link = link.substring(0, hash);
        }
        link = VaultPaths.stripSuffix(VaultPaths.normalize(link));
        if (link.isEmpty()) {
            return Optional.empty();
        }

        String path = byKey.get(link);
        if (path == null && link.contains("/")) {
            path = byKey.get(link.substring(link.lastIndexOf('/') + 1));
        }
        return Optional.ofNullable(path);
    }

    private static boolean shorter(String candidate, String existing) {
        if (candidate.length() != existing.length()) {
            return candidate.length() < existing.length();
        }
        return candidate.compareTo(existing) < 0;
    }
}
