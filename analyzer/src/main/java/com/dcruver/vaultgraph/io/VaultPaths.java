package com.dcruver.vaultgraph.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Vault-relative path helpers. Note paths always use forward slashes and end in {@code .md}.
 */
public final class VaultPaths {

    public static final String NOTE_SUFFIX = ".md";

    private VaultPaths() {
    }

    public static String relativize(Path vaultRoot, Path file) {
        return normalize(vaultRoot.relativize(file).toString());
    }

    public static String normalize(String path) {
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    public static boolean isNote(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(NOTE_SUFFIX);
    }

    public static String withSuffix(String path) {
        return isNote(path) ? path : path + NOTE_SUFFIX;
    }

    public static String stripSuffix(String path) {
        return isNote(path) ? path.substring(0, path.length() - NOTE_SUFFIX.length()) : path;
    }

    /**
     * File name without directory and without {@code .md}.
     */
    public static String baseName(String path) {
        String stripped = stripSuffix(path);
        int slash = stripped.lastIndexOf('/');
        return slash < 0 ? stripped : stripped.substring(slash + 1);
    }
}
