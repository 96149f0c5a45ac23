package com.dcruver.vaultgraph.graph;

import com.dcruver.vaultgraph.domain.NoteEntry;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides which notes take part in an analysis, from include and exclude patterns.
 *
 * Supported pattern forms (all case-insensitive):
 * <ul>
 *   <li>{@code tag:name} - the note carries the tag or a nested tag below it</li>
 *   <li>{@code find:text} - the text occurs in the path or the title</li>
 *   <li>{@code key:value} - the frontmatter property equals the value, or lists it</li>
 *   <li>anything else - a path; {@code *}, {@code **} and {@code ?} are globs,
 *       otherwise an exact path (with or without .md) or a directory prefix</li>
 * </ul>
 */
public final class NoteSelector {

    private static final NoteSelector ALL = new NoteSelector(List.of(), List.of());

    private final List<Predicate<NoteEntry>> includes;
    private final List<Predicate<NoteEntry>> excludes;

    private NoteSelector(List<Predicate<NoteEntry>> includes, List<Predicate<NoteEntry>> excludes) {
        this.includes = includes;
        this.excludes = excludes;
    }

    public static NoteSelector all() {
        return ALL;
    }

    /**
     * @throws IllegalArgumentException when a pattern is malformed
     */
    public static NoteSelector of(Collection<String> includePatterns, Collection<String> excludePatterns) {
        List<Predicate<NoteEntry>> includes = compileAll(includePatterns);
        List<Predicate<NoteEntry>> excludes = compileAll(excludePatterns);
        if (includes.isEmpty() && excludes.isEmpty()) {
            return ALL;
        }
        return new NoteSelector(includes, excludes);
    }

    public boolean accepts(NoteEntry note) {
        if (!includes.isEmpty() && includes.stream().noneMatch(p -> p.test(note))) {
            return false;
        }
        return excludes.stream().noneMatch(p -> p.test(note));
    }

    private static List<Predicate<NoteEntry>> compileAll(Collection<String> patterns) {
        if (patterns == null) {
            return List.of();
        }
        return patterns.stream()
            .filter(p -> p != null && !p.isBlank())
            .map(String::trim)
            .map(NoteSelector::compile)
            .toList();
    }

    static Predicate<NoteEntry> compile(String pattern) {
        String lower = pattern.toLowerCase(Locale.ROOT);

        if (lower.startsWith("tag:")) {
            String tag = normalizeTag(unquote(pattern.substring(4)));
            requireValue(pattern, tag, "tag");
            return note -> note.getTags().stream()
                .map(NoteSelector::normalizeTag)
                .anyMatch(t -> t.equals(tag) || t.startsWith(tag + "/"));
        }

        if (lower.startsWith("find:")) {
            String term = unquote(pattern.substring(5)).toLowerCase(Locale.ROOT);
            requireValue(pattern, term, "find");
            return note -> contains(note.getPath(), term) || contains(note.getTitle(), term);
        }

        int colon = pattern.indexOf(':');
        if (colon > 0) {
            String key = pattern.substring(0, colon).trim();
            String value = unquote(pattern.substring(colon + 1).trim());
            requireValue(pattern, value, "property");
            return note -> propertyMatches(note.getFrontmatter(), key, value);
        }

        return pathPredicate(pattern);
    }

    private static Predicate<NoteEntry> pathPredicate(String pattern) {
        String normalized = pattern.replace('\\', '/').toLowerCase(Locale.ROOT);
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        if (normalized.contains("*") || normalized.contains("?")) {
            Pattern glob = Pattern.compile(globToRegex(normalized));
            return note -> {
                String path = note.getPath().toLowerCase(Locale.ROOT);
                return glob.matcher(path).matches() || glob.matcher(stripMd(path)).matches();
            };
        }

        String target = normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
        return note -> {
            String path = note.getPath().toLowerCase(Locale.ROOT);
            return path.equals(target)
                || stripMd(path).equals(stripMd(target))
                || path.startsWith(target + "/");
        };
    }

    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    private static boolean propertyMatches(Map<String, Object> frontmatter, String key, String value) {
        if (frontmatter == null) {
            return false;
        }
        for (Map.Entry<String, Object> entry : frontmatter.entrySet()) {
            if (!entry.getKey().equalsIgnoreCase(key)) {
                continue;
            }
            Object raw = entry.getValue();
            if (raw instanceof Collection<?> items) {
                return items.stream().anyMatch(item -> item != null && item.toString().equalsIgnoreCase(value));
            }
            return raw != null && raw.toString().equalsIgnoreCase(value);
        }
        return false;
    }

    private static boolean contains(String text, String term) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(term);
    }

    private static String normalizeTag(String tag) {
        String trimmed = tag.trim();
        if (trimmed.startsWith("#")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private static String unquote(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static void requireValue(String pattern, String value, String kind) {
        if (value.isEmpty() || value.equals("*")) {
            throw new IllegalArgumentException(String.format(
                "Invalid %s pattern '%s': value cannot be empty or a wildcard", kind, pattern));
        }
    }

    private static String stripMd(String path) {
        return path.endsWith(".md") ? path.substring(0, path.length() - 3) : path;
    }
}
