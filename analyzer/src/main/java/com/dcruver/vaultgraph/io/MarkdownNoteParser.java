package com.dcruver.vaultgraph.io;

import com.dcruver.vaultgraph.domain.NoteEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses one Markdown note: YAML frontmatter, title, tags and wikilinks.
 */
@Component
@Slf4j
public class MarkdownNoteParser {

    private static final Pattern EMBED = Pattern.compile("!\\[\\[([^\\]|]*)(?:\\|[^\\]]*)?\\]\\]");
    private static final Pattern WIKILINK = Pattern.compile("\\[\\[([^\\]|]*)(?:\\|[^\\]]*)?\\]\\]");
    private static final Pattern HASHTAG = Pattern.compile("(?<![\\w#/&])#([\\p{L}\\p{N}_/-]*[\\p{L}_/-][\\p{L}\\p{N}_/-]*)");
    private static final Pattern INLINE_CODE = Pattern.compile("`[^`]*`");
    private static final Pattern HEADING = Pattern.compile("^#\\s+(.+?)\\s*#*\\s*$");

    // Frontmatter keys consulted for the note's timestamp, in order
    private static final List<String> TIMESTAMP_KEYS = List.of("updated", "modified", "date", "created");

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm")
    );

    private final YAMLMapper yamlMapper = new YAMLMapper();

    /**
     * Parse a note.
     *
     * @param path      vault-relative note path
     * @param content   raw file content
     * @param fileTime  file modification time, used when frontmatter has no date
     * @param options   link filtering
     * @param index     resolves link targets to note paths
     */
    public NoteEntry parse(String path, String content, Instant fileTime, NoteLoadOptions options, NotePathIndex index) {
        String text = content.replace("\r\n", "\n");
        Map<String, Object> frontmatter = new LinkedHashMap<>();
        String body = text;

        if (text.startsWith("---\n")) {
            int end = frontmatterEnd(text);
            if (end > 0) {
                frontmatter = readFrontmatter(path, text.substring(4, end));
                int bodyStart = text.indexOf('\n', end + 1);
                body = bodyStart < 0 ? "" : text.substring(bodyStart + 1);
            }
        }

        List<String> codeFree = linesOutsideCode(body);

        NoteEntry.NoteEntryBuilder builder = NoteEntry.builder()
            .path(path)
            .title(title(path, frontmatter, codeFree))
            .tags(tags(frontmatter, codeFree))
            .outboundLinks(links(path, body, options, index));

        Instant timestamp = frontmatterTimestamp(frontmatter);
        builder.lastModified(timestamp != null ? timestamp : fileTime);

        frontmatter.forEach(builder::frontmatterValue);
        return builder.build();
    }

    // Index of the closing "---" (or "...") line, -1 when the block never closes
    private static int frontmatterEnd(String text) {
        int lineStart = 4;
        while (lineStart < text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            String line = lineEnd < 0 ? text.substring(lineStart) : text.substring(lineStart, lineEnd);
            if (line.strip().equals("---") || line.strip().equals("...")) {
                return lineStart;
            }
            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }
        return -1;
    }

    private Map<String, Object> readFrontmatter(String path, String yaml) {
        if (yaml.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> values = yamlMapper.readValue(yaml, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            if (values == null) {
                return new LinkedHashMap<>();
            }
            values.values().removeIf(v -> v == null);
            return values;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed frontmatter in {}: {}", path, e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    private static String title(String path, Map<String, Object> frontmatter, List<String> lines) {
        Object fmTitle = frontmatter.get("title");
        if (fmTitle instanceof String s && !s.isBlank()) {
            return s.strip();
        }
        for (String line : lines) {
            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                return heading.group(1);
            }
        }
        return VaultPaths.baseName(path);
    }

    /**
     * Frontmatter tags first, then inline hashtags outside code, deduplicated
     * case-insensitively keeping the first spelling.
     */
    static List<String> tags(Map<String, Object> frontmatter, List<String> lines) {
        List<String> raw = new ArrayList<>();
        for (String key : List.of("tags", "tag")) {
            Object value = frontmatter.get(key);
            if (value instanceof Collection<?> list) {
                list.forEach(item -> raw.add(String.valueOf(item)));
            } else if (value != null) {
                for (String part : String.valueOf(value).split("[,\\s]+")) {
                    raw.add(part);
                }
            }
        }
        for (String line : lines) {
            Matcher hashtag = HASHTAG.matcher(INLINE_CODE.matcher(line).replaceAll(""));
            while (hashtag.find()) {
                raw.add(hashtag.group(1));
            }
        }

        Set<String> seen = new LinkedHashSet<>();
        List<String> tags = new ArrayList<>();
        for (String tag : raw) {
            String cleaned = tag.strip();
            while (cleaned.startsWith("#")) {
                cleaned = cleaned.substring(1);
            }
            if (!cleaned.isEmpty() && seen.add(cleaned.toLowerCase(Locale.ROOT))) {
                tags.add(cleaned);
            }
        }
        return tags;
    }

    /**
     * Resolved wikilink targets in order of appearance, without duplicates.
     * Links that resolve to no note, or to the note itself, are dropped.
     */
    static List<String> links(String path, String body, NoteLoadOptions options, NotePathIndex index) {
        String text = options.isSkipEmbeds() ? EMBED.matcher(body).replaceAll("") : body;
        Set<String> targets = new LinkedHashSet<>();
        Matcher link = WIKILINK.matcher(text);
        while (link.find()) {
            String target = link.group(1).strip();
            if (options.isSkipAnchors() && target.contains("#")) {
                continue;
            }
            index.resolve(target)
                .filter(resolved -> !resolved.equals(path))
                .ifPresent(targets::add);
        }
        return new ArrayList<>(targets);
    }

    static List<String> linesOutsideCode(String body) {
        List<String> lines = new ArrayList<>();
        boolean inFence = false;
        for (String line : body.split("\n", -1)) {
            String trimmed = line.strip();
            if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
                inFence = !inFence;
                continue;
            }
            if (!inFence) {
                lines.add(line);
            }
        }
        return lines;
    }

    static Instant frontmatterTimestamp(Map<String, Object> frontmatter) {
        for (String key : TIMESTAMP_KEYS) {
            Object value = frontmatter.get(key);
            if (value == null) {
                continue;
            }
            Instant parsed = parseTimestamp(String.valueOf(value).strip());
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    static Instant parseTimestamp(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("Not an offset timestamp: {}", value);
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(value, format).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                log.trace("Timestamp {} does not match {}", value, format);
            }
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp in frontmatter: {}", value);
            return null;
        }
    }
}
