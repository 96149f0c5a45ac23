package com.dcruver.vaultgraph.app;

import com.dcruver.vaultgraph.config.GraphProperties;
import com.dcruver.vaultgraph.domain.AnalysisResult;
import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.Toggle;
import com.dcruver.vaultgraph.reporting.ContextReportBuilder;
import com.dcruver.vaultgraph.reporting.GraphReportGenerator;
import com.dcruver.vaultgraph.reporting.NoteContextOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Spring Shell commands for analyzing a vault's link graph.
 * Every command loads and analyzes the vault afresh; notes are never written.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class GraphShellCommands {

    private final VaultGraphService vaultGraphService;
    private final GraphReportGenerator reportGenerator;
    private final ContextReportBuilder contextReportBuilder;
    private final GraphProperties properties;

    @ShellMethod(key = {"graph degrees", "graph stats"}, value = "Top notes by authority, hub score and link counts")
    public String degrees(
        @ShellOption(value = "--vault", defaultValue = ShellOption.NULL) String vault,
        @ShellOption(value = "--limit", defaultValue = ShellOption.NULL) Integer limit,
        @ShellOption(value = "--all", defaultValue = "false") boolean all,
        @ShellOption(value = "--include", defaultValue = ShellOption.NULL) String include,
        @ShellOption(value = "--exclude", defaultValue = ShellOption.NULL) String exclude,
        @ShellOption(value = "--min-degree", defaultValue = ShellOption.NULL) Integer minDegree,
        @ShellOption(value = "--mutual-only", defaultValue = "false") boolean mutualOnly,
        @ShellOption(value = "--recency-cascade", defaultValue = ShellOption.NULL) String recencyCascade,
        @ShellOption(value = "--skip-anchors", defaultValue = "false") boolean skipAnchors,
        @ShellOption(value = "--skip-embeds", defaultValue = "false") boolean skipEmbeds,
        @ShellOption(value = "--timings", defaultValue = "false") boolean timings) {
        try {
            GraphOptions options = options(include, exclude, minDegree, mutualOnly, recencyCascade,
                skipAnchors, skipEmbeds);
            AnalysisResult result = vaultGraphService.analyze(vault, options);
            return withTimings(reportGenerator.degrees(result, displayLimit(limit, all)), result, timings);
        } catch (Exception e) {
            log.error("Graph degrees failed", e);
            return "graph degrees failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "graph communities", value = "List link communities, most recently active first")
    public String communities(
        @ShellOption(value = "--vault", defaultValue = ShellOption.NULL) String vault,
        @ShellOption(value = "--limit", defaultValue = ShellOption.NULL) Integer limit,
        @ShellOption(value = "--all", defaultValue = "false") boolean all,
        @ShellOption(value = "--include", defaultValue = ShellOption.NULL) String include,
        @ShellOption(value = "--exclude", defaultValue = ShellOption.NULL) String exclude,
        @ShellOption(value = "--min-degree", defaultValue = ShellOption.NULL) Integer minDegree,
        @ShellOption(value = "--mutual-only", defaultValue = "false") boolean mutualOnly,
        @ShellOption(value = "--recency-cascade", defaultValue = ShellOption.NULL) String recencyCascade,
        @ShellOption(value = "--skip-anchors", defaultValue = "false") boolean skipAnchors,
        @ShellOption(value = "--skip-embeds", defaultValue = "false") boolean skipEmbeds,
        @ShellOption(value = "--timings", defaultValue = "false") boolean timings) {
        try {
            GraphOptions options = options(include, exclude, minDegree, mutualOnly, recencyCascade,
                skipAnchors, skipEmbeds);
            AnalysisResult result = vaultGraphService.analyze(vault, options);
            return withTimings(reportGenerator.communities(result, displayLimit(limit, all)), result, timings);
        } catch (Exception e) {
            log.error("Graph communities failed", e);
            return "graph communities failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "graph community", value = "Show one community by id (c0) or by the path of a member note")
    public String community(
        @ShellOption(value = "--target") String target,
        @ShellOption(value = "--vault", defaultValue = ShellOption.NULL) String vault,
        @ShellOption(value = "--limit", defaultValue = ShellOption.NULL) Integer limit,
        @ShellOption(value = "--all", defaultValue = "false") boolean all,
        @ShellOption(value = "--neighbors", defaultValue = "false") boolean neighbors,
        @ShellOption(value = "--include", defaultValue = ShellOption.NULL) String include,
        @ShellOption(value = "--exclude", defaultValue = ShellOption.NULL) String exclude,
        @ShellOption(value = "--min-degree", defaultValue = ShellOption.NULL) Integer minDegree,
        @ShellOption(value = "--mutual-only", defaultValue = "false") boolean mutualOnly,
        @ShellOption(value = "--recency-cascade", defaultValue = ShellOption.NULL) String recencyCascade,
        @ShellOption(value = "--skip-anchors", defaultValue = "false") boolean skipAnchors,
        @ShellOption(value = "--skip-embeds", defaultValue = "false") boolean skipEmbeds,
        @ShellOption(value = "--timings", defaultValue = "false") boolean timings) {
        try {
            GraphOptions options = options(include, exclude, minDegree, mutualOnly, recencyCascade,
                skipAnchors, skipEmbeds);
            AnalysisResult result = vaultGraphService.analyze(vault, options);
            String report = reportGenerator.community(result, target, displayLimit(limit, all), neighbors);
            return withTimings(report, result, timings);
        } catch (Exception e) {
            log.error("Graph community failed", e);
            return "graph community failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "graph clusters", value = "List groups of notes that link to each other in cycles")
    public String clusters(
        @ShellOption(value = "--vault", defaultValue = ShellOption.NULL) String vault,
        @ShellOption(value = "--limit", defaultValue = ShellOption.NULL) Integer limit,
        @ShellOption(value = "--all", defaultValue = "false") boolean all,
        @ShellOption(value = "--include", defaultValue = ShellOption.NULL) String include,
        @ShellOption(value = "--exclude", defaultValue = ShellOption.NULL) String exclude,
        @ShellOption(value = "--min-degree", defaultValue = ShellOption.NULL) Integer minDegree,
        @ShellOption(value = "--mutual-only", defaultValue = "false") boolean mutualOnly,
        @ShellOption(value = "--recency-cascade", defaultValue = ShellOption.NULL) String recencyCascade,
        @ShellOption(value = "--skip-anchors", defaultValue = "false") boolean skipAnchors,
        @ShellOption(value = "--skip-embeds", defaultValue = "false") boolean skipEmbeds,
        @ShellOption(value = "--timings", defaultValue = "false") boolean timings) {
        try {
            GraphOptions options = options(include, exclude, minDegree, mutualOnly, recencyCascade,
                skipAnchors, skipEmbeds);
            AnalysisResult result = vaultGraphService.analyze(vault, options);
            return withTimings(reportGenerator.clusters(result, displayLimit(limit, all)), result, timings);
        } catch (Exception e) {
            log.error("Graph clusters failed", e);
            return "graph clusters failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "graph orphans", value = "List notes with no links in or out")
    public String orphans(
        @ShellOption(value = "--vault", defaultValue = ShellOption.NULL) String vault,
        @ShellOption(value = "--limit", defaultValue = ShellOption.NULL) Integer limit,
        @ShellOption(value = "--all", defaultValue = "false") boolean all,
        @ShellOption(value = "--include", defaultValue = ShellOption.NULL) String include,
        @ShellOption(value = "--exclude", defaultValue = ShellOption.NULL) String exclude,
        @ShellOption(value = "--min-degree", defaultValue = "0") Integer minDegree,
        @ShellOption(value = "--mutual-only", defaultValue = "false") boolean mutualOnly,
        @ShellOption(value = "--recency-cascade", defaultValue = ShellOption.NULL) String recencyCascade,
        @ShellOption(value = "--skip-anchors", defaultValue = "false") boolean skipAnchors,
        @ShellOption(value = "--skip-embeds", defaultValue = "false") boolean skipEmbeds,
        @ShellOption(value = "--timings", defaultValue = "false") boolean timings) {
        try {
            // orphans have degree 0, so min-degree pruning is off unless asked for
            GraphOptions options = options(include, exclude, minDegree, mutualOnly, recencyCascade,
                skipAnchors, skipEmbeds);
            AnalysisResult result = vaultGraphService.analyze(vault, options);
            return withTimings(reportGenerator.orphans(result, displayLimit(limit, all)), result, timings);
        } catch (Exception e) {
            log.error("Graph orphans failed", e);
            return "graph orphans failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "graph note-context", value = "JSON graph context for the given notes")
    public String noteContext(
        @ShellOption(value = "--files") String files,
        @ShellOption(value = "--vault", defaultValue = ShellOption.NULL) String vault,
        @ShellOption(value = "--backlinks", defaultValue = "true", arity = 1) boolean backlinks,
        @ShellOption(value = "--neighbors", defaultValue = "true", arity = 1) boolean neighbors,
        @ShellOption(value = "--frontmatter", defaultValue = "false") boolean frontmatter,
        @ShellOption(value = "--tags", defaultValue = "true", arity = 1) boolean tags,
        @ShellOption(value = "--neighbor-limit", defaultValue = "50") int neighborLimit,
        @ShellOption(value = "--backlinks-limit", defaultValue = "50") int backlinksLimit,
        @ShellOption(value = "--all", defaultValue = "false") boolean all,
        @ShellOption(value = "--include", defaultValue = ShellOption.NULL) String include,
        @ShellOption(value = "--exclude", defaultValue = ShellOption.NULL) String exclude,
        @ShellOption(value = "--min-degree", defaultValue = ShellOption.NULL) Integer minDegree,
        @ShellOption(value = "--mutual-only", defaultValue = "false") boolean mutualOnly,
        @ShellOption(value = "--recency-cascade", defaultValue = ShellOption.NULL) String recencyCascade,
        @ShellOption(value = "--skip-anchors", defaultValue = "false") boolean skipAnchors,
        @ShellOption(value = "--skip-embeds", defaultValue = "false") boolean skipEmbeds,
        @ShellOption(value = "--timings", defaultValue = "false") boolean timings) {
        try {
            GraphOptions options = options(include, exclude, minDegree, mutualOnly, recencyCascade,
                skipAnchors, skipEmbeds);
            AnalysisResult result = vaultGraphService.analyze(vault, options);
            NoteContextOptions contextOptions = NoteContextOptions.builder()
                .backlinks(backlinks)
                .neighbors(neighbors)
                .frontmatter(frontmatter)
                .tags(tags)
                .neighborLimit(all ? 0 : neighborLimit)
                .backlinksLimit(all ? 0 : backlinksLimit)
                .build();
            String json = contextReportBuilder.noteContextJson(result, split(files), contextOptions);
            return withTimings(json, result, timings);
        } catch (Exception e) {
            log.error("Graph note-context failed", e);
            return "graph note-context failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "graph vault-context", value = "JSON overview of the vault's link structure")
    public String vaultContext(
        @ShellOption(value = "--vault", defaultValue = ShellOption.NULL) String vault,
        @ShellOption(value = "--limit", defaultValue = ShellOption.NULL) Integer limit,
        @ShellOption(value = "--all", defaultValue = "false") boolean all,
        @ShellOption(value = "--include", defaultValue = ShellOption.NULL) String include,
        @ShellOption(value = "--exclude", defaultValue = ShellOption.NULL) String exclude,
        @ShellOption(value = "--min-degree", defaultValue = ShellOption.NULL) Integer minDegree,
        @ShellOption(value = "--mutual-only", defaultValue = "false") boolean mutualOnly,
        @ShellOption(value = "--recency-cascade", defaultValue = ShellOption.NULL) String recencyCascade,
        @ShellOption(value = "--skip-anchors", defaultValue = "false") boolean skipAnchors,
        @ShellOption(value = "--skip-embeds", defaultValue = "false") boolean skipEmbeds,
        @ShellOption(value = "--timings", defaultValue = "false") boolean timings) {
        try {
            GraphOptions options = options(include, exclude, minDegree, mutualOnly, recencyCascade,
                skipAnchors, skipEmbeds);
            AnalysisResult result = vaultGraphService.analyze(vault, options);
            // timings are embedded in the document rather than appended
            return contextReportBuilder.vaultContextJson(result, displayLimit(limit, all), timings);
        } catch (Exception e) {
            log.error("Graph vault-context failed", e);
            return "graph vault-context failed: " + e.getMessage();
        }
    }

    /**
     * Configured defaults overridden by whatever the command line set.
     */
    GraphOptions options(String include, String exclude, Integer minDegree, boolean mutualOnly,
                         String recencyCascade, boolean skipAnchors, boolean skipEmbeds) {
        GraphOptions.GraphOptionsBuilder builder = properties.toOptions().toBuilder()
            .includePatterns(split(include))
            .excludePatterns(split(exclude))
            .skipAnchors(skipAnchors)
            .skipEmbeds(skipEmbeds);
        if (minDegree != null) {
            builder.minDegree(minDegree);
        }
        if (mutualOnly) {
            builder.mutualOnly(true);
        }
        Toggle cascade = parseToggle(recencyCascade);
        if (cascade.isSet()) {
            builder.recencyCascade(cascade);
        }
        return builder.build();
    }

    int displayLimit(Integer limit, boolean all) {
        if (all) {
            return 0;
        }
        return limit != null ? limit : properties.getLimit();
    }

    static Toggle parseToggle(String value) {
        if (value == null || value.isBlank()) {
            return Toggle.UNSET;
        }
        switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "true", "on", "yes", "1":
                return Toggle.ENABLED;
            case "false", "off", "no", "0":
                return Toggle.DISABLED;
            default:
                throw new IllegalArgumentException("--recency-cascade expects true or false, got " + value);
        }
    }

    static List<String> split(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::strip)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private String withTimings(String report, AnalysisResult result, boolean timings) {
        if (!timings) {
            return report;
        }
        return report + "\n" + reportGenerator.timings(result.getTimings());
    }
}
