package com.dcruver.vaultgraph.reporting;

import com.dcruver.vaultgraph.domain.AnalysisResult;
import com.dcruver.vaultgraph.domain.AuthorityScore;
import com.dcruver.vaultgraph.domain.AuthorityStats;
import com.dcruver.vaultgraph.domain.CommunityRecency;
import com.dcruver.vaultgraph.domain.CommunitySummary;
import com.dcruver.vaultgraph.domain.GraphNode;
import com.dcruver.vaultgraph.domain.TagCount;
import com.dcruver.vaultgraph.io.VaultPaths;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON context documents for tools that want the graph around a note, or an
 * overview of the whole vault.
 */
@Component
public class ContextReportBuilder {

    static final int SUMMARY_TAGS = 3;
    static final int SUMMARY_AUTHORITY = 3;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NoteContext(String path, String title, List<String> tags, Map<String, Object> frontmatter,
                              GraphStats graph, CommunityContext community, Neighbors neighbors,
                              List<String> backlinks, String error) {
    }

    public record GraphStats(int inbound, int outbound, double hub, double authority,
                             String weakComponent, String strongComponent) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CommunityContext(String id, int size, double fraction, String anchor, double density,
                                   CommunityRecency recency, List<TagCount> topTags,
                                   List<AuthorityScore> topAuthority, AuthorityStats authorityStats) {
    }

    public record Neighbors(List<String> linksOut, List<String> linksIn) {
    }

    public record ComponentContext(String id, int size, List<String> members) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record VaultContext(int notes, int links, int orphanCount, List<String> orphans,
                               List<ComponentContext> weakComponents, int communityCount,
                               List<CommunityContext> communities, Map<String, Long> timings) {
    }

    /**
     * One context entry per requested note. A note the analysis does not know
     * gets an entry with an error instead of failing the whole document.
     */
    public List<NoteContext> noteContexts(AnalysisResult result, List<String> files, NoteContextOptions options) {
        List<NoteContext> contexts = new ArrayList<>();
        for (String file : files) {
            String path = VaultPaths.withSuffix(VaultPaths.normalize(file));
            GraphNode node = result.getNodes().get(path);
            if (node == null) {
                contexts.add(new NoteContext(path, null, null, null, null, null, null, null,
                    GraphReportGenerator.missingNoteMessage(result, path)));
                continue;
            }

            List<String> linksIn = result.linksInto(path);
            Neighbors neighbors = null;
            if (options.isNeighbors()) {
                neighbors = new Neighbors(
                    GraphReportGenerator.limit(node.getNeighbors(), options.getNeighborLimit()),
                    GraphReportGenerator.limit(linksIn, options.getNeighborLimit()));
            }
            boolean withTags = options.isTags() && result.getOptions().isIncludeTags();
            contexts.add(new NoteContext(
                path,
                node.getTitle(),
                withTags ? node.getTags() : null,
                options.isFrontmatter() && !node.getFrontmatter().isEmpty() ? node.getFrontmatter() : null,
                new GraphStats(node.getInbound(), node.getOutbound(), node.getHub(), node.getAuthority(),
                    node.getWeakComponent(), node.getStrongComponent()),
                result.communityOf(path).map(c -> summarize(c, result, false)).orElse(null),
                neighbors,
                options.isBacklinks() ? GraphReportGenerator.limit(linksIn, options.getBacklinksLimit()) : null,
                null));
        }
        return contexts;
    }

    public String noteContextJson(AnalysisResult result, List<String> files, NoteContextOptions options) {
        return write(noteContexts(result, files, options));
    }

    public VaultContext vaultContext(AnalysisResult result, int limit, boolean includeTimings) {
        List<ComponentContext> components = new ArrayList<>();
        List<List<String>> weak = result.getWeakComponents();
        for (int i = 0; i < weak.size(); i++) {
            components.add(new ComponentContext("comp" + i, weak.get(i).size(), weak.get(i)));
        }

        List<CommunityContext> communities = GraphReportGenerator.limit(
                GraphReportGenerator.mostRecentFirst(result.getCommunities()), limit).stream()
            .map(c -> summarize(c, result, true))
            .toList();

        return new VaultContext(
            result.getStats().nodeCount(),
            result.getStats().edgeCount(),
            result.getOrphans().size(),
            GraphReportGenerator.limit(result.getOrphans(), limit),
            GraphReportGenerator.limit(components, limit),
            result.getCommunities().size(),
            communities,
            includeTimings ? result.getTimings().toMillis() : null);
    }

    public String vaultContextJson(AnalysisResult result, int limit, boolean includeTimings) {
        return write(vaultContext(result, limit, includeTimings));
    }

    private static CommunityContext summarize(CommunitySummary community, AnalysisResult result, boolean truncated) {
        int total = result.getStats().nodeCount();
        List<TagCount> tags = community.getTopTags();
        List<AuthorityScore> authority = community.getTopAuthority();
        if (truncated) {
            tags = GraphReportGenerator.limit(tags, SUMMARY_TAGS);
            authority = GraphReportGenerator.limit(authority, SUMMARY_AUTHORITY);
        }
        return new CommunityContext(
            community.getId(),
            community.size(),
            total == 0 ? 0.0 : (double) community.size() / total,
            community.getAnchor(),
            community.getDensity(),
            community.getRecency(),
            result.getOptions().isIncludeTags() ? tags : null,
            truncated ? authority : null,
            truncated ? community.getAuthorityStats() : null);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
