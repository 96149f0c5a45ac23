package com.dcruver.vaultgraph.reporting;

import com.dcruver.vaultgraph.domain.AnalysisResult;
import com.dcruver.vaultgraph.domain.AuthorityBucket;
import com.dcruver.vaultgraph.domain.AuthorityScore;
import com.dcruver.vaultgraph.domain.CommunityRecency;
import com.dcruver.vaultgraph.domain.CommunitySummary;
import com.dcruver.vaultgraph.domain.GraphNode;
import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.GraphTimings;
import com.dcruver.vaultgraph.domain.TagCount;
import com.dcruver.vaultgraph.io.VaultPaths;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Plain-text reports over a finished analysis. Nothing here recomputes the graph.
 * A limit of zero or less means no limit.
 */
@Component
public class GraphReportGenerator {

    static final String NONE = "(none)";

    /**
     * Most recently active communities first, then larger ones.
     */
    static final Comparator<CommunitySummary> MOST_RECENT_FIRST = Comparator
        .comparingDouble((CommunitySummary c) -> c.getRecency() == null
            ? Double.MAX_VALUE
            : c.getRecency().getLatestAgeDays())
        .thenComparing(Comparator.comparingInt(CommunitySummary::size).reversed())
        .thenComparing(CommunitySummary::getId);

    public String degrees(AnalysisResult result, int limit) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Notes: %d, links: %d, orphans: %d%n%n",
            result.getStats().nodeCount(), result.getStats().edgeCount(), result.getOrphans().size()));
        if (result.isEmpty()) {
            return sb.append(NONE).append('\n').toString();
        }

        appendRanking(sb, "Top authorities", result, GraphNode::getAuthority, limit);
        appendRanking(sb, "Top hubs", result, GraphNode::getHub, limit);
        appendRanking(sb, "Most linked to", result, GraphNode::getInbound, limit);
        appendRanking(sb, "Most links out", result, GraphNode::getOutbound, limit);
        return sb.toString();
    }

    public String communities(AnalysisResult result, int limit) {
        List<CommunitySummary> ordered = mostRecentFirst(result.getCommunities());
        if (ordered.isEmpty()) {
            return NONE + "\n";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Communities: %d%n%n", ordered.size()));
        for (CommunitySummary community : limit(ordered, limit)) {
            sb.append(String.format("%s  size %d  anchor %s  density %.3f%n",
                community.getId(), community.size(), community.getAnchor(), community.getDensity()));
            sb.append("  recency: ").append(describe(community.getRecency())).append('\n');
            if (!community.getTopTags().isEmpty()) {
                sb.append("  tags: ").append(tags(community.getTopTags())).append('\n');
            }
            sb.append("  top notes: ").append(community.getTopAuthority().stream()
                .map(AuthorityScore::path)
                .collect(Collectors.joining(", "))).append('\n');
            if (!community.getBridges().isEmpty()) {
                sb.append("  bridges: ").append(String.join(", ", community.getBridges())).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Detail of one community, found by its ID or by the path of one of its notes.
     *
     * @throws GraphLookupException when neither matches
     */
    public String community(AnalysisResult result, String idOrPath, int limit, boolean includeNeighbors) {
        CommunitySummary community = findCommunity(result, idOrPath);

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Community %s: %d notes, %d internal links, density %.3f%n",
            community.getId(), community.size(), community.getInternalEdges(), community.getDensity()));
        sb.append("Anchor: ").append(community.getAnchor()).append('\n');
        sb.append("Recency: ").append(describe(community.getRecency())).append('\n');
        if (!community.getTopTags().isEmpty()) {
            sb.append("Tags: ").append(tags(community.getTopTags())).append('\n');
        }
        if (community.getAuthorityStats() != null) {
            sb.append(String.format("Authority: mean %.4f, p50 %.4f, p90 %.4f, max %.4f%n",
                community.getAuthorityStats().getMean(), community.getAuthorityStats().getP50(),
                community.getAuthorityStats().getP90(), community.getAuthorityStats().getMax()));
        }
        if (!community.getAuthorityBuckets().isEmpty()) {
            sb.append("Authority distribution:\n");
            for (AuthorityBucket bucket : community.getAuthorityBuckets()) {
                sb.append(String.format("  %.4f - %.4f: %d (%s)%n",
                    bucket.high(), bucket.low(), bucket.count(), bucket.example()));
            }
        }
        if (!community.getBridges().isEmpty()) {
            sb.append("Bridges: ").append(String.join(", ", community.getBridges())).append('\n');
        }

        sb.append("\nMembers:\n");
        List<GraphNode> members = community.getMembers().stream()
            .map(path -> result.getNodes().get(path))
            .sorted(Comparator.comparingDouble(GraphNode::getAuthority).reversed()
                .thenComparing(GraphNode::getPath))
            .toList();
        for (GraphNode member : limit(members, limit)) {
            sb.append(String.format("  %s  (authority %.4f, hub %.4f, in %d, out %d)%n",
                member.getPath(), member.getAuthority(), member.getHub(),
                member.getInbound(), member.getOutbound()));
            if (result.getOptions().isIncludeTags() && !member.getTags().isEmpty()) {
                sb.append("    tags: ").append(String.join(", ", member.getTags())).append('\n');
            }
            if (includeNeighbors && !member.getNeighbors().isEmpty()) {
                sb.append("    links to: ").append(String.join(", ", member.getNeighbors())).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Strong components with more than one note: groups that link to each other in a cycle.
     */
    public String clusters(AnalysisResult result, int limit) {
        List<List<String>> clusters = result.getMutualClusters();
        if (clusters.isEmpty()) {
            return NONE + "\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Mutual link clusters: %d%n%n", clusters.size()));
        int index = 0;
        for (List<String> cluster : limit(clusters, limit)) {
            sb.append(String.format("Cluster %d (%d notes)%n", ++index, cluster.size()));
            cluster.forEach(path -> sb.append("  ").append(path).append('\n'));
        }
        return sb.toString();
    }

    public String orphans(AnalysisResult result, int limit) {
        if (result.getOrphans().isEmpty()) {
            return NONE + "\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Orphans: %d%n", result.getOrphans().size()));
        limit(result.getOrphans(), limit).forEach(path -> sb.append("  ").append(path).append('\n'));
        return sb.toString();
    }

    public String timings(GraphTimings timings) {
        StringBuilder sb = new StringBuilder("Timings:\n");
        for (Map.Entry<String, Long> entry : timings.toMillis().entrySet()) {
            sb.append(String.format("  %s: %d%n", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }

    static List<CommunitySummary> mostRecentFirst(List<CommunitySummary> communities) {
        List<CommunitySummary> ordered = new ArrayList<>(communities);
        ordered.sort(MOST_RECENT_FIRST);
        return ordered;
    }

    static CommunitySummary findCommunity(AnalysisResult result, String idOrPath) {
        if (idOrPath == null || idOrPath.isBlank()) {
            throw new GraphLookupException("Give a community id or a note path");
        }
        String key = idOrPath.strip();
        var byId = result.findCommunity(key);
        if (byId.isPresent()) {
            return byId.get();
        }

        String path = VaultPaths.withSuffix(VaultPaths.normalize(key));
        if (result.findNode(path).isEmpty()) {
            throw new GraphLookupException(missingNoteMessage(result, path));
        }
        return result.communityOf(path).orElseThrow(() -> new GraphLookupException(
            "Note " + path + " has no community; singleton communities are excluded from this analysis"));
    }

    static String missingNoteMessage(AnalysisResult result, String path) {
        GraphOptions options = result.getOptions();
        if (result.getFilteredOut().contains(path)) {
            return "Note " + path + " was excluded by the include/exclude filters";
        }
        if (result.getPruned().contains(path)) {
            return "Note " + path + " was pruned by min-degree " + options.getMinDegree()
                + "; lower --min-degree to keep it";
        }
        StringBuilder message = new StringBuilder("No community or note named " + path);
        if (!options.getIncludePatterns().isEmpty() || !options.getExcludePatterns().isEmpty()) {
            message.append("; include/exclude filters are active");
        }
        if (options.getMinDegree() > 0) {
            message.append("; notes with fewer than ").append(options.getMinDegree())
                .append(" links are pruned");
        }
        return message.toString();
    }

    private static void appendRanking(StringBuilder sb, String title, AnalysisResult result,
                                      ToDoubleFunction<GraphNode> score, int limit) {
        List<GraphNode> ranked = result.getNodes().values().stream()
            .sorted(Comparator.comparingDouble(score).reversed().thenComparing(GraphNode::getPath))
            .toList();
        sb.append(title).append(":\n");
        int rank = 0;
        for (GraphNode node : limit(ranked, limit)) {
            sb.append(String.format("%4d. %s  (authority %.4f, hub %.4f, in %d, out %d)%n",
                ++rank, node.getPath(), node.getAuthority(), node.getHub(),
                node.getInbound(), node.getOutbound()));
        }
        sb.append('\n');
    }

    static String describe(CommunityRecency recency) {
        if (recency == null) {
            return "unknown";
        }
        return String.format("latest %s %.1f days ago, %d touched in the last %d days",
            recency.getLatestPath(), recency.getLatestAgeDays(), recency.getRecentCount(), recency.getWindowDays());
    }

    private static String tags(List<TagCount> tags) {
        return tags.stream()
            .map(t -> t.tag() + " (" + t.count() + ")")
            .collect(Collectors.joining(", "));
    }

    static <T> List<T> limit(List<T> items, int limit) {
        if (limit <= 0 || items.size() <= limit) {
            return items;
        }
        return items.subList(0, limit);
    }
}
