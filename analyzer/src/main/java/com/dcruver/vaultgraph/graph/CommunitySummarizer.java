package com.dcruver.vaultgraph.graph;

import com.dcruver.vaultgraph.domain.AuthorityBucket;
import com.dcruver.vaultgraph.domain.AuthorityScore;
import com.dcruver.vaultgraph.domain.AuthorityStats;
import com.dcruver.vaultgraph.domain.CommunityRecency;
import com.dcruver.vaultgraph.domain.CommunitySummary;
import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.NoteEntry;
import com.dcruver.vaultgraph.domain.TagCount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups label-propagation labels into communities and annotates each one
 * with anchor, density, tags, authority distribution, recency and bridges.
 * Communities come back in ID order: {@code c0} is the largest.
 */
@Component
@Slf4j
public class CommunitySummarizer {

    static final int BRIDGE_LIMIT = 5;
    private static final double SECONDS_PER_DAY = 86_400.0;

    public List<CommunitySummary> summarize(LinkGraph graph,
                                            Map<String, String> labels,
                                            HitsScores scores,
                                            Map<String, NoteEntry> entries,
                                            Map<String, Instant> effectiveTimes,
                                            Instant now,
                                            GraphOptions options) {
        Map<String, List<String>> grouped = new TreeMap<>();
        for (Map.Entry<String, String> label : labels.entrySet()) {
            grouped.computeIfAbsent(label.getValue(), k -> new ArrayList<>()).add(label.getKey());
        }

        List<List<String>> groups = new ArrayList<>();
        int droppedSingletons = 0;
        for (List<String> members : grouped.values()) {
            if (members.size() == 1 && !options.isIncludeSingletonCommunities()) {
                droppedSingletons++;
                continue;
            }
            members.sort(Comparator.naturalOrder());
            groups.add(List.copyOf(members));
        }
        groups.sort(ComponentFinder.LARGEST_FIRST);
        if (droppedSingletons > 0) {
            log.debug("Dropped {} singleton communities", droppedSingletons);
        }

        Map<String, String> membership = ComponentFinder.assignIds(groups, "c");
        Map<String, List<String>> bridges = bridges(graph, membership, scores);

        List<CommunitySummary> summaries = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            String id = "c" + i;
            List<String> members = groups.get(i);
            int internal = internalEdges(graph, members);
            summaries.add(CommunitySummary.builder()
                .id(id)
                .members(members)
                .anchor(anchor(members, scores))
                .internalEdges(internal)
                .density(density(internal, members.size()))
                .topTags(options.isIncludeTags()
                    ? topTags(members, entries, options.getTopTagsLimit())
                    : List.of())
                .topAuthority(topAuthority(members, scores, options.getTopAuthorityLimit()))
                .authorityBuckets(authorityBuckets(members, scores))
                .authorityStats(authorityStats(members, scores))
                .recency(recency(members, effectiveTimes, now, options.getRecencyWindowDays()))
                .bridges(bridges.getOrDefault(id, List.of()))
                .build());
        }
        return List.copyOf(summaries);
    }

    static String anchor(List<String> members, HitsScores scores) {
        return byAuthority(members, scores).get(0);
    }

    static int internalEdges(LinkGraph graph, List<String> members) {
        Set<String> memberSet = Set.copyOf(members);
        int count = 0;
        for (String member : members) {
            for (String target : graph.outbound(member)) {
                if (memberSet.contains(target)) {
                    count++;
                }
            }
        }
        return count;
    }

    static double density(int internalEdges, int size) {
        if (size <= 1) {
            return 0.0;
        }
        return (double) internalEdges / ((double) size * (size - 1));
    }

    static List<TagCount> topTags(List<String> members, Map<String, NoteEntry> entries, int limit) {
        Map<String, Integer> counts = new HashMap<>();
        for (String member : members) {
            NoteEntry entry = entries.get(member);
            if (entry == null) {
                continue;
            }
            for (String tag : entry.getTags()) {
                counts.merge(tag.toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(limit)
            .map(e -> new TagCount(e.getKey(), e.getValue()))
            .toList();
    }

    static List<AuthorityScore> topAuthority(List<String> members, HitsScores scores, int limit) {
        return byAuthority(members, scores).stream()
            .limit(limit)
            .map(path -> new AuthorityScore(path, scores.authority(path), scores.hub(path)))
            .toList();
    }

    /**
     * Members split into equal slices from highest to lowest authority.
     * Slice count is the square root of the size, kept between 5 and 10.
     */
    static List<AuthorityBucket> authorityBuckets(List<String> members, HitsScores scores) {
        if (members.isEmpty()) {
            return List.of();
        }
        List<String> ordered = byAuthority(members, scores);
        int bucketCount = bucketCountFor(ordered.size());
        int sliceSize = (int) Math.ceil((double) ordered.size() / bucketCount);

        List<AuthorityBucket> buckets = new ArrayList<>();
        for (int start = 0; start < ordered.size(); start += sliceSize) {
            List<String> slice = ordered.subList(start, Math.min(start + sliceSize, ordered.size()));
            buckets.add(new AuthorityBucket(
                scores.authority(slice.get(slice.size() - 1)),
                scores.authority(slice.get(0)),
                slice.size(),
                slice.get(0)));
        }
        return List.copyOf(buckets);
    }

    static int bucketCountFor(int size) {
        if (size <= 0) {
            return 0;
        }
        int count = (int) Math.ceil(Math.sqrt(size));
        return Math.max(5, Math.min(10, count));
    }

    static AuthorityStats authorityStats(List<String> members, HitsScores scores) {
        if (members.isEmpty()) {
            return null;
        }
        double[] values = members.stream().mapToDouble(scores::authority).sorted().toArray();
        double mean = Arrays.stream(values).average().orElse(0.0);
        return AuthorityStats.builder()
            .mean(mean)
            .p50(percentile(values, 0.50))
            .p75(percentile(values, 0.75))
            .p90(percentile(values, 0.90))
            .p95(percentile(values, 0.95))
            .p99(percentile(values, 0.99))
            .max(values[values.length - 1])
            .build();
    }

    // nearest-rank over ascending values
    static double percentile(double[] ascending, double quantile) {
        int index = (int) Math.ceil(quantile * ascending.length) - 1;
        index = Math.max(0, Math.min(ascending.length - 1, index));
        return ascending[index];
    }

    static CommunityRecency recency(List<String> members, Map<String, Instant> effectiveTimes,
                                    Instant now, int windowDays) {
        String latestPath = null;
        Instant latest = null;
        int recent = 0;
        Duration window = Duration.ofDays(windowDays);
        for (String member : members) {
            Instant ts = effectiveTimes.get(member);
            if (ts == null) {
                continue;
            }
            if (latest == null || ts.isAfter(latest)) {
                latest = ts;
                latestPath = member;
            }
            if (Duration.between(ts, now).compareTo(window) <= 0) {
                recent++;
            }
        }
        if (latest == null) {
            return null;
        }
        double ageDays = Math.max(0.0, Duration.between(latest, now).toMillis() / 1000.0 / SECONDS_PER_DAY);
        return CommunityRecency.builder()
            .latestPath(latestPath)
            .latestTimestamp(latest)
            .latestAgeDays(ageDays)
            .recentCount(recent)
            .windowDays(windowDays)
            .build();
    }

    /**
     * Per community, members with edges into another community. Edges touching a
     * node without community are ignored.
     */
    static Map<String, List<String>> bridges(LinkGraph graph, Map<String, String> membership, HitsScores scores) {
        Map<String, Integer> crossEdges = new HashMap<>();
        for (String source : graph.nodes()) {
            String sourceCommunity = membership.get(source);
            if (sourceCommunity == null) {
                continue;
            }
            for (String target : graph.outbound(source)) {
                String targetCommunity = membership.get(target);
                if (targetCommunity != null && !targetCommunity.equals(sourceCommunity)) {
                    crossEdges.merge(source, 1, Integer::sum);
                    crossEdges.merge(target, 1, Integer::sum);
                }
            }
        }

        Map<String, List<String>> perCommunity = new HashMap<>();
        for (String node : crossEdges.keySet()) {
            perCommunity.computeIfAbsent(membership.get(node), k -> new ArrayList<>()).add(node);
        }
        Comparator<String> order = Comparator
            .<String>comparingInt(crossEdges::get).reversed()
            .thenComparing(Comparator.<String>comparingDouble(scores::authority).reversed())
            .thenComparing(Comparator.naturalOrder());
        perCommunity.replaceAll((id, nodes) -> nodes.stream().sorted(order).limit(BRIDGE_LIMIT).toList());
        return perCommunity;
    }

    private static List<String> byAuthority(List<String> members, HitsScores scores) {
        return members.stream()
            .sorted(Comparator.<String>comparingDouble(scores::authority).reversed()
                .thenComparing(Comparator.naturalOrder()))
            .toList();
    }
}
