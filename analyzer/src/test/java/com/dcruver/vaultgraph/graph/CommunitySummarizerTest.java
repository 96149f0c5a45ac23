package com.dcruver.vaultgraph.graph;

import com.dcruver.vaultgraph.domain.AuthorityBucket;
import com.dcruver.vaultgraph.domain.AuthorityStats;
import com.dcruver.vaultgraph.domain.CommunityRecency;
import com.dcruver.vaultgraph.domain.CommunitySummary;
import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.NoteEntry;
import com.dcruver.vaultgraph.domain.TagCount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.dcruver.vaultgraph.NoteFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

class CommunitySummarizerTest {

    private CommunitySummarizer summarizer;
    private LinkGraph graph;
    private Map<String, String> labels;
    private HitsScores scores;

    @BeforeEach
    void setUp() {
        summarizer = new CommunitySummarizer();

        // community x: x1 <-> x2, x1 -> x3; community y: y1 <-> y2; x3 -> y1 crosses over
        graph = LinkGraph.of(Map.of(
            "x1.md", List.of("x2.md", "x3.md"),
            "x2.md", List.of("x1.md"),
            "x3.md", List.of("y1.md"),
            "y1.md", List.of("y2.md"),
            "y2.md", List.of("y1.md"),
            "solo.md", List.of()));
        labels = Map.of(
            "x1.md", "x", "x2.md", "x", "x3.md", "x",
            "y1.md", "y", "y2.md", "y",
            "solo.md", "solo.md");
        scores = HitsScores.builder()
            .authorities(Map.of("x1.md", 0.2, "x2.md", 0.5, "x3.md", 0.3, "y1.md", 0.6, "y2.md", 0.4))
            .hubs(Map.of("x1.md", 0.7))
            .build();
    }

    @Test
    void numbersCommunitiesBySize() {
        List<CommunitySummary> communities = summarize(GraphOptions.defaults(), Map.of(), Map.of());

        assertEquals(List.of("c0", "c1", "c2"), communities.stream().map(CommunitySummary::getId).toList());
        assertEquals(List.of("x1.md", "x2.md", "x3.md"), communities.get(0).getMembers());
        assertEquals(List.of("y1.md", "y2.md"), communities.get(1).getMembers());
        assertEquals(List.of("solo.md"), communities.get(2).getMembers());
    }

    @Test
    void dropsSingletonsWhenAsked() {
        List<CommunitySummary> communities = summarize(
            GraphOptions.builder().includeSingletonCommunities(false).build(), Map.of(), Map.of());

        assertEquals(2, communities.size());
        assertTrue(communities.stream().noneMatch(c -> c.contains("solo.md")));
    }

    @Test
    void anchorDensityAndInternalEdges() {
        CommunitySummary x = summarize(GraphOptions.defaults(), Map.of(), Map.of()).get(0);

        assertEquals("x2.md", x.getAnchor());
        assertEquals(3, x.getInternalEdges());
        assertEquals(0.5, x.getDensity(), 1e-12);
    }

    @Test
    void singletonHasZeroDensity() {
        CommunitySummary solo = summarize(GraphOptions.defaults(), Map.of(), Map.of()).get(2);

        assertEquals(0.0, solo.getDensity());
        assertEquals("solo.md", solo.getAnchor());
    }

    @Test
    void topAuthorityIsOrderedAndLimited() {
        GraphOptions options = GraphOptions.builder().topAuthorityLimit(2).build();

        CommunitySummary x = summarize(options, Map.of(), Map.of()).get(0);

        assertEquals(List.of("x2.md", "x3.md"),
            x.getTopAuthority().stream().map(s -> s.path()).toList());
    }

    @Test
    void countsTagsCaseInsensitively() {
        Map<String, NoteEntry> entries = new HashMap<>();
        entries.put("x1.md", entry("x1.md", "Graph", "ideas"));
        entries.put("x2.md", entry("x2.md", "graph"));
        entries.put("x3.md", entry("x3.md", "ideas", "zeta"));

        CommunitySummary x = summarize(GraphOptions.defaults(), entries, Map.of()).get(0);

        assertEquals(List.of(new TagCount("graph", 2), new TagCount("ideas", 2), new TagCount("zeta", 1)),
            x.getTopTags());
    }

    @Test
    void skipsTagsWhenDisabled() {
        Map<String, NoteEntry> entries = Map.of("x1.md", entry("x1.md", "graph"));

        CommunitySummary x = summarize(GraphOptions.builder().includeTags(false).build(), entries, Map.of()).get(0);

        assertTrue(x.getTopTags().isEmpty());
    }

    @Test
    void bridgesAreMembersWithCrossCommunityEdges() {
        List<CommunitySummary> communities = summarize(GraphOptions.defaults(), Map.of(), Map.of());

        assertEquals(List.of("x3.md"), communities.get(0).getBridges());
        assertEquals(List.of("y1.md"), communities.get(1).getBridges());
        assertTrue(communities.get(2).getBridges().isEmpty());
    }

    @Test
    void recencyUsesEffectiveTimes() {
        Map<String, Instant> times = Map.of(
            "x1.md", NOW.minus(Duration.ofDays(40)),
            "x2.md", NOW.minus(Duration.ofHours(36)),
            "x3.md", NOW.minus(Duration.ofDays(10)));

        CommunityRecency recency = summarize(GraphOptions.defaults(), Map.of(), times).get(0).getRecency();

        assertEquals("x2.md", recency.getLatestPath());
        assertEquals(1.5, recency.getLatestAgeDays(), 1e-9);
        assertEquals(2, recency.getRecentCount());
        assertEquals(30, recency.getWindowDays());
    }

    @Test
    void recencyIsNullWithoutTimestamps() {
        CommunitySummary y = summarize(GraphOptions.defaults(), Map.of(), Map.of()).get(1);

        assertNull(y.getRecency());
    }

    @Test
    void authorityStatsUseNearestRank() {
        AuthorityStats stats = summarize(GraphOptions.defaults(), Map.of(), Map.of()).get(0).getAuthorityStats();

        assertEquals(1.0 / 3.0, stats.getMean(), 1e-12);
        assertEquals(0.3, stats.getP50(), 1e-12);
        assertEquals(0.5, stats.getP75(), 1e-12);
        assertEquals(0.5, stats.getMax(), 1e-12);
    }

    @Test
    void bucketsCoverEveryMember() {
        List<String> members = new ArrayList<>();
        Map<String, Double> authorities = new HashMap<>();
        for (int i = 0; i < 30; i++) {
            String path = String.format("n%02d.md", i);
            members.add(path);
            authorities.put(path, i / 30.0);
        }
        HitsScores many = HitsScores.builder().authorities(authorities).hubs(Map.of()).build();

        List<AuthorityBucket> buckets = CommunitySummarizer.authorityBuckets(members, many);

        assertEquals(6, buckets.size());
        assertEquals(30, buckets.stream().mapToInt(AuthorityBucket::count).sum());
        assertEquals("n29.md", buckets.get(0).example());
        assertTrue(buckets.get(0).high() >= buckets.get(0).low());
        assertTrue(buckets.get(0).low() > buckets.get(1).high());
    }

    @Test
    void bucketCountStaysBetweenFiveAndTen() {
        assertEquals(5, CommunitySummarizer.bucketCountFor(1));
        assertEquals(5, CommunitySummarizer.bucketCountFor(25));
        assertEquals(6, CommunitySummarizer.bucketCountFor(30));
        assertEquals(10, CommunitySummarizer.bucketCountFor(1000));
    }

    private List<CommunitySummary> summarize(GraphOptions options, Map<String, NoteEntry> entries,
                                             Map<String, Instant> times) {
        return summarizer.summarize(graph, labels, scores, entries, times, NOW, options);
    }

    private static NoteEntry entry(String path, String... tags) {
        return NoteEntry.builder().path(path).tags(List.of(tags)).build();
    }
}
