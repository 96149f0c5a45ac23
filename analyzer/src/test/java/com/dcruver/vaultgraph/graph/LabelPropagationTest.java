package com.dcruver.vaultgraph.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LabelPropagationTest {

    private LabelPropagation propagation;

    @BeforeEach
    void setUp() {
        propagation = new LabelPropagation();
    }

    @Test
    void separatesTwoTriangles() {
        LinkGraph graph = LinkGraph.of(Map.of(
            "a1.md", List.of("a2.md", "a3.md"),
            "a2.md", List.of("a3.md"),
            "a3.md", List.of("a1.md"),
            "b1.md", List.of("b2.md", "b3.md"),
            "b2.md", List.of("b3.md"),
            "b3.md", List.of("b1.md")));

        Map<String, String> labels = propagation.detect(graph, 20);

        assertEquals(labels.get("a1.md"), labels.get("a2.md"));
        assertEquals(labels.get("a1.md"), labels.get("a3.md"));
        assertEquals(labels.get("b1.md"), labels.get("b3.md"));
        assertNotEquals(labels.get("a1.md"), labels.get("b1.md"));
    }

    @Test
    void isolatedNotesKeepTheirOwnLabel() {
        LinkGraph graph = LinkGraph.of(Map.of("a.md", List.of(), "b.md", List.of()));

        Map<String, String> labels = propagation.detect(graph, 20);

        assertEquals("a.md", labels.get("a.md"));
        assertEquals("b.md", labels.get("b.md"));
    }

    @Test
    void tiesGoToTheLowestLabel() {
        // hub sees a.md and z.md once each
        LinkGraph graph = LinkGraph.of(Map.of(
            "hub.md", List.of("a.md", "z.md"),
            "a.md", List.of(),
            "z.md", List.of()));

        Map<String, String> labels = propagation.detect(graph, 1);

        // a.md adopts hub.md first, then hub.md sees {hub.md, z.md} and keeps hub.md
        assertEquals("hub.md", labels.get("a.md"));
        assertEquals("hub.md", labels.get("hub.md"));
        assertEquals("hub.md", labels.get("z.md"));
    }

    @Test
    void labelsEveryNode() {
        LinkGraph graph = LinkGraph.of(Map.of(
            "a.md", List.of("b.md"),
            "b.md", List.of(),
            "c.md", List.of()));

        assertEquals(graph.nodes(), List.copyOf(propagation.detect(graph, 20).keySet()));
    }
}
