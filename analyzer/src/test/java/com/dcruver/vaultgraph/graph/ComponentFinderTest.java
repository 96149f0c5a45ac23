package com.dcruver.vaultgraph.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ComponentFinderTest {

    private ComponentFinder finder;

    @BeforeEach
    void setUp() {
        finder = new ComponentFinder();
    }

    @Test
    void weakComponentsIgnoreDirection() {
        LinkGraph graph = LinkGraph.of(Map.of(
            "a.md", List.of("b.md"),
            "c.md", List.of("b.md"),
            "d.md", List.of("e.md"),
            "b.md", List.of(),
            "e.md", List.of(),
            "f.md", List.of()));

        List<List<String>> weak = finder.weakComponents(graph);

        assertEquals(List.of(
            List.of("a.md", "b.md", "c.md"),
            List.of("d.md", "e.md"),
            List.of("f.md")), weak);
    }

    @Test
    void strongComponentsFollowCycles() {
        LinkGraph graph = LinkGraph.of(Map.of(
            "a.md", List.of("b.md"),
            "b.md", List.of("c.md"),
            "c.md", List.of("a.md", "d.md"),
            "d.md", List.of("e.md"),
            "e.md", List.of("d.md"),
            "f.md", List.of("a.md")));

        List<List<String>> strong = finder.strongComponents(graph);

        assertEquals(List.of(
            List.of("a.md", "b.md", "c.md"),
            List.of("d.md", "e.md"),
            List.of("f.md")), strong);
    }

    @Test
    void largeComponentsComeFirstThenByFirstPath() {
        LinkGraph graph = LinkGraph.of(Map.of(
            "z1.md", List.of("z2.md"),
            "z2.md", List.of(),
            "a1.md", List.of("a2.md"),
            "a2.md", List.of(),
            "m1.md", List.of("m2.md", "m3.md"),
            "m2.md", List.of(),
            "m3.md", List.of()));

        List<List<String>> weak = finder.weakComponents(graph);
        Map<String, String> ids = ComponentFinder.assignIds(weak, "comp");

        assertEquals("comp0", ids.get("m2.md"));
        assertEquals("comp1", ids.get("a1.md"));
        assertEquals("comp2", ids.get("z2.md"));
    }

    @Test
    void deepChainDoesNotOverflow() {
        Map<String, List<String>> chain = new HashMap<>();
        int length = 20_000;
        for (int i = 0; i < length; i++) {
            String next = String.format("n%05d.md", i + 1);
            chain.put(String.format("n%05d.md", i), i + 1 < length ? List.of(next) : List.of());
        }
        // close the loop so the whole chain is one strong component
        chain.put(String.format("n%05d.md", length - 1), List.of("n00000.md"));

        List<List<String>> strong = finder.strongComponents(LinkGraph.of(chain));

        assertEquals(1, strong.size());
        assertEquals(length, strong.get(0).size());
    }

    @Test
    void everyNodeInExactlyOneComponent() {
        LinkGraph graph = LinkGraph.of(Map.of(
            "a.md", List.of("b.md"),
            "b.md", List.of("a.md"),
            "c.md", List.of("a.md"),
            "d.md", List.of()));

        List<String> strongMembers = new ArrayList<>();
        finder.strongComponents(graph).forEach(strongMembers::addAll);
        List<String> weakMembers = new ArrayList<>();
        finder.weakComponents(graph).forEach(weakMembers::addAll);

        assertEquals(4, strongMembers.size());
        assertEquals(4, weakMembers.size());
        assertTrue(strongMembers.containsAll(graph.nodes()));
        assertTrue(weakMembers.containsAll(graph.nodes()));
    }
}
