package com.hcltech.causal.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PathFinderTest {

    private static List<String> rendered(List<Path> paths) {
        return paths.stream().map(Path::toString).sorted().toList();
    }

    @Test
    void findsPathsInBothDirections() {
        List<Path> paths = PathFinder.findAllPaths(GraphFixture.confounded(), List.of("X"), List.of("Y"));
        assertEquals(List.of("X -> Y", "X <- U -> Y"), rendered(paths));
    }

    @Test
    void pathStopsAtFirstTarget() {
        List<Path> paths = PathFinder.findAllPaths(GraphFixture.chain(), List.of("A"), List.of("B", "D"));
        assertEquals(List.of("A -> B"), rendered(paths));
    }

    @Test
    void maxLength_limitsEdgeCount() {
        assertEquals(List.of(), PathFinder.findAllPaths(GraphFixture.chain(), List.of("A"), List.of("D"), 2));
        assertEquals(1, PathFinder.findAllPaths(GraphFixture.chain(), List.of("A"), List.of("D"), 3).size());
        assertThrows(IllegalArgumentException.class,
                () -> PathFinder.findAllPaths(GraphFixture.chain(), List.of("A"), List.of("D"), -1));
    }

    @Test
    void disconnected_isEmpty() {
        CausalGraph g = CausalGraph.builder("g").nodes("A", "B").build();
        assertEquals(List.of(), PathFinder.findAllPaths(g, List.of("A"), List.of("B")));
    }

    @Test
    void bidirectedAndUndirectedEdges_areWalked() {
        CausalGraph g = CausalGraph.builder("g").nodes("A", "B", "C")
                .bidirected("A", "B").undirected("B", "C").build();
        assertEquals(List.of("A <-> B -- C"), rendered(PathFinder.findAllPaths(g, List.of("A"), List.of("C"))));
    }

    @Test
    void path_recordsLengthAndEnds() {
        Path p = PathFinder.findAllPaths(GraphFixture.chain(), List.of("A"), List.of("D")).get(0);
        assertEquals(3, p.length());
        assertEquals("A", p.source());
        assertEquals("D", p.target());
        assertEquals(Direction.FORWARD, p.edges().get(0).direction());
    }

    @Test
    void backdoorPaths_startIntoTreatment() {
        GraphIndex index = GraphIndex.of(GraphFixture.confounded());
        List<Path> paths = PathFinder.findBackdoorPaths(index, List.of("X"), List.of("Y"), PathFinder.UNBOUNDED);
        assertEquals(List.of("X <- U -> Y"), rendered(paths));
    }

    @Test
    void backdoorPaths_includeBidirectedStart() {
        GraphIndex index = GraphIndex.of(GraphFixture.latentConfounded());
        assertEquals(List.of("X <-> Y"),
                rendered(PathFinder.findBackdoorPaths(index, List.of("X"), List.of("Y"), PathFinder.UNBOUNDED)));
    }

    @Test
    void hasDirectedPath_respectsAvoidedNodes() {
        GraphIndex index = GraphIndex.of(GraphFixture.chain());
        assertTrue(PathFinder.hasDirectedPath(index, "A", "D", Set.of()));
        assertFalse(PathFinder.hasDirectedPath(index, "A", "D", Set.of("C")));
        assertFalse(PathFinder.hasDirectedPath(index, "D", "A", Set.of()));
    }
}
