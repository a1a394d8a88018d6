package com.hcltech.causal.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Exhaustive simple-path search. Edges are walked in either direction, as d-separation requires.
 * The search is exponential in the worst case; causal graphs written by people are small enough for that.
 */
public final class PathFinder {
    /** Length limit meaning "no limit". */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private PathFinder() {
    }

    public static List<Path> findAllPaths(CausalGraph graph, Collection<String> sources, Collection<String> targets) {
        return findAllPaths(GraphIndex.of(graph), sources, targets, UNBOUNDED);
    }

    public static List<Path> findAllPaths(CausalGraph graph, Collection<String> sources, Collection<String> targets, int maxLength) {
        return findAllPaths(GraphIndex.of(graph), sources, targets, maxLength);
    }

    /**
     * Every simple path from a source to a target with at most {@code maxLength} edges.
     * A path stops at the first target it reaches.
     */
    public static List<Path> findAllPaths(GraphIndex index, Collection<String> sources, Collection<String> targets, int maxLength) {
        return search(index, sources, Set.copyOf(targets), maxLength, (source, first) -> true);
    }

    /** Paths whose first edge has an arrowhead at the treatment it leaves. */
    public static List<Path> findBackdoorPaths(GraphIndex index, Collection<String> treatments, Collection<String> outcomes, int maxLength) {
        return search(index, treatments, Set.copyOf(outcomes), maxLength, (source, first) -> first.pointsInto(source));
    }

    /** Whether a directed path leads from {@code from} to {@code to} without entering any node in {@code avoiding}. */
    public static boolean hasDirectedPath(GraphIndex index, String from, String to, Set<String> avoiding) {
        Set<String> seen = new HashSet<>();
        List<String> stack = new ArrayList<>(List.of(from));
        seen.add(from);
        while (!stack.isEmpty()) {
            String current = stack.remove(stack.size() - 1);
            for (String child : index.children(current)) {
                if (child.equals(to)) return true;
                if (avoiding.contains(child) || !seen.add(child)) continue;
                stack.add(child);
            }
        }
        return false;
    }

    private static List<Path> search(GraphIndex index, Collection<String> sources, Set<String> targets, int maxLength,
                                     BiPredicate<String, PathEdge> firstStep) {
        if (maxLength < 0) throw new IllegalArgumentException("maxLength must be >= 0 but was " + maxLength);
        List<Path> found = new ArrayList<>();
        for (String source : new LinkedHashSet<>(sources)) {
            if (!index.hasNode(source)) continue;
            List<String> nodes = new ArrayList<>(List.of(source));
            Set<String> visited = new HashSet<>(nodes);
            dfs(index, source, source, targets, maxLength, firstStep, nodes, new ArrayList<>(), visited, found);
        }
        return found;
    }

    private static void dfs(GraphIndex index, String source, String current, Set<String> targets, int maxLength,
                            BiPredicate<String, PathEdge> firstStep,
                            List<String> nodes, List<PathEdge> edges, Set<String> visited, List<Path> found) {
        if (edges.size() > 0 && targets.contains(current)) {
            found.add(new Path(nodes, edges));
            return;
        }
        if (edges.size() >= maxLength) return;
        for (GraphIndex.Incidence next : index.incidences(current)) {
            if (visited.contains(next.neighbour())) continue;
            if (edges.isEmpty() && !firstStep.test(source, next.step())) continue;
            visited.add(next.neighbour());
            nodes.add(next.neighbour());
            edges.add(next.step());
            dfs(index, source, next.neighbour(), targets, maxLength, firstStep, nodes, edges, visited, found);
            edges.remove(edges.size() - 1);
            nodes.remove(nodes.size() - 1);
            visited.remove(next.neighbour());
        }
    }
}
