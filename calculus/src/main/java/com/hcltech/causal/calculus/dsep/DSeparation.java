package com.hcltech.causal.calculus.dsep;

import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.GraphIndex;
import com.hcltech.causal.graph.Path;
import com.hcltech.causal.graph.PathEdge;
import com.hcltech.causal.graph.PathFinder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * D-separation by path enumeration.
 * <p>
 * A node is a collider on a path when both of its path edges have an arrowhead at it. A path is blocked when some
 * interior node is a conditioned non-collider, or a collider that is not conditioned and has no conditioned
 * descendant. The two endpoints are never tested.
 */
public final class DSeparation {

    private DSeparation() {
    }

    /** Whether the interior node at {@code position} is a collider on {@code path}. */
    public static boolean isCollider(Path path, int position) {
        if (position <= 0 || position >= path.length())
            throw new IllegalArgumentException("Position " + position + " is not interior to a path of length " + path.length());
        String node = path.nodes().get(position);
        PathEdge in = path.edges().get(position - 1);
        PathEdge out = path.edges().get(position);
        return in.pointsInto(node) && out.pointsInto(node);
    }

    public static BlockingResult isPathBlocked(CausalGraph graph, Path path, Set<String> conditioningSet) {
        return isPathBlocked(GraphIndex.of(graph), path, conditioningSet);
    }

    public static BlockingResult isPathBlocked(GraphIndex index, Path path, Set<String> conditioningSet) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(conditioningSet, "conditioningSet");
        for (int i = 1; i < path.length(); i++) {
            String node = path.nodes().get(i);
            if (isCollider(path, i)) {
                if (!conditioningSet.contains(node) && !containsAny(conditioningSet, index.descendants(node)))
                    return BlockingResult.colliderNotConditioned(node);
            } else if (conditioningSet.contains(node)) {
                return BlockingResult.nonColliderConditioned(node);
            }
        }
        return BlockingResult.OPEN;
    }

    public static DSeparationResult checkDSeparation(CausalGraph graph, DSeparationQuery query) {
        return checkDSeparation(graph, query, DSeparationOptions.defaults());
    }

    public static DSeparationResult checkDSeparation(CausalGraph graph, DSeparationQuery query, DSeparationOptions options) {
        return checkDSeparation(GraphIndex.of(graph), query, options);
    }

    public static DSeparationResult checkDSeparation(GraphIndex index, DSeparationQuery query, DSeparationOptions options) {
        int limit = options.maxPathLength() == 0 ? PathFinder.UNBOUNDED : options.maxPathLength();
        List<Path> paths = PathFinder.findAllPaths(index, query.x(), query.y(), limit);
        List<PathStatus> blocking = new ArrayList<>();
        List<PathStatus> open = new ArrayList<>();
        for (Path p : paths) {
            PathStatus status = PathStatus.of(p, isPathBlocked(index, p, query.z()));
            (status.blocked() ? blocking : open).add(status);
        }
        boolean separated = open.isEmpty();
        String explanation = explain(query, paths.size(), open.size());
        if (!options.includePathDetails()) {
            blocking = List.of();
            open = List.of();
        }
        return new DSeparationResult(separated, query.z(), blocking, open, explanation);
    }

    /** Verdict only; stops at the first open path. */
    public static boolean isSeparated(GraphIndex index, Collection<String> x, Collection<String> y, Set<String> z, int maxLength) {
        for (Path p : PathFinder.findAllPaths(index, x, y, maxLength)) {
            if (!isPathBlocked(index, p, z).blocked()) return false;
        }
        return true;
    }

    /** Every unshielded collider with directed parents, ordered by collider in node order then by parent id. */
    public static List<VStructure> findVStructures(CausalGraph graph) {
        GraphIndex index = GraphIndex.of(graph);
        List<VStructure> result = new ArrayList<>();
        for (String c : index.nodeIds()) {
            List<String> parents = index.parents(c).stream().sorted().toList();
            for (int i = 0; i < parents.size(); i++) {
                for (int j = i + 1; j < parents.size(); j++) {
                    if (!index.adjacent(parents.get(i), parents.get(j)))
                        result.add(new VStructure(parents.get(i), c, parents.get(j)));
                }
            }
        }
        return result;
    }

    private static String explain(DSeparationQuery query, int total, int open) {
        if (total == 0) return "No paths exist between " + braces(query.x()) + " and " + braces(query.y());
        if (open == 0) return "All " + total + " path(s) are blocked by conditioning on " + braces(query.z());
        return open + " of " + total + " path(s) remain open after conditioning on " + braces(query.z());
    }

    static String braces(Collection<String> ids) {
        return "{" + String.join(", ", ids) + "}";
    }

    private static boolean containsAny(Set<String> set, Collection<String> candidates) {
        for (String c : candidates) if (set.contains(c)) return true;
        return false;
    }
}
