package com.hcltech.causal.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adjacency index over a {@link CausalGraph}, built once per call.
 * <p>
 * Edges naming an unknown node id are left out, so unknown ids behave as nodes with no incident edges.
 * Self-loops are indexed as incidences but never make a node its own parent, child, ancestor or descendant.
 */
public final class GraphIndex {
    private static final Logger LOG = LoggerFactory.getLogger(GraphIndex.class);

    /** An edge seen from one of its endpoints. */
    public record Incidence(String neighbour, PathEdge step) {}

    private final CausalGraph graph;
    private final Set<String> nodeIds;
    private final Map<String, Set<String>> parents = new LinkedHashMap<>();
    private final Map<String, Set<String>> children = new LinkedHashMap<>();
    private final Map<String, Set<String>> bidirected = new LinkedHashMap<>();
    private final Map<String, List<Incidence>> incidences = new LinkedHashMap<>();

    private GraphIndex(CausalGraph graph) {
        this.graph = graph;
        this.nodeIds = Collections.unmodifiableSet(new LinkedHashSet<>(graph.nodeIds()));
        for (String id : nodeIds) {
            parents.put(id, new LinkedHashSet<>());
            children.put(id, new LinkedHashSet<>());
            bidirected.put(id, new LinkedHashSet<>());
            incidences.put(id, new ArrayList<>());
        }
        for (Edge e : graph.edges()) {
            if (!nodeIds.contains(e.from()) || !nodeIds.contains(e.to())) {
                LOG.debug("Graph {}: ignoring edge {} because it names an unknown node", graph.id(), e);
                continue;
            }
            incidences.get(e.from()).add(new Incidence(e.to(), new PathEdge(e, Direction.FORWARD)));
            incidences.get(e.to()).add(new Incidence(e.from(), new PathEdge(e, Direction.BACKWARD)));
            if (e.isSelfLoop()) continue;
            switch (e.kind()) {
                case DIRECTED -> {
                    children.get(e.from()).add(e.to());
                    parents.get(e.to()).add(e.from());
                }
                case BIDIRECTED -> {
                    bidirected.get(e.from()).add(e.to());
                    bidirected.get(e.to()).add(e.from());
                }
                case UNDIRECTED -> { }
            }
        }
    }

    public static GraphIndex of(CausalGraph graph) {
        return new GraphIndex(graph);
    }

    public CausalGraph graph() {
        return graph;
    }

    public Set<String> nodeIds() {
        return nodeIds;
    }

    public boolean hasNode(String id) {
        return nodeIds.contains(id);
    }

    public Set<String> parents(String id) {
        return Collections.unmodifiableSet(parents.getOrDefault(id, Set.of()));
    }

    public Set<String> children(String id) {
        return Collections.unmodifiableSet(children.getOrDefault(id, Set.of()));
    }

    public List<Incidence> incidences(String id) {
        return Collections.unmodifiableList(incidences.getOrDefault(id, List.of()));
    }

    /** True if any edge of any kind joins a and b. */
    public boolean adjacent(String a, String b) {
        for (Incidence i : incidences.getOrDefault(a, List.of())) {
            if (i.neighbour().equals(b)) return true;
        }
        return false;
    }

    public Set<String> ancestors(String id) {
        return closure(List.of(id), parents, Set.of(id));
    }

    public Set<String> descendants(String id) {
        return closure(List.of(id), children, Set.of(id));
    }

    /** Union of the ancestors of each member. A member is included only if it is an ancestor of another. */
    public Set<String> ancestorsOf(Collection<String> ids) {
        Set<String> result = new LinkedHashSet<>();
        for (String id : ids) result.addAll(ancestors(id));
        return Collections.unmodifiableSet(result);
    }

    public Set<String> descendantsOf(Collection<String> ids) {
        Set<String> result = new LinkedHashSet<>();
        for (String id : ids) result.addAll(descendants(id));
        return Collections.unmodifiableSet(result);
    }

    /**
     * Shortest chain of bidirected edges from any of {@code from} to any of {@code to}, as node ids.
     * Such a chain is latent confounding that no observed conditioning set can block.
     */
    public Optional<List<String>> bidirectedPath(Collection<String> from, Collection<String> to) {
        Map<String, String> cameFrom = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String f : from) {
            if (hasNode(f) && !cameFrom.containsKey(f)) {
                cameFrom.put(f, null);
                queue.add(f);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (to.contains(current) && cameFrom.get(current) != null) return Optional.of(unwind(cameFrom, current));
            for (String next : bidirected.getOrDefault(current, Set.of())) {
                if (!cameFrom.containsKey(next)) {
                    cameFrom.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> unwind(Map<String, String> cameFrom, String end) {
        List<String> chain = new ArrayList<>();
        for (String at = end; at != null; at = cameFrom.get(at)) chain.add(0, at);
        return chain;
    }

    private static Set<String> closure(Collection<String> start, Map<String, Set<String>> step, Set<String> exclude) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(start);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            for (String next : step.getOrDefault(current, Set.of())) {
                if (seen.add(next)) stack.push(next);
            }
        }
        seen.removeAll(exclude);
        return Collections.unmodifiableSet(seen);
    }
}
