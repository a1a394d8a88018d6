package com.hcltech.causal.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable causal graph: nodes plus an edge list. Algorithms never edit a graph in place;
 * surgery returns a new value.
 * <p>
 * Edges may name ids that are not among the nodes. Such edges are kept as given and ignored by traversal.
 */
public record CausalGraph(String id, List<Node> nodes, List<Edge> edges, Map<String, Object> metadata) {
    public CausalGraph {
        Objects.requireNonNull(id, "id");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public CausalGraph(String id, List<Node> nodes, List<Edge> edges) {
        this(id, nodes, edges, Map.of());
    }

    /** Node ids in declaration order. */
    public List<String> nodeIds() {
        return nodes.stream().map(Node::id).toList();
    }

    public boolean hasNode(String nodeId) {
        for (Node n : nodes) if (n.id().equals(nodeId)) return true;
        return false;
    }

    public boolean hasEdge(String from, String to, EdgeKind kind) {
        for (Edge e : edges) {
            if (e.kind() == kind && e.from().equals(from) && e.to().equals(to)) return true;
        }
        return false;
    }

    public static GraphBuilder builder(String id) {
        return new GraphBuilder(id);
    }
}
