package com.hcltech.causal.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Fluent construction of a {@link CausalGraph}; edge helpers do not add missing nodes. */
public final class GraphBuilder {
    private final String id;
    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    GraphBuilder(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public GraphBuilder nodes(String... ids) {
        for (String n : ids) nodes.add(Node.of(n));
        return this;
    }

    public GraphBuilder node(Node node) {
        nodes.add(node);
        return this;
    }

    public GraphBuilder directed(String from, String to) {
        edges.add(Edge.directed(from, to));
        return this;
    }

    public GraphBuilder bidirected(String a, String b) {
        edges.add(Edge.bidirected(a, b));
        return this;
    }

    public GraphBuilder undirected(String a, String b) {
        edges.add(Edge.undirected(a, b));
        return this;
    }

    public GraphBuilder edge(Edge edge) {
        edges.add(edge);
        return this;
    }

    public GraphBuilder metadata(String key, Object value) {
        metadata.put(key, value);
        return this;
    }

    public CausalGraph build() {
        return new CausalGraph(id, nodes, edges, metadata);
    }
}
