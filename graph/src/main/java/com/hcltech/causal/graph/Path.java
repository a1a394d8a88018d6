package com.hcltech.causal.graph;

import java.util.List;
import java.util.Objects;

/** A simple path. {@code nodes} has exactly one more entry than {@code edges}. */
public record Path(List<String> nodes, List<PathEdge> edges) {
    public Path {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        if (nodes.size() != edges.size() + 1)
            throw new IllegalArgumentException("Path needs one more node than edges: " + nodes + " / " + edges.size() + " edges");
    }

    /** Edge count. */
    public int length() {
        return edges.size();
    }

    public String source() {
        return nodes.get(0);
    }

    public String target() {
        return nodes.get(nodes.size() - 1);
    }

    /** Renders as e.g. {@code X <- U -> Y}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(nodes.get(0));
        for (int i = 0; i < edges.size(); i++) {
            sb.append(' ').append(edges.get(i).arrow()).append(' ').append(nodes.get(i + 1));
        }
        return sb.toString();
    }
}
