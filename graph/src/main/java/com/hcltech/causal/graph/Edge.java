package com.hcltech.causal.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/** An edge between two node ids. For a bidirected or undirected edge the from/to order carries no meaning. */
public record Edge(String from, String to, EdgeKind kind) {
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (kind == null) kind = EdgeKind.DIRECTED;
    }

    public static Edge directed(String from, String to) {
        return new Edge(from, to, EdgeKind.DIRECTED);
    }

    public static Edge bidirected(String a, String b) {
        return new Edge(a, b, EdgeKind.BIDIRECTED);
    }

    public static Edge undirected(String a, String b) {
        return new Edge(a, b, EdgeKind.UNDIRECTED);
    }

    @JsonIgnore
    public boolean isDirected() {
        return kind == EdgeKind.DIRECTED;
    }

    @JsonIgnore
    public boolean isSelfLoop() {
        return from.equals(to);
    }

    public boolean touches(String nodeId) {
        return from.equals(nodeId) || to.equals(nodeId);
    }

    /** True if this edge has an arrowhead at {@code nodeId}. */
    public boolean pointsInto(String nodeId) {
        return switch (kind) {
            case DIRECTED -> to.equals(nodeId);
            case BIDIRECTED -> touches(nodeId);
            case UNDIRECTED -> false;
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case DIRECTED -> from + " -> " + to;
            case BIDIRECTED -> from + " <-> " + to;
            case UNDIRECTED -> from + " -- " + to;
        };
    }
}
