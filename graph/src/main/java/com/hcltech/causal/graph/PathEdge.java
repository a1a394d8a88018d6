package com.hcltech.causal.graph;

import java.util.Objects;

/** One step of a path: the underlying edge and the direction it was walked in. */
public record PathEdge(Edge edge, Direction direction) {
    public PathEdge {
        Objects.requireNonNull(edge, "edge");
        Objects.requireNonNull(direction, "direction");
    }

    /** Node the step leaves. */
    public String from() {
        return direction == Direction.FORWARD ? edge.from() : edge.to();
    }

    /** Node the step arrives at. */
    public String to() {
        return direction == Direction.FORWARD ? edge.to() : edge.from();
    }

    public boolean pointsInto(String nodeId) {
        return edge.pointsInto(nodeId);
    }

    /** Arrow as it reads in walking order, e.g. {@code <-} for a directed edge walked backwards. */
    String arrow() {
        return switch (edge.kind()) {
            case DIRECTED -> direction == Direction.FORWARD ? "->" : "<-";
            case BIDIRECTED -> "<->";
            case UNDIRECTED -> "--";
        };
    }
}
