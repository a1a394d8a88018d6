package com.hcltech.causal.graph;

/** Whether a path walks an edge from its {@code from} end ({@link #FORWARD}) or from its {@code to} end. */
public enum Direction {
    FORWARD,
    BACKWARD
}
