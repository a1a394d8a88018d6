package com.hcltech.causal.graph.centrality;

public enum CentralityMeasure {
    DEGREE,
    IN_DEGREE,
    OUT_DEGREE,
    BETWEENNESS,
    CLOSENESS,
    PAGERANK,
    EIGENVECTOR,
    KATZ
}
