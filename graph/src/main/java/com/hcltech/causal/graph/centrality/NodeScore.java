package com.hcltech.causal.graph.centrality;

public record NodeScore(String nodeId, double score) {}
