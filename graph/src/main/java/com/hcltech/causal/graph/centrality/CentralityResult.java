package com.hcltech.causal.graph.centrality;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Scores per requested measure, plus the best {@code topN} nodes of each (highest first). */
public record CentralityResult(
        Map<CentralityMeasure, Map<String, Double>> measures,
        Map<CentralityMeasure, List<NodeScore>> topNodes
) {
    public CentralityResult {
        measures = measures.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(measures));
        topNodes = topNodes.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(topNodes));
    }

    /** Scores for one measure; empty if it was not requested. */
    public Map<String, Double> scores(CentralityMeasure measure) {
        return measures.getOrDefault(measure, Map.of());
    }
}
