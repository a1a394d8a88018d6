package com.hcltech.causal.graph.centrality;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for {@link Centrality#computeAll}. Iterative measures stop after {@code maxIterations} or once no score
 * moves by more than {@code tolerance}.
 */
public record CentralityConfig(
        Set<CentralityMeasure> measures,
        double dampingFactor,
        int maxIterations,
        double tolerance,
        boolean normalize,
        int topN
) {
    public CentralityConfig {
        Objects.requireNonNull(measures, "measures");
        measures = measures.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(measures));
        if (dampingFactor <= 0 || dampingFactor >= 1)
            throw new IllegalArgumentException("dampingFactor must be in (0,1) but was " + dampingFactor);
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1 but was " + maxIterations);
        if (tolerance <= 0) throw new IllegalArgumentException("tolerance must be > 0 but was " + tolerance);
        if (topN < 0) throw new IllegalArgumentException("topN must be >= 0 but was " + topN);
    }

    /** Everything except Katz, which has to be asked for. */
    public static CentralityConfig defaults() {
        return new CentralityConfig(
                EnumSet.complementOf(EnumSet.of(CentralityMeasure.KATZ)), 0.85, 100, 1e-6, true, 5);
    }

    public CentralityConfig withMeasures(Set<CentralityMeasure> measures) {
        return new CentralityConfig(measures, dampingFactor, maxIterations, tolerance, normalize, topN);
    }
}
