package com.hcltech.causal.calculus.analysis;

import com.hcltech.causal.calculus.identify.AdjustmentFormula;
import com.hcltech.causal.calculus.identify.IdentificationMethod;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * @param originalDistribution       the observational distribution of the outcomes, e.g. {@code P(Y)}
 * @param interventionalDistribution the target quantity, e.g. {@code P(Y | do(X))}
 * @param estimand                   the adjustment formula in LaTeX, when identifiable
 * @param unknownVariables           requested ids the graph does not contain
 */
public record InterventionAnalysisResult(
        boolean identifiable,
        String originalDistribution,
        String interventionalDistribution,
        @Nullable IdentificationMethod method,
        @Nullable AdjustmentFormula adjustment,
        @Nullable String estimand,
        @Nullable String nonIdentifiableReason,
        List<String> unknownVariables
) {
    public InterventionAnalysisResult {
        unknownVariables = unknownVariables == null ? List.of() : List.copyOf(unknownVariables);
    }
}
