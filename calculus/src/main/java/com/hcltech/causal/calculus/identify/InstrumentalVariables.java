package com.hcltech.causal.calculus.identify;

import com.hcltech.causal.calculus.config.EngineConfig;
import com.hcltech.causal.calculus.dsep.DSeparation;
import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.GraphIndex;
import com.hcltech.causal.graph.GraphSurgery;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Instrument search. Z is an instrument for X on Y when it is an ancestor of X, not a descendant of X, and is
 * d-separated from Y once the edges leaving X are removed, so that it reaches Y only through X.
 */
public final class InstrumentalVariables {

    private InstrumentalVariables() {
    }

    public static Optional<String> findInstrumentalVariable(CausalGraph graph, String treatment, String outcome) {
        return findInstrumentalVariable(graph, treatment, outcome, EngineConfig.defaults());
    }

    /** The first qualifying instrument in id order. */
    public static Optional<String> findInstrumentalVariable(CausalGraph graph, String treatment, String outcome, EngineConfig config) {
        GraphIndex index = GraphIndex.of(graph);
        if (!index.hasNode(treatment) || !index.hasNode(outcome)) return Optional.empty();
        Set<String> downstream = index.descendants(treatment);
        GraphIndex exclusion = GraphIndex.of(GraphSurgery.removeOutgoingEdges(graph, List.of(treatment)));
        return index.ancestors(treatment).stream()
                .filter(z -> !z.equals(outcome) && !downstream.contains(z))
                .sorted()
                .filter(z -> DSeparation.isSeparated(exclusion, List.of(z), List.of(outcome), Set.of(), config.pathLimit()))
                .findFirst();
    }

    /** Wald estimand {@code β = Cov(Z, Y) / Cov(Z, X)}. */
    public static AdjustmentFormula generateIVFormula(String treatment, String outcome, String instrument) {
        return new AdjustmentFormula(IdentificationMethod.INSTRUMENTAL, List.of(instrument),
                "\\beta_{" + treatment + " \\to " + outcome + "} = \\frac{Cov(" + instrument + ", " + outcome + ")}{Cov(" + instrument + ", " + treatment + ")}",
                "β_{" + treatment + "→" + outcome + "} = Cov(" + instrument + "," + outcome + ") / Cov(" + instrument + "," + treatment + ")",
                true);
    }
}
