package com.hcltech.causal.calculus.identify;

import com.hcltech.causal.calculus.config.EngineConfig;
import com.hcltech.causal.calculus.dsep.Separators;
import com.hcltech.causal.common.Combinations;
import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.GraphIndex;
import com.hcltech.causal.graph.PathFinder;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Frontdoor adjustment through a mediator set M. M qualifies when
 * <ol>
 *     <li>every directed path from X to Y enters M,</li>
 *     <li>no path entering X reaches M unblocked, and</li>
 *     <li>every path entering M that reaches Y is blocked by conditioning on X.</li>
 * </ol>
 * Mediators are drawn from the nodes that descend from X and are ancestors of Y.
 */
public final class FrontdoorAdjustment {

    private FrontdoorAdjustment() {
    }

    public static FrontdoorResult checkFrontdoorCriterion(CausalGraph graph, String treatment, String outcome) {
        return checkFrontdoorCriterion(GraphIndex.of(graph), treatment, outcome, EngineConfig.defaults());
    }

    public static FrontdoorResult checkFrontdoorCriterion(GraphIndex index, String treatment, String outcome, EngineConfig config) {
        if (!index.hasNode(treatment) || !index.hasNode(outcome)) return FrontdoorResult.NOT_SATISFIED;
        Set<String> onward = index.descendants(treatment);
        Set<String> upstream = index.ancestors(outcome);
        List<String> candidates = onward.stream()
                .filter(upstream::contains)
                .filter(id -> !id.equals(treatment) && !id.equals(outcome))
                .sorted()
                .toList();
        Optional<List<String>> mediators = Combinations.firstMatching(candidates, 1, config.maxAdjustmentSetSize(),
                m -> qualifies(index, treatment, outcome, m, config.pathLimit()));
        return mediators.map(m -> new FrontdoorResult(true, m)).orElse(FrontdoorResult.NOT_SATISFIED);
    }

    private static boolean qualifies(GraphIndex index, String treatment, String outcome, List<String> mediators, int maxLength) {
        if (PathFinder.hasDirectedPath(index, treatment, outcome, Set.copyOf(mediators))) return false;
        if (!Separators.backdoorPathsBlocked(index, List.of(treatment), mediators, Set.of(), maxLength)) return false;
        return Separators.backdoorPathsBlocked(index, mediators, List.of(outcome), Set.of(treatment), maxLength);
    }

    /** {@code P(Y | do(X)) = Σ_M P(M | X) Σ_X' P(Y | M, X') P(X')}. */
    public static AdjustmentFormula generateFrontdoorFormula(String treatment, String outcome, List<String> mediators) {
        String m = String.join(", ", mediators);
        String mPlain = String.join(",", mediators);
        String x = treatment;
        String y = outcome;
        return new AdjustmentFormula(IdentificationMethod.FRONTDOOR, mediators,
                "P(" + y + " | do(" + x + ")) = \\sum_{" + m + "} P(" + m + " | " + x + ") \\sum_{" + x + "'} P(" + y + " | " + m + ", " + x + "') P(" + x + "')",
                "P(" + y + "|do(" + x + ")) = Σ_{" + mPlain + "} P(" + mPlain + "|" + x + ") Σ_{" + x + "'} P(" + y + "|" + mPlain + "," + x + "') P(" + x + "')",
                true);
    }
}
