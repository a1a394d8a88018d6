package com.hcltech.causal.calculus.identify;

import com.hcltech.causal.calculus.config.EngineConfig;
import com.hcltech.causal.calculus.dsep.Separators;
import com.hcltech.causal.common.Combinations;
import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.GraphIndex;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Backdoor adjustment: condition on a set that blocks every path entering a treatment and contains no descendant of one.
 * Candidate sets come from the nodes that are neither treatments, outcomes nor descendants of a treatment, smallest
 * first, then in id order.
 */
public final class BackdoorAdjustment {

    private BackdoorAdjustment() {
    }

    public static List<List<String>> findAllBackdoorSets(CausalGraph graph, Collection<String> treatments, Collection<String> outcomes) {
        return findAllBackdoorSets(graph, treatments, outcomes, EngineConfig.defaults());
    }

    /** Every valid set with at most {@link EngineConfig#maxAdjustmentSetSize()} members. */
    public static List<List<String>> findAllBackdoorSets(CausalGraph graph, Collection<String> treatments,
                                                         Collection<String> outcomes, EngineConfig config) {
        GraphIndex index = GraphIndex.of(graph);
        return Combinations.upToSize(candidates(index, treatments, outcomes), config.maxAdjustmentSetSize()).stream()
                .filter(z -> Separators.isValidBackdoorAdjustment(index, treatments, outcomes, z, config.pathLimit()))
                .toList();
    }

    /** The first valid set in candidate order, so the empty set when it works. */
    public static Optional<List<String>> findBackdoorAdjustmentSet(GraphIndex index, Collection<String> treatments,
                                                                   Collection<String> outcomes, EngineConfig config) {
        return Combinations.firstMatching(candidates(index, treatments, outcomes), 0, config.maxAdjustmentSetSize(),
                z -> Separators.isValidBackdoorAdjustment(index, treatments, outcomes, z, config.pathLimit()));
    }

    /** {@code P(Y | do(X)) = Σ_Z P(Y | X, Z) P(Z)}, or just {@code P(Y | X)} for an empty set. */
    public static AdjustmentFormula generateBackdoorFormula(Collection<String> treatments, Collection<String> outcomes,
                                                            Collection<String> adjustmentSet) {
        String x = String.join(", ", treatments);
        String y = String.join(", ", outcomes);
        String xPlain = String.join(",", treatments);
        String yPlain = String.join(",", outcomes);
        if (adjustmentSet.isEmpty()) {
            return new AdjustmentFormula(IdentificationMethod.BACKDOOR, List.of(),
                    "P(" + y + " | do(" + x + ")) = P(" + y + " | " + x + ")",
                    "P(" + yPlain + "|do(" + xPlain + ")) = P(" + yPlain + "|" + xPlain + ")",
                    true);
        }
        String z = String.join(", ", adjustmentSet);
        String zPlain = String.join(",", adjustmentSet);
        return new AdjustmentFormula(IdentificationMethod.BACKDOOR, List.copyOf(adjustmentSet),
                "P(" + y + " | do(" + x + ")) = \\sum_{" + z + "} P(" + y + " | " + x + ", " + z + ") P(" + z + ")",
                "P(" + yPlain + "|do(" + xPlain + ")) = Σ_{" + zPlain + "} P(" + yPlain + "|" + xPlain + "," + zPlain + ") P(" + zPlain + ")",
                true);
    }

    static List<String> candidates(GraphIndex index, Collection<String> treatments, Collection<String> outcomes) {
        Set<String> excluded = new LinkedHashSet<>(treatments);
        excluded.addAll(outcomes);
        excluded.addAll(index.descendantsOf(treatments));
        return index.nodeIds().stream().filter(id -> !excluded.contains(id)).sorted().toList();
    }
}
