package com.hcltech.causal.calculus.identify;

import com.hcltech.causal.calculus.config.EngineConfig;
import com.hcltech.causal.calculus.docalculus.DoCalculus;
import com.hcltech.causal.calculus.docalculus.RuleResult;
import com.hcltech.causal.calculus.dsep.Separators;
import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.GraphIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tries the strategies in a fixed order and reports the first that works: the empty backdoor set, the bounded
 * backdoor search, the parents of the treatments, frontdoor adjustment, an instrument, and finally the do-calculus
 * rules. Frontdoor and instrument searches need a single treatment and a single outcome.
 */
public final class CausalIdentifier implements Identifier {
    private static final Logger LOG = LoggerFactory.getLogger(CausalIdentifier.class);

    static final String MISSING_VARIABLES = "Missing treatment or outcome variable";
    static final String NO_STRATEGY =
            "No valid adjustment set found, frontdoor criterion not satisfied, no instrument and no do-calculus reduction";

    private final EngineConfig config;

    public CausalIdentifier(EngineConfig config) {
        this.config = config;
    }

    public CausalIdentifier() {
        this(EngineConfig.defaults());
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public IdentifiabilityResult isIdentifiable(CausalGraph graph, Collection<String> treatments, Collection<String> outcomes) {
        if (treatments.isEmpty() || outcomes.isEmpty()) return IdentifiabilityResult.notIdentifiable(MISSING_VARIABLES);
        GraphIndex index = GraphIndex.of(graph);
        List<String> unknown = new ArrayList<>();
        for (String id : new LinkedHashSet<>(concat(treatments, outcomes))) {
            if (!index.hasNode(id)) unknown.add(id);
        }
        if (!unknown.isEmpty()) return IdentifiabilityResult.notIdentifiable("Unknown variable(s): " + String.join(", ", unknown));

        Optional<AdjustmentFormula> formula = backdoor(index, treatments, outcomes)
                .or(() -> frontdoor(index, treatments, outcomes))
                .or(() -> instrument(graph, treatments, outcomes))
                .or(() -> doCalculus(graph, treatments, outcomes));
        if (formula.isPresent()) {
            LOG.debug("Effect of {} on {} identified by {}", treatments, outcomes, formula.get().type());
            return IdentifiabilityResult.identified(formula.get());
        }
        String reason = index.bidirectedPath(treatments, outcomes)
                .map(chain -> "Treatment and outcome are confounded by a latent bidirected path "
                        + String.join(" <-> ", chain) + " that no adjustment set can block")
                .orElse(NO_STRATEGY);
        LOG.debug("Effect of {} on {} not identifiable: {}", treatments, outcomes, reason);
        return IdentifiabilityResult.notIdentifiable(reason);
    }

    private Optional<AdjustmentFormula> backdoor(GraphIndex index, Collection<String> treatments, Collection<String> outcomes) {
        Optional<List<String>> set = BackdoorAdjustment.findBackdoorAdjustmentSet(index, treatments, outcomes, config);
        if (set.isEmpty()) {
            List<String> parents = parentsOf(index, treatments, outcomes);
            if (parents.size() > config.maxAdjustmentSetSize()
                    && Separators.isValidBackdoorAdjustment(index, treatments, outcomes, parents, config.pathLimit())) {
                LOG.debug("Bounded backdoor search exhausted; parents {} of {} are a valid set", parents, treatments);
                set = Optional.of(parents);
            }
        }
        return set.map(z -> BackdoorAdjustment.generateBackdoorFormula(treatments, outcomes, z));
    }

    /** Parents of the treatments that are not treatments, outcomes or descendants of a treatment, in id order. */
    private static List<String> parentsOf(GraphIndex index, Collection<String> treatments, Collection<String> outcomes) {
        Set<String> parents = new LinkedHashSet<>();
        for (String t : treatments) parents.addAll(index.parents(t));
        parents.removeAll(treatments);
        parents.removeAll(outcomes);
        parents.removeAll(index.descendantsOf(treatments));
        return parents.stream().sorted().toList();
    }

    private Optional<AdjustmentFormula> frontdoor(GraphIndex index, Collection<String> treatments, Collection<String> outcomes) {
        if (treatments.size() != 1 || outcomes.size() != 1) return Optional.empty();
        String x = treatments.iterator().next();
        String y = outcomes.iterator().next();
        FrontdoorResult result = FrontdoorAdjustment.checkFrontdoorCriterion(index, x, y, config);
        return result.satisfied()
                ? Optional.of(FrontdoorAdjustment.generateFrontdoorFormula(x, y, result.mediators()))
                : Optional.empty();
    }

    private Optional<AdjustmentFormula> instrument(CausalGraph graph, Collection<String> treatments, Collection<String> outcomes) {
        if (treatments.size() != 1 || outcomes.size() != 1) return Optional.empty();
        String x = treatments.iterator().next();
        String y = outcomes.iterator().next();
        return InstrumentalVariables.findInstrumentalVariable(graph, x, y, config)
                .map(z -> InstrumentalVariables.generateIVFormula(x, y, z));
    }

    private Optional<AdjustmentFormula> doCalculus(CausalGraph graph, Collection<String> treatments, Collection<String> outcomes) {
        return DoCalculus.identify(graph, treatments, outcomes, config).map(rule -> formula(treatments, outcomes, rule));
    }

    private static AdjustmentFormula formula(Collection<String> treatments, Collection<String> outcomes, RuleResult rule) {
        String x = String.join(", ", treatments);
        String y = String.join(", ", outcomes);
        String xPlain = String.join(",", treatments);
        String yPlain = String.join(",", outcomes);
        return new AdjustmentFormula(IdentificationMethod.DO_CALCULUS, List.of(),
                "P(" + y + " | do(" + x + ")) = " + rule.latex(),
                "P(" + yPlain + "|do(" + xPlain + ")) = " + rule.result(),
                true);
    }

    private static List<String> concat(Collection<String> a, Collection<String> b) {
        List<String> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }
}
