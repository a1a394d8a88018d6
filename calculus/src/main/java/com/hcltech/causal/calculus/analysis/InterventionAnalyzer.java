package com.hcltech.causal.calculus.analysis;

import com.hcltech.causal.calculus.Notation;
import com.hcltech.causal.calculus.config.EngineConfig;
import com.hcltech.causal.calculus.identify.CausalIdentifier;
import com.hcltech.causal.calculus.identify.IdentifiabilityResult;
import com.hcltech.causal.calculus.identify.Identifier;
import com.hcltech.causal.graph.CausalGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Entry point for "what happens to Y if we set X?": validates the request and hands it to an {@link Identifier}. */
public class InterventionAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(InterventionAnalyzer.class);

    static final String MISSING_VARIABLES = "Missing treatment or outcome variable";

    private final Identifier identifier;

    public InterventionAnalyzer(Identifier identifier) {
        this.identifier = identifier;
    }

    public static InterventionAnalyzer withConfig(EngineConfig config) {
        return new InterventionAnalyzer(new CausalIdentifier(config));
    }

    public static InterventionAnalyzer defaults() {
        return withConfig(EngineConfig.defaults());
    }

    public InterventionAnalysisResult analyzeIntervention(CausalGraph graph, InterventionRequest request) {
        List<String> treatments = request.treatments();
        List<String> outcomes = request.outcomes();
        String original = Notation.latex(outcomes, List.of(), List.of());
        String interventional = Notation.interventional(outcomes, treatments);

        if (treatments.isEmpty() || outcomes.isEmpty()) {
            LOG.info("Intervention analysis on graph {} rejected: {}", graph.id(), MISSING_VARIABLES);
            return notIdentifiable(original, interventional, MISSING_VARIABLES, List.of());
        }

        List<String> unknown = unknownVariables(graph, treatments, outcomes);
        if (!unknown.isEmpty()) {
            String reason = "Unknown variable(s): " + String.join(", ", unknown);
            LOG.info("Intervention analysis on graph {} rejected: {}", graph.id(), reason);
            return notIdentifiable(original, interventional, reason, unknown);
        }

        IdentifiabilityResult result = identifier.isIdentifiable(graph, treatments, outcomes);
        if (!result.identifiable() || result.formula() == null) {
            LOG.info("{} on graph {} is not identifiable: {}", interventional, graph.id(), result.reason());
            return notIdentifiable(original, interventional, result.reason(), List.of());
        }
        LOG.info("{} on graph {} identified by {}: {}", interventional, graph.id(), result.method(), result.formula().plainText());
        return new InterventionAnalysisResult(true, original, interventional, result.method(), result.formula(),
                result.formula().latex(), null, List.of());
    }

    private static InterventionAnalysisResult notIdentifiable(String original, String interventional, String reason,
                                                              List<String> unknown) {
        return new InterventionAnalysisResult(false, original, interventional, null, null, null, reason, unknown);
    }

    private static List<String> unknownVariables(CausalGraph graph, List<String> treatments, List<String> outcomes) {
        Set<String> requested = new LinkedHashSet<>(treatments);
        requested.addAll(outcomes);
        List<String> unknown = new ArrayList<>();
        for (String id : requested) {
            if (!graph.hasNode(id)) unknown.add(id);
        }
        return unknown;
    }
}
