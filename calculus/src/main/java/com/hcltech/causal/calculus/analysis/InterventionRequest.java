package com.hcltech.causal.calculus.analysis;

import com.hcltech.causal.graph.Intervention;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/** Interventions to apply and the outcome variables to watch. */
public record InterventionRequest(List<Intervention> interventions, List<String> outcomes) {
    public InterventionRequest {
        interventions = interventions == null ? List.of() : List.copyOf(interventions);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static InterventionRequest of(String treatment, String outcome) {
        return new InterventionRequest(List.of(Intervention.atomic(treatment)), List.of(outcome));
    }

    /** Intervened variables, each once, in request order. */
    public List<String> treatments() {
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        for (Intervention i : interventions) ids.add(i.variable());
        return new ArrayList<>(ids);
    }
}
