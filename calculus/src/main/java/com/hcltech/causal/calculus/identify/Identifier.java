package com.hcltech.causal.calculus.identify;

import com.hcltech.causal.graph.CausalGraph;

import java.util.Collection;

/** Decides whether the effect of the treatments on the outcomes is identifiable. Never throws for a well-formed graph. */
public interface Identifier {
    IdentifiabilityResult isIdentifiable(CausalGraph graph, Collection<String> treatments, Collection<String> outcomes);
}
