package com.hcltech.causal.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Graph transformations behind the do-operator. Each returns a new graph; the argument is left untouched. */
public final class GraphSurgery {
    public static final String CUT_INCOMING_KEY = "cutIncoming";
    public static final String CUT_OUTGOING_KEY = "cutOutgoing";
    public static final String DESCRIPTION_KEY = "description";

    private GraphSurgery() {
    }

    /** The graph after do(...) on every intervened variable: all arrowheads into those variables are removed. */
    public static CausalGraph createMutilatedGraph(CausalGraph graph, Collection<Intervention> interventions) {
        Objects.requireNonNull(interventions, "interventions");
        Set<String> variables = new LinkedHashSet<>();
        for (Intervention i : interventions) variables.add(i.variable());
        return cutIncomingEdges(graph, variables);
    }

    /**
     * Drops every edge with an arrowhead at a node in {@code variables}: directed edges into it, self-loops
     * included, and bidirected edges touching it. Outgoing directed edges survive, and so do undirected edges,
     * whichever way round they are written.
     */
    public static CausalGraph cutIncomingEdges(CausalGraph graph, Collection<String> variables) {
        Objects.requireNonNull(graph, "graph");
        Set<String> cut = new LinkedHashSet<>(variables);
        List<Edge> kept = new ArrayList<>();
        for (Edge e : graph.edges()) {
            if (cut.stream().noneMatch(e::pointsInto)) kept.add(e);
        }
        Map<String, Object> metadata = new LinkedHashMap<>(graph.metadata());
        metadata.put(CUT_INCOMING_KEY, List.copyOf(cut));
        metadata.put(DESCRIPTION_KEY, "Mutilated graph with interventions on: " + String.join(", ", cut));
        return new CausalGraph(graph.id() + "_mutilated", graph.nodes(), kept, metadata);
    }

    /** Drops every directed edge leaving a node in {@code variables}. */
    public static CausalGraph removeOutgoingEdges(CausalGraph graph, Collection<String> variables) {
        Objects.requireNonNull(graph, "graph");
        Set<String> cut = new LinkedHashSet<>(variables);
        List<Edge> kept = new ArrayList<>();
        for (Edge e : graph.edges()) {
            if (!(e.isDirected() && cut.contains(e.from()))) kept.add(e);
        }
        Map<String, Object> metadata = new LinkedHashMap<>(graph.metadata());
        metadata.put(CUT_OUTGOING_KEY, List.copyOf(cut));
        return new CausalGraph(graph.id() + "_cut_outgoing", graph.nodes(), kept, metadata);
    }

    /**
     * Removes {@code variable} and every edge touching it, then links each of its directed parents to each of
     * its directed children, unless that directed edge is already present.
     */
    public static CausalGraph createMarginalizedGraph(CausalGraph graph, String variable) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(variable, "variable");
        Set<String> parents = new LinkedHashSet<>();
        Set<String> children = new LinkedHashSet<>();
        List<Edge> kept = new ArrayList<>();
        for (Edge e : graph.edges()) {
            if (!e.touches(variable)) {
                kept.add(e);
                continue;
            }
            if (e.isDirected() && !e.isSelfLoop()) {
                if (e.to().equals(variable)) parents.add(e.from());
                else children.add(e.to());
            }
        }
        for (String p : parents) {
            for (String c : children) {
                Edge bridge = Edge.directed(p, c);
                if (!kept.contains(bridge)) kept.add(bridge);
            }
        }
        List<Node> nodes = graph.nodes().stream().filter(n -> !n.id().equals(variable)).toList();
        return new CausalGraph(graph.id() + "_marginalized_" + variable, nodes, kept, graph.metadata());
    }
}
