package com.hcltech.causal.graph.centrality;

import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.Edge;
import com.hcltech.causal.graph.EdgeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Node centrality for causal graphs. Bidirected and undirected edges count in both directions; betweenness,
 * closeness and eigenvector centrality ignore direction altogether. Edges naming unknown nodes are skipped.
 */
public final class Centrality {
    private static final double KATZ_ALPHA = 0.1;
    private static final double KATZ_BETA = 1.0;

    private Centrality() {
    }

    private record Adjacency(List<String> nodes, Map<String, List<String>> out, Map<String, List<String>> in) {}

    private static Adjacency adjacency(CausalGraph graph, boolean directed) {
        List<String> nodes = graph.nodeIds();
        Map<String, List<String>> out = new LinkedHashMap<>();
        Map<String, List<String>> in = new LinkedHashMap<>();
        for (String n : nodes) {
            out.put(n, new ArrayList<>());
            in.put(n, new ArrayList<>());
        }
        for (Edge e : graph.edges()) {
            if (!out.containsKey(e.from()) || !out.containsKey(e.to())) continue;
            out.get(e.from()).add(e.to());
            in.get(e.to()).add(e.from());
            if (!directed || e.kind() != EdgeKind.DIRECTED) {
                out.get(e.to()).add(e.from());
                in.get(e.from()).add(e.to());
            }
        }
        return new Adjacency(nodes, out, in);
    }

    public static Map<String, Double> degree(CausalGraph graph, boolean normalize) {
        Adjacency adj = adjacency(graph, true);
        double norm = normaliser(adj, normalize);
        Map<String, Double> result = new LinkedHashMap<>();
        for (String n : adj.nodes()) result.put(n, (adj.out().get(n).size() + adj.in().get(n).size()) / norm);
        return result;
    }

    public static Map<String, Double> inDegree(CausalGraph graph, boolean normalize) {
        Adjacency adj = adjacency(graph, true);
        double norm = normaliser(adj, normalize);
        Map<String, Double> result = new LinkedHashMap<>();
        for (String n : adj.nodes()) result.put(n, adj.in().get(n).size() / norm);
        return result;
    }

    public static Map<String, Double> outDegree(CausalGraph graph, boolean normalize) {
        Adjacency adj = adjacency(graph, true);
        double norm = normaliser(adj, normalize);
        Map<String, Double> result = new LinkedHashMap<>();
        for (String n : adj.nodes()) result.put(n, adj.out().get(n).size() / norm);
        return result;
    }

    private static double normaliser(Adjacency adj, boolean normalize) {
        int n = adj.nodes().size();
        return normalize && n > 1 ? n - 1 : 1;
    }

    /** Brandes' algorithm over the undirected skeleton. Normalised scores lie in [0, 1]. */
    public static Map<String, Double> betweenness(CausalGraph graph, boolean normalize) {
        Adjacency adj = adjacency(graph, false);
        List<String> nodes = adj.nodes();
        Map<String, Double> result = new LinkedHashMap<>();
        for (String v : nodes) result.put(v, 0.0);

        for (String s : nodes) {
            Deque<String> stack = new ArrayDeque<>();
            Map<String, List<String>> pred = new LinkedHashMap<>();
            Map<String, Double> sigma = new LinkedHashMap<>();
            Map<String, Integer> dist = new LinkedHashMap<>();
            Map<String, Double> delta = new LinkedHashMap<>();
            for (String v : nodes) {
                pred.put(v, new ArrayList<>());
                sigma.put(v, 0.0);
                dist.put(v, -1);
                delta.put(v, 0.0);
            }
            sigma.put(s, 1.0);
            dist.put(s, 0);

            Deque<String> queue = new ArrayDeque<>(List.of(s));
            while (!queue.isEmpty()) {
                String v = queue.poll();
                stack.push(v);
                for (String w : adj.out().get(v)) {
                    if (dist.get(w) < 0) {
                        dist.put(w, dist.get(v) + 1);
                        queue.add(w);
                    }
                    if (dist.get(w) == dist.get(v) + 1) {
                        sigma.put(w, sigma.get(w) + sigma.get(v));
                        pred.get(w).add(v);
                    }
                }
            }
            while (!stack.isEmpty()) {
                String w = stack.pop();
                for (String v : pred.get(w)) {
                    delta.put(v, delta.get(v) + sigma.get(v) / sigma.get(w) * (1 + delta.get(w)));
                }
                if (!w.equals(s)) result.put(w, result.get(w) + delta.get(w));
            }
        }

        int n = nodes.size();
        // every unordered pair was counted from both ends
        double scale = normalize && n > 2 ? (double) (n - 1) * (n - 2) : 2.0;
        result.replaceAll((k, v) -> v / scale);
        return result;
    }

    /** Reachable nodes over total distance, scaled by the reachable share when normalising. Isolated nodes score 0. */
    public static Map<String, Double> closeness(CausalGraph graph, boolean normalize) {
        Adjacency adj = adjacency(graph, false);
        int n = adj.nodes().size();
        Map<String, Double> result = new LinkedHashMap<>();
        for (String source : adj.nodes()) {
            Map<String, Integer> dist = new LinkedHashMap<>();
            dist.put(source, 0);
            Deque<String> queue = new ArrayDeque<>(List.of(source));
            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (String next : adj.out().get(current)) {
                    if (!dist.containsKey(next)) {
                        dist.put(next, dist.get(current) + 1);
                        queue.add(next);
                    }
                }
            }
            int reachable = dist.size() - 1;
            long total = 0;
            for (int d : dist.values()) total += d;
            if (reachable == 0 || total == 0) {
                result.put(source, 0.0);
                continue;
            }
            double cc = (double) reachable / total;
            result.put(source, normalize && n > 1 ? cc * reachable / (n - 1) : cc);
        }
        return result;
    }

    /** Power iteration; a node with no out-links spreads its rank over every node. */
    public static Map<String, Double> pageRank(CausalGraph graph, double dampingFactor, int maxIterations, double tolerance) {
        Adjacency adj = adjacency(graph, true);
        List<String> nodes = adj.nodes();
        int n = nodes.size();
        Map<String, Double> rank = new LinkedHashMap<>();
        if (n == 0) return rank;
        for (String v : nodes) rank.put(v, 1.0 / n);

        for (int iter = 0; iter < maxIterations; iter++) {
            Map<String, Double> next = new LinkedHashMap<>();
            for (String v : nodes) next.put(v, (1 - dampingFactor) / n);
            for (String v : nodes) {
                List<String> targets = adj.out().get(v);
                if (targets.isEmpty()) {
                    double share = dampingFactor * rank.get(v) / n;
                    for (String other : nodes) next.put(other, next.get(other) + share);
                } else {
                    double share = dampingFactor * rank.get(v) / targets.size();
                    for (String t : targets) next.put(t, next.get(t) + share);
                }
            }
            double diff = maxDiff(rank, next);
            rank = next;
            if (diff < tolerance) break;
        }
        return rank;
    }

    /**
     * Power iteration over the undirected skeleton, L2-normalised each round. Each node keeps its own previous score
     * as well, which stops bipartite graphs from oscillating without moving the fixed point.
     */
    public static Map<String, Double> eigenvector(CausalGraph graph, int maxIterations, double tolerance) {
        Adjacency adj = adjacency(graph, false);
        List<String> nodes = adj.nodes();
        Map<String, Double> score = new LinkedHashMap<>();
        if (nodes.isEmpty()) return score;
        for (String v : nodes) score.put(v, 1.0 / Math.sqrt(nodes.size()));

        for (int iter = 0; iter < maxIterations; iter++) {
            Map<String, Double> next = new LinkedHashMap<>();
            double norm = 0;
            for (String v : nodes) {
                double sum = score.get(v);
                for (String u : adj.in().get(v)) sum += score.get(u);
                next.put(v, sum);
                norm += sum * sum;
            }
            double l2 = Math.sqrt(norm);
            if (l2 > 0) next.replaceAll((k, v) -> v / l2);
            double diff = maxDiff(score, next);
            score = next;
            if (diff < tolerance) break;
        }
        return score;
    }

    /** Katz centrality with attenuation 0.1 and base score 1, scaled so the best node scores 1. */
    public static Map<String, Double> katz(CausalGraph graph, int maxIterations, double tolerance) {
        Adjacency adj = adjacency(graph, true);
        List<String> nodes = adj.nodes();
        Map<String, Double> score = new LinkedHashMap<>();
        for (String v : nodes) score.put(v, 0.0);

        for (int iter = 0; iter < maxIterations; iter++) {
            Map<String, Double> next = new LinkedHashMap<>();
            for (String v : nodes) {
                double sum = KATZ_BETA;
                for (String u : adj.in().get(v)) sum += KATZ_ALPHA * score.get(u);
                next.put(v, sum);
            }
            double diff = maxDiff(score, next);
            score = next;
            if (diff < tolerance) break;
        }
        double max = score.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
        if (max > 0) score.replaceAll((k, v) -> v / max);
        return score;
    }

    public static Map<String, Double> compute(CausalGraph graph, CentralityMeasure measure, CentralityConfig config) {
        return switch (measure) {
            case DEGREE -> degree(graph, config.normalize());
            case IN_DEGREE -> inDegree(graph, config.normalize());
            case OUT_DEGREE -> outDegree(graph, config.normalize());
            case BETWEENNESS -> betweenness(graph, config.normalize());
            case CLOSENESS -> closeness(graph, config.normalize());
            case PAGERANK -> pageRank(graph, config.dampingFactor(), config.maxIterations(), config.tolerance());
            case EIGENVECTOR -> eigenvector(graph, config.maxIterations(), config.tolerance());
            case KATZ -> katz(graph, config.maxIterations(), config.tolerance());
        };
    }

    public static CentralityResult computeAll(CausalGraph graph, CentralityConfig config) {
        Map<CentralityMeasure, Map<String, Double>> measures = new EnumMap<>(CentralityMeasure.class);
        Map<CentralityMeasure, List<NodeScore>> top = new EnumMap<>(CentralityMeasure.class);
        for (CentralityMeasure m : CentralityMeasure.values()) {
            if (!config.measures().contains(m)) continue;
            Map<String, Double> scores = Collections.unmodifiableMap(compute(graph, m, config));
            measures.put(m, scores);
            if (!scores.isEmpty()) top.put(m, ranked(scores).stream().limit(config.topN()).toList());
        }
        return new CentralityResult(measures, top);
    }

    /** Highest-scoring node for {@code measure}; ties go to the node declared first. Empty for an empty graph. */
    public static Optional<NodeScore> mostCentral(CausalGraph graph, CentralityMeasure measure) {
        List<NodeScore> ranked = ranked(compute(graph, measure, CentralityConfig.defaults()));
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    /** Highest first; equal scores keep declaration order. */
    private static List<NodeScore> ranked(Map<String, Double> scores) {
        List<NodeScore> list = new ArrayList<>();
        scores.forEach((k, v) -> list.add(new NodeScore(k, v)));
        list.sort(Comparator.comparingDouble(NodeScore::score).reversed());
        return list;
    }

    private static double maxDiff(Map<String, Double> before, Map<String, Double> after) {
        double max = 0;
        Set<String> keys = new HashSet<>(after.keySet());
        for (String k : keys) max = Math.max(max, Math.abs(after.get(k) - before.getOrDefault(k, 0.0)));
        return max;
    }
}
