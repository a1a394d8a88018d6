package com.hcltech.causal.calculus.dsep;

import com.hcltech.causal.calculus.config.EngineConfig;
import com.hcltech.causal.common.Combinations;
import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.GraphIndex;
import com.hcltech.causal.graph.Path;
import com.hcltech.causal.graph.PathFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Sets derived from d-separation: Markov blankets, implied independencies, separators and backdoor sets. */
public final class Separators {
    private static final Logger LOG = LoggerFactory.getLogger(Separators.class);

    private Separators() {
    }

    /** Parents, children and the children's other parents of {@code nodeId}. */
    public static Set<String> computeMarkovBlanket(CausalGraph graph, String nodeId) {
        GraphIndex index = GraphIndex.of(graph);
        Set<String> blanket = new LinkedHashSet<>(index.parents(nodeId));
        blanket.addAll(index.children(nodeId));
        for (String child : index.children(nodeId)) blanket.addAll(index.parents(child));
        blanket.remove(nodeId);
        return Collections.unmodifiableSet(blanket);
    }

    public static List<ImpliedIndependence> getImpliedIndependencies(CausalGraph graph) {
        return getImpliedIndependencies(graph, EngineConfig.defaults());
    }

    /**
     * For each pair of non-adjacent nodes, in node order, every conditioning set of up to
     * {@link EngineConfig#maxConditioningSetSize()} other nodes that separates them.
     */
    public static List<ImpliedIndependence> getImpliedIndependencies(CausalGraph graph, EngineConfig config) {
        GraphIndex index = GraphIndex.of(graph);
        List<String> ids = new ArrayList<>(index.nodeIds());
        List<ImpliedIndependence> result = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                String x = ids.get(i);
                String y = ids.get(j);
                if (index.adjacent(x, y)) continue;
                List<String> others = ids.stream().filter(id -> !id.equals(x) && !id.equals(y)).sorted().toList();
                for (List<String> z : Combinations.upToSize(others, config.maxConditioningSetSize())) {
                    if (DSeparation.isSeparated(index, List.of(x), List.of(y), Set.copyOf(z), config.pathLimit()))
                        result.add(new ImpliedIndependence(x, y, z));
                }
            }
        }
        return result;
    }

    public static Optional<List<String>> findMinimalSeparator(CausalGraph graph, Collection<String> x, Collection<String> y) {
        return findMinimalSeparator(graph, x, y, EngineConfig.defaults());
    }

    /**
     * Smallest set of ancestors of X and Y, with at most {@link EngineConfig#maxSeparatorSize()} members, that separates
     * them. Ties go to the lexicographically first set of ids. Empty when X and Y are adjacent or no set fits.
     */
    public static Optional<List<String>> findMinimalSeparator(CausalGraph graph, Collection<String> x, Collection<String> y,
                                                              EngineConfig config) {
        GraphIndex index = GraphIndex.of(graph);
        Set<String> endpoints = new LinkedHashSet<>(x);
        endpoints.addAll(y);
        List<String> candidates = index.ancestorsOf(endpoints).stream()
                .filter(id -> !endpoints.contains(id))
                .sorted()
                .toList();
        Optional<List<String>> found = Combinations.firstMatching(candidates, 0, config.maxSeparatorSize(),
                z -> DSeparation.isSeparated(index, x, y, Set.copyOf(z), config.pathLimit()));
        LOG.debug("Minimal separator of {} and {}: {}", x, y, found.map(Object::toString).orElse("none"));
        return found;
    }

    public static boolean isValidBackdoorAdjustment(CausalGraph graph, Collection<String> treatments,
                                                    Collection<String> outcomes, Collection<String> adjustmentSet) {
        return isValidBackdoorAdjustment(GraphIndex.of(graph), treatments, outcomes, adjustmentSet, PathFinder.UNBOUNDED);
    }

    /** No member of the set descends from a treatment, and the set blocks every backdoor path. */
    public static boolean isValidBackdoorAdjustment(GraphIndex index, Collection<String> treatments,
                                                    Collection<String> outcomes, Collection<String> adjustmentSet,
                                                    int maxLength) {
        Set<String> descendants = index.descendantsOf(treatments);
        for (String z : adjustmentSet) {
            if (descendants.contains(z)) return false;
        }
        return backdoorPathsBlocked(index, treatments, outcomes, Set.copyOf(adjustmentSet), maxLength);
    }

    public static boolean backdoorPathsBlocked(GraphIndex index, Collection<String> treatments,
                                               Collection<String> outcomes, Set<String> conditioningSet, int maxLength) {
        for (Path p : PathFinder.findBackdoorPaths(index, treatments, outcomes, maxLength)) {
            if (!DSeparation.isPathBlocked(index, p, conditioningSet).blocked()) return false;
        }
        return true;
    }
}
