package com.hcltech.causal.calculus.docalculus;

import com.hcltech.causal.calculus.Notation;
import com.hcltech.causal.calculus.config.EngineConfig;
import com.hcltech.causal.calculus.dsep.DSeparation;
import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.GraphIndex;
import com.hcltech.causal.graph.GraphSurgery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pearl's three rules of do-calculus over outcomes Y, intervened X, the variables Z being rewritten and
 * the further conditioning set W. Each rule checks {@code Y _||_ Z | X, W} in its own surgery of the graph:
 * <ol>
 *     <li>incoming edges of X cut: an observation {@code z} may be dropped</li>
 *     <li>incoming edges of X and outgoing edges of Z cut: {@code do(z)} may be replaced by {@code z}</li>
 *     <li>incoming edges of X and of Z(W) cut, where Z(W) are the members of Z that are not ancestors of W
 *     once X is cut: {@code do(z)} may be dropped</li>
 * </ol>
 * Y and Z must be non-empty, and no variable may appear in two of the four sets.
 */
public final class DoCalculus {
    private static final Logger LOG = LoggerFactory.getLogger(DoCalculus.class);

    private DoCalculus() {
    }

    public static RuleResult applyRule1(CausalGraph graph, Collection<String> y, Collection<String> x,
                                        Collection<String> z, Collection<String> w) {
        return applyRule1(graph, y, x, z, w, EngineConfig.defaults());
    }

    public static RuleResult applyRule1(CausalGraph graph, Collection<String> y, Collection<String> x,
                                        Collection<String> z, Collection<String> w, EngineConfig config) {
        Optional<String> problem = malformed(y, x, z, w);
        if (problem.isPresent()) return RuleResult.inapplicable(1, problem.get());
        CausalGraph cut = GraphSurgery.cutIncomingEdges(graph, x);
        if (!independent(cut, y, z, union(x, w), config))
            return RuleResult.inapplicable(1, "Y is not independent of Z given X, W once X's incoming edges are cut");
        return RuleResult.applied(1, Notation.plain(y, x, w), Notation.latex(y, x, w),
                "Rule 1: observation of {" + Notation.join(z) + "} can be removed");
    }

    public static RuleResult applyRule2(CausalGraph graph, Collection<String> y, Collection<String> x,
                                        Collection<String> z, Collection<String> w) {
        return applyRule2(graph, y, x, z, w, EngineConfig.defaults());
    }

    public static RuleResult applyRule2(CausalGraph graph, Collection<String> y, Collection<String> x,
                                        Collection<String> z, Collection<String> w, EngineConfig config) {
        Optional<String> problem = malformed(y, x, z, w);
        if (problem.isPresent()) return RuleResult.inapplicable(2, problem.get());
        CausalGraph cut = GraphSurgery.removeOutgoingEdges(GraphSurgery.cutIncomingEdges(graph, x), z);
        if (!independent(cut, y, z, union(x, w), config))
            return RuleResult.inapplicable(2, "Y is not independent of Z given X, W once X's incoming and Z's outgoing edges are cut");
        List<String> conditions = List.copyOf(union(z, w));
        return RuleResult.applied(2, Notation.plain(y, x, conditions), Notation.latex(y, x, conditions),
                "Rule 2: do(" + Notation.join(z) + ") can be exchanged for observation");
    }

    public static RuleResult applyRule3(CausalGraph graph, Collection<String> y, Collection<String> x,
                                        Collection<String> z, Collection<String> w) {
        return applyRule3(graph, y, x, z, w, EngineConfig.defaults());
    }

    public static RuleResult applyRule3(CausalGraph graph, Collection<String> y, Collection<String> x,
                                        Collection<String> z, Collection<String> w, EngineConfig config) {
        Optional<String> problem = malformed(y, x, z, w);
        if (problem.isPresent()) return RuleResult.inapplicable(3, problem.get());
        CausalGraph withoutX = GraphSurgery.cutIncomingEdges(graph, x);
        Set<String> ancestorsOfW = GraphIndex.of(withoutX).ancestorsOf(w);
        Set<String> zw = new LinkedHashSet<>(z);
        zw.removeAll(ancestorsOfW);
        CausalGraph cut = GraphSurgery.cutIncomingEdges(withoutX, zw);
        if (!independent(cut, y, z, union(x, w), config))
            return RuleResult.inapplicable(3, "Y is not independent of Z given X, W once X's and Z(W)'s incoming edges are cut");
        return RuleResult.applied(3, Notation.plain(y, x, w), Notation.latex(y, x, w),
                "Rule 3: do(" + Notation.join(z) + ") has no effect and can be removed");
    }

    public static Optional<RuleResult> identify(CausalGraph graph, Collection<String> treatments, Collection<String> outcomes) {
        return identify(graph, treatments, outcomes, EngineConfig.defaults());
    }

    /**
     * Tries to rewrite {@code P(Y | do(X))} without the do-operator: rule 2 turns it into {@code P(Y | X)},
     * failing that rule 3 turns it into {@code P(Y)}.
     */
    public static Optional<RuleResult> identify(CausalGraph graph, Collection<String> treatments,
                                                Collection<String> outcomes, EngineConfig config) {
        RuleResult exchange = applyRule2(graph, outcomes, List.of(), treatments, List.of(), config);
        if (exchange.applicable()) {
            LOG.debug("do({}) exchanged for observation by rule 2", treatments);
            return Optional.of(exchange);
        }
        RuleResult removal = applyRule3(graph, outcomes, List.of(), treatments, List.of(), config);
        if (removal.applicable()) {
            LOG.debug("do({}) removed by rule 3", treatments);
            return Optional.of(removal);
        }
        return Optional.empty();
    }

    private static boolean independent(CausalGraph graph, Collection<String> y, Collection<String> z,
                                       Set<String> given, EngineConfig config) {
        return DSeparation.isSeparated(GraphIndex.of(graph), y, z, given, config.pathLimit());
    }

    private static Optional<String> malformed(Collection<String> y, Collection<String> x,
                                              Collection<String> z, Collection<String> w) {
        if (y.isEmpty()) return Optional.of("Y must not be empty");
        if (z.isEmpty()) return Optional.of("Z must not be empty");
        Set<String> seen = new HashSet<>();
        for (Collection<String> set : List.of(y, x, z, w)) {
            for (String id : new LinkedHashSet<>(set)) {
                if (!seen.add(id)) return Optional.of("Variable " + id + " appears in more than one of Y, X, Z, W");
            }
        }
        return Optional.empty();
    }

    private static Set<String> union(Collection<String> a, Collection<String> b) {
        Set<String> result = new LinkedHashSet<>(a);
        result.addAll(b);
        return result;
    }
}
