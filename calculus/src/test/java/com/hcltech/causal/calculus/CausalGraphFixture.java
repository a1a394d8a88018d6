package com.hcltech.causal.calculus;

import com.hcltech.causal.graph.CausalGraph;

/** The textbook graphs the calculus tests are written against. */
public final class CausalGraphFixture {
    private CausalGraphFixture() {
    }

    /** X -> Y. */
    public static CausalGraph simple() {
        return CausalGraph.builder("simple").nodes("X", "Y").directed("X", "Y").build();
    }

    /** U -> X, U -> Y, X -> Y. */
    public static CausalGraph confounded() {
        return CausalGraph.builder("confounded").nodes("U", "X", "Y")
                .directed("U", "X").directed("U", "Y").directed("X", "Y").build();
    }

    /** U -> X, U -> Y, X -> M, M -> Y. */
    public static CausalGraph frontdoor() {
        return CausalGraph.builder("frontdoor").nodes("U", "X", "M", "Y")
                .directed("U", "X").directed("U", "Y").directed("X", "M").directed("M", "Y").build();
    }

    /** X -> M -> Y with X <-> Y. */
    public static CausalGraph frontdoorLatent() {
        return CausalGraph.builder("frontdoor-latent").nodes("X", "M", "Y")
                .directed("X", "M").directed("M", "Y").bidirected("X", "Y").build();
    }

    /** Z -> X, U -> X, U -> Y, X -> Y. */
    public static CausalGraph instrument() {
        return CausalGraph.builder("iv").nodes("Z", "U", "X", "Y")
                .directed("Z", "X").directed("U", "X").directed("U", "Y").directed("X", "Y").build();
    }

    /** Z -> X, X -> Y, X <-> Y. */
    public static CausalGraph instrumentLatent() {
        return CausalGraph.builder("iv-latent").nodes("Z", "X", "Y")
                .directed("Z", "X").directed("X", "Y").bidirected("X", "Y").build();
    }

    /** X <-> Y and nothing else. */
    public static CausalGraph bidirectedOnly() {
        return CausalGraph.builder("bidirected").nodes("X", "Y").bidirected("X", "Y").build();
    }

    /** X -> Y with X <-> Y: the bow arc. */
    public static CausalGraph bow() {
        return CausalGraph.builder("bow").nodes("X", "Y").directed("X", "Y").bidirected("X", "Y").build();
    }

    /** A <- C -> B. */
    public static CausalGraph fork() {
        return CausalGraph.builder("fork").nodes("A", "B", "C").directed("C", "A").directed("C", "B").build();
    }

    /** A -> C <- B, C -> D. */
    public static CausalGraph collider() {
        return CausalGraph.builder("collider").nodes("A", "B", "C", "D")
                .directed("A", "C").directed("B", "C").directed("C", "D").build();
    }

    /** A -> B -> C. */
    public static CausalGraph chain() {
        return CausalGraph.builder("chain").nodes("A", "B", "C").directed("A", "B").directed("B", "C").build();
    }
}
