package com.hcltech.causal.graph;

/** Small graphs shared by the graph tests. */
public final class GraphFixture {
    private GraphFixture() {
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

    /** A -> B -> C -> D. */
    public static CausalGraph chain() {
        return CausalGraph.builder("chain").nodes("A", "B", "C", "D")
                .directed("A", "B").directed("B", "C").directed("C", "D").build();
    }

    /** A -> C <- B, C -> D. */
    public static CausalGraph collider() {
        return CausalGraph.builder("collider").nodes("A", "B", "C", "D")
                .directed("A", "C").directed("B", "C").directed("C", "D").build();
    }

    /** X -> Y with a latent common cause X <-> Y. */
    public static CausalGraph latentConfounded() {
        return CausalGraph.builder("latent").nodes("X", "Y")
                .directed("X", "Y").bidirected("X", "Y").build();
    }
}
