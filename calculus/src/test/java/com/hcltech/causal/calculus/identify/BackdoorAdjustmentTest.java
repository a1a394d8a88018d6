package com.hcltech.causal.calculus.identify;

import com.hcltech.causal.calculus.CausalGraphFixture;
import com.hcltech.causal.calculus.config.EngineConfig;
import com.hcltech.causal.graph.CausalGraph;
import com.hcltech.causal.graph.GraphIndex;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BackdoorAdjustmentTest {

    @Test
    void unconfounded_emptySetIsValid() {
        assertEquals(List.of(List.of()), BackdoorAdjustment.findAllBackdoorSets(CausalGraphFixture.simple(), List.of("X"), List.of("Y")));
    }

    @Test
    void confounded_includesConfounder() {
        List<List<String>> sets = BackdoorAdjustment.findAllBackdoorSets(CausalGraphFixture.confounded(), List.of("X"), List.of("Y"));
        assertTrue(sets.contains(List.of("U")));
        assertFalse(sets.contains(List.of()));
    }

    @Test
    void firstSet_isSmallestThenAlphabetical() {
        CausalGraph g = CausalGraph.builder("g").nodes("X", "Y", "B", "A")
                .directed("A", "B").directed("B", "X").directed("A", "Y").directed("X", "Y").build();
        Optional<List<String>> first = BackdoorAdjustment.findBackdoorAdjustmentSet(GraphIndex.of(g), List.of("X"), List.of("Y"),
                EngineConfig.defaults());
        assertEquals(Optional.of(List.of("A")), first);
        assertEquals(List.of(List.of("A"), List.of("B"), List.of("A", "B")),
                BackdoorAdjustment.findAllBackdoorSets(g, List.of("X"), List.of("Y")));
    }

    @Test
    void sizeCap_limitsSearch() {
        EngineConfig onlyEmpty = new EngineConfig(0, 0, 5, 3);
        assertEquals(List.of(), BackdoorAdjustment.findAllBackdoorSets(CausalGraphFixture.confounded(), List.of("X"), List.of("Y"), onlyEmpty));
    }

    @Test
    void emptySetFormula_hasNoSummation() {
        AdjustmentFormula f = BackdoorAdjustment.generateBackdoorFormula(List.of("X"), List.of("Y"), List.of());
        assertEquals("P(Y | do(X)) = P(Y | X)", f.latex());
        assertEquals("P(Y|do(X)) = P(Y|X)", f.plainText());
        assertFalse(f.latex().contains("\\sum"));
        assertEquals(List.of(), f.adjustmentSet());
        assertEquals(IdentificationMethod.BACKDOOR, f.type());
        assertTrue(f.valid());
    }

    @Test
    void formula_sumsOverAdjustmentSet() {
        AdjustmentFormula f = BackdoorAdjustment.generateBackdoorFormula(List.of("X"), List.of("Y"), List.of("U", "V"));
        assertEquals("P(Y | do(X)) = \\sum_{U, V} P(Y | X, U, V) P(U, V)", f.latex());
        assertEquals("P(Y|do(X)) = Σ_{U,V} P(Y|X,U,V) P(U,V)", f.plainText());
        assertEquals(List.of("U", "V"), f.adjustmentSet());
    }
}
