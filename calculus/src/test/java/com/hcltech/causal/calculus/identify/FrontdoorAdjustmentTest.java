package com.hcltech.causal.calculus.identify;

import com.hcltech.causal.calculus.CausalGraphFixture;
import com.hcltech.causal.graph.CausalGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrontdoorAdjustmentTest {

    @Test
    void classicFrontdoorGraph_isSatisfiedThroughMediator() {
        assertEquals(new FrontdoorResult(true, List.of("M")),
                FrontdoorAdjustment.checkFrontdoorCriterion(CausalGraphFixture.frontdoor(), "X", "Y"));
    }

    @Test
    void latentConfounder_asBidirectedEdge() {
        assertEquals(new FrontdoorResult(true, List.of("M")),
                FrontdoorAdjustment.checkFrontdoorCriterion(CausalGraphFixture.frontdoorLatent(), "X", "Y"));
    }

    @Test
    void noMediator_isNotSatisfied() {
        FrontdoorResult r = FrontdoorAdjustment.checkFrontdoorCriterion(CausalGraphFixture.simple(), "X", "Y");
        assertFalse(r.satisfied());
        assertEquals(List.of(), r.mediators());
    }

    @Test
    void directEdgeBypassingMediator_isNotSatisfied() {
        CausalGraph g = CausalGraph.builder("g").nodes("X", "M", "Y")
                .directed("X", "M").directed("M", "Y").directed("X", "Y").build();
        assertFalse(FrontdoorAdjustment.checkFrontdoorCriterion(g, "X", "Y").satisfied());
    }

    @Test
    void confoundedMediator_isNotSatisfied() {
        CausalGraph g = CausalGraph.builder("g").nodes("X", "M", "Y")
                .directed("X", "M").directed("M", "Y").bidirected("M", "Y").build();
        assertFalse(FrontdoorAdjustment.checkFrontdoorCriterion(g, "X", "Y").satisfied());
    }

    @Test
    void twoParallelMediators_areFoundTogether() {
        CausalGraph g = CausalGraph.builder("g").nodes("X", "M1", "M2", "Y")
                .directed("X", "M1").directed("X", "M2").directed("M1", "Y").directed("M2", "Y").bidirected("X", "Y").build();
        assertEquals(List.of("M1", "M2"), FrontdoorAdjustment.checkFrontdoorCriterion(g, "X", "Y").mediators());
    }

    @Test
    void unknownVariables_areNotSatisfied() {
        assertFalse(FrontdoorAdjustment.checkFrontdoorCriterion(CausalGraphFixture.frontdoor(), "Q", "Y").satisfied());
    }

    @Test
    void formula_isTwoStage() {
        AdjustmentFormula f = FrontdoorAdjustment.generateFrontdoorFormula("X", "Y", List.of("M"));
        assertEquals("P(Y | do(X)) = \\sum_{M} P(M | X) \\sum_{X'} P(Y | M, X') P(X')", f.latex());
        assertEquals("P(Y|do(X)) = Σ_{M} P(M|X) Σ_{X'} P(Y|M,X') P(X')", f.plainText());
        assertEquals(IdentificationMethod.FRONTDOOR, f.type());
        assertEquals(List.of("M"), f.adjustmentSet());
    }
}
