package com.hcltech.causal.calculus.identify;

import com.hcltech.causal.calculus.CausalGraphFixture;
import com.hcltech.causal.graph.CausalGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentalVariablesTest {

    @Test
    void ivGraph_findsInstrument() {
        assertEquals(Optional.of("Z"), InstrumentalVariables.findInstrumentalVariable(CausalGraphFixture.instrument(), "X", "Y"));
    }

    @Test
    void directEffectOnOutcome_violatesExclusion() {
        CausalGraph g = CausalGraph.builder("iv").nodes("Z", "U", "X", "Y")
                .directed("Z", "X").directed("U", "X").directed("U", "Y").directed("X", "Y").directed("Z", "Y").build();
        assertEquals(Optional.empty(), InstrumentalVariables.findInstrumentalVariable(g, "X", "Y"));
    }

    @Test
    void instrumentConfoundedWithOutcome_isRejected() {
        CausalGraph g = CausalGraph.builder("g").nodes("Z", "X", "Y")
                .directed("Z", "X").directed("X", "Y").bidirected("Z", "Y").build();
        assertEquals(Optional.empty(), InstrumentalVariables.findInstrumentalVariable(g, "X", "Y"));
    }

    @Test
    void latentTreatmentOutcomeConfounding_isAllowed() {
        assertEquals(Optional.of("Z"), InstrumentalVariables.findInstrumentalVariable(CausalGraphFixture.instrumentLatent(), "X", "Y"));
    }

    @Test
    void indirectAncestor_canBeInstrument() {
        CausalGraph g = CausalGraph.builder("g").nodes("W", "Z", "X", "Y")
                .directed("W", "Z").directed("Z", "X").directed("X", "Y").bidirected("X", "Y").build();
        assertEquals(Optional.of("W"), InstrumentalVariables.findInstrumentalVariable(g, "X", "Y"));
    }

    @Test
    void noAncestors_noInstrument() {
        assertEquals(Optional.empty(), InstrumentalVariables.findInstrumentalVariable(CausalGraphFixture.simple(), "X", "Y"));
        assertEquals(Optional.empty(), InstrumentalVariables.findInstrumentalVariable(CausalGraphFixture.simple(), "Q", "Y"));
    }

    @Test
    void formula_isCovarianceRatio() {
        AdjustmentFormula f = InstrumentalVariables.generateIVFormula("X", "Y", "Z");
        assertEquals("\\beta_{X \\to Y} = \\frac{Cov(Z, Y)}{Cov(Z, X)}", f.latex());
        assertEquals("β_{X→Y} = Cov(Z,Y) / Cov(Z,X)", f.plainText());
        assertEquals(List.of("Z"), f.adjustmentSet());
        assertEquals(IdentificationMethod.INSTRUMENTAL, f.type());
    }
}
