package com.iudex.cograg.rag.crag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.iudex.cograg.Fixtures;
import com.iudex.cograg.model.FusedResult;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CragGateTest {

    private final CragGate gate = new CragGate();

    @Test
    @DisplayName("Empty list passes with nothing to correct")
    void emptyListPasses() {
        GateDecision decision = gate.evaluate(List.of());

        assertTrue(decision.passed());
        assertEquals("no results to correct (empty result list)", decision.reason());
        assertTrue(decision.recommendedActions().isEmpty());
    }

    @Test
    @DisplayName("Strong evidence passes without corrective actions")
    void strongEvidencePasses() {
        GateDecision decision = gate.evaluate(scores(0.9, 0.8, 0.7, 0.1));

        assertTrue(decision.passed());
        assertEquals(EvidenceLevel.STRONG, decision.level());
        assertEquals(0.8, decision.avgTop3(), 1e-9);
    }

    @Test
    @DisplayName("Weak best score fails and recommends a rewrite")
    void weakBestFails() {
        GateDecision decision = gate.evaluate(scores(0.42, 0.40, 0.38));

        assertFalse(decision.passed());
        assertEquals(EvidenceLevel.LOW, decision.level());
        assertThat(decision.recommendedActions()).containsExactly(CorrectiveAction.REWRITE_QUERY, CorrectiveAction.EXPAND_TOP_K);
        assertThat(decision.reason()).contains("best score below minimum");
    }

    @Test
    @DisplayName("One strong hit among noise fails on the top-3 average")
    void lowAverageFails() {
        GateDecision decision = gate.evaluate(scores(0.8, 0.1, 0.05));

        assertFalse(decision.passed());
        assertThat(decision.reason()).contains("average of top 3 below minimum");
    }

    @Test
    @DisplayName("Thresholds are inclusive")
    void thresholdsAreInclusive() {
        assertTrue(gate.evaluate(scores(0.5, 0.5, 0.5), 0.5, 0.5).passed());
    }

    @Test
    @DisplayName("Same scores give the same decision regardless of order")
    void decisionIsDeterministic() {
        GateDecision first = gate.evaluate(scores(0.3, 0.6, 0.55, 0.2));
        GateDecision second = gate.evaluate(scores(0.2, 0.55, 0.6, 0.3));

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Retrieval that produced nothing is a failed gate")
    void noEvidenceFails() {
        GateDecision decision = GateDecision.noEvidence("failed backends: lexical");

        assertFalse(decision.passed());
        assertEquals(EvidenceLevel.INSUFFICIENT, decision.level());
        assertThat(decision.recommendedActions()).contains(CorrectiveAction.EXPAND_SOURCES);
    }

    private static List<FusedResult> scores(double... values) {
        List<FusedResult> results = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            results.add(Fixtures.fused("d" + i, "chunk " + i, values[i]));
        }
        return results;
    }
}
