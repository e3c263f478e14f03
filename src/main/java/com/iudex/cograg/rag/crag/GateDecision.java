package com.iudex.cograg.rag.crag;

import java.util.List;

/**
 * Outcome of one gate evaluation. Computed per fusion call, never persisted.
 *
 * @param passed             whether the evidence is good enough to answer from
 * @param bestScore          highest score in the evaluated list
 * @param avgTop3            mean of the three highest scores (fewer if the list is shorter)
 * @param reason             human-readable explanation
 * @param level              coarse evidence strength
 * @param recommendedActions corrective steps for a retry; empty when none apply
 * @param resultCount        number of results evaluated
 */
public record GateDecision(boolean passed, double bestScore, double avgTop3, String reason, EvidenceLevel level,
                           List<CorrectiveAction> recommendedActions, int resultCount) {

    public GateDecision {
        recommendedActions = List.copyOf(recommendedActions);
    }

    /**
     * An empty list has nothing for the gate to correct.
     */
    public static GateDecision nothingToCorrect() {
        return new GateDecision(true, 0.0, 0.0, "no results to correct (empty result list)", EvidenceLevel.INSUFFICIENT, List.of(), 0);
    }

    /**
     * Used by the pipeline when retrieval itself produced nothing: there is no evidence to answer from.
     */
    public static GateDecision noEvidence(String detail) {
        String reason = "0 results retrieved" + (detail == null || detail.isBlank() ? "" : " (" + detail + ")");
        return new GateDecision(false, 0.0, 0.0, reason, EvidenceLevel.INSUFFICIENT,
                List.of(CorrectiveAction.REWRITE_QUERY, CorrectiveAction.EXPAND_TOP_K, CorrectiveAction.EXPAND_SOURCES), 0);
    }
}
