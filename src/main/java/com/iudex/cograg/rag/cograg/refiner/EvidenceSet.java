package com.iudex.cograg.rag.cograg.refiner;

import com.iudex.cograg.model.FusedResult;
import java.util.List;
import java.util.Map;

/**
 * Refined evidence of one tree node, sorted by quality descending. Immutable.
 *
 * @param qualityScore      mean chunk quality, three decimals; 0 when the node has no evidence
 * @param qualityByResultId chunk quality keyed by result id
 */
public record EvidenceSet(String nodeId, List<FusedResult> results, double qualityScore, boolean hasConflicts,
                          Map<String, Double> qualityByResultId) {

    public EvidenceSet {
        results = List.copyOf(results);
        qualityByResultId = Map.copyOf(qualityByResultId);
    }

    public static EvidenceSet empty(String nodeId) {
        return new EvidenceSet(nodeId, List.of(), 0.0, false, Map.of());
    }

    public boolean isEmpty() {
        return this.results.isEmpty();
    }

    public EvidenceSet withConflicts() {
        return new EvidenceSet(this.nodeId, this.results, this.qualityScore, true, this.qualityByResultId);
    }
}
