package com.iudex.cograg.rag.cograg.refiner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RefinementResult(Map<String, EvidenceSet> evidenceByNode, List<Conflict> conflicts) {

    public RefinementResult {
        evidenceByNode = Collections.unmodifiableMap(new LinkedHashMap<>(evidenceByNode));
        conflicts = List.copyOf(conflicts);
    }

    public EvidenceSet evidenceFor(String nodeId) {
        EvidenceSet set = this.evidenceByNode.get(nodeId);
        return set != null ? set : EvidenceSet.empty(nodeId);
    }

    public boolean hasConflicts() {
        return !this.conflicts.isEmpty();
    }
}
