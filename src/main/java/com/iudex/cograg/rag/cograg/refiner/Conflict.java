package com.iudex.cograg.rag.cograg.refiner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A pair of evidence chunks that appear to disagree. Informational: it never removes evidence.
 *
 * @param nodeIds   one node for {@link ConflictType#INTRA_NODE}, two for {@link ConflictType#CROSS_NODE}
 * @param resultIds ids of the two chunks involved
 * @param signals   labels of the rules that fired
 */
public record Conflict(ConflictType type, List<String> nodeIds, List<String> resultIds, List<String> signals) {

    public Conflict {
        nodeIds = List.copyOf(nodeIds);
        resultIds = List.copyOf(resultIds);
        signals = List.copyOf(signals);
    }

    public boolean involves(String nodeId) {
        return this.nodeIds.contains(nodeId);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", this.type.label());
        map.put("nodes", this.nodeIds);
        map.put("results", this.resultIds);
        map.put("signals", this.signals);
        return map;
    }
}
