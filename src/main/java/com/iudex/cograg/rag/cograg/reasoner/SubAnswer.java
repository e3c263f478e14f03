package com.iudex.cograg.rag.cograg.reasoner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answer to one leaf question.
 *
 * @param citations    legal references cited in the answer, as written
 * @param evidenceRefs ids of the evidence chunks the answer was built from
 * @param extractive   true when the answer was assembled from evidence text because the model failed
 */
public record SubAnswer(String nodeId, String question, String answer, double confidence, List<String> citations,
                        List<String> evidenceRefs, boolean hasConflicts, boolean gatePassed, boolean extractive) {

    public SubAnswer {
        citations = List.copyOf(citations);
        evidenceRefs = List.copyOf(evidenceRefs);
    }

    public SubAnswer withAnswer(String revised, List<String> revisedCitations) {
        return new SubAnswer(this.nodeId, this.question, revised, this.confidence, revisedCitations, this.evidenceRefs,
                this.hasConflicts, this.gatePassed, this.extractive);
    }

    public SubAnswer withConfidence(double capped) {
        return new SubAnswer(this.nodeId, this.question, this.answer, capped, this.citations, this.evidenceRefs,
                this.hasConflicts, this.gatePassed, this.extractive);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("nodeId", this.nodeId);
        map.put("question", this.question);
        map.put("answer", this.answer);
        map.put("confidence", this.confidence);
        map.put("citations", this.citations);
        map.put("evidenceRefs", this.evidenceRefs);
        map.put("hasConflicts", this.hasConflicts);
        map.put("gatePassed", this.gatePassed);
        map.put("extractive", this.extractive);
        return map;
    }
}
