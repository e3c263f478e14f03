package com.iudex.cograg.rag.cograg.integrator;

import com.iudex.cograg.rag.cograg.reasoner.SubAnswer;
import com.iudex.cograg.rag.cograg.refiner.Conflict;
import java.util.List;
import java.util.Map;

/**
 * Audit block of one cognitive request: the mind-map, intermediate answers and budget usage.
 *
 * @param mindMap               nested rendering of the decomposition tree; empty when planning never ran
 * @param qualityByNode         refined evidence quality per node
 * @param consultationId        id under which this consultation was stored, {@code null} when not stored
 * @param reusedConsultationId  id of the recalled consultation whose tree was reused, if any
 */
public record CognitiveAudit(String traceId, Map<String, Object> mindMap, List<SubAnswer> subAnswers, List<Conflict> conflicts,
                             Map<String, Double> qualityByNode, List<String> warnings, boolean timedOut, String consultationId,
                             String reusedConsultationId, Map<String, Object> budgetUsage) {

    public CognitiveAudit {
        mindMap = mindMap == null ? Map.of() : Map.copyOf(mindMap);
        subAnswers = List.copyOf(subAnswers);
        conflicts = List.copyOf(conflicts);
        qualityByNode = Map.copyOf(qualityByNode);
        warnings = List.copyOf(warnings);
        budgetUsage = Map.copyOf(budgetUsage);
    }
}
