package com.iudex.cograg.rag.memory;

import java.util.Set;

public record SimilarConsultation(ConsultationRecord record, double similarity, Set<String> penalizedReferences) {

    public SimilarConsultation {
        penalizedReferences = Set.copyOf(penalizedReferences);
    }

    public String consultationId() {
        return this.record.id();
    }
}
