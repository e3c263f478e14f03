package com.iudex.cograg.rag.memory;

import com.iudex.cograg.constant.LegalPatterns;
import com.iudex.cograg.rag.cograg.planner.TreeSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An answered consultation. Created once at integration time; only corrections are appended later.
 *
 * @param tree        decomposition tree, {@code null} when none was built
 * @param nodeAnswers answer text per leaf node id
 */
public record ConsultationRecord(String id, String tenantId, String query, Set<String> keywords, TreeSnapshot tree,
                                 Map<String, String> nodeAnswers, String finalAnswer, List<String> citations,
                                 Instant createdAt, List<Correction> corrections) {

    public ConsultationRecord {
        keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        nodeAnswers = Map.copyOf(nodeAnswers);
        citations = List.copyOf(citations);
        corrections = List.copyOf(corrections);
    }

    public ConsultationRecord withCorrection(Correction correction) {
        List<Correction> updated = new ArrayList<>(this.corrections);
        updated.add(correction);
        return new ConsultationRecord(this.id, this.tenantId, this.query, this.keywords, this.tree, this.nodeAnswers,
                this.finalAnswer, this.citations, this.createdAt, updated);
    }

    /**
     * Every reference flagged by any correction, both as given and in normalized citation form.
     */
    public Set<String> penalizedReferences() {
        Set<String> refs = new LinkedHashSet<>();
        for (Correction correction : this.corrections) {
            for (String ref : correction.badReferences()) {
                if (ref != null && !ref.isBlank()) {
                    refs.add(ref.trim());
                    refs.add(LegalPatterns.normalizeReference(ref));
                }
            }
        }
        return refs;
    }
}
