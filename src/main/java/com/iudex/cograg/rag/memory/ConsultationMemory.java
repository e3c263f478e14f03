package com.iudex.cograg.rag.memory;

import com.iudex.cograg.rag.cograg.planner.TreeSnapshot;
import com.iudex.cograg.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Similarity-indexed memory of answered consultations.
 *
 * <p>Recall compares stopword-filtered keyword sets with Jaccard similarity over the tenant's most
 * recent records. A record is returned only for the same tenant and at or above the threshold;
 * on equal similarity the newer record wins. Store failures degrade to "no memory" and are
 * logged, never thrown.</p>
 */
@Service
public class ConsultationMemory {
    private static final Logger log = LoggerFactory.getLogger(ConsultationMemory.class);
    private final ConsultationStore store;
    @Value(value="${iudex.memory.enabled:true}")
    private boolean enabled = true;
    @Value(value="${iudex.memory.similarity-threshold:0.85}")
    private double similarityThreshold = 0.85;
    @Value(value="${iudex.memory.recall-window:50}")
    private int recallWindow = 50;

    public ConsultationMemory(ConsultationStore store) {
        this.store = store;
    }

    @PostConstruct
    public void init() {
        log.info("Consultation memory initialized (enabled={}, threshold={}, recallWindow={}, store={})",
                this.enabled, this.similarityThreshold, this.recallWindow, this.store.getClass().getSimpleName());
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    public Optional<SimilarConsultation> findSimilar(String query, String tenantId) {
        return this.findSimilar(query, tenantId, this.similarityThreshold);
    }

    public Optional<SimilarConsultation> findSimilar(String query, String tenantId, double threshold) {
        if (tenantId == null || query == null || query.isBlank()) {
            return Optional.empty();
        }
        Set<String> keywords = KeywordExtractor.extract(query);
        if (keywords.isEmpty()) {
            return Optional.empty();
        }
        List<ConsultationRecord> candidates;
        try {
            candidates = this.store.recent(tenantId, this.recallWindow);
        } catch (RuntimeException e) {
            log.warn("Memory: recall failed for tenant {}: {}", tenantId, e.getMessage());
            return Optional.empty();
        }
        ConsultationRecord best = null;
        double bestSimilarity = -1.0;
        for (ConsultationRecord record : candidates) {
            if (!tenantId.equals(record.tenantId())) {
                continue;
            }
            double similarity = KeywordExtractor.jaccard(keywords, record.keywords());
            if (similarity >= threshold && similarity > bestSimilarity) {
                best = record;
                bestSimilarity = similarity;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        log.info("Memory: recalled consultation {} (similarity={}) for {}", best.id(), String.format("%.3f", bestSimilarity),
                LogSanitizer.querySummary(query));
        return Optional.of(new SimilarConsultation(best, bestSimilarity, best.penalizedReferences()));
    }

    /**
     * @return the new record id, or {@code null} when the store rejected the write
     */
    public String store(String query, String tenantId, TreeSnapshot tree, Map<String, String> nodeAnswers, String finalAnswer,
                        List<String> citations) {
        ConsultationRecord record = new ConsultationRecord(UUID.randomUUID().toString(), tenantId, query,
                KeywordExtractor.extract(query), tree, nodeAnswers, finalAnswer, citations, Instant.now(), List.of());
        try {
            this.store.save(record);
            log.debug("Memory: stored consultation {} for tenant {}", record.id(), tenantId);
            return record.id();
        } catch (RuntimeException e) {
            log.warn("Memory: failed to store consultation for tenant {}: {}", tenantId, e.getMessage());
            return null;
        }
    }

    public boolean applyCorrection(String recordId, List<String> badReferences, String note) {
        return this.applyCorrection(recordId, badReferences, note, null);
    }

    public boolean applyCorrection(String recordId, List<String> badReferences, String note, String reviewerId) {
        if (recordId == null || badReferences == null || badReferences.isEmpty()) {
            return false;
        }
        boolean applied = this.store.appendCorrection(recordId, new Correction(badReferences, note, reviewerId, Instant.now()));
        if (applied) {
            log.info("Memory: correction with {} references applied to consultation {}", badReferences.size(), recordId);
        }
        return applied;
    }
}
