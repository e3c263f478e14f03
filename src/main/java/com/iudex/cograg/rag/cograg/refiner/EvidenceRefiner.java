package com.iudex.cograg.rag.cograg.refiner;

import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.reasoning.ReasoningStep;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Scores, sorts and cross-checks the evidence gathered for each tree node.
 *
 * <p>Intra-node checks compare each chunk with the next {@code conflictWindow} chunks of the
 * same node; cross-node checks compare only the top {@code crossNodeTop} chunks of every pair of
 * nodes. A node touched by any conflict keeps all its evidence and is flagged.</p>
 */
@Service
public class EvidenceRefiner {
    private static final Logger log = LoggerFactory.getLogger(EvidenceRefiner.class);
    private final EvidenceQualityScorer scorer;
    private final ContradictionPolicy contradictionPolicy;
    @Value(value="${iudex.refiner.enabled:true}")
    private boolean enabled = true;
    @Value(value="${iudex.refiner.conflict-window:5}")
    private int conflictWindow = 5;
    @Value(value="${iudex.refiner.cross-node-top:3}")
    private int crossNodeTop = 3;

    public EvidenceRefiner(EvidenceQualityScorer scorer, ContradictionPolicy contradictionPolicy) {
        this.scorer = scorer;
        this.contradictionPolicy = contradictionPolicy;
    }

    @PostConstruct
    public void init() {
        log.info("Evidence refiner initialized (enabled={}, conflictWindow={}, crossNodeTop={}, policy={})",
                this.enabled, this.conflictWindow, this.crossNodeTop, this.contradictionPolicy.getClass().getSimpleName());
    }

    public RefinementResult refine(Map<String, List<FusedResult>> evidenceByNode) {
        return this.refine(evidenceByNode, RequestContext.detached(Query.of("refinement", "default")));
    }

    public RefinementResult refine(Map<String, List<FusedResult>> evidenceByNode, RequestContext context) {
        long startTime = System.currentTimeMillis();
        Map<String, EvidenceSet> refined = new LinkedHashMap<>();
        for (Map.Entry<String, List<FusedResult>> entry : evidenceByNode.entrySet()) {
            refined.put(entry.getKey(), this.score(entry.getKey(), entry.getValue()));
        }
        if (!this.enabled) {
            context.trace().addStep(ReasoningStep.StepType.REFINEMENT, "Evidence refinement", "disabled: passthrough",
                    System.currentTimeMillis() - startTime);
            return new RefinementResult(refined, List.of());
        }

        List<Conflict> conflicts = new ArrayList<>();
        for (EvidenceSet set : refined.values()) {
            conflicts.addAll(this.intraNodeConflicts(set));
        }
        conflicts.addAll(this.crossNodeConflicts(new ArrayList<>(refined.values())));

        Set<String> conflicted = new HashSet<>();
        for (Conflict conflict : conflicts) {
            conflicted.addAll(conflict.nodeIds());
        }
        for (String nodeId : conflicted) {
            refined.computeIfPresent(nodeId, (id, set) -> set.withConflicts());
        }

        long elapsed = System.currentTimeMillis() - startTime;
        int chunks = refined.values().stream().mapToInt(set -> set.results().size()).sum();
        context.trace().addStep(ReasoningStep.StepType.REFINEMENT, "Evidence refinement",
                String.format("%d nodes, %d chunks, %d conflicts", refined.size(), chunks, conflicts.size()),
                elapsed, Map.of("conflicts", conflicts.size(), "conflictedNodes", List.copyOf(conflicted)));
        if (!conflicts.isEmpty()) {
            log.info("Refiner: {} conflicts across {} nodes", conflicts.size(), conflicted.size());
        }
        return new RefinementResult(refined, conflicts);
    }

    private EvidenceSet score(String nodeId, List<FusedResult> results) {
        if (results == null || results.isEmpty()) {
            return EvidenceSet.empty(nodeId);
        }
        Map<String, Double> quality = new HashMap<>();
        List<FusedResult> ordered = new ArrayList<>(results);
        double sum = 0.0;
        for (FusedResult result : ordered) {
            double value = this.scorer.score(result);
            quality.put(keyOf(result), value);
            sum += value;
        }
        if (this.enabled) {
            ordered.sort(Comparator.comparingDouble((FusedResult result) -> quality.get(keyOf(result))).reversed());
        }
        double average = EvidenceQualityScorer.round(sum / ordered.size());
        return new EvidenceSet(nodeId, ordered, average, false, quality);
    }

    private List<Conflict> intraNodeConflicts(EvidenceSet set) {
        List<Conflict> conflicts = new ArrayList<>();
        List<FusedResult> results = set.results();
        for (int i = 0; i < results.size(); i++) {
            int end = Math.min(results.size(), i + Math.max(1, this.conflictWindow));
            for (int j = i + 1; j < end; j++) {
                List<String> signals = this.contradictionPolicy.signals(results.get(i).text(), results.get(j).text());
                if (!signals.isEmpty()) {
                    conflicts.add(new Conflict(ConflictType.INTRA_NODE, List.of(set.nodeId()),
                            List.of(keyOf(results.get(i)), keyOf(results.get(j))), signals));
                }
            }
        }
        return conflicts;
    }

    private List<Conflict> crossNodeConflicts(List<EvidenceSet> sets) {
        List<Conflict> conflicts = new ArrayList<>();
        int top = Math.max(1, this.crossNodeTop);
        for (int a = 0; a < sets.size(); a++) {
            List<FusedResult> first = head(sets.get(a).results(), top);
            for (int b = a + 1; b < sets.size(); b++) {
                List<FusedResult> second = head(sets.get(b).results(), top);
                for (FusedResult left : first) {
                    for (FusedResult right : second) {
                        if (left.dedupKey().equals(right.dedupKey())) {
                            continue;
                        }
                        List<String> signals = this.contradictionPolicy.signals(left.text(), right.text());
                        if (!signals.isEmpty()) {
                            conflicts.add(new Conflict(ConflictType.CROSS_NODE, List.of(sets.get(a).nodeId(), sets.get(b).nodeId()),
                                    List.of(keyOf(left), keyOf(right)), signals));
                        }
                    }
                }
            }
        }
        return conflicts;
    }

    private static List<FusedResult> head(List<FusedResult> results, int limit) {
        return results.size() > limit ? results.subList(0, limit) : results;
    }

    private static String keyOf(FusedResult result) {
        return result.id() != null ? result.id() : result.dedupKey();
    }
}
