package com.iudex.cograg.rag.crag;

import com.iudex.cograg.model.FusedResult;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Corrective quality gate over fused or reranked results.
 *
 * <p>The decision depends only on the scores and thresholds passed in: {@code pass} iff
 * {@code best >= minBest} and {@code avgTop3 >= minAvgTop3}.</p>
 */
@Component
public class CragGate {
    private static final Logger log = LoggerFactory.getLogger(CragGate.class);
    private static final int TOP_N = 3;
    @Value("${iudex.crag.min-best:0.5}")
    private double minBest = 0.5;
    @Value("${iudex.crag.min-avg-top3:0.35}")
    private double minAvgTop3 = 0.35;
    @Value("${iudex.crag.strong-best:0.70}")
    private double strongBest = 0.70;
    @Value("${iudex.crag.strong-avg:0.55}")
    private double strongAvg = 0.55;

    @PostConstruct
    public void init() {
        log.info("CRAG gate initialized (minBest={}, minAvgTop3={}, strongBest={}, strongAvg={})",
                this.minBest, this.minAvgTop3, this.strongBest, this.strongAvg);
    }

    public GateDecision evaluate(List<FusedResult> results) {
        return this.evaluate(results, this.minBest, this.minAvgTop3);
    }

    public GateDecision evaluate(List<FusedResult> results, double minBest, double minAvgTop3) {
        if (results == null || results.isEmpty()) {
            return GateDecision.nothingToCorrect();
        }
        double[] scores = results.stream().mapToDouble(FusedResult::score).sorted().toArray();
        double best = scores[scores.length - 1];
        double avgTop3 = averageTop(scores, TOP_N);
        return this.decide(best, avgTop3, minBest, minAvgTop3, results.size());
    }

    GateDecision decide(double best, double avgTop3, double minBest, double minAvgTop3, int resultCount) {
        boolean passed = best >= minBest && avgTop3 >= minAvgTop3;
        EvidenceLevel level = this.classify(best, avgTop3, passed);
        List<String> reasons = new ArrayList<>();
        reasons.add(String.format(Locale.ROOT, "best_score=%.3f (threshold=%.2f)", best, minBest));
        reasons.add(String.format(Locale.ROOT, "avg_top3=%.3f (threshold=%.2f)", avgTop3, minAvgTop3));
        if (best < minBest) {
            reasons.add("best score below minimum");
        }
        if (avgTop3 < minAvgTop3) {
            reasons.add("average of top 3 below minimum");
        }
        reasons.add(passed ? "gate passed" : "gate failed");
        return new GateDecision(passed, best, avgTop3, String.join("; ", reasons), level, recommendedActions(level), resultCount);
    }

    private EvidenceLevel classify(double best, double avgTop3, boolean passed) {
        if (passed && best >= this.strongBest && avgTop3 >= this.strongAvg) {
            return EvidenceLevel.STRONG;
        }
        if (passed) {
            return EvidenceLevel.MODERATE;
        }
        return best > 0.0 || avgTop3 > 0.0 ? EvidenceLevel.LOW : EvidenceLevel.INSUFFICIENT;
    }

    private static List<CorrectiveAction> recommendedActions(EvidenceLevel level) {
        return switch (level) {
            case STRONG, MODERATE -> List.of();
            case LOW -> List.of(CorrectiveAction.REWRITE_QUERY, CorrectiveAction.EXPAND_TOP_K);
            case INSUFFICIENT -> List.of(CorrectiveAction.REWRITE_QUERY, CorrectiveAction.EXPAND_TOP_K, CorrectiveAction.EXPAND_SOURCES);
        };
    }

    static double averageTop(double[] ascending, int n) {
        int count = Math.min(n, ascending.length);
        if (count == 0) {
            return 0.0;
        }
        double[] top = Arrays.copyOfRange(ascending, ascending.length - count, ascending.length);
        double sum = 0.0;
        for (double score : top) {
            sum += score;
        }
        return sum / count;
    }

    public double getMinBest() {
        return this.minBest;
    }

    public double getMinAvgTop3() {
        return this.minAvgTop3;
    }
}
