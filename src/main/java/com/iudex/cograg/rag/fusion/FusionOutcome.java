package com.iudex.cograg.rag.fusion;

import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.FusedResult;
import java.util.List;
import java.util.Map;

/**
 * Fused ranking plus the per-backend bookkeeping needed for result metadata.
 *
 * @param candidateCounts raw hit count per backend that answered
 * @param failedBackends  backends excluded because they failed or timed out
 * @param warnings        human-readable, non-fatal warnings
 */
public record FusionOutcome(List<FusedResult> results, Map<BackendType, Integer> candidateCounts,
                            List<String> failedBackends, List<String> warnings, boolean deadlineHit) {

    public FusionOutcome {
        results = List.copyOf(results);
        candidateCounts = Map.copyOf(candidateCounts);
        failedBackends = List.copyOf(failedBackends);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return this.results.isEmpty();
    }
}
