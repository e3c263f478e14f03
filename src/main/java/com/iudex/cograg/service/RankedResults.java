package com.iudex.cograg.service;

import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.rag.classifier.Classification;
import com.iudex.cograg.rag.crag.GateDecision;
import com.iudex.cograg.rag.rerank.RerankProvider;
import java.util.List;
import java.util.Map;

/**
 * Output of the simple-query path.
 *
 * @param effectiveQuery query text that produced {@code results}; differs from {@code query} after a rewrite retry
 * @param warnings       non-fatal warnings (failed backends, skipped embedding, reranker fallback)
 * @param timedOut       true when the request deadline cut the search short; {@code results} holds the best partial ranking
 */
public record RankedResults(String query, String effectiveQuery, List<FusedResult> results, Classification classification,
                            GateDecision gate, RerankProvider rerankProvider, List<String> warnings, boolean timedOut,
                            int retryRounds, Map<String, Object> metadata) {

    public RankedResults {
        results = List.copyOf(results);
        warnings = List.copyOf(warnings);
        metadata = Map.copyOf(metadata);
    }

    public boolean isEmpty() {
        return this.results.isEmpty();
    }

    public boolean gatePassed() {
        return this.gate != null && this.gate.passed();
    }
}
