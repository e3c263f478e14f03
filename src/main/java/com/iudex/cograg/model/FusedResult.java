package com.iudex.cograg.model;

import java.util.List;

/**
 * A candidate after rank fusion.
 *
 * @param candidate   representative candidate (text and metadata of the strongest contributing backend)
 * @param rrfScore    raw weighted reciprocal-rank score
 * @param score       current relevance score in [0,1]; normalized RRF after fusion, replaced by rerankers
 * @param backends    backends that returned this content
 * @param dedupKey    content hash, unique within one fusion call
 */
public record FusedResult(RetrievalCandidate candidate, double rrfScore, double score, List<BackendType> backends, String dedupKey) {

    public FusedResult {
        backends = List.copyOf(backends);
    }

    public FusedResult withScore(double newScore) {
        return new FusedResult(this.candidate, this.rrfScore, newScore, this.backends, this.dedupKey);
    }

    public String id() {
        return this.candidate.id();
    }

    public String text() {
        return this.candidate.text();
    }

    public SourceMetadata metadata() {
        return this.candidate.metadata();
    }
}
