package com.iudex.cograg.rag.fusion;

import com.iudex.cograg.capability.IndexHit;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.RetrievalCandidate;
import com.iudex.cograg.model.SourceMetadata;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin wrapper that turns one backend capability into ranked {@link RetrievalCandidate}s.
 *
 * <p>Implementations throw {@link com.iudex.cograg.exception.BackendUnavailableException} or
 * {@link com.iudex.cograg.exception.EmbeddingException}; fusion treats both as soft failures.</p>
 */
public interface RetrievalAdapter {

    BackendType backend();

    default String name() {
        return this.backend().key();
    }

    List<RetrievalCandidate> retrieve(RetrievalRequest request);

    static List<RetrievalCandidate> toCandidates(BackendType backend, List<IndexHit> hits) {
        List<RetrievalCandidate> candidates = new ArrayList<>();
        if (hits == null) {
            return candidates;
        }
        for (IndexHit hit : hits) {
            if (hit == null || hit.text() == null || hit.text().isBlank()) {
                continue;
            }
            candidates.add(new RetrievalCandidate(backend, hit.id(), hit.text(), hit.score(), SourceMetadata.fromMap(hit.metadata())));
        }
        return candidates;
    }
}
