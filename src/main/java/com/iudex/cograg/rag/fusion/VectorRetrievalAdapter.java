package com.iudex.cograg.rag.fusion;

import com.iudex.cograg.capability.EmbeddingService;
import com.iudex.cograg.capability.VectorIndex;
import com.iudex.cograg.exception.BackendUnavailableException;
import com.iudex.cograg.exception.EmbeddingException;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.RetrievalCandidate;
import java.util.List;

/**
 * Embeds the query, then searches the vector index. An embedding failure surfaces as
 * {@link EmbeddingException} so the caller can report that dense search was skipped.
 */
public class VectorRetrievalAdapter implements RetrievalAdapter {
    private final VectorIndex index;
    private final EmbeddingService embeddingService;

    public VectorRetrievalAdapter(VectorIndex index, EmbeddingService embeddingService) {
        this.index = index;
        this.embeddingService = embeddingService;
    }

    @Override
    public BackendType backend() {
        return BackendType.VECTOR;
    }

    @Override
    public List<RetrievalCandidate> retrieve(RetrievalRequest request) {
        float[] embedding;
        try {
            embedding = this.embeddingService.embed(request.query());
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingException("Query embedding failed: " + e.getMessage(), e);
        }
        try {
            return RetrievalAdapter.toCandidates(BackendType.VECTOR,
                    this.index.search(embedding, request.effectiveFilters(), request.topK()));
        } catch (BackendUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendUnavailableException(this.name(), "Vector search failed: " + e.getMessage(), e);
        }
    }
}
