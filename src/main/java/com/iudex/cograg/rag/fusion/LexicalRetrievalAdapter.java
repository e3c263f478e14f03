package com.iudex.cograg.rag.fusion;

import com.iudex.cograg.capability.LexicalIndex;
import com.iudex.cograg.exception.BackendUnavailableException;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.RetrievalCandidate;
import java.util.List;

public class LexicalRetrievalAdapter implements RetrievalAdapter {
    private final LexicalIndex index;

    public LexicalRetrievalAdapter(LexicalIndex index) {
        this.index = index;
    }

    @Override
    public BackendType backend() {
        return BackendType.LEXICAL;
    }

    @Override
    public List<RetrievalCandidate> retrieve(RetrievalRequest request) {
        try {
            return RetrievalAdapter.toCandidates(BackendType.LEXICAL,
                    this.index.search(request.query(), request.effectiveFilters(), request.topK()));
        } catch (BackendUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendUnavailableException(this.name(), "Lexical search failed: " + e.getMessage(), e);
        }
    }
}
