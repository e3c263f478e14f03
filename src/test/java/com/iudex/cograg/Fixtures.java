package com.iudex.cograg;

import com.iudex.cograg.capability.LanguageModelService;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.RetrievalCandidate;
import com.iudex.cograg.model.SourceMetadata;
import com.iudex.cograg.rag.fusion.ContentHasher;
import com.iudex.cograg.service.GuardedLanguageModel;
import com.iudex.cograg.service.ProviderCallGuard;
import java.util.List;
import java.util.Map;

/**
 * Builders for the result types most tests need.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static FusedResult fused(String id, String text, double score) {
        return fused(id, text, score, null);
    }

    public static FusedResult fused(String id, String text, double score, String documentType) {
        SourceMetadata metadata = new SourceMetadata(documentType, null, null, Map.of());
        RetrievalCandidate candidate = new RetrievalCandidate(BackendType.LEXICAL, id, text, score, metadata);
        return new FusedResult(candidate, score / 60.0, score, List.of(BackendType.LEXICAL), ContentHasher.dedupKey(text));
    }

    public static RetrievalCandidate candidate(BackendType backend, String id, String text) {
        return new RetrievalCandidate(backend, id, text, 1.0, SourceMetadata.EMPTY);
    }

    /**
     * Wraps a (usually mocked) model in a fresh guard, so cached completions never leak between tests.
     */
    public static GuardedLanguageModel guarded(LanguageModelService languageModel) {
        return new GuardedLanguageModel(languageModel, new ProviderCallGuard());
    }
}
