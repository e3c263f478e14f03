package com.iudex.cograg.rag.rerank;

import java.util.Locale;

public enum RerankProvider {
    /** Listwise relevance scoring by the language model, cross-encoder style. */
    LLM,
    /** Query/passage embedding cosine similarity. */
    EMBEDDING,
    /** No reranker ran; fusion scores kept. */
    PASSTHROUGH;

    public static RerankProvider fromKey(String key) {
        return RerankProvider.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
