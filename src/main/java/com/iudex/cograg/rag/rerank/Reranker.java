package com.iudex.cograg.rag.rerank;

import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.model.FusedResult;
import java.util.List;

/**
 * One reranking model. Returns the same candidates with relevance scores in [0,1], or throws
 * {@link RerankException} so the caller can move on to the next provider in its chain.
 */
public interface Reranker {

    RerankProvider provider();

    boolean isAvailable();

    List<FusedResult> rerank(String query, List<FusedResult> candidates, RequestContext context);
}
