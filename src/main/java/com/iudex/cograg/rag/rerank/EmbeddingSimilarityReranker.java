package com.iudex.cograg.rag.rerank;

import com.iudex.cograg.capability.EmbeddingService;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.model.FusedResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Secondary reranker: cosine similarity between the query embedding and each passage embedding.
 * A passage whose embedding fails keeps its fusion score.
 */
@Component
public class EmbeddingSimilarityReranker implements Reranker {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingSimilarityReranker.class);
    private final EmbeddingService embeddingService;
    private final ExecutorService executor;
    @Value("${iudex.rerank.embedding.timeout-ms:5000}")
    private long timeoutMs = 5000L;

    @Autowired
    public EmbeddingSimilarityReranker(ObjectProvider<EmbeddingService> embeddingService, @Qualifier("rerankerExecutor") ExecutorService executor) {
        this(embeddingService.getIfAvailable(), executor);
    }

    EmbeddingSimilarityReranker(EmbeddingService embeddingService, ExecutorService executor) {
        this.embeddingService = embeddingService;
        this.executor = executor;
    }

    @Override
    public RerankProvider provider() {
        return RerankProvider.EMBEDDING;
    }

    @Override
    public boolean isAvailable() {
        return this.embeddingService != null;
    }

    @Override
    public List<FusedResult> rerank(String query, List<FusedResult> candidates, RequestContext context) {
        float[] queryVector;
        try {
            queryVector = this.embeddingService.embed(query);
        } catch (RuntimeException e) {
            throw new RerankException("Query embedding failed: " + e.getMessage(), e);
        }
        List<Future<float[]>> futures = new ArrayList<>(candidates.size());
        for (FusedResult candidate : candidates) {
            try {
                futures.add(this.executor.submit(() -> this.embeddingService.embed(candidate.text())));
            } catch (RejectedExecutionException e) {
                futures.add(null);
            }
        }
        long deadline = System.currentTimeMillis() + context.budget().remainingMillis(this.timeoutMs);
        List<FusedResult> reranked = new ArrayList<>(candidates.size());
        int failures = 0;
        for (int i = 0; i < candidates.size(); i++) {
            FusedResult candidate = candidates.get(i);
            float[] vector = this.await(futures.get(i), deadline);
            if (vector == null) {
                failures++;
                reranked.add(candidate);
                continue;
            }
            reranked.add(candidate.withScore(Math.max(0.0, cosine(queryVector, vector))));
        }
        if (failures == candidates.size()) {
            throw new RerankException("No passage could be embedded");
        }
        if (failures > 0 && log.isWarnEnabled()) {
            log.warn("Embedding reranker kept fusion scores for {} of {} passages", failures, candidates.size());
        }
        return reranked;
    }

    private float[] await(Future<float[]> future, long deadline) {
        if (future == null) {
            return null;
        }
        long remaining = deadline - System.currentTimeMillis();
        if (remaining <= 0L) {
            future.cancel(true);
            return null;
        }
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            return null;
        } catch (ExecutionException e) {
            log.debug("Passage embedding failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return null;
        }
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
