package com.iudex.cograg.rag.fusion;

import com.iudex.cograg.config.FusionProperties;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.EmbeddingException;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.model.RetrievalCandidate;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.service.ProviderCallGuard;
import com.iudex.cograg.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Parallel multi-backend retrieval merged with weighted Reciprocal Rank Fusion.
 *
 * <p>Every adapter runs concurrently with its own timeout. A failed, rejected or timed-out
 * adapter is logged and excluded; fusion never fails as a whole. Candidates returned by several
 * backends sum their contributions and are merged by content hash.</p>
 */
@Service
public class HybridFusionService {
    private static final Logger log = LoggerFactory.getLogger(HybridFusionService.class);
    private static final Comparator<FusedResult> RANKING = Comparator
            .comparingDouble(FusedResult::rrfScore).reversed()
            .thenComparing(result -> result.id() == null ? "" : result.id())
            .thenComparing(FusedResult::dedupKey);
    private final FusionProperties properties;
    private final ProviderCallGuard callGuard;
    private final ExecutorService ragExecutor;

    public HybridFusionService(FusionProperties properties, ProviderCallGuard callGuard, @Qualifier("ragExecutor") ExecutorService ragExecutor) {
        this.properties = properties;
        this.callGuard = callGuard;
        this.ragExecutor = ragExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Hybrid fusion initialized (rrfK={}, graphWeight={}, overrides={}, defaultTimeoutMs={})",
                this.properties.getRrfK(), this.properties.getGraphWeight(), this.properties.getWeightOverrides(), this.properties.getDefaultTimeoutMs());
    }

    public List<FusedResult> fuse(String query, FusionWeights weights, List<RetrievalAdapter> adapters, int topK) {
        return this.fuse(query, weights, adapters, topK, Map.of(), RequestContext.detached(Query.of(query, "default"))).results();
    }

    public FusionOutcome fuse(String query, FusionWeights weights, List<RetrievalAdapter> adapters, int topK,
                              Map<String, Object> filters, RequestContext context) {
        long startTime = System.currentTimeMillis();
        RetrievalRequest request = new RetrievalRequest(query, context.tenantId(), context.scope(), filters, topK);
        Map<RetrievalAdapter, CompletableFuture<List<RetrievalCandidate>>> futures = new LinkedHashMap<>();
        Map<BackendType, Integer> counts = new EnumMap<>(BackendType.class);
        List<String> failed = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean deadlineHit = false;

        for (RetrievalAdapter adapter : adapters) {
            try {
                futures.put(adapter, CompletableFuture.supplyAsync(() -> this.callGuard.call(
                        context.tenantId(), adapter.name(), "search", request.cacheKey(), () -> adapter.retrieve(request)), this.ragExecutor));
            } catch (RejectedExecutionException e) {
                if (log.isWarnEnabled()) {
                    log.warn("Fusion: executor saturated, skipping backend '{}'", adapter.name());
                }
                failed.add(adapter.name());
                warnings.add("backend " + adapter.name() + " skipped: executor saturated");
            }
        }

        Map<BackendType, List<RetrievalCandidate>> ranked = new LinkedHashMap<>();
        for (Map.Entry<RetrievalAdapter, CompletableFuture<List<RetrievalCandidate>>> entry : futures.entrySet()) {
            RetrievalAdapter adapter = entry.getKey();
            CompletableFuture<List<RetrievalCandidate>> future = entry.getValue();
            long adapterTimeout = this.properties.timeoutFor(adapter.backend());
            long remainingMs = Math.min(startTime + adapterTimeout - System.currentTimeMillis(), context.budget().remainingMillis());
            if (remainingMs <= 0L) {
                future.cancel(true);
                deadlineHit |= context.budget().isExpired();
                failed.add(adapter.name());
                warnings.add("backend " + adapter.name() + " timed out after " + adapterTimeout + "ms");
                if (log.isWarnEnabled()) {
                    log.warn("Fusion: backend '{}' out of time before fan-in", adapter.name());
                }
                continue;
            }
            try {
                List<RetrievalCandidate> candidates = future.get(remainingMs, TimeUnit.MILLISECONDS);
                List<RetrievalCandidate> safe = candidates == null ? List.of() : candidates;
                if (ranked.putIfAbsent(adapter.backend(), safe) != null) {
                    log.warn("Fusion: second adapter for backend '{}' ignored", adapter.name());
                    warnings.add("backend " + adapter.name() + " listed twice; extra adapter ignored");
                    continue;
                }
                counts.merge(adapter.backend(), safe.size(), Integer::sum);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                failed.add(adapter.name());
                warnings.add("backend " + adapter.name() + " interrupted");
                log.warn("Fusion: interrupted while waiting for backend '{}'", adapter.name());
            } catch (TimeoutException e) {
                future.cancel(true);
                deadlineHit |= context.budget().isExpired();
                failed.add(adapter.name());
                warnings.add("backend " + adapter.name() + " timed out after " + adapterTimeout + "ms");
                if (log.isWarnEnabled()) {
                    log.warn("Fusion: backend '{}' timed out (waited {}ms)", adapter.name(), remainingMs);
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                failed.add(adapter.name());
                if (cause instanceof EmbeddingException) {
                    warnings.add("embedding failed; vector search skipped");
                } else {
                    warnings.add("backend " + adapter.name() + " unavailable: " + LogSanitizer.sanitize(cause.getMessage()));
                }
                if (log.isWarnEnabled()) {
                    log.warn("Fusion: backend '{}' failed: {}", adapter.name(), LogSanitizer.sanitize(cause.getMessage()));
                }
            }
        }

        List<FusedResult> fused = this.reciprocalRankFusion(ranked, weights, topK);
        long elapsed = System.currentTimeMillis() - startTime;
        warnings.forEach(context::addWarning);
        context.trace().addStep(ReasoningStep.StepType.FUSION, "Hybrid retrieval with RRF fusion",
                String.format("%d backends answered, %d failed, %d fused results", ranked.size(), failed.size(), fused.size()),
                elapsed, Map.of("candidateCounts", counts.toString(), "failedBackends", List.copyOf(failed), "fusedResults", fused.size()));
        log.info("Fusion: {} backends, {} failed, {} fused in {}ms for {}", ranked.size(), failed.size(), fused.size(), elapsed,
                LogSanitizer.querySummary(query));
        return new FusionOutcome(fused, counts, failed, warnings, deadlineHit);
    }

    /**
     * Weighted RRF over the ranked lists that arrived. Ranks follow each backend's own order;
     * a repeated dedup key inside one list keeps only its best rank. Only backends that returned
     * something count toward the normalization ceiling.
     */
    List<FusedResult> reciprocalRankFusion(Map<BackendType, List<RetrievalCandidate>> ranked, FusionWeights weights, int topK) {
        int rrfK = Math.max(1, this.properties.getRrfK());
        Map<String, Accumulator> byKey = new LinkedHashMap<>();
        double maxAttainable = 0.0;
        for (Map.Entry<BackendType, List<RetrievalCandidate>> entry : ranked.entrySet()) {
            BackendType backend = entry.getKey();
            double weight = weights.weightFor(backend);
            if (entry.getValue().isEmpty()) {
                continue;
            }
            maxAttainable += weight / (rrfK + 1.0);
            Set<String> seenInBackend = new HashSet<>();
            int rank = 0;
            for (RetrievalCandidate candidate : entry.getValue()) {
                String key = ContentHasher.dedupKey(candidate.text());
                if (!seenInBackend.add(key)) {
                    continue;
                }
                rank++;
                double contribution = rrfContribution(weight, rrfK, rank);
                byKey.computeIfAbsent(key, Accumulator::new).add(backend, candidate, contribution);
            }
        }
        List<FusedResult> results = new ArrayList<>(byKey.size());
        for (Accumulator accumulator : byKey.values()) {
            double normalized = maxAttainable > 0.0 ? Math.min(1.0, accumulator.score / maxAttainable) : 0.0;
            results.add(new FusedResult(accumulator.representative, accumulator.score, normalized, accumulator.backends, accumulator.key));
        }
        results.sort(RANKING);
        return results.size() > topK ? new ArrayList<>(results.subList(0, Math.max(0, topK))) : results;
    }

    static double rrfContribution(double weight, int rrfK, int rank) {
        return weight * (1.0 / (rrfK + rank));
    }

    private static final class Accumulator {
        private final String key;
        private final List<BackendType> backends = new ArrayList<>();
        private RetrievalCandidate representative;
        private double bestContribution = -1.0;
        private double score;

        private Accumulator(String key) {
            this.key = key;
        }

        private void add(BackendType backend, RetrievalCandidate candidate, double contribution) {
            this.score += contribution;
            if (!this.backends.contains(backend)) {
                this.backends.add(backend);
            }
            if (contribution > this.bestContribution) {
                this.bestContribution = contribution;
                this.representative = candidate;
            }
        }
    }
}
