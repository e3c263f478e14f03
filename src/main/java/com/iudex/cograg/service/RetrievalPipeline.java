package com.iudex.cograg.service;

import com.iudex.cograg.config.FusionProperties;
import com.iudex.cograg.context.RequestBudget;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.BudgetExceededException;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.rag.classifier.Classification;
import com.iudex.cograg.rag.classifier.QueryClassifier;
import com.iudex.cograg.rag.crag.CorrectiveAction;
import com.iudex.cograg.rag.crag.CragGate;
import com.iudex.cograg.rag.crag.GateDecision;
import com.iudex.cograg.rag.crag.QueryRewriteService;
import com.iudex.cograg.rag.fusion.FusionOutcome;
import com.iudex.cograg.rag.fusion.FusionWeights;
import com.iudex.cograg.rag.fusion.HybridFusionService;
import com.iudex.cograg.rag.fusion.RetrievalAdapters;
import com.iudex.cograg.rag.rerank.RerankProvider;
import com.iudex.cograg.rag.rerank.RerankService;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.reasoning.ReasoningTracer;
import com.iudex.cograg.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Simple-query path: classify, fuse, rerank, gate, and retry once with wider scope when the
 * gate fails. Never throws; a deadline hit returns the best ranking gathered so far.
 */
@Service
public class RetrievalPipeline {
    private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);
    private final QueryClassifier classifier;
    private final HybridFusionService fusionService;
    private final RerankService rerankService;
    private final CragGate cragGate;
    private final QueryRewriteService rewriteService;
    private final RetrievalAdapters adapters;
    private final FusionProperties fusionProperties;
    private final ReasoningTracer tracer;
    @Value("${iudex.classifier.llm-enabled:true}")
    private boolean llmClassification = true;
    @Value("${iudex.crag.corrective-retry:true}")
    private boolean correctiveRetry = true;
    @Value("${iudex.crag.max-retries:1}")
    private int maxRetries = 1;
    @Value("${iudex.crag.retry-top-k-multiplier:2}")
    private int retryTopKMultiplier = 2;
    @Value("${iudex.crag.retry-top-k-cap:50}")
    private int retryTopKCap = 50;
    @Value("${iudex.retrieval.timeout-ms:15000}")
    private long searchTimeoutMs = 15000L;
    @Value("${iudex.retrieval.max-llm-calls:6}")
    private int searchMaxLlmCalls = 6;

    public RetrievalPipeline(QueryClassifier classifier, HybridFusionService fusionService, RerankService rerankService,
                             CragGate cragGate, QueryRewriteService rewriteService, RetrievalAdapters adapters,
                             FusionProperties fusionProperties, ReasoningTracer tracer) {
        this.classifier = classifier;
        this.fusionService = fusionService;
        this.rerankService = rerankService;
        this.cragGate = cragGate;
        this.rewriteService = rewriteService;
        this.adapters = adapters;
        this.fusionProperties = fusionProperties;
        this.tracer = tracer;
    }

    @PostConstruct
    public void init() {
        log.info("Retrieval pipeline initialized (backends={}, correctiveRetry={}, maxRetries={}, timeoutMs={})",
                this.adapters.all().size(), this.correctiveRetry, this.maxRetries, this.searchTimeoutMs);
    }

    public RankedResults search(String query, String tenantId, String scope, Map<String, Object> filters, int topK, boolean includeGraph) {
        Query request = new Query(query, tenantId, scope, null);
        RequestBudget budget = RequestBudget.of(Duration.ofMillis(this.searchTimeoutMs), this.searchMaxLlmCalls, Long.MAX_VALUE);
        RequestContext context = new RequestContext(request, budget, this.tracer.startTrace(tenantId, query));
        try {
            return this.search(context, request.text(), filters, topK, includeGraph);
        } finally {
            this.tracer.endTrace(context.trace());
        }
    }

    /**
     * Runs the path for {@code queryText} inside an existing request, sharing its deadline and trace.
     */
    public RankedResults search(RequestContext context, String queryText, Map<String, Object> filters, int topK, boolean includeGraph) {
        long startTime = System.currentTimeMillis();
        SearchState state = new SearchState(queryText);
        try {
            context.budget().checkDeadline("classification");
            state.classification = this.classifier.classify(queryText, this.llmClassification, context);
            FusionWeights weights = FusionWeights.from(state.classification, this.fusionProperties);
            state.best = this.attempt(context, queryText, weights, filters, topK, includeGraph, state);

            while (!state.best.gate.passed() && this.correctiveRetry && state.retryRounds < this.maxRetries) {
                context.budget().checkDeadline("crag-retry");
                state.retryRounds++;
                List<CorrectiveAction> actions = state.best.gate.recommendedActions();
                String retryQuery = actions.contains(CorrectiveAction.REWRITE_QUERY)
                        ? this.rewriteService.rewriteQuery(queryText, context) : queryText;
                int retryTopK = actions.contains(CorrectiveAction.EXPAND_TOP_K)
                        ? Math.min(Math.max(topK, topK * this.retryTopKMultiplier), Math.max(topK, this.retryTopKCap)) : topK;
                boolean retryGraph = includeGraph || actions.contains(CorrectiveAction.EXPAND_SOURCES);
                long retryStart = System.currentTimeMillis();
                Attempt retry = this.attempt(context, retryQuery, weights, filters, retryTopK, retryGraph, state);
                boolean improved = retry.isBetterThan(state.best);
                context.trace().addStep(ReasoningStep.StepType.CRAG_RETRY, "Corrective retry " + state.retryRounds,
                        String.format("actions=%s, topK=%d, improved=%s", actions, retryTopK, improved),
                        System.currentTimeMillis() - retryStart, Map.of("rewritten", !retryQuery.equals(queryText), "improved", improved));
                if (improved) {
                    state.best = retry.truncate(topK);
                }
            }
        } catch (BudgetExceededException e) {
            state.timedOut = true;
            state.warnings.add("deadline exceeded during " + e.getStage() + "; returning partial results");
            context.addWarning("deadline exceeded during " + e.getStage());
            context.trace().addStep(ReasoningStep.StepType.TIMEOUT, "Deadline exceeded", e.getMessage(), 0L);
            log.warn("Pipeline: deadline exceeded at {} for {}", e.getStage(), LogSanitizer.querySummary(queryText));
        }
        return state.toResults(queryText, System.currentTimeMillis() - startTime);
    }

    private Attempt attempt(RequestContext context, String queryText, FusionWeights weights, Map<String, Object> filters,
                            int topK, boolean includeGraph, SearchState state) {
        context.budget().checkDeadline("fusion");
        FusionOutcome fusion = this.fusionService.fuse(queryText, weights, this.adapters.forRequest(includeGraph), topK, filters, context);
        state.warnings.addAll(fusion.warnings());
        if (fusion.isEmpty()) {
            String detail = fusion.failedBackends().isEmpty() ? "no backend returned candidates"
                    : "failed backends: " + String.join(", ", fusion.failedBackends());
            GateDecision gate = GateDecision.noEvidence(detail);
            this.recordGate(context, gate);
            Attempt empty = new Attempt(queryText, List.of(), RerankProvider.PASSTHROUGH, gate);
            if (state.best == null) {
                state.best = empty;
            }
            if (fusion.deadlineHit()) {
                context.budget().checkDeadline("fusion");
            }
            return empty;
        }
        if (state.best == null) {
            state.best = new Attempt(queryText, fusion.results(), RerankProvider.PASSTHROUGH, this.cragGate.evaluate(fusion.results()));
        }
        context.budget().checkDeadline("rerank");
        RerankService.RerankOutcome reranked = this.rerankService.rerank(queryText, fusion.results(), context);
        GateDecision gate = this.cragGate.evaluate(reranked.results());
        this.recordGate(context, gate);
        return new Attempt(queryText, reranked.results(), reranked.provider(), gate);
    }

    private void recordGate(RequestContext context, GateDecision gate) {
        context.trace().addStep(ReasoningStep.StepType.CRAG_GATE, "CRAG gate", gate.reason(), 0L,
                Map.of("passed", gate.passed(), "level", gate.level().name(), "bestScore", gate.bestScore()));
    }

    private record Attempt(String query, List<FusedResult> results, RerankProvider provider, GateDecision gate) {

        boolean isBetterThan(Attempt other) {
            if (other == null) {
                return true;
            }
            if (this.gate.passed() != other.gate.passed()) {
                return this.gate.passed();
            }
            return this.gate.bestScore() > other.gate.bestScore();
        }

        Attempt truncate(int topK) {
            return this.results.size() <= topK ? this : new Attempt(this.query, this.results.subList(0, topK), this.provider, this.gate);
        }
    }

    private static final class SearchState {
        private final String originalQuery;
        private final List<String> warnings = new ArrayList<>();
        private Classification classification;
        private Attempt best;
        private int retryRounds;
        private boolean timedOut;

        private SearchState(String originalQuery) {
            this.originalQuery = originalQuery;
        }

        private RankedResults toResults(String query, long elapsedMs) {
            Classification effectiveClassification = this.classification != null ? this.classification : Classification.neutral();
            Attempt outcome = this.best != null ? this.best
                    : new Attempt(this.originalQuery, List.of(), RerankProvider.PASSTHROUGH, GateDecision.noEvidence("search did not complete"));
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("elapsedMs", elapsedMs);
            metadata.put("category", effectiveClassification.category().name());
            metadata.put("sparseWeight", effectiveClassification.sparseWeight());
            metadata.put("denseWeight", effectiveClassification.denseWeight());
            metadata.put("evidenceLevel", outcome.gate().level().name());
            return new RankedResults(query, outcome.query(), outcome.results(), effectiveClassification, outcome.gate(),
                    outcome.provider(), new ArrayList<>(new LinkedHashSet<>(this.warnings)), this.timedOut, this.retryRounds, metadata);
        }
    }
}
