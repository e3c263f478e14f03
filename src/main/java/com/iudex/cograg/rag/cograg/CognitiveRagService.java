package com.iudex.cograg.rag.cograg;

import com.iudex.cograg.context.RequestBudget;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.BudgetExceededException;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.rag.cograg.integrator.CognitiveAudit;
import com.iudex.cograg.rag.cograg.integrator.GateStatus;
import com.iudex.cograg.rag.cograg.integrator.IntegratedAnswer;
import com.iudex.cograg.rag.cograg.integrator.Integrator;
import com.iudex.cograg.rag.cograg.planner.CognitivePlanner;
import com.iudex.cograg.rag.cograg.planner.CognitiveTree;
import com.iudex.cograg.rag.cograg.planner.MindMapNode;
import com.iudex.cograg.rag.cograg.reasoner.SubAnswer;
import com.iudex.cograg.rag.cograg.reasoner.SubAnswerGenerator;
import com.iudex.cograg.rag.cograg.refiner.EvidenceRefiner;
import com.iudex.cograg.rag.cograg.refiner.EvidenceSet;
import com.iudex.cograg.rag.cograg.refiner.RefinementResult;
import com.iudex.cograg.rag.cograg.verifier.AnswerVerifier;
import com.iudex.cograg.rag.cograg.verifier.VerificationReport;
import com.iudex.cograg.rag.cograg.verifier.VerificationStatus;
import com.iudex.cograg.rag.memory.ConsultationMemory;
import com.iudex.cograg.rag.memory.SimilarConsultation;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.reasoning.ReasoningTracer;
import com.iudex.cograg.service.RankedResults;
import com.iudex.cograg.service.RetrievalPipeline;
import com.iudex.cograg.util.BoundedFanOut;
import com.iudex.cograg.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Full decomposition path: memory recall, planning, per-leaf retrieval, refinement, leaf answers,
 * verification, abstain policy, integration and memory store.
 *
 * <p>Every call runs under one {@link RequestBudget}. {@link #ask} never throws: an exhausted
 * budget yields the best partial answer flagged as timed out, built without further model calls.</p>
 */
@Service
public class CognitiveRagService {
    private static final Logger log = LoggerFactory.getLogger(CognitiveRagService.class);
    private final ConsultationMemory memory;
    private final CognitivePlanner planner;
    private final RetrievalPipeline retrievalPipeline;
    private final EvidenceRefiner refiner;
    private final SubAnswerGenerator subAnswerGenerator;
    private final AnswerVerifier verifier;
    private final Integrator integrator;
    private final ReasoningTracer tracer;
    private final ExecutorService branchExecutor;
    @Value(value="${iudex.planner.max-depth:3}")
    private int maxDepth = 3;
    @Value(value="${iudex.planner.max-children:4}")
    private int maxChildren = 4;
    @Value(value="${iudex.cograg.top-k:8}")
    private int topK = 8;
    @Value(value="${iudex.cograg.include-graph:true}")
    private boolean includeGraph = true;
    @Value(value="${iudex.cograg.max-parallel-branches:4}")
    private int maxParallelBranches = 4;
    @Value(value="${iudex.cograg.request-timeout-ms:60000}")
    private long requestTimeoutMs = 60000L;
    @Value(value="${iudex.cograg.max-llm-calls:60}")
    private int maxLlmCalls = 60;
    @Value(value="${iudex.cograg.max-tokens:120000}")
    private long maxTokens = 120000L;
    @Value(value="${iudex.cograg.abstain-threshold:0.3}")
    private double abstainThreshold = 0.3;
    @Value(value="${iudex.cograg.abstain-explain:true}")
    private boolean abstainExplain = true;

    public CognitiveRagService(ConsultationMemory memory, CognitivePlanner planner, RetrievalPipeline retrievalPipeline,
                               EvidenceRefiner refiner, SubAnswerGenerator subAnswerGenerator, AnswerVerifier verifier, Integrator integrator,
                               ReasoningTracer tracer, @Qualifier("branchExecutor") ExecutorService branchExecutor) {
        this.memory = memory;
        this.planner = planner;
        this.retrievalPipeline = retrievalPipeline;
        this.refiner = refiner;
        this.subAnswerGenerator = subAnswerGenerator;
        this.verifier = verifier;
        this.integrator = integrator;
        this.tracer = tracer;
        this.branchExecutor = branchExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Cognitive RAG initialized (maxDepth={}, maxChildren={}, topK={}, maxParallelBranches={}, timeoutMs={}, maxLlmCalls={}, abstainThreshold={})",
                this.maxDepth, this.maxChildren, this.topK, this.maxParallelBranches, this.requestTimeoutMs, this.maxLlmCalls, this.abstainThreshold);
    }

    public IntegratedAnswer ask(String query, String tenantId, String scope, String caseId) {
        Query request = new Query(query, tenantId, scope, caseId);
        RequestContext context = this.newContext(request);
        Progress progress = new Progress();
        try {
            Deliberation deliberation = this.deliberate(context, progress);
            return this.conclude(context, progress, deliberation);
        } catch (RuntimeException e) {
            log.error("CogRAG: request failed for {}: {}", LogSanitizer.querySummary(request.text()), e.getMessage(), e);
            context.addWarning("processing failed: " + e.getClass().getSimpleName());
            context.trace().addStep(ReasoningStep.StepType.ERROR, "Request failed", LogSanitizer.sanitize(e.getMessage()), 0L);
            IntegratedAnswer failed = this.integrator.integrate(request.text(), List.of(), GateStatus.ABSTAIN,
                    List.of("internal processing error"), false, context);
            return failed.withAudit(this.audit(context, progress, false, null));
        } finally {
            this.tracer.endTrace(context.trace());
        }
    }

    /**
     * Same pipeline as {@link #ask}, with the final answer streamed. Abstentions and single answers
     * arrive as one element; several answers are synthesized by the streaming model. A failure
     * anywhere in the pipeline ends the stream with a templated abstention instead of an error.
     */
    public Flux<String> askStreaming(String query, String tenantId, String scope, String caseId) {
        return Flux.defer(() -> {
            Query request = new Query(query, tenantId, scope, caseId);
            RequestContext context = this.newContext(request);
            Progress progress = new Progress();
            return Flux.defer(() -> this.streamAnswer(context, progress))
                    .onErrorResume(RuntimeException.class, e -> {
                        log.error("CogRAG: streaming request failed for {}: {}", LogSanitizer.querySummary(request.text()), e.getMessage(), e);
                        context.addWarning("processing failed: " + e.getClass().getSimpleName());
                        context.trace().addStep(ReasoningStep.StepType.ERROR, "Request failed", LogSanitizer.sanitize(e.getMessage()), 0L);
                        return Flux.just(Integrator.templatedAbstention(request.text(), List.of(), List.of("internal processing error")));
                    })
                    .doFinally(signal -> this.tracer.endTrace(context.trace()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Flux<String> streamAnswer(RequestContext context, Progress progress) {
        Deliberation deliberation = this.deliberate(context, progress);
        if (deliberation.status() == GateStatus.ABSTAIN) {
            IntegratedAnswer answer = this.integrator.integrate(context.query().text(), deliberation.subAnswers(), GateStatus.ABSTAIN,
                    deliberation.issues(), this.abstainExplain, context);
            return answer.answer() == null ? Flux.<String>empty() : Flux.just(answer.answer());
        }
        StringBuilder streamed = new StringBuilder();
        return this.integrator.streamSynthesis(context.query().text(), deliberation.subAnswers(), context)
                .doOnNext(streamed::append)
                .doOnComplete(() -> {
                    if (!deliberation.timedOut()) {
                        this.remember(context, progress, deliberation, streamed.toString(),
                                Integrator.mergeCitations(deliberation.subAnswers()));
                    }
                });
    }

    private RequestContext newContext(Query request) {
        RequestBudget budget = RequestBudget.of(Duration.ofMillis(this.requestTimeoutMs), this.maxLlmCalls, this.maxTokens);
        return new RequestContext(request, budget, this.tracer.startTrace(request.tenantId(), request.text()));
    }

    /**
     * Everything up to the abstain decision. A budget exhausted mid-way switches to the partial path.
     */
    private Deliberation deliberate(RequestContext context, Progress progress) {
        try {
            this.recall(context, progress);
            context.budget().checkDeadline("planning");
            if (progress.tree == null) {
                progress.tree = this.planner.plan(context.query().text(), this.maxDepth, this.maxChildren, context);
            }
            this.retrieve(context, progress);
            context.budget().checkDeadline("refinement");
            return this.reason(context, progress, false);
        } catch (BudgetExceededException e) {
            log.warn("CogRAG: deadline exceeded at {} for {}, answering from partial evidence", e.getStage(),
                    LogSanitizer.querySummary(context.query().text()));
            context.addWarning("deadline exceeded during " + e.getStage() + "; partial answer");
            context.trace().addStep(ReasoningStep.StepType.TIMEOUT, "Deadline exceeded", e.getMessage(), 0L);
            return this.reason(context, progress, true);
        }
    }

    private void recall(RequestContext context, Progress progress) {
        if (!this.memory.isEnabled()) {
            return;
        }
        long startTime = System.currentTimeMillis();
        Optional<SimilarConsultation> similar = this.memory.findSimilar(context.query().text(), context.tenantId());
        if (similar.isEmpty()) {
            context.trace().addStep(ReasoningStep.StepType.MEMORY_RECALL, "Consultation memory", "no similar consultation",
                    System.currentTimeMillis() - startTime);
            return;
        }
        SimilarConsultation match = similar.get();
        progress.penalizedRefs = match.penalizedReferences();
        progress.reusedConsultationId = match.consultationId();
        if (match.record().tree() != null) {
            try {
                progress.tree = CognitiveTree.fromSnapshot(match.record().tree());
            } catch (IllegalArgumentException e) {
                log.warn("CogRAG: stored tree of consultation {} unusable: {}", match.consultationId(), e.getMessage());
                context.addWarning("memory: stored tree unusable, planning again");
            }
        }
        context.trace().addStep(ReasoningStep.StepType.MEMORY_RECALL, "Consultation memory",
                String.format("reused %s (similarity=%.3f, penalized refs=%d)", match.consultationId(), match.similarity(), progress.penalizedRefs.size()),
                System.currentTimeMillis() - startTime,
                Map.of("consultationId", match.consultationId(), "treeReused", progress.tree != null));
    }

    private void retrieve(RequestContext context, Progress progress) {
        List<MindMapNode> leaves = progress.tree.leaves();
        Map<String, Object> filters = new HashMap<>();
        if (context.query().caseId() != null) {
            filters.put("case_id", context.query().caseId());
        }
        List<BoundedFanOut.Outcome<RankedResults>> outcomes = BoundedFanOut.run(leaves,
                leaf -> this.retrievalPipeline.search(context, leaf.getQuestion(), filters, this.topK, this.includeGraph),
                this.maxParallelBranches, this.branchExecutor, context.budget());
        for (int i = 0; i < leaves.size(); i++) {
            MindMapNode leaf = leaves.get(i);
            BoundedFanOut.Outcome<RankedResults> outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                progress.rankedByNode.put(leaf.getId(), outcome.value());
                progress.branchTimedOut |= outcome.value().timedOut();
            } else if (outcome.timedOut()) {
                progress.branchTimedOut = true;
                context.addWarning("retrieval for node " + leaf.getId() + " cut by the deadline");
            } else {
                context.addWarning("retrieval for node " + leaf.getId() + " failed");
                if (log.isWarnEnabled()) {
                    log.warn("CogRAG: retrieval failed for node {}: {}", leaf.getId(), LogSanitizer.sanitize(outcome.error().getMessage()));
                }
            }
        }
    }

    /**
     * Refinement, leaf answers, verification and the abstain decision. The partial path answers
     * extractively and verifies citations without model calls.
     */
    private Deliberation reason(RequestContext context, Progress progress, boolean timedOut) {
        if (progress.tree == null) {
            CognitiveTree single = new CognitiveTree(context.query().text());
            single.markEnd(single.getRootId());
            single.freeze();
            progress.tree = single;
        }
        Map<String, List<FusedResult>> evidence = new LinkedHashMap<>();
        Map<String, Boolean> gateByNode = new HashMap<>();
        int excluded = 0;
        for (MindMapNode leaf : progress.tree.leaves()) {
            RankedResults ranked = progress.rankedByNode.get(leaf.getId());
            if (ranked == null) {
                continue;
            }
            List<FusedResult> kept = new ArrayList<>();
            for (FusedResult result : ranked.results()) {
                if (result.id() != null && progress.penalizedRefs.contains(result.id())) {
                    excluded++;
                } else {
                    kept.add(result);
                }
            }
            evidence.put(leaf.getId(), kept);
            gateByNode.put(leaf.getId(), ranked.gatePassed());
        }
        if (excluded > 0) {
            context.trace().addMetric("penalizedEvidenceExcluded", excluded);
        }
        progress.refinement = this.refiner.refine(evidence, context);

        List<SubAnswer> answers;
        if (timedOut) {
            answers = new ArrayList<>();
            for (MindMapNode leaf : progress.tree.leaves()) {
                this.subAnswerGenerator.generate(leaf, progress.refinement.evidenceFor(leaf.getId()),
                        gateByNode.getOrDefault(leaf.getId(), false), progress.penalizedRefs, context).ifPresent(answers::add);
            }
        } else {
            answers = this.subAnswerGenerator.generateAll(progress.tree.leaves(), progress.refinement, gateByNode,
                    progress.penalizedRefs, context);
        }
        VerificationReport verification = this.verifier.verify(answers, progress.refinement, !timedOut, context);
        answers = verification.subAnswers();
        progress.subAnswers = answers;

        List<String> issues = new ArrayList<>(verification.issues());
        for (MindMapNode leaf : progress.tree.leaves()) {
            RankedResults ranked = progress.rankedByNode.get(leaf.getId());
            if (ranked != null && !ranked.gatePassed() && ranked.gate() != null) {
                issues.add("evidence gate failed for node " + leaf.getId() + ": " + ranked.gate().reason());
            }
        }
        double average = answers.stream().mapToDouble(SubAnswer::confidence).average().orElse(0.0);
        for (SubAnswer answer : answers) {
            if (answer.confidence() < this.abstainThreshold) {
                issues.add(String.format("low confidence on node %s (%.2f)", answer.nodeId(), answer.confidence()));
            }
        }
        GateStatus status = GateStatus.PROCEED;
        if (answers.isEmpty()) {
            status = GateStatus.ABSTAIN;
            issues.add("no sub-question could be answered from the retrieved evidence");
        } else if (verification.status() == VerificationStatus.ABSTAIN) {
            status = GateStatus.ABSTAIN;
            issues.add("most sub-answers cite material that is not in the evidence");
        } else if (average < this.abstainThreshold) {
            status = GateStatus.ABSTAIN;
            issues.add(String.format("average confidence %.2f below threshold %.2f", average, this.abstainThreshold));
        }
        boolean cut = timedOut || progress.branchTimedOut || context.budget().isExpired();
        return new Deliberation(answers, status, issues, cut);
    }

    private IntegratedAnswer conclude(RequestContext context, Progress progress, Deliberation deliberation) {
        IntegratedAnswer answer = this.integrator.integrate(context.query().text(), deliberation.subAnswers(), deliberation.status(),
                deliberation.issues(), this.abstainExplain, context);
        String consultationId = null;
        if (!deliberation.timedOut() && deliberation.status() == GateStatus.PROCEED) {
            consultationId = this.remember(context, progress, deliberation, answer.answer(), answer.citations());
        }
        log.info("CogRAG: {} for {} ({} leaves, {} answers, timedOut={})", answer.mode(),
                LogSanitizer.querySummary(context.query().text()), progress.tree.leaves().size(),
                deliberation.subAnswers().size(), deliberation.timedOut());
        return answer.withAudit(this.audit(context, progress, deliberation.timedOut(), consultationId));
    }

    private String remember(RequestContext context, Progress progress, Deliberation deliberation, String finalAnswer,
                            List<String> citations) {
        if (!this.memory.isEnabled() || progress.reusedConsultationId != null || finalAnswer == null) {
            return null;
        }
        long startTime = System.currentTimeMillis();
        Map<String, String> nodeAnswers = new LinkedHashMap<>();
        for (SubAnswer subAnswer : deliberation.subAnswers()) {
            nodeAnswers.put(subAnswer.nodeId(), subAnswer.answer());
        }
        String id = this.memory.store(context.query().text(), context.tenantId(), progress.tree.snapshot(), nodeAnswers, finalAnswer, citations);
        context.trace().addStep(ReasoningStep.StepType.MEMORY_STORE, "Consultation memory",
                id != null ? "stored " + id : "store failed", System.currentTimeMillis() - startTime);
        return id;
    }

    private CognitiveAudit audit(RequestContext context, Progress progress, boolean timedOut, String consultationId) {
        Map<String, Double> quality = new LinkedHashMap<>();
        if (progress.refinement != null) {
            for (EvidenceSet set : progress.refinement.evidenceByNode().values()) {
                quality.put(set.nodeId(), set.qualityScore());
            }
        }
        return new CognitiveAudit(context.trace().getTraceId(),
                progress.tree != null ? progress.tree.toMap() : Map.of(),
                progress.subAnswers,
                progress.refinement != null ? progress.refinement.conflicts() : List.of(),
                quality, context.warnings(), timedOut, consultationId, progress.reusedConsultationId, context.budget().usage());
    }

    private record Deliberation(List<SubAnswer> subAnswers, GateStatus status, List<String> issues, boolean timedOut) {
    }

    /**
     * Per-request state kept so the partial path can answer from whatever finished.
     */
    private static final class Progress {
        private CognitiveTree tree;
        private final Map<String, RankedResults> rankedByNode = new LinkedHashMap<>();
        private boolean branchTimedOut;
        private RefinementResult refinement;
        private List<SubAnswer> subAnswers = List.of();
        private Set<String> penalizedRefs = Set.of();
        private String reusedConsultationId;
    }
}
