package com.iudex.cograg.rag.cograg.reasoner;

import com.iudex.cograg.constant.LegalPatterns;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.rag.cograg.planner.MindMapNode;
import com.iudex.cograg.rag.cograg.refiner.EvidenceSet;
import com.iudex.cograg.rag.cograg.refiner.RefinementResult;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.service.GuardedLanguageModel;
import com.iudex.cograg.util.BoundedFanOut;
import com.iudex.cograg.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Answers each leaf question from its refined evidence only.
 *
 * <p>A leaf without evidence gets no answer. When the model call fails, or the request has no
 * model calls left, the answer is assembled from the top evidence chunks instead.</p>
 */
@Service
public class SubAnswerGenerator {
    private static final Logger log = LoggerFactory.getLogger(SubAnswerGenerator.class);
    private static final int EXTRACTIVE_CHUNKS = 3;
    private static final int EXTRACTIVE_CHARS = 300;
    private final GuardedLanguageModel languageModel;
    private final ExecutorService branchExecutor;
    @Value(value="${iudex.reasoner.max-chunks:8}")
    private int maxChunks = 8;
    @Value(value="${iudex.reasoner.chunk-chars:1200}")
    private int chunkChars = 1200;
    @Value(value="${iudex.reasoner.max-tokens:600}")
    private int maxTokens = 600;
    @Value(value="${iudex.cograg.max-parallel-branches:4}")
    private int maxParallelBranches = 4;

    public SubAnswerGenerator(GuardedLanguageModel languageModel, @Qualifier("branchExecutor") ExecutorService branchExecutor) {
        this.languageModel = languageModel;
        this.branchExecutor = branchExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Sub-answer generator initialized (maxChunks={}, maxTokens={}, maxParallelBranches={})",
                this.maxChunks, this.maxTokens, this.maxParallelBranches);
    }

    /**
     * Answers all leaves concurrently. Leaves cut by the deadline are skipped and reported as a
     * warning; the returned list keeps leaf order.
     */
    public List<SubAnswer> generateAll(List<MindMapNode> leaves, RefinementResult refinement, Map<String, Boolean> gateByNode,
                                       Set<String> penalizedRefs, RequestContext context) {
        long startTime = System.currentTimeMillis();
        List<BoundedFanOut.Outcome<Optional<SubAnswer>>> outcomes = BoundedFanOut.run(leaves,
                leaf -> this.generate(leaf, refinement.evidenceFor(leaf.getId()), gateByNode.getOrDefault(leaf.getId(), false),
                        penalizedRefs, context),
                this.maxParallelBranches, this.branchExecutor, context.budget());
        List<SubAnswer> answers = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < outcomes.size(); i++) {
            BoundedFanOut.Outcome<Optional<SubAnswer>> outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                outcome.value().ifPresent(answers::add);
            } else {
                skipped++;
                if (outcome.error() != null && log.isWarnEnabled()) {
                    log.warn("Reasoner: leaf {} failed: {}", leaves.get(i).getId(), LogSanitizer.sanitize(outcome.error().getMessage()));
                }
            }
        }
        if (skipped > 0) {
            context.addWarning("reasoning: " + skipped + " leaf answers not produced before the deadline");
        }
        context.trace().addStep(ReasoningStep.StepType.REASONING, "Sub-answer generation",
                String.format("%d of %d leaves answered", answers.size(), leaves.size()),
                System.currentTimeMillis() - startTime, Map.of("answered", answers.size(), "skipped", skipped));
        return answers;
    }

    public Optional<SubAnswer> generate(MindMapNode leaf, EvidenceSet evidence, boolean gatePassed, Set<String> penalizedRefs,
                                        RequestContext context) {
        if (evidence == null || evidence.isEmpty()) {
            return Optional.empty();
        }
        List<FusedResult> chunks = evidence.results().size() > this.maxChunks
                ? evidence.results().subList(0, this.maxChunks) : evidence.results();
        String answer;
        boolean extractive = false;
        try {
            context.budget().acquireLlmCall("reasoning");
            String prompt = this.buildPrompt(leaf.getQuestion(), chunks);
            answer = this.languageModel.complete(context, "reasoning", prompt, this.maxTokens, 0.1);
            context.budget().recordUsage(prompt, answer);
            if (answer == null || answer.isBlank()) {
                answer = extractiveAnswer(chunks);
                extractive = true;
            }
        } catch (RuntimeException e) {
            log.warn("Reasoner: model answer failed for node {}, using extractive answer: {}", leaf.getId(), e.getMessage());
            context.addWarning("reasoning: extractive answer used for node " + leaf.getId());
            answer = extractiveAnswer(chunks);
            extractive = true;
        }
        answer = answer.trim();
        List<String> citations = filterCitations(LegalPatterns.extractCitations(answer), penalizedRefs);
        List<String> evidenceRefs = new ArrayList<>();
        for (FusedResult chunk : chunks) {
            if (chunk.id() != null && !penalizedRefs.contains(chunk.id()) && !evidenceRefs.contains(chunk.id())) {
                evidenceRefs.add(chunk.id());
            }
        }
        double confidence = confidence(evidence.results().size(), evidence.qualityScore(), evidence.hasConflicts(), answer.length(), gatePassed);
        return Optional.of(new SubAnswer(leaf.getId(), leaf.getQuestion(), answer, confidence, citations, evidenceRefs,
                evidence.hasConflicts(), gatePassed, extractive));
    }

    /**
     * Base 0.5, adjusted for evidence volume, node quality, conflicts and answer length; halved
     * when the node's gate failed.
     */
    static double confidence(int chunkCount, double quality, boolean hasConflicts, int answerLength, boolean gatePassed) {
        double confidence = 0.5;
        if (chunkCount >= 5) {
            confidence += 0.2;
        } else if (chunkCount >= 2) {
            confidence += 0.1;
        }
        confidence += 0.2 * quality;
        if (hasConflicts) {
            confidence -= 0.15;
        }
        if (answerLength > 200) {
            confidence += 0.1;
        } else if (answerLength < 50) {
            confidence -= 0.1;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        if (!gatePassed) {
            confidence /= 2.0;
        }
        return Math.round(confidence * 1000.0) / 1000.0;
    }

    static String extractiveAnswer(List<FusedResult> chunks) {
        StringBuilder answer = new StringBuilder("Based on the retrieved sources:");
        int used = 0;
        for (FusedResult chunk : chunks) {
            if (used >= EXTRACTIVE_CHUNKS) {
                break;
            }
            String text = chunk.text() == null ? "" : chunk.text().strip();
            if (text.isEmpty()) {
                continue;
            }
            if (text.length() > EXTRACTIVE_CHARS) {
                text = text.substring(0, EXTRACTIVE_CHARS).trim() + "...";
            }
            answer.append("\n- ").append(text).append(" [ref:").append(chunk.id()).append("]");
            used++;
        }
        return answer.toString();
    }

    private static List<String> filterCitations(List<String> raw, Set<String> penalizedRefs) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String citation : raw) {
            String normalized = LegalPatterns.normalizeReference(citation);
            if (penalizedRefs.contains(normalized) || penalizedRefs.contains(citation)) {
                continue;
            }
            unique.putIfAbsent(normalized.toLowerCase(Locale.ROOT), citation);
        }
        return new ArrayList<>(unique.values());
    }

    private String buildPrompt(String question, List<FusedResult> chunks) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Answer the legal question using ONLY the sources below. ")
                .append("Do not add facts, statutes or precedents that are not in the sources. ")
                .append("Cite the sources you use with their [ref:<id>] markers and keep article, statute and precedent numbers exactly as written. ")
                .append("If the sources disagree, present each position with its marker. ")
                .append("If the sources do not answer the question, say so.\n\n");
        prompt.append("Question: ").append(question).append("\n\nSources:\n");
        for (FusedResult chunk : chunks) {
            String text = chunk.text() == null ? "" : chunk.text();
            if (text.length() > this.chunkChars) {
                text = text.substring(0, this.chunkChars) + "...";
            }
            prompt.append("[ref:").append(chunk.id()).append("] ").append(text).append("\n\n");
        }
        prompt.append("Answer:");
        return prompt.toString();
    }
}
