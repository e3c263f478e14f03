package com.iudex.cograg.rag.cograg.verifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.iudex.cograg.constant.LegalPatterns;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.ModelOutputParseException;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.rag.cograg.reasoner.SubAnswer;
import com.iudex.cograg.rag.cograg.refiner.RefinementResult;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.service.GuardedLanguageModel;
import com.iudex.cograg.util.ModelJson;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Checks leaf answers against their evidence before integration.
 *
 * <p>The citation check always runs. The model consistency check is opt-in and only runs on
 * answers that passed the citation check. Rejected answers are rewritten by the model and checked
 * again, up to {@code max-rethinks} rounds. When rounds run out, the request abstains if most
 * answers are still rejected; otherwise it proceeds with the rejected answers at capped confidence.</p>
 */
@Service
public class AnswerVerifier {
    private static final Logger log = LoggerFactory.getLogger(AnswerVerifier.class);
    private static final double REJECTED_CONFIDENCE_CAP = 0.2;
    private static final int EVIDENCE_CHUNKS = 6;
    private static final int EVIDENCE_CHARS = 800;
    private static final List<String> REJECTION_MARKERS = List.of(
            "inconsistente", "não fundamentada", "nao fundamentada", "alucinação", "alucinacao", "incorreto", "falso",
            "inconsistent", "not supported", "hallucinat");
    private final GuardedLanguageModel languageModel;
    @Value(value="${iudex.verifier.enabled:true}")
    private boolean enabled = true;
    @Value(value="${iudex.verifier.llm-enabled:false}")
    private boolean llmEnabled = false;
    @Value(value="${iudex.verifier.max-rethinks:1}")
    private int maxRethinks = 1;
    @Value(value="${iudex.verifier.max-tokens:512}")
    private int maxTokens = 512;

    public AnswerVerifier(GuardedLanguageModel languageModel) {
        this.languageModel = languageModel;
    }

    @PostConstruct
    public void init() {
        log.info("Answer verifier initialized (enabled={}, llmEnabled={}, maxRethinks={})", this.enabled, this.llmEnabled, this.maxRethinks);
    }

    /**
     * Verifies every answer against the refined evidence of its node.
     *
     * @param allowModelCalls false on the partial path; only the citation check runs and nothing is rewritten
     */
    public VerificationReport verify(List<SubAnswer> subAnswers, RefinementResult refinement, boolean allowModelCalls,
                                     RequestContext context) {
        if (!this.enabled || subAnswers.isEmpty()) {
            return VerificationReport.skipped(subAnswers);
        }
        long startTime = System.currentTimeMillis();
        List<SubAnswer> current = new ArrayList<>(subAnswers);
        List<VerificationResult> results = this.checkAll(current, refinement, allowModelCalls, context);
        int rethinks = 0;
        while (countRejected(results) > 0 && allowModelCalls && rethinks < this.maxRethinks && !context.budget().isExpired()) {
            rethinks++;
            boolean revised = false;
            for (int i = 0; i < current.size(); i++) {
                VerificationResult result = results.get(i);
                if (result.consistent()) {
                    continue;
                }
                SubAnswer answer = current.get(i);
                SubAnswer rewritten = this.rethink(answer, result, evidenceOf(refinement, answer), context);
                if (rewritten != answer) {
                    current.set(i, rewritten);
                    results.set(i, this.check(rewritten, refinement, true, context));
                    revised = true;
                }
            }
            if (!revised) {
                break;
            }
        }

        int rejected = countRejected(results);
        List<String> issues = new ArrayList<>();
        for (int i = 0; i < current.size(); i++) {
            VerificationResult result = results.get(i);
            if (!result.consistent()) {
                current.set(i, current.get(i).withConfidence(Math.min(current.get(i).confidence(), REJECTED_CONFIDENCE_CAP)));
                for (String issue : result.issues()) {
                    issues.add("[" + shortId(result.nodeId()) + "] " + issue);
                }
            }
        }
        VerificationStatus status = VerificationStatus.APPROVED;
        if (rejected > 0 && rejected * 2 > current.size()) {
            status = VerificationStatus.ABSTAIN;
        } else if (rejected > 0) {
            context.addWarning("verification: " + rejected + " of " + current.size() + " sub-answers kept with unresolved issues");
        }
        log.debug("Verifier: {} ({} of {} rejected, {} rethinks)", status, rejected, current.size(), rethinks);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("rejected", rejected);
        data.put("rethinks", rethinks);
        data.put("status", status.name());
        context.trace().addStep(ReasoningStep.StepType.VERIFICATION, "Answer verification",
                String.format("%d of %d sub-answers rejected after %d rethinks", rejected, current.size(), rethinks),
                System.currentTimeMillis() - startTime, data);
        return new VerificationReport(current, status, issues, results, rethinks);
    }

    private List<VerificationResult> checkAll(List<SubAnswer> answers, RefinementResult refinement, boolean allowModelCalls,
                                              RequestContext context) {
        List<VerificationResult> results = new ArrayList<>();
        for (SubAnswer answer : answers) {
            results.add(this.check(answer, refinement, allowModelCalls, context));
        }
        return results;
    }

    private VerificationResult check(SubAnswer answer, RefinementResult refinement, boolean allowModelCalls, RequestContext context) {
        List<FusedResult> evidence = evidenceOf(refinement, answer);
        List<String> problems = CitationGroundingCheck.check(answer.answer(), evidence);
        if (!problems.isEmpty()) {
            return VerificationResult.ungrounded(answer.nodeId(), problems);
        }
        if (!this.llmEnabled || !allowModelCalls || context.budget().isExpired()) {
            return VerificationResult.grounded(answer.nodeId());
        }
        return this.checkWithModel(answer, evidence, context);
    }

    private VerificationResult checkWithModel(SubAnswer answer, List<FusedResult> evidence, RequestContext context) {
        String response;
        try {
            context.budget().acquireLlmCall("verification");
            String prompt = buildVerificationPrompt(answer, evidence);
            response = this.languageModel.complete(context, "verification", prompt, this.maxTokens, 0.0);
            context.budget().recordUsage(prompt, response);
        } catch (RuntimeException e) {
            log.warn("Verifier: model check failed for node {}, keeping citation verdict: {}", answer.nodeId(), e.getMessage());
            context.addWarning("verification: model check skipped for node " + answer.nodeId());
            return VerificationResult.grounded(answer.nodeId());
        }
        return parseVerdict(answer.nodeId(), response);
    }

    static VerificationResult parseVerdict(String nodeId, String response) {
        try {
            JsonNode json = ModelJson.parseObject(response);
            boolean consistent = json.path("is_consistent").asBoolean(true);
            double confidence = Math.max(0.0, Math.min(1.0, json.path("confidence").asDouble(consistent ? 0.7 : 0.3)));
            List<String> issues = new ArrayList<>();
            for (JsonNode issue : json.path("issues")) {
                String text = issue.asText("").trim();
                if (!text.isEmpty()) {
                    issues.add(text);
                }
            }
            if (!consistent && issues.isEmpty()) {
                issues.add("model check found the answer inconsistent with the evidence");
            }
            String suggestion = json.path("suggestion").asText("").trim();
            return new VerificationResult(nodeId, consistent, confidence, issues, json.path("requires_new_search").asBoolean(false),
                    suggestion.isEmpty() ? null : suggestion);
        } catch (ModelOutputParseException e) {
            String lower = response == null ? "" : response.toLowerCase(Locale.ROOT);
            for (String marker : REJECTION_MARKERS) {
                if (lower.contains(marker)) {
                    return new VerificationResult(nodeId, false, 0.5, List.of("model check flagged the answer as '" + marker + "'"), false, null);
                }
            }
            return new VerificationResult(nodeId, true, 0.7, List.of(), false, null);
        }
    }

    /**
     * Asks the model for a corrected answer. Returns the same instance when no usable rewrite came back.
     */
    private SubAnswer rethink(SubAnswer answer, VerificationResult result, List<FusedResult> evidence, RequestContext context) {
        String revised;
        try {
            context.budget().acquireLlmCall("verification");
            String prompt = buildRethinkPrompt(answer, result, evidence);
            revised = this.languageModel.complete(context, "verification", prompt, this.maxTokens * 2, 0.1);
            context.budget().recordUsage(prompt, revised);
        } catch (RuntimeException e) {
            log.warn("Verifier: rethink failed for node {}: {}", answer.nodeId(), e.getMessage());
            context.addWarning("verification: rethink failed for node " + answer.nodeId());
            return answer;
        }
        if (revised == null || revised.isBlank()) {
            return answer;
        }
        String text = revised.trim();
        return answer.withAnswer(text, citationsOf(text));
    }

    private static List<String> citationsOf(String text) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String citation : LegalPatterns.extractCitations(text)) {
            unique.putIfAbsent(LegalPatterns.normalizeReference(citation), citation);
        }
        return new ArrayList<>(unique.values());
    }

    private static List<FusedResult> evidenceOf(RefinementResult refinement, SubAnswer answer) {
        return refinement == null ? List.of() : refinement.evidenceFor(answer.nodeId()).results();
    }

    private static int countRejected(List<VerificationResult> results) {
        int rejected = 0;
        for (VerificationResult result : results) {
            if (!result.consistent()) {
                rejected++;
            }
        }
        return rejected;
    }

    private static String shortId(String nodeId) {
        return nodeId.length() > 8 ? nodeId.substring(0, 8) : nodeId;
    }

    private static String buildVerificationPrompt(SubAnswer answer, List<FusedResult> evidence) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Check whether the answer below is fully supported by the sources. ")
                .append("Flag statements, statutes, articles or precedents that the sources do not contain.\n")
                .append("Reply with JSON only: {\"is_consistent\": true|false, \"confidence\": 0.0-1.0, \"issues\": [\"...\"], ")
                .append("\"requires_new_search\": true|false, \"suggestion\": \"...\"}\n\n");
        prompt.append("Question: ").append(answer.question()).append("\n\nAnswer: ").append(answer.answer()).append("\n\n");
        appendSources(prompt, evidence);
        return prompt.toString();
    }

    private static String buildRethinkPrompt(SubAnswer answer, VerificationResult result, List<FusedResult> evidence) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("The answer below failed verification against its sources. Rewrite it using ONLY the sources. ")
                .append("Remove every claim, statute, article or precedent the sources do not contain, ")
                .append("keep the [ref:<id>] markers of the sources you use, and say so if the sources do not answer the question.\n\n");
        prompt.append("Question: ").append(answer.question()).append("\n\nPrevious answer: ").append(answer.answer()).append("\n\nIssues:\n");
        for (String issue : result.issues()) {
            prompt.append("- ").append(issue).append('\n');
        }
        if (result.suggestion() != null) {
            prompt.append("Suggestion: ").append(result.suggestion()).append('\n');
        }
        prompt.append('\n');
        appendSources(prompt, evidence);
        prompt.append("Corrected answer:");
        return prompt.toString();
    }

    private static void appendSources(StringBuilder prompt, List<FusedResult> evidence) {
        prompt.append("Sources:\n");
        int used = 0;
        for (FusedResult chunk : evidence) {
            if (used++ >= EVIDENCE_CHUNKS) {
                break;
            }
            String text = chunk.text() == null ? "" : chunk.text();
            if (text.length() > EVIDENCE_CHARS) {
                text = text.substring(0, EVIDENCE_CHARS) + "...";
            }
            prompt.append("[ref:").append(chunk.id()).append("] ").append(text).append("\n\n");
        }
    }
}
