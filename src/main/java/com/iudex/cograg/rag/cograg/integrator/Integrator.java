package com.iudex.cograg.rag.cograg.integrator;

import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.rag.cograg.reasoner.SubAnswer;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.service.GuardedLanguageModel;
import com.iudex.cograg.util.LogSanitizer;
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
import reactor.core.publisher.Flux;

/**
 * Turns leaf answers into the final answer, or into an explained abstention.
 *
 * <p>Paths:</p>
 * <ol>
 *   <li>abstain with explanation: model-written explanation of the issues, templated text on failure</li>
 *   <li>abstain without explanation: no answer text, abstain metadata only, no model call</li>
 *   <li>proceed: fixed message for zero answers, the single answer unchanged, or a model synthesis
 *   of several answers with a rule-based concatenation as fallback</li>
 * </ol>
 * <p>An expired request budget forces the deterministic variant of each path.</p>
 */
@Service
public class Integrator {
    private static final Logger log = LoggerFactory.getLogger(Integrator.class);
    public static final String NOTHING_FOUND = "No relevant information was found in the available sources to answer this question.";
    static final String ABSTAIN_REASON = "insufficient or contradictory evidence";
    private final GuardedLanguageModel languageModel;
    @Value(value="${iudex.integrator.max-tokens:1200}")
    private int maxTokens = 1200;
    @Value(value="${iudex.integrator.temperature:0.2}")
    private double temperature = 0.2;

    public Integrator(GuardedLanguageModel languageModel) {
        this.languageModel = languageModel;
    }

    @PostConstruct
    public void init() {
        log.info("Integrator initialized (maxTokens={}, temperature={})", this.maxTokens, this.temperature);
    }

    public IntegratedAnswer integrate(String query, List<SubAnswer> subAnswers, GateStatus gateStatus, List<String> issues,
                                      boolean abstainOnInsufficient) {
        return this.integrate(query, subAnswers, gateStatus, issues, abstainOnInsufficient, RequestContext.detached(Query.of(query, "default")));
    }

    public IntegratedAnswer integrate(String query, List<SubAnswer> subAnswers, GateStatus gateStatus, List<String> issues,
                                      boolean abstainOnInsufficient, RequestContext context) {
        long startTime = System.currentTimeMillis();
        List<SubAnswer> answers = subAnswers == null ? List.of() : subAnswers;
        List<String> safeIssues = issues == null ? List.of() : issues;
        List<String> citations = mergeCitations(answers);
        IntegratedAnswer result;
        if (gateStatus == GateStatus.ABSTAIN) {
            AbstainInfo abstain = new AbstainInfo(ABSTAIN_REASON, safeIssues, answers.size());
            if (abstainOnInsufficient) {
                result = this.explainAbstention(query, answers, safeIssues, citations, abstain, context);
            } else {
                result = new IntegratedAnswer(null, List.of(), GateStatus.ABSTAIN, abstain, IntegrationMode.ABSTAIN_SILENT, false, null);
            }
        } else if (answers.isEmpty()) {
            result = new IntegratedAnswer(NOTHING_FOUND, List.of(), GateStatus.PROCEED, null, IntegrationMode.NO_RESULTS, false, null);
        } else if (answers.size() == 1) {
            result = new IntegratedAnswer(answers.get(0).answer(), citations, GateStatus.PROCEED, null, IntegrationMode.SINGLE_ANSWER, false, null);
        } else {
            result = this.synthesize(query, answers, citations, context);
        }
        context.trace().addStep(ReasoningStep.StepType.INTEGRATION, "Answer integration",
                String.format("%s from %d sub-answers, %d citations", result.mode(), answers.size(), result.citations().size()),
                System.currentTimeMillis() - startTime, Map.of("mode", result.mode().name(), "subAnswers", answers.size()));
        return result;
    }

    /**
     * Streams the final answer text. Zero or one sub-answer is emitted as a single element; several
     * are synthesized by the streaming model, falling back to the rule-based text on any error.
     */
    public Flux<String> streamSynthesis(String query, List<SubAnswer> subAnswers, RequestContext context) {
        List<SubAnswer> answers = subAnswers == null ? List.of() : subAnswers;
        if (answers.isEmpty()) {
            return Flux.just(NOTHING_FOUND);
        }
        if (answers.size() == 1) {
            return Flux.just(answers.get(0).answer());
        }
        String fallback = ruleBasedAnswer(answers);
        if (context.budget().isExpired()) {
            return Flux.just(fallback);
        }
        String prompt = this.buildSynthesisPrompt(query, answers);
        return Flux.defer(() -> {
                    context.budget().acquireLlmCall("integration");
                    return this.languageModel.stream(context, "integration", prompt, this.maxTokens, this.temperature);
                })
                .onErrorResume(error -> {
                    log.warn("Integrator: streaming synthesis failed, using rule-based answer: {}", LogSanitizer.sanitize(error.getMessage()));
                    context.addWarning("integration: streaming synthesis failed, rule-based answer used");
                    return Flux.just(fallback);
                });
    }

    private IntegratedAnswer synthesize(String query, List<SubAnswer> answers, List<String> citations, RequestContext context) {
        if (!context.budget().isExpired()) {
            String prompt = this.buildSynthesisPrompt(query, answers);
            try {
                context.budget().acquireLlmCall("integration");
                String text = this.languageModel.complete(context, "integration", prompt, this.maxTokens, this.temperature);
                context.budget().recordUsage(prompt, text);
                if (text != null && !text.isBlank()) {
                    return new IntegratedAnswer(text.trim(), citations, GateStatus.PROCEED, null, IntegrationMode.SYNTHESIZED, false, null);
                }
                context.addWarning("integration: empty synthesis, rule-based answer used");
            } catch (RuntimeException e) {
                log.warn("Integrator: synthesis failed for {}, using rule-based answer: {}", LogSanitizer.querySummary(query), e.getMessage());
                context.addWarning("integration: synthesis failed, rule-based answer used");
            }
        }
        return new IntegratedAnswer(ruleBasedAnswer(answers), citations, GateStatus.PROCEED, null, IntegrationMode.RULE_BASED, false, null);
    }

    private IntegratedAnswer explainAbstention(String query, List<SubAnswer> answers, List<String> issues, List<String> citations,
                                               AbstainInfo abstain, RequestContext context) {
        if (!context.budget().isExpired()) {
            String prompt = this.buildAbstainPrompt(query, answers, issues);
            try {
                context.budget().acquireLlmCall("integration");
                String text = this.languageModel.complete(context, "integration", prompt, this.maxTokens, this.temperature);
                context.budget().recordUsage(prompt, text);
                if (text != null && !text.isBlank()) {
                    return new IntegratedAnswer(text.trim(), citations, GateStatus.ABSTAIN, abstain, IntegrationMode.ABSTAIN_EXPLAINED, false, null);
                }
            } catch (RuntimeException e) {
                log.warn("Integrator: abstain explanation failed for {}, using template: {}", LogSanitizer.querySummary(query), e.getMessage());
                context.addWarning("integration: abstain explanation failed, template used");
            }
        }
        return new IntegratedAnswer(templatedAbstention(query, answers, issues), citations, GateStatus.ABSTAIN, abstain,
                IntegrationMode.ABSTAIN_TEMPLATE, false, null);
    }

    /**
     * Citation union across sub-answers; the first spelling of each citation wins.
     */
    public static List<String> mergeCitations(List<SubAnswer> answers) {
        Map<String, String> merged = new LinkedHashMap<>();
        for (SubAnswer answer : answers) {
            for (String citation : answer.citations()) {
                if (citation != null && !citation.isBlank()) {
                    merged.putIfAbsent(citation.trim().toLowerCase(Locale.ROOT), citation.trim());
                }
            }
        }
        return new ArrayList<>(merged.values());
    }

    static String ruleBasedAnswer(List<SubAnswer> answers) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < answers.size(); i++) {
            SubAnswer answer = answers.get(i);
            if (i > 0) {
                text.append("\n\n").append(i == answers.size() - 1 ? "Finally, regarding '" : "Additionally, regarding '");
            } else {
                text.append("Regarding '");
            }
            text.append(answer.question()).append("': ").append(answer.answer());
        }
        return text.toString();
    }

    public static String templatedAbstention(String query, List<SubAnswer> answers, List<String> issues) {
        StringBuilder text = new StringBuilder();
        text.append("A definitive answer to \"").append(query).append("\" cannot be given: the available evidence is insufficient or contradictory.");
        if (!issues.isEmpty()) {
            text.append("\n\nIssues found:");
            for (String issue : issues) {
                text.append("\n- ").append(issue);
            }
        }
        if (!answers.isEmpty()) {
            text.append("\n\nPartial findings (").append(answers.size()).append("), to be verified against the sources:");
            for (SubAnswer answer : answers) {
                text.append("\n- ").append(answer.question()).append(": ").append(answer.answer());
            }
        }
        return text.toString();
    }

    private String buildSynthesisPrompt(String query, List<SubAnswer> answers) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Combine the partial answers below into one coherent answer to the original legal question.\n")
                .append("Rules:\n")
                .append("- Use only information present in the partial answers; do not add facts, statutes or precedents.\n")
                .append("- Keep every [ref:<id>] marker and legal citation exactly as written.\n")
                .append("- Where partial answers disagree, present each position with its sources instead of choosing one.\n\n");
        prompt.append("Original question: ").append(query).append("\n\n");
        for (int i = 0; i < answers.size(); i++) {
            SubAnswer answer = answers.get(i);
            prompt.append("Partial answer ").append(i + 1);
            if (answer.hasConflicts()) {
                prompt.append(" (sources in conflict)");
            }
            prompt.append("\nSub-question: ").append(answer.question()).append("\nAnswer: ").append(answer.answer()).append("\n\n");
        }
        prompt.append("Final answer:");
        return prompt.toString();
    }

    private String buildAbstainPrompt(String query, List<SubAnswer> answers, List<String> issues) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("The research system cannot answer the legal question below with confidence. ")
                .append("Explain to the user, in a few sentences, why a definitive answer is not possible, referring to the issues listed. ")
                .append("Mention the partial findings only as unverified indications and keep their citations as written. ")
                .append("Do not answer the question yourself.\n\n");
        prompt.append("Question: ").append(query).append("\n\nIssues:\n");
        for (String issue : issues) {
            prompt.append("- ").append(issue).append("\n");
        }
        if (!answers.isEmpty()) {
            prompt.append("\nPartial findings:\n");
            for (SubAnswer answer : answers) {
                prompt.append("- ").append(answer.question()).append(": ").append(answer.answer()).append("\n");
            }
        }
        prompt.append("\nExplanation:");
        return prompt.toString();
    }
}
