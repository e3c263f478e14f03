package com.iudex.cograg.rag.classifier;

import com.iudex.cograg.constant.LegalPatterns;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.reasoning.ReasoningStep;
import com.iudex.cograg.service.GuardedLanguageModel;
import com.iudex.cograg.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Maps a query to a {@link QueryCategory} and its sparse/dense weight pair.
 *
 * <p>High-precision patterns (case numbers, explicit citations) are resolved locally without
 * any model call. Everything else may be classified by the language model when allowed; any
 * failure yields the neutral 0.5/0.5 category.</p>
 */
@Service
public class QueryClassifier {
    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final List<Pattern> IDENTIFIER_PATTERNS = List.of(
            LegalPatterns.CNJ_NUMBER,
            Pattern.compile("\\b(?:processo|autos)\\s+n?[º°.]?\\s*\\d{5,}", FLAGS));
    private static final List<Pattern> CITATION_PATTERNS = List.of(
            Pattern.compile("^\\s*(?:art\\.?|artigo)\\s*\\d+", FLAGS),
            Pattern.compile("§\\s*\\d+", FLAGS),
            Pattern.compile("\\binciso\\s+[IVXLCDM]+\\b", FLAGS),
            Pattern.compile("\\bal[íi]nea\\s+[\"'“]?[a-z][\"'”]?(?:\\s|$|,)", FLAGS),
            Pattern.compile("\\bs[úu]mula\\s+(?:vinculante\\s+)?(?:n[º°.]*\\s*)?\\d+", FLAGS),
            Pattern.compile("^\\s*(?:lei|decreto)\\s+(?:n[º°.]*\\s*)?\\d[\\d.]*(?:/\\d{2,4})?\\s*$", FLAGS));
    private static final Pattern CATEGORY_LINE = Pattern.compile("CATEGORY\\s*[:=-]\\s*([A-Za-z_\\- ]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD = Pattern.compile("[A-Za-z_]+");

    private final GuardedLanguageModel languageModel;
    private final ClassificationCache cache;
    @Value(value="${iudex.classifier.llm-enabled:true}")
    private boolean llmEnabled = true;
    @Value(value="${iudex.classifier.max-tokens:20}")
    private int maxTokens = 20;

    public QueryClassifier(GuardedLanguageModel languageModel, ClassificationCache cache) {
        this.languageModel = languageModel;
        this.cache = cache;
    }

    @PostConstruct
    public void init() {
        log.info("Query classifier initialized (llmEnabled={}, categories={})", this.llmEnabled, QueryCategory.values().length);
    }

    public Classification classify(String query, boolean allowLlm) {
        return this.classify(query, allowLlm, RequestContext.detached(Query.of(query, "default")));
    }

    public Classification classify(String query, boolean allowLlm, RequestContext context) {
        long startTime = System.currentTimeMillis();
        if (query == null || query.isBlank()) {
            return Classification.neutral();
        }
        Optional<QueryCategory> fastPath = this.matchPatterns(query);
        if (fastPath.isPresent()) {
            Classification result = Classification.of(fastPath.get(), false);
            this.record(context, result, "pattern", startTime);
            return result;
        }
        if (!allowLlm || !this.llmEnabled) {
            Classification result = Classification.neutral();
            this.record(context, result, "llm-disabled", startTime);
            return result;
        }
        QueryCategory cached = this.cache.get(context.tenantId(), query);
        if (cached != null) {
            Classification result = Classification.of(cached, true);
            this.record(context, result, "cache", startTime);
            return result;
        }
        Classification result = this.classifyWithLlm(query, context);
        if (result.usedLlm()) {
            this.cache.put(context.tenantId(), query, result.category());
        }
        this.record(context, result, result.usedLlm() ? "llm" : "fallback", startTime);
        return result;
    }

    Optional<QueryCategory> matchPatterns(String query) {
        for (Pattern pattern : IDENTIFIER_PATTERNS) {
            if (pattern.matcher(query).find()) {
                return Optional.of(QueryCategory.IDENTIFIER);
            }
        }
        for (Pattern pattern : CITATION_PATTERNS) {
            if (pattern.matcher(query).find()) {
                return Optional.of(QueryCategory.CITATION);
            }
        }
        return Optional.empty();
    }

    private Classification classifyWithLlm(String query, RequestContext context) {
        String prompt = this.buildPrompt(query);
        try {
            context.budget().acquireLlmCall("classification");
            String response = this.languageModel.complete(context, "classification", prompt, this.maxTokens, 0.0);
            context.budget().recordUsage(prompt, response);
            Optional<QueryCategory> category = parseCategory(response);
            if (category.isEmpty()) {
                log.warn("Classifier: unrecognized model answer '{}', using GENERAL", LogSanitizer.sanitize(response));
                context.addWarning("classification: unparseable model answer, neutral weights used");
                return Classification.neutral();
            }
            return Classification.of(category.get(), true);
        } catch (RuntimeException e) {
            log.warn("Classifier: model classification failed for {}: {}", LogSanitizer.querySummary(query), e.getMessage());
            context.addWarning("classification: model unavailable, neutral weights used");
            return Classification.neutral();
        }
    }

    private String buildPrompt(String query) {
        String categories = Arrays.stream(QueryCategory.values())
                .map(category -> "- " + category.name() + ": " + category.description())
                .collect(Collectors.joining("\n"));
        return "Classify the legal research query below into exactly one category.\n\n"
                + "Categories:\n" + categories + "\n\n"
                + "Query: " + query + "\n\n"
                + "Answer with a single line in the form CATEGORY: <NAME>";
    }

    static Optional<QueryCategory> parseCategory(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        Matcher line = CATEGORY_LINE.matcher(response);
        if (line.find()) {
            Optional<QueryCategory> labelled = QueryCategory.fromLabel(line.group(1));
            if (labelled.isPresent()) {
                return labelled;
            }
        }
        Matcher words = WORD.matcher(response);
        while (words.find()) {
            Optional<QueryCategory> match = QueryCategory.fromLabel(words.group());
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private void record(RequestContext context, Classification result, String path, long startTime) {
        context.trace().addStep(ReasoningStep.StepType.CLASSIFICATION, "Query classification",
                String.format("%s via %s (sparse=%.2f, dense=%.2f)", result.category(), path, result.sparseWeight(), result.denseWeight()),
                System.currentTimeMillis() - startTime,
                Map.of("category", result.category().name(), "path", path, "usedLlm", result.usedLlm()));
    }
}
