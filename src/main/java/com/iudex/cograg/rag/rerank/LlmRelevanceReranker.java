package com.iudex.cograg.rag.rerank;

import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.BudgetExceededException;
import com.iudex.cograg.exception.LanguageModelException;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.service.GuardedLanguageModel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Primary reranker: the language model reads the query next to every passage and scores each
 * pair in a single listwise call.
 */
@Component
public class LlmRelevanceReranker implements Reranker {
    private static final Pattern SCORE_LINE = Pattern.compile("^\\s*\\[?(\\d+)\\]?\\s*[:=\\-]\\s*(1(?:\\.0+)?|0(?:\\.\\d+)?)\\b", Pattern.MULTILINE);
    private final GuardedLanguageModel languageModel;
    @Value("${iudex.rerank.llm.passage-chars:600}")
    private int passageChars = 600;
    @Value("${iudex.rerank.llm.max-candidates:20}")
    private int maxCandidates = 20;

    public LlmRelevanceReranker(GuardedLanguageModel languageModel) {
        this.languageModel = languageModel;
    }

    @Override
    public RerankProvider provider() {
        return RerankProvider.LLM;
    }

    @Override
    public boolean isAvailable() {
        return this.languageModel.isAvailable();
    }

    @Override
    public List<FusedResult> rerank(String query, List<FusedResult> candidates, RequestContext context) {
        int scored = Math.min(candidates.size(), this.maxCandidates);
        String prompt = this.buildPrompt(query, candidates.subList(0, scored));
        String response;
        try {
            context.budget().acquireLlmCall("rerank");
            response = this.languageModel.complete(context, "rerank", prompt, 12 * scored + 20, 0.0);
            context.budget().recordUsage(prompt, response);
        } catch (BudgetExceededException e) {
            throw e;
        } catch (LanguageModelException e) {
            throw new RerankException("LLM relevance scoring failed: " + e.getMessage(), e);
        }
        Map<Integer, Double> scores = parseScores(response);
        List<FusedResult> reranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            FusedResult candidate = candidates.get(i);
            if (i >= scored) {
                // Outside the scoring window: keep the fused score.
                reranked.add(candidate);
                continue;
            }
            Double score = scores.get(i + 1);
            if (score == null) {
                throw new RerankException("LLM relevance scoring omitted passage " + (i + 1));
            }
            reranked.add(candidate.withScore(score));
        }
        return reranked;
    }

    private String buildPrompt(String query, List<FusedResult> candidates) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Rate how relevant each passage is to the legal question, from 0.0 (irrelevant) to 1.0 (directly answers it).\n\n");
        prompt.append("Question: ").append(query).append("\n\n");
        for (int i = 0; i < candidates.size(); i++) {
            String text = candidates.get(i).text();
            if (text.length() > this.passageChars) {
                text = text.substring(0, this.passageChars) + "...";
            }
            prompt.append('[').append(i + 1).append("] ").append(text.replace('\n', ' ')).append('\n');
        }
        prompt.append("\nAnswer with one line per passage in the form <number>: <score>. No other text.");
        return prompt.toString();
    }

    static Map<Integer, Double> parseScores(String response) {
        Map<Integer, Double> scores = new HashMap<>();
        if (response == null) {
            return scores;
        }
        Matcher matcher = SCORE_LINE.matcher(response);
        while (matcher.find()) {
            scores.putIfAbsent(Integer.parseInt(matcher.group(1)), Double.parseDouble(matcher.group(2)));
        }
        return scores;
    }
}
