package com.iudex.cograg.rag.crag;

import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.BudgetExceededException;
import com.iudex.cograg.service.GuardedLanguageModel;
import com.iudex.cograg.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Rewrites a query whose retrieval failed the gate into a more specific search query.
 * Any failure returns the original query.
 */
@Service
public class QueryRewriteService {
    private static final Logger log = LoggerFactory.getLogger(QueryRewriteService.class);
    private static final String REWRITE_PROMPT = "You refine search queries for a Brazilian legal research engine.\n"
            + "The query below returned weak results.\n\n"
            + "Rewrite it to be more precise: name the statute, article, court or legal institute it most likely refers to, "
            + "and use terms that appear in statutes, decisions and doctrine. Keep the original intent and language.\n"
            + "Return ONLY the rewritten query, with no explanation.\n\n"
            + "Example:\n"
            + "Input: \"prazo pra reclamar produto com defeito\"\n"
            + "Output: \"prazo decadencial vício do produto art. 26 CDC\"\n\n"
            + "Input: \"%s\"\nOutput:";
    private final GuardedLanguageModel languageModel;
    @Value(value="${iudex.crag.rewrite-max-tokens:80}")
    private int maxTokens = 80;

    public QueryRewriteService(GuardedLanguageModel languageModel) {
        this.languageModel = languageModel;
    }

    public String rewriteQuery(String originalQuery, RequestContext context) {
        long startTime = System.currentTimeMillis();
        String prompt = String.format(REWRITE_PROMPT, originalQuery);
        try {
            context.budget().acquireLlmCall("crag-rewrite");
            String rewritten = this.languageModel.complete(context, "crag-rewrite", prompt, this.maxTokens, 0.2);
            context.budget().recordUsage(prompt, rewritten);
            rewritten = rewritten == null ? "" : rewritten.trim();
            if (rewritten.startsWith("Output:")) {
                rewritten = rewritten.substring("Output:".length()).trim();
            }
            if (rewritten.length() > 1 && rewritten.startsWith("\"") && rewritten.endsWith("\"")) {
                rewritten = rewritten.substring(1, rewritten.length() - 1).trim();
            }
            if (rewritten.isBlank()) {
                return originalQuery;
            }
            log.info("CRAG: Rewrote query {} -> {} ({}ms)", LogSanitizer.querySummary(originalQuery),
                    LogSanitizer.querySummary(rewritten), System.currentTimeMillis() - startTime);
            return rewritten;
        } catch (BudgetExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("CRAG: Query rewrite failed: {}", e.getMessage());
            return originalQuery;
        }
    }
}
