package com.iudex.cograg.rag.rerank;

import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.BudgetExceededException;
import com.iudex.cograg.model.FusedResult;
import com.iudex.cograg.model.Query;
import com.iudex.cograg.reasoning.ReasoningStep;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs the configured reranker chain in order and applies the legal domain boost.
 *
 * <p>The first available provider that succeeds wins. When every provider is unavailable or
 * fails, candidates pass through with their fusion scores untouched.</p>
 */
@Service
public class RerankService {
    private static final Logger log = LoggerFactory.getLogger(RerankService.class);
    private static final Comparator<FusedResult> BY_SCORE = Comparator
            .comparingDouble(FusedResult::score).reversed()
            .thenComparing(Comparator.comparingDouble(FusedResult::rrfScore).reversed())
            .thenComparing(result -> result.id() == null ? "" : result.id());
    private final Map<RerankProvider, Reranker> available = new EnumMap<>(RerankProvider.class);
    @Value("${iudex.rerank.providers:llm,embedding}")
    private String providerChain = "llm,embedding";
    @Value("${iudex.rerank.domain-boost:0.1}")
    private double domainBoost = 0.1;
    @Value("${iudex.rerank.boost-saturation:5}")
    private int boostSaturation = 5;
    private List<Reranker> chain = List.of();
    private LegalDomainBoost boost;

    public RerankService(List<Reranker> rerankers) {
        for (Reranker reranker : rerankers) {
            this.available.put(reranker.provider(), reranker);
        }
    }

    @PostConstruct
    public void init() {
        List<Reranker> resolved = new ArrayList<>();
        for (String name : this.providerChain.split(",")) {
            if (name.isBlank()) {
                continue;
            }
            RerankProvider provider;
            try {
                provider = RerankProvider.fromKey(name);
            } catch (IllegalArgumentException e) {
                log.warn("Unknown reranker '{}' in chain, ignoring", name.trim());
                continue;
            }
            Reranker reranker = this.available.get(provider);
            if (reranker != null && !resolved.contains(reranker)) {
                resolved.add(reranker);
            }
        }
        this.chain = List.copyOf(resolved);
        this.boost = new LegalDomainBoost(this.domainBoost, this.boostSaturation);
        log.info("Rerank chain initialized: {} (domainBoost={})", this.chain.stream().map(Reranker::provider).toList(), this.domainBoost);
    }

    public List<FusedResult> rerank(String query, List<FusedResult> candidates) {
        return this.rerank(query, candidates, RequestContext.detached(Query.of(query, "default"))).results();
    }

    public RerankOutcome rerank(String query, List<FusedResult> candidates, RequestContext context) {
        if (query == null || query.isBlank() || candidates == null || candidates.isEmpty()) {
            return new RerankOutcome(candidates == null ? List.of() : candidates, RerankProvider.PASSTHROUGH);
        }
        if (this.boost == null) {
            this.init();
        }
        long startTime = System.currentTimeMillis();
        for (Reranker reranker : this.chain) {
            if (!reranker.isAvailable()) {
                log.debug("Reranker {} unavailable, trying next", reranker.provider());
                continue;
            }
            context.budget().checkDeadline("rerank");
            try {
                List<FusedResult> scored = reranker.rerank(query, candidates, context);
                List<FusedResult> boosted = new ArrayList<>(scored.size());
                for (FusedResult result : scored) {
                    boosted.add(result.withScore(this.boost.apply(result.score(), result.text())));
                }
                boosted.sort(BY_SCORE);
                this.record(context, reranker.provider(), boosted.size(), startTime);
                return new RerankOutcome(boosted, reranker.provider());
            } catch (BudgetExceededException e) {
                throw e;
            } catch (RuntimeException e) {
                if (log.isWarnEnabled()) {
                    log.warn("Reranker {} failed, falling back: {}", reranker.provider(), e.getMessage());
                }
                context.addWarning("reranker " + reranker.provider().name().toLowerCase() + " failed; fell back");
            }
        }
        this.record(context, RerankProvider.PASSTHROUGH, candidates.size(), startTime);
        return new RerankOutcome(candidates, RerankProvider.PASSTHROUGH);
    }

    private void record(RequestContext context, RerankProvider provider, int count, long startTime) {
        context.trace().addStep(ReasoningStep.StepType.RERANK, "Rerank",
                String.format("%d candidates via %s", count, provider), System.currentTimeMillis() - startTime,
                Map.of("provider", provider.name()));
    }

    public record RerankOutcome(List<FusedResult> results, RerankProvider provider) {
    }
}
