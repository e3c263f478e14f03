package com.iudex.cograg.service;

import com.iudex.cograg.capability.LanguageModelService;
import com.iudex.cograg.context.RequestContext;
import com.iudex.cograg.exception.LanguageModelException;
import com.iudex.cograg.exception.ProviderRateLimitedException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Language-model access for the reasoning stages, routed through {@link ProviderCallGuard}.
 *
 * <p>Every call consumes a token from the caller's (tenant, {@value #PROVIDER}, operation) bucket.
 * Deterministic completions (temperature 0) are also served from the guard's short-lived response
 * cache; sampled and streamed completions never are. A rate-limit rejection surfaces as
 * {@link LanguageModelException} so callers take their usual model-failure fallback.</p>
 */
@Component
public class GuardedLanguageModel {
    static final String PROVIDER = "llm";
    private final LanguageModelService delegate;
    private final ProviderCallGuard callGuard;

    public GuardedLanguageModel(LanguageModelService delegate, ProviderCallGuard callGuard) {
        this.delegate = delegate;
        this.callGuard = callGuard;
    }

    public String complete(RequestContext context, String operation, String prompt, int maxTokens, double temperature) {
        try {
            if (temperature == 0.0) {
                String requestKey = maxTokens + "|" + digest(prompt);
                return this.callGuard.call(context.tenantId(), PROVIDER, operation, requestKey,
                        () -> this.delegate.complete(prompt, maxTokens, temperature));
            }
            this.callGuard.acquire(context.tenantId(), PROVIDER, operation);
            return this.delegate.complete(prompt, maxTokens, temperature);
        } catch (ProviderRateLimitedException e) {
            throw new LanguageModelException(e.getMessage(), e);
        }
    }

    public Flux<String> stream(RequestContext context, String operation, String prompt, int maxTokens, double temperature) {
        return Flux.defer(() -> {
            try {
                this.callGuard.acquire(context.tenantId(), PROVIDER, operation);
            } catch (ProviderRateLimitedException e) {
                return Flux.error(new LanguageModelException(e.getMessage(), e));
            }
            return this.delegate.stream(prompt, maxTokens, temperature);
        });
    }

    public boolean isAvailable() {
        return this.delegate.isAvailable();
    }

    private static String digest(String prompt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(prompt.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
