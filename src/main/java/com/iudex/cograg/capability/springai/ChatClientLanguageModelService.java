package com.iudex.cograg.capability.springai;

import com.iudex.cograg.capability.LanguageModelService;
import com.iudex.cograg.exception.LanguageModelException;
import com.iudex.cograg.util.LogSanitizer;
import com.iudex.cograg.util.ProviderCircuitBreaker;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * {@link LanguageModelService} backed by a Spring AI {@link ChatClient}. Consecutive provider failures put the
 * provider into a cooldown during which calls fail fast.
 */
@Service
public class ChatClientLanguageModelService implements LanguageModelService {
    private static final Logger log = LoggerFactory.getLogger(ChatClientLanguageModelService.class);
    private static final String PROVIDER = "llm";
    private final ChatClient chatClient;
    private final ExecutorService llmExecutor;
    @Value(value="${iudex.llm.timeout-ms:20000}")
    private long timeoutMs = 20000L;
    @Value(value="${iudex.llm.circuit.failure-threshold:5}")
    private int failureThreshold = 5;
    @Value(value="${iudex.llm.circuit.cooldown-seconds:30}")
    private long cooldownSeconds = 30L;
    private ProviderCircuitBreaker circuitBreaker;

    public ChatClientLanguageModelService(ChatClient.Builder chatClientBuilder, @Qualifier("llmExecutor") ExecutorService llmExecutor) {
        this.chatClient = chatClientBuilder.build();
        this.llmExecutor = llmExecutor;
        this.circuitBreaker = new ProviderCircuitBreaker(PROVIDER, this.failureThreshold, Duration.ofSeconds(this.cooldownSeconds));
    }

    @PostConstruct
    public void init() {
        this.circuitBreaker = new ProviderCircuitBreaker(PROVIDER, this.failureThreshold, Duration.ofSeconds(this.cooldownSeconds));
        log.info("ChatClient language model initialized (timeoutMs={}, failureThreshold={}, cooldownSeconds={})",
                this.timeoutMs, this.failureThreshold, this.cooldownSeconds);
    }

    @Override
    public String complete(String prompt, int maxTokens, double temperature) {
        if (!this.circuitBreaker.admit()) {
            throw this.refused();
        }
        long startTime = System.currentTimeMillis();
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> this.chatClient.prompt()
                    .user(prompt)
                    .options(this.options(maxTokens, temperature))
                    .call()
                    .content(), this.llmExecutor);
        } catch (RejectedExecutionException e) {
            this.circuitBreaker.abandon();
            throw new LanguageModelException("LLM executor saturated", e);
        }
        try {
            String content = future.get(this.timeoutMs, TimeUnit.MILLISECONDS);
            if (content == null || content.isBlank()) {
                throw new LanguageModelException("Language model returned an empty completion");
            }
            this.circuitBreaker.onSuccess();
            if (log.isDebugEnabled()) {
                log.debug("LLM completion in {}ms ({} chars)", System.currentTimeMillis() - startTime, content.length());
            }
            return content;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            this.circuitBreaker.abandon();
            throw new LanguageModelException("Language model call interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            this.circuitBreaker.onFailure(e);
            throw new LanguageModelException("Language model call timed out after " + this.timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            this.circuitBreaker.onFailure(cause);
            throw new LanguageModelException("Language model call failed: " + LogSanitizer.sanitize(cause.getMessage()), cause);
        } catch (LanguageModelException e) {
            this.circuitBreaker.onFailure(e);
            throw e;
        }
    }

    @Override
    public Flux<String> stream(String prompt, int maxTokens, double temperature) {
        return Flux.defer(() -> {
            if (!this.circuitBreaker.admit()) {
                return Flux.error(this.refused());
            }
            return this.chatClient.prompt()
                    .user(prompt)
                    .options(this.options(maxTokens, temperature))
                    .stream()
                    .content()
                    .doOnComplete(this.circuitBreaker::onSuccess)
                    .doOnCancel(this.circuitBreaker::abandon)
                    .onErrorMap(error -> !(error instanceof LanguageModelException), error -> {
                        this.circuitBreaker.onFailure(error);
                        return new LanguageModelException("Language model stream failed: " + LogSanitizer.sanitize(error.getMessage()), error);
                    });
        });
    }

    @Override
    public boolean isAvailable() {
        return this.circuitBreaker.mode() != ProviderCircuitBreaker.Mode.COOLING_DOWN;
    }

    private LanguageModelException refused() {
        long remaining = this.circuitBreaker.remainingCooldownMillis();
        return new LanguageModelException(remaining > 0
                ? "Language model provider cooling down, retry in " + remaining + "ms"
                : "Language model provider busy with a trial call");
    }

    private ChatOptions options(int maxTokens, double temperature) {
        return ChatOptions.builder()
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
    }
}
