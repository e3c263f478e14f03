package com.iudex.cograg.context;

import com.iudex.cograg.exception.BudgetExceededException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request-scoped deadline plus caps on language-model calls and tokens.
 *
 * <p>Shared by every branch of one request. Checked before each expensive operation;
 * all waits are bounded by {@link #remainingMillis()}.</p>
 */
public final class RequestBudget {
    private static final long UNBOUNDED = Long.MAX_VALUE;

    private final long startNanos;
    private final long deadlineNanos;
    private final long timeoutMs;
    private final int maxLlmCalls;
    private final long maxTokens;
    private final AtomicInteger llmCalls = new AtomicInteger();
    private final AtomicLong tokensUsed = new AtomicLong();
    private volatile String exhaustedAt;

    private RequestBudget(long timeoutMs, int maxLlmCalls, long maxTokens) {
        this.startNanos = System.nanoTime();
        this.timeoutMs = timeoutMs;
        this.deadlineNanos = timeoutMs == UNBOUNDED ? UNBOUNDED : this.startNanos + Duration.ofMillis(timeoutMs).toNanos();
        this.maxLlmCalls = maxLlmCalls;
        this.maxTokens = maxTokens;
    }

    public static RequestBudget of(Duration timeout, int maxLlmCalls, long maxTokens) {
        return new RequestBudget(Math.max(1L, timeout.toMillis()), Math.max(0, maxLlmCalls), Math.max(0L, maxTokens));
    }

    public static RequestBudget unbounded() {
        return new RequestBudget(UNBOUNDED, Integer.MAX_VALUE, UNBOUNDED);
    }

    public long remainingMillis() {
        if (this.deadlineNanos == UNBOUNDED) {
            return UNBOUNDED;
        }
        return Math.max(0L, Duration.ofNanos(this.deadlineNanos - System.nanoTime()).toMillis());
    }

    /**
     * Remaining time capped at {@code limitMs}, for per-call timeouts nested inside the deadline.
     */
    public long remainingMillis(long limitMs) {
        return Math.min(limitMs, this.remainingMillis());
    }

    public boolean isExpired() {
        return this.deadlineNanos != UNBOUNDED && System.nanoTime() - this.deadlineNanos >= 0L;
    }

    public void checkDeadline(String stage) {
        if (this.isExpired()) {
            this.exhaustedAt = stage;
            throw new BudgetExceededException(stage, "Request deadline of " + this.timeoutMs + "ms exceeded at " + stage);
        }
    }

    /**
     * Reserves one language-model call, failing when the deadline passed or the call cap is reached.
     */
    public void acquireLlmCall(String stage) {
        this.checkDeadline(stage);
        if (this.tokensUsed.get() >= this.maxTokens) {
            this.exhaustedAt = stage;
            throw new BudgetExceededException(stage, "Token budget of " + this.maxTokens + " exhausted at " + stage);
        }
        if (this.llmCalls.incrementAndGet() > this.maxLlmCalls) {
            this.exhaustedAt = stage;
            throw new BudgetExceededException(stage, "LLM call budget of " + this.maxLlmCalls + " exhausted at " + stage);
        }
    }

    /**
     * Records approximate token usage (four characters per token) for one completed call.
     */
    public void recordUsage(String prompt, String completion) {
        long chars = (prompt == null ? 0 : prompt.length()) + (completion == null ? 0 : completion.length());
        this.tokensUsed.addAndGet(Math.max(1L, chars / 4L));
    }

    public int getLlmCalls() {
        return this.llmCalls.get();
    }

    public long getTokensUsed() {
        return this.tokensUsed.get();
    }

    public long elapsedMillis() {
        return Duration.ofNanos(System.nanoTime() - this.startNanos).toMillis();
    }

    public String getExhaustedAt() {
        return this.exhaustedAt;
    }

    public Map<String, Object> usage() {
        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("elapsedMs", this.elapsedMillis());
        usage.put("llmCalls", this.llmCalls.get());
        usage.put("tokensUsed", this.tokensUsed.get());
        if (this.deadlineNanos != UNBOUNDED) {
            usage.put("timeoutMs", this.timeoutMs);
        }
        if (this.exhaustedAt != null) {
            usage.put("exhaustedAt", this.exhaustedAt);
        }
        return usage;
    }
}
