package com.iudex.cograg.util;

import java.time.Duration;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops calling a model provider after consecutive failures.
 *
 * <p>After {@code failureThreshold} failures in a row the provider cools down and every call is
 * refused. Once the cooldown has elapsed a single trial call is let through: success makes the
 * provider available again, failure starts a new cooldown. Refused calls never reach the provider,
 * so they do not count as failures.</p>
 */
public final class ProviderCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

    public enum Mode {
        AVAILABLE,
        COOLING_DOWN,
        TRIAL
    }

    private final String provider;
    private final int failureThreshold;
    private final long cooldownMs;
    private final LongSupplier clock;
    private Mode mode = Mode.AVAILABLE;
    private int consecutiveFailures;
    private long cooldownEndsAt;
    private boolean trialInFlight;

    public ProviderCircuitBreaker(String provider, int failureThreshold, Duration cooldown) {
        this(provider, failureThreshold, cooldown, System::currentTimeMillis);
    }

    ProviderCircuitBreaker(String provider, int failureThreshold, Duration cooldown, LongSupplier clock) {
        this.provider = provider;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.cooldownMs = cooldown == null ? 30000L : Math.max(0L, cooldown.toMillis());
        this.clock = clock;
    }

    /**
     * True when the caller may contact the provider now. A true answer while cooling down is the
     * trial call and must be followed by {@link #onSuccess()} or {@link #onFailure(Throwable)}.
     */
    public synchronized boolean admit() {
        switch (this.mode) {
            case AVAILABLE:
                return true;
            case COOLING_DOWN:
                if (this.clock.getAsLong() < this.cooldownEndsAt) {
                    return false;
                }
                this.mode = Mode.TRIAL;
                this.trialInFlight = true;
                log.info("Provider '{}' cooldown over, sending a trial call", this.provider);
                return true;
            case TRIAL:
            default:
                if (this.trialInFlight) {
                    return false;
                }
                this.trialInFlight = true;
                return true;
        }
    }

    public synchronized void onSuccess() {
        if (this.mode != Mode.AVAILABLE) {
            log.info("Provider '{}' available again after {} consecutive failures", this.provider, this.consecutiveFailures);
        }
        this.mode = Mode.AVAILABLE;
        this.consecutiveFailures = 0;
        this.trialInFlight = false;
    }

    public synchronized void onFailure(Throwable error) {
        this.consecutiveFailures++;
        this.trialInFlight = false;
        if (this.mode == Mode.TRIAL || this.consecutiveFailures >= this.failureThreshold) {
            this.mode = Mode.COOLING_DOWN;
            this.cooldownEndsAt = this.clock.getAsLong() + this.cooldownMs;
            if (log.isWarnEnabled()) {
                log.warn("Provider '{}' cooling down for {}ms after {} consecutive failures, last: {}", this.provider, this.cooldownMs,
                        this.consecutiveFailures, error != null ? LogSanitizer.sanitize(error.getMessage()) : "n/a");
            }
        }
    }

    /**
     * Ends an admitted call that never got a provider answer, without counting it either way.
     */
    public synchronized void abandon() {
        this.trialInFlight = false;
    }

    public synchronized Mode mode() {
        return this.mode;
    }

    public synchronized int consecutiveFailures() {
        return this.consecutiveFailures;
    }

    /**
     * Milliseconds until a trial call is allowed; 0 unless cooling down.
     */
    public synchronized long remainingCooldownMillis() {
        return this.mode == Mode.COOLING_DOWN ? Math.max(0L, this.cooldownEndsAt - this.clock.getAsLong()) : 0L;
    }

    public String provider() {
        return this.provider;
    }
}
