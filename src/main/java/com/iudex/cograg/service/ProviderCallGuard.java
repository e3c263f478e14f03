package com.iudex.cograg.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.iudex.cograg.exception.ProviderRateLimitedException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rate limiting and short-lived response caching for external provider calls, keyed by
 * (tenant, provider, operation).
 *
 * <p>Identical concurrent requests share one load: the response cache uses Caffeine's atomic
 * compute, so only the first caller reaches the provider and the rest wait for its result.
 * Failures are not cached.</p>
 */
@Component
public class ProviderCallGuard {
    private static final Logger log = LoggerFactory.getLogger(ProviderCallGuard.class);
    @Value(value="${iudex.guard.requests-per-minute:120}")
    private int requestsPerMinute = 120;
    @Value(value="${iudex.guard.cache-ttl-seconds:30}")
    private long cacheTtlSeconds = 30L;
    @Value(value="${iudex.guard.cache-size:10000}")
    private long cacheSize = 10000L;
    private final Cache<String, Bucket> bucketCache = Caffeine.newBuilder().maximumSize(10000L).expireAfterAccess(1L, TimeUnit.HOURS).build();
    private Cache<String, Object> responseCache;

    @PostConstruct
    public void init() {
        this.responseCache = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, this.cacheSize))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1L, this.cacheTtlSeconds)))
                .build();
        log.info("Provider call guard initialized (requestsPerMinute={}, cacheTtlSeconds={})", this.requestsPerMinute, this.cacheTtlSeconds);
    }

    /**
     * Returns the cached response for {@code requestKey} or loads it through the rate limiter.
     *
     * @throws ProviderRateLimitedException when the (tenant, provider, operation) bucket is empty
     */
    @SuppressWarnings("unchecked")
    public <T> T call(String tenantId, String provider, String operation, String requestKey, Supplier<T> loader) {
        String scope = scopeKey(tenantId, provider, operation);
        return (T) this.responses().get(scope + "|" + requestKey, key -> {
            this.acquire(tenantId, provider, operation);
            return loader.get();
        });
    }

    /**
     * Takes one token from the (tenant, provider, operation) bucket without touching the response cache.
     * Used for calls whose responses must not be shared, such as sampled or streamed completions.
     *
     * @throws ProviderRateLimitedException when the bucket is empty
     */
    public void acquire(String tenantId, String provider, String operation) {
        String scope = scopeKey(tenantId, provider, operation);
        Bucket bucket = this.bucketCache.get(scope, k -> this.createBucket(this.requestsPerMinute));
        if (!bucket.tryConsume(1L)) {
            if (log.isWarnEnabled()) {
                log.warn("Rate limit hit for provider '{}' operation '{}' (tenant {})", provider, operation, tenantId);
            }
            throw new ProviderRateLimitedException(provider, operation);
        }
    }

    public void clear() {
        this.responses().invalidateAll();
        this.bucketCache.invalidateAll();
    }

    private Cache<String, Object> responses() {
        if (this.responseCache == null) {
            this.init();
        }
        return this.responseCache;
    }

    private Bucket createBucket(int perMinute) {
        int capacity = Math.max(1, perMinute);
        Bandwidth limit = Bandwidth.builder().capacity(capacity).refillGreedy(capacity, Duration.ofMinutes(1L)).build();
        return Bucket.builder().addLimit(limit).build();
    }

    static String scopeKey(String tenantId, String provider, String operation) {
        return (tenantId == null ? "" : tenantId) + "|" + provider + "|" + operation;
    }
}
