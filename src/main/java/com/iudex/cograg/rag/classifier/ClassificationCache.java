package com.iudex.cograg.rag.classifier;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tenant-keyed cache of model-assigned query categories with TTL eviction.
 */
@Component
public class ClassificationCache {
    private static final Logger log = LoggerFactory.getLogger(ClassificationCache.class);
    @Value(value="${iudex.classifier.cache-size:5000}")
    private long maxSize = 5000L;
    @Value(value="${iudex.classifier.cache-ttl-seconds:3600}")
    private long ttlSeconds = 3600L;
    private Cache<String, QueryCategory> cache;

    @PostConstruct
    public void init() {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, this.maxSize))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1L, this.ttlSeconds)))
                .build();
        log.info("Classification cache initialized (maxSize={}, ttlSeconds={})", this.maxSize, this.ttlSeconds);
    }

    public QueryCategory get(String tenantId, String query) {
        return this.cache().getIfPresent(key(tenantId, query));
    }

    public void put(String tenantId, String query, QueryCategory category) {
        this.cache().put(key(tenantId, query), category);
    }

    public long size() {
        Cache<String, QueryCategory> current = this.cache();
        current.cleanUp();
        return current.estimatedSize();
    }

    public void clear() {
        this.cache().invalidateAll();
        log.info("Classification cache cleared");
    }

    private Cache<String, QueryCategory> cache() {
        if (this.cache == null) {
            this.init();
        }
        return this.cache;
    }

    static String key(String tenantId, String query) {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return (tenantId == null ? "" : tenantId) + "|" + normalized;
    }
}
