package com.iudex.cograg.reasoning;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.iudex.cograg.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates per-request traces and keeps completed ones briefly for lookup by id.
 */
@Component
public class ReasoningTracer {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTracer.class);
    @Value(value="${iudex.reasoning.max-cached-traces:1000}")
    private int maxCachedTraces = 1000;
    @Value(value="${iudex.reasoning.trace-ttl-minutes:30}")
    private long traceTtlMinutes = 30;
    private Cache<String, ReasoningTrace> traceCache;

    @PostConstruct
    public void init() {
        this.traceCache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, this.maxCachedTraces))
                .expireAfterWrite(Duration.ofMinutes(Math.max(1L, this.traceTtlMinutes)))
                .build();
        log.info("Reasoning tracer initialized (maxCachedTraces={}, ttlMinutes={})", this.maxCachedTraces, this.traceTtlMinutes);
    }

    public ReasoningTrace startTrace(String tenantId, String query) {
        ReasoningTrace trace = new ReasoningTrace(tenantId, LogSanitizer.querySummary(query));
        log.debug("Started reasoning trace {} for tenant {}", trace.getTraceId(), LogSanitizer.sanitize(tenantId));
        return trace;
    }

    public void endTrace(ReasoningTrace trace) {
        if (trace == null) {
            return;
        }
        trace.complete();
        if (this.traceCache == null) {
            this.init();
        }
        this.traceCache.put(trace.getTraceId(), trace);
        log.debug("Completed reasoning trace: {}", trace.getSummary());
    }

    public ReasoningTrace getTrace(String traceId) {
        return this.traceCache == null || traceId == null ? null : this.traceCache.getIfPresent(traceId);
    }

    public void clearCache() {
        if (this.traceCache != null) {
            this.traceCache.invalidateAll();
        }
    }
}
