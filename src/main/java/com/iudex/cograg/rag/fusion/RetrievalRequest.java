package com.iudex.cograg.rag.fusion;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parameters handed to every adapter in one fusion call.
 */
public record RetrievalRequest(String query, String tenantId, String scope, Map<String, Object> filters, int topK) {

    public RetrievalRequest {
        filters = filters == null ? Map.of() : Map.copyOf(filters);
        topK = Math.max(1, topK);
    }

    /**
     * Caller filters plus the tenant and scope constraints every backend must honour.
     */
    public Map<String, Object> effectiveFilters() {
        Map<String, Object> merged = new HashMap<>(this.filters);
        merged.put("tenant_id", this.tenantId);
        if (this.scope != null && !this.scope.isBlank()) {
            merged.put("scope", this.scope);
        }
        return merged;
    }

    /**
     * Stable cache key for identical requests.
     */
    public String cacheKey() {
        return this.query + "|" + this.scope + "|" + this.topK + "|" + new TreeMap<>(this.filters);
    }
}
