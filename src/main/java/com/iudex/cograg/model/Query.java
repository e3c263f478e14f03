package com.iudex.cograg.model;

import java.util.Objects;

/**
 * A question as issued by a caller. Immutable once created.
 *
 * @param text     raw natural-language query
 * @param tenantId tenant the request is scoped to; every cache and memory lookup is keyed by it
 * @param scope    corpus scope inside the tenant (collection, court, practice area)
 * @param caseId   optional case identifier, may be {@code null}
 */
public record Query(String text, String tenantId, String scope, String caseId) {

    public Query {
        text = text == null ? "" : text.trim();
        tenantId = Objects.requireNonNullElse(tenantId, "default");
        scope = Objects.requireNonNullElse(scope, "");
    }

    public static Query of(String text, String tenantId) {
        return new Query(text, tenantId, "", null);
    }

    public Query withText(String newText) {
        return new Query(newText, this.tenantId, this.scope, this.caseId);
    }
}
