package com.iudex.cograg.context;

import com.iudex.cograg.model.Query;
import com.iudex.cograg.reasoning.ReasoningTrace;
import com.iudex.cograg.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Everything one request threads through the engine: the query, its budget, its trace and
 * the non-fatal warnings collected along the way.
 */
public final class RequestContext {
    private final Query query;
    private final RequestBudget budget;
    private final ReasoningTrace trace;
    private final List<String> warnings = new CopyOnWriteArrayList<>();

    public RequestContext(Query query, RequestBudget budget, ReasoningTrace trace) {
        this.query = query;
        this.budget = budget;
        this.trace = trace;
    }

    /**
     * Context for calls made outside a managed request, such as direct component use.
     */
    public static RequestContext detached(Query query) {
        return new RequestContext(query, RequestBudget.unbounded(),
                new ReasoningTrace(query.tenantId(), LogSanitizer.querySummary(query.text())));
    }

    public Query query() {
        return this.query;
    }

    public String tenantId() {
        return this.query.tenantId();
    }

    public String scope() {
        return this.query.scope();
    }

    public RequestBudget budget() {
        return this.budget;
    }

    public ReasoningTrace trace() {
        return this.trace;
    }

    public void addWarning(String warning) {
        if (warning != null && !this.warnings.contains(warning)) {
            this.warnings.add(warning);
        }
    }

    public List<String> warnings() {
        return new ArrayList<>(this.warnings);
    }
}
