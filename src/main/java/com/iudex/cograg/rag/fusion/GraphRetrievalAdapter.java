package com.iudex.cograg.rag.fusion;

import com.iudex.cograg.capability.GraphOperation;
import com.iudex.cograg.capability.GraphStore;
import com.iudex.cograg.constant.LegalPatterns;
import com.iudex.cograg.exception.BackendUnavailableException;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.model.RetrievalCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph enrichment: passages linked to the legal references named in the query.
 * Queries without a recognizable reference return no graph candidates.
 */
public class GraphRetrievalAdapter implements RetrievalAdapter {
    private final GraphStore graphStore;
    private final int maxHops;
    private final int limit;

    public GraphRetrievalAdapter(GraphStore graphStore, int maxHops, int limit) {
        this.graphStore = graphStore;
        this.maxHops = Math.max(1, maxHops);
        this.limit = Math.max(1, limit);
    }

    @Override
    public BackendType backend() {
        return BackendType.GRAPH;
    }

    @Override
    public List<RetrievalCandidate> retrieve(RetrievalRequest request) {
        Set<String> references = LegalPatterns.extractReferences(request.query());
        if (references.isEmpty()) {
            return List.of();
        }
        Map<String, Object> params = Map.of(
                "references", new ArrayList<>(references),
                "limit", Math.min(this.limit, request.topK()),
                "max_hops", this.maxHops,
                "tenant_id", request.tenantId());
        try {
            return RetrievalAdapter.toCandidates(BackendType.GRAPH,
                    this.graphStore.query(GraphOperation.RELATED_PASSAGES, params, request.scope()));
        } catch (BackendUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendUnavailableException(this.name(), "Graph query failed: " + e.getMessage(), e);
        }
    }
}
