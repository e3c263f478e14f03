package com.iudex.cograg.rag.fusion;

import com.iudex.cograg.model.BackendType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The adapters wired for this deployment, in fan-out order. At most one adapter per backend.
 */
public class RetrievalAdapters {
    private final List<RetrievalAdapter> adapters;
    private final boolean graphEnabled;

    public RetrievalAdapters(List<RetrievalAdapter> adapters, boolean graphEnabled) {
        Set<BackendType> seen = EnumSet.noneOf(BackendType.class);
        for (RetrievalAdapter adapter : adapters) {
            if (!seen.add(adapter.backend())) {
                throw new IllegalArgumentException("More than one retrieval adapter for backend '" + adapter.name() + "'");
            }
        }
        this.adapters = List.copyOf(adapters);
        this.graphEnabled = graphEnabled;
    }

    /**
     * Adapters for one request; the graph adapter joins only when enrichment is enabled and requested.
     */
    public List<RetrievalAdapter> forRequest(boolean includeGraph) {
        List<RetrievalAdapter> selected = new ArrayList<>();
        for (RetrievalAdapter adapter : this.adapters) {
            if (adapter.backend() == BackendType.GRAPH && !(includeGraph && this.graphEnabled)) {
                continue;
            }
            selected.add(adapter);
        }
        return selected;
    }

    public List<RetrievalAdapter> all() {
        return this.adapters;
    }

    public boolean isGraphEnabled() {
        return this.graphEnabled;
    }
}
