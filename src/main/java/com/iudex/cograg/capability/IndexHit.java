package com.iudex.cograg.capability;

import java.util.Map;

/**
 * Raw hit returned by an external index or store.
 */
public record IndexHit(String id, String text, double score, Map<String, Object> metadata) {

    public IndexHit {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
