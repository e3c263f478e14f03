package com.iudex.cograg.capability;

/**
 * The closed set of graph queries the engine may issue. No free-form query language is exposed.
 */
public enum GraphOperation {
    /** Passages linked to the given legal references, params: {@code references}, {@code limit}, {@code max_hops}. */
    RELATED_PASSAGES,
    /** Decisions citing the given references, params: {@code references}, {@code limit}. */
    CITING_DECISIONS,
    /** Entities adjacent to the given entity ids, params: {@code entity_ids}, {@code limit}. */
    NEIGHBORS
}
