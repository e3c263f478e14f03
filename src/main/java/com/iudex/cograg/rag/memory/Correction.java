package com.iudex.cograg.rag.memory;

import java.time.Instant;
import java.util.List;

/**
 * Reviewer feedback on a stored consultation: references that must not be relied on again.
 */
public record Correction(List<String> badReferences, String note, String reviewerId, Instant createdAt) {

    public Correction {
        badReferences = List.copyOf(badReferences);
    }
}
