package com.iudex.cograg.rag.crag;

/**
 * Corrective steps a failed gate recommends for the retry round.
 */
public enum CorrectiveAction {
    EXPAND_TOP_K,
    REWRITE_QUERY,
    EXPAND_SOURCES
}
