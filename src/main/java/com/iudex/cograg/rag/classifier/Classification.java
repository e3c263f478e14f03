package com.iudex.cograg.rag.classifier;

/**
 * Result of classifying one query.
 *
 * @param usedLlm true only when the category came from an accepted model answer
 */
public record Classification(QueryCategory category, double sparseWeight, double denseWeight, boolean usedLlm) {

    public static Classification of(QueryCategory category, boolean usedLlm) {
        return new Classification(category, category.sparseWeight(), category.denseWeight(), usedLlm);
    }

    public static Classification neutral() {
        return of(QueryCategory.GENERAL, false);
    }
}
