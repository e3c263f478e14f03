package com.iudex.cograg.rag.classifier;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of query categories with their calibrated sparse/dense retrieval weights.
 *
 * <p>Identifier-like categories lean on lexical matching; conceptual and argumentative ones on
 * embedding similarity. Each pair is written out literally so the two weights sum to exactly 1.0.</p>
 */
public enum QueryCategory {
    IDENTIFIER("document identifier such as a CNJ case number or protocol", 0.90, 0.10, true),
    CITATION("explicit article, paragraph, statute or precedent citation", 0.75, 0.25, true),
    NORM("question about what a statute or regulation provides", 0.65, 0.35, false),
    FACTUAL("question about concrete facts, dates, amounts or parties", 0.60, 0.40, false),
    PROCEDURAL("question about procedure, deadlines, filings or appeals", 0.55, 0.45, false),
    GENERAL("anything that fits no other category", 0.50, 0.50, false),
    CASE_LAW("question about court decisions and jurisprudential positions", 0.40, 0.60, false),
    ARGUMENTATIVE("request to build or assess a legal argument or thesis", 0.35, 0.65, false),
    CONCEPTUAL("question about the meaning of a legal concept or doctrine", 0.25, 0.75, false);

    private final String description;
    private final double sparseWeight;
    private final double denseWeight;
    private final boolean identifierLike;

    QueryCategory(String description, double sparseWeight, double denseWeight, boolean identifierLike) {
        this.description = description;
        this.sparseWeight = sparseWeight;
        this.denseWeight = denseWeight;
        this.identifierLike = identifierLike;
    }

    public String description() {
        return this.description;
    }

    public double sparseWeight() {
        return this.sparseWeight;
    }

    public double denseWeight() {
        return this.denseWeight;
    }

    public boolean isIdentifierLike() {
        return this.identifierLike;
    }

    public static Optional<QueryCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (QueryCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
