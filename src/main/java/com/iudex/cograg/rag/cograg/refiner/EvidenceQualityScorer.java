package com.iudex.cograg.rag.cograg.refiner;

import com.iudex.cograg.constant.LegalPatterns;
import com.iudex.cograg.model.FusedResult;
import org.springframework.stereotype.Component;

/**
 * Per-chunk evidence quality in [0,1].
 *
 * <p>Sum of four terms, capped at 1.0:</p>
 * <ul>
 *   <li>relevance: 0.4 x the current score (capped at 1)</li>
 *   <li>source prior: case law 0.30, statute 0.25, commentary 0.20, other labelled source 0.10</li>
 *   <li>length: up to 0.15, very short chunks get nothing</li>
 *   <li>reference density: 0.10 for one recognised legal reference, 0.15 for three or more</li>
 * </ul>
 */
@Component
public class EvidenceQualityScorer {
    private static final double RELEVANCE_WEIGHT = 0.4;
    private static final double PRIOR_CASE_LAW = 0.30;
    private static final double PRIOR_STATUTE = 0.25;
    private static final double PRIOR_COMMENTARY = 0.20;
    private static final double PRIOR_OTHER = 0.10;

    public double score(FusedResult result) {
        double relevance = RELEVANCE_WEIGHT * Math.max(0.0, Math.min(result.score(), 1.0));
        double total = relevance + sourcePrior(result.metadata().normalizedType())
                + lengthTerm(result.text()) + referenceTerm(result.text());
        return round(Math.min(1.0, total));
    }

    static double sourcePrior(String type) {
        if (type == null || type.isEmpty()) {
            return 0.0;
        }
        if (type.contains("jurisprud") || type.contains("acord") || type.contains("acórd") || type.contains("case")) {
            return PRIOR_CASE_LAW;
        }
        if (type.contains("lei") || type.contains("codigo") || type.contains("código") || type.contains("decreto")
                || type.contains("statute") || type.contains("legisla")) {
            return PRIOR_STATUTE;
        }
        if (type.contains("doutrina") || type.contains("artigo") || type.contains("commentary") || type.contains("article")) {
            return PRIOR_COMMENTARY;
        }
        return PRIOR_OTHER;
    }

    static double lengthTerm(String text) {
        int length = text == null ? 0 : text.strip().length();
        if (length > 500) {
            return 0.15;
        }
        if (length > 200) {
            return 0.10;
        }
        return length > 50 ? 0.05 : 0.0;
    }

    static double referenceTerm(String text) {
        int refs = LegalPatterns.extractReferences(text).size();
        if (refs >= 3) {
            return 0.15;
        }
        return refs >= 1 ? 0.10 : 0.0;
    }

    static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
