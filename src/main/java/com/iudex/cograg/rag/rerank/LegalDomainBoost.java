package com.iudex.cograg.rag.rerank;

import com.iudex.cograg.constant.LegalPatterns;

/**
 * Bounded additive boost for passages dense in statute and citation tokens.
 *
 * <p>The boost grows linearly with the match count up to {@code saturation} matches and never
 * exceeds {@code maxBoost}, so a passage can only overtake one whose base score is at most
 * {@code maxBoost} higher.</p>
 */
public final class LegalDomainBoost {
    private final double maxBoost;
    private final int saturation;

    public LegalDomainBoost(double maxBoost, int saturation) {
        this.maxBoost = Math.max(0.0, maxBoost);
        this.saturation = Math.max(1, saturation);
    }

    public double boostFor(String text) {
        int matches = LegalPatterns.countDomainMatches(text);
        return this.maxBoost * Math.min((double) matches / this.saturation, 1.0);
    }

    public double apply(double baseScore, String text) {
        return Math.min(1.0, baseScore + this.boostFor(text));
    }

    public double getMaxBoost() {
        return this.maxBoost;
    }
}
