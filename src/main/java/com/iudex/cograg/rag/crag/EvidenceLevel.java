package com.iudex.cograg.rag.crag;

public enum EvidenceLevel {
    STRONG(1.0),
    MODERATE(0.7),
    LOW(0.4),
    INSUFFICIENT(0.1);

    private final double confidence;

    EvidenceLevel(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return this.confidence;
    }

    public boolean requiresCorrection() {
        return this == LOW || this == INSUFFICIENT;
    }
}
