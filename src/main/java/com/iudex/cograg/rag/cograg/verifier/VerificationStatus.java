package com.iudex.cograg.rag.cograg.verifier;

/**
 * {@code ABSTAIN} when most leaf answers are still ungrounded after rethinking.
 */
public enum VerificationStatus {
    APPROVED,
    ABSTAIN
}
