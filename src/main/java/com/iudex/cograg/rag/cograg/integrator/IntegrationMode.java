package com.iudex.cograg.rag.cograg.integrator;

/**
 * How the final answer text was produced.
 */
public enum IntegrationMode {
    NO_RESULTS,
    SINGLE_ANSWER,
    SYNTHESIZED,
    RULE_BASED,
    ABSTAIN_EXPLAINED,
    ABSTAIN_TEMPLATE,
    ABSTAIN_SILENT;

    public boolean isAbstain() {
        return this == ABSTAIN_EXPLAINED || this == ABSTAIN_TEMPLATE || this == ABSTAIN_SILENT;
    }
}
