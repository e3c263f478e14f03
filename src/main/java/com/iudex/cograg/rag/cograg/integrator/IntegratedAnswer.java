package com.iudex.cograg.rag.cograg.integrator;

import java.util.List;

/**
 * Final result of a cognitive request.
 *
 * @param answer     answer text; {@code null} when abstaining without explanation
 * @param citations  union of sub-answer citations, deduplicated ignoring case
 * @param abstain    abstain metadata, {@code null} on the normal path
 * @param timedOut   true when the request deadline cut processing short
 * @param audit      trace of the request; {@code null} until attached by the orchestrator
 */
public record IntegratedAnswer(String answer, List<String> citations, GateStatus gateStatus, AbstainInfo abstain,
                               IntegrationMode mode, boolean timedOut, CognitiveAudit audit) {

    public IntegratedAnswer {
        citations = List.copyOf(citations);
    }

    public boolean isAbstain() {
        return this.abstain != null;
    }

    public IntegratedAnswer withAudit(CognitiveAudit newAudit) {
        return new IntegratedAnswer(this.answer, this.citations, this.gateStatus, this.abstain, this.mode,
                this.timedOut || newAudit != null && newAudit.timedOut(), newAudit);
    }
}
