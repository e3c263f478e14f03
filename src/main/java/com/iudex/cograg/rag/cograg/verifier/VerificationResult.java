package com.iudex.cograg.rag.cograg.verifier;

import java.util.List;

/**
 * Verdict on one leaf answer.
 *
 * @param suggestion correction hint from the model check, or {@code null}
 */
public record VerificationResult(String nodeId, boolean consistent, double confidence, List<String> issues,
                                 boolean requiresNewSearch, String suggestion) {

    public VerificationResult {
        issues = List.copyOf(issues);
    }

    static VerificationResult grounded(String nodeId) {
        return new VerificationResult(nodeId, true, 0.9, List.of(), false, null);
    }

    static VerificationResult ungrounded(String nodeId, List<String> issues) {
        return new VerificationResult(nodeId, false, 0.2, issues, false, null);
    }
}
