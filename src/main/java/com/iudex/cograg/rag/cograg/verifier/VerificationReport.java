package com.iudex.cograg.rag.cograg.verifier;

import com.iudex.cograg.rag.cograg.reasoner.SubAnswer;
import java.util.List;

/**
 * Outcome of verifying all leaf answers of a request.
 *
 * @param subAnswers answers after rethinking, with the confidence of rejected ones capped
 * @param issues     problems found, each prefixed with the short id of its node
 * @param rethinks   rethink rounds performed
 */
public record VerificationReport(List<SubAnswer> subAnswers, VerificationStatus status, List<String> issues,
                                 List<VerificationResult> results, int rethinks) {

    public VerificationReport {
        subAnswers = List.copyOf(subAnswers);
        issues = List.copyOf(issues);
        results = List.copyOf(results);
    }

    public static VerificationReport skipped(List<SubAnswer> subAnswers) {
        return new VerificationReport(subAnswers, VerificationStatus.APPROVED, List.of(), List.of(), 0);
    }

    public long rejectedCount() {
        return this.results.stream().filter(result -> !result.consistent()).count();
    }
}
