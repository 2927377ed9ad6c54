package com.finopsguard.policy;

import java.util.List;

/**
 * Aggregate outcome of every evaluated policy for one request.
 *
 * @param results one entry per evaluated policy, in registration order
 * @param blocked true iff a blocking policy failed
 * @param skippedPolicies ids of malformed policies that could not be evaluated
 */
public record PolicyEvaluationReport(
        List<PolicyEvaluationResult> results,
        boolean blocked,
        List<PolicyEvaluationResult> blockingViolations,
        List<PolicyEvaluationResult> advisoryViolations,
        List<String> passedPolicies,
        List<String> skippedPolicies,
        OverallStatus overallStatus
) {
    public enum OverallStatus {
        PASS("pass"),
        ADVISORY("advisory"),
        BLOCK("block");

        private final String value;

        OverallStatus(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    public PolicyEvaluationReport {
        results = List.copyOf(results);
        blockingViolations = List.copyOf(blockingViolations);
        advisoryViolations = List.copyOf(advisoryViolations);
        passedPolicies = List.copyOf(passedPolicies);
        skippedPolicies = List.copyOf(skippedPolicies);
    }

    static PolicyEvaluationReport of(List<PolicyEvaluationResult> results, List<String> skippedPolicies) {
        List<PolicyEvaluationResult> blocking = results.stream().filter(PolicyEvaluationResult::isBlocking).toList();
        List<PolicyEvaluationResult> advisory = results.stream()
                .filter(result -> result.isFailed() && !result.isBlocking())
                .toList();
        List<String> passed = results.stream()
                .filter(result -> !result.isFailed())
                .map(PolicyEvaluationResult::policyId)
                .toList();

        OverallStatus status = !blocking.isEmpty()
                ? OverallStatus.BLOCK
                : advisory.isEmpty() ? OverallStatus.PASS : OverallStatus.ADVISORY;

        return new PolicyEvaluationReport(results, !blocking.isEmpty(), blocking, advisory, passed,
                skippedPolicies, status);
    }

    public static PolicyEvaluationReport empty() {
        return of(List.of(), List.of());
    }
}
