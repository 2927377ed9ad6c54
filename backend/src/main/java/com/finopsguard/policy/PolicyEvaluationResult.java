package com.finopsguard.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one policy against one request.
 *
 * @param violationDetails budget overage, failed rules or violating resources; empty on pass
 */
public record PolicyEvaluationResult(
        String policyId,
        String policyName,
        PolicyStatus status,
        String reason,
        ViolationMode onViolation,
        Map<String, Object> violationDetails
) {
    public PolicyEvaluationResult {
        violationDetails = violationDetails == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(violationDetails));
    }

    static PolicyEvaluationResult passed(Policy policy, ViolationMode mode, String reason) {
        return new PolicyEvaluationResult(policy.getId(), policy.getName(), PolicyStatus.PASS, reason, mode, Map.of());
    }

    static PolicyEvaluationResult failed(Policy policy, ViolationMode mode, String reason,
                                         Map<String, Object> details) {
        return new PolicyEvaluationResult(policy.getId(), policy.getName(), PolicyStatus.FAIL, reason, mode, details);
    }

    public boolean isFailed() {
        return status == PolicyStatus.FAIL;
    }

    public boolean isBlocking() {
        return isFailed() && onViolation.isBlocking();
    }
}
