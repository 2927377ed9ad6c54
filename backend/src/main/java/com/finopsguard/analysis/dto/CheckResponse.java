package com.finopsguard.analysis.dto;

import com.finopsguard.policy.PolicyEvaluationReport;
import com.finopsguard.recommendation.Recommendation;

import java.util.List;

/**
 * Result of a cost impact check: cost estimate, policy outcome and hints.
 */
public record CheckResponse(
        double estimatedMonthlyCost,
        double estimatedFirstWeekCost,
        List<ResourceBreakdownItem> breakdownByResource,
        List<String> riskFlags,
        List<Recommendation> recommendations,
        PolicyEvaluationReport policyEval,
        String pricingConfidence,
        long durationMs
) {
    public boolean isBlocked() {
        return policyEval != null && policyEval.blocked();
    }
}
