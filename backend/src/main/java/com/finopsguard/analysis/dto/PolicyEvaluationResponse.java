package com.finopsguard.analysis.dto;

import com.finopsguard.policy.PolicyEvaluationResult;

public record PolicyEvaluationResponse(
        PolicyEvaluationResult result,
        boolean blocked,
        double estimatedMonthlyCost,
        String pricingConfidence
) {}
