package com.finopsguard.simulation;

import com.finopsguard.domain.model.PricingConfidence;

import java.util.List;

/**
 * Outcome of a cost simulation. Amounts are kept at full precision; callers
 * round when presenting them.
 */
public record SimulationResult(
        double estimatedMonthlyCost,
        double estimatedFirstWeekCost,
        List<CostBreakdownEntry> breakdown,
        List<String> riskFlags,
        PricingConfidence pricingConfidence,
        long durationMs
) {
    public static final String OVER_BUDGET = "over_budget";
    public static final String ANALYSIS_TIMEOUT = "analysis_timeout";

    public SimulationResult {
        breakdown = List.copyOf(breakdown);
        riskFlags = List.copyOf(riskFlags);
    }

    static SimulationResult empty(long durationMs) {
        return new SimulationResult(0, 0, List.of(), List.of(), PricingConfidence.HIGH, durationMs);
    }

    public boolean hasRiskFlag(String flag) {
        return riskFlags.contains(flag);
    }

    public boolean isPartial() {
        return hasRiskFlag(ANALYSIS_TIMEOUT);
    }
}
