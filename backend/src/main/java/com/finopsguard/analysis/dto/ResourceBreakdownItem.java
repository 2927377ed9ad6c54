package com.finopsguard.analysis.dto;

import java.util.List;

/**
 * Per-resource cost line of a check response. Money is rounded to cents.
 */
public record ResourceBreakdownItem(
        String resourceId,
        String type,
        String size,
        String region,
        int count,
        double hourlyPrice,
        double monthlyCost,
        String pricingConfidence,
        String priceSource,
        List<String> notes
) {}
