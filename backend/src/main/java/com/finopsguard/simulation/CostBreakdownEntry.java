package com.finopsguard.simulation;

import com.finopsguard.domain.model.PricingConfidence;
import com.finopsguard.pricing.PriceSourceType;

import java.util.List;

/**
 * Cost of one resource: hourly unit price times count over a month.
 */
public record CostBreakdownEntry(
        String resourceId,
        String type,
        String name,
        String size,
        String region,
        int count,
        String sku,
        double hourlyPrice,
        double monthlyCost,
        PricingConfidence confidence,
        PriceSourceType priceSource,
        List<String> notes
) {
    public CostBreakdownEntry {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
