package com.finopsguard.pricing;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.PricingConfidence;

import java.time.Instant;

/**
 * Hourly USD price for one (cloud, sku, region), tagged with its source.
 */
public record PriceQuote(
        CloudProvider cloud,
        String sku,
        String region,
        double hourlyPrice,
        PricingConfidence confidence,
        PriceSourceType source,
        Instant fetchedAt
) {
    public PriceQuote {
        if (hourlyPrice < 0) {
            throw new IllegalArgumentException("Hourly price must not be negative: " + hourlyPrice);
        }
    }

    static PriceQuote of(CloudProvider cloud, String sku, String region, double hourlyPrice,
                         PriceSourceType source, Instant fetchedAt) {
        return new PriceQuote(cloud, sku, region, hourlyPrice, source.getConfidence(), source, fetchedAt);
    }
}
