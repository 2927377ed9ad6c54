package com.finopsguard.pricing;

/**
 * One row of the published price catalog.
 */
public record PriceCatalogItem(
        String cloud,
        String sku,
        String region,
        double hourlyPrice,
        double monthlyPrice,
        String confidence
) {}
