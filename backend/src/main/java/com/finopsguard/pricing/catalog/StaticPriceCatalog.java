package com.finopsguard.pricing.catalog;

import com.finopsguard.domain.model.CloudProvider;

import java.util.Map;
import java.util.Optional;

/**
 * Bundled list prices for one provider.
 *
 * Prices are on-demand hourly USD in the provider's reference region and are
 * applied to every region unless a region override exists. Keys follow the
 * SKU conventions of the cost simulator: a machine size ({@code t3.medium}),
 * a canonical type for flat services ({@code aws_eks_cluster}) or
 * {@code type:size} for tiered services ({@code aws_load_balancer:application}).
 */
public interface StaticPriceCatalog {

    CloudProvider getProvider();

    /**
     * Reference-region prices keyed by SKU.
     */
    Map<String, Double> getHourlyPrices();

    /**
     * Region-specific prices keyed by {@code region + "/" + sku}.
     */
    default Map<String, Double> getRegionOverrides() {
        return Map.of();
    }

    default Optional<Double> lookup(String sku, String region) {
        if (sku == null) {
            return Optional.empty();
        }
        if (region != null) {
            Double override = getRegionOverrides().get(region + "/" + sku);
            if (override != null) {
                return Optional.of(override);
            }
        }
        return Optional.ofNullable(getHourlyPrices().get(sku));
    }
}
