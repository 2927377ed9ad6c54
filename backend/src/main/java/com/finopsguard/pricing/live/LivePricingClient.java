package com.finopsguard.pricing.live;

import com.finopsguard.domain.model.CloudProvider;

import java.util.Optional;

/**
 * Port interface for provider pricing APIs.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Return hourly on-demand USD prices only
 * 2. Throw {@link LivePricingException} on transport or payload failures
 * 3. Return empty when the API answers but has no price for the SKU
 */
public interface LivePricingClient {

    /**
     * Returns the cloud provider this client queries.
     */
    CloudProvider getProvider();

    /**
     * Whether the SKU is something this API can price. Service-level SKUs
     * such as load balancer tiers or serverless types are never sent live.
     */
    boolean supports(String sku);

    /**
     * Fetch the current on-demand price.
     *
     * @param sku Provider-specific SKU identifier, e.g. {@code t3.medium}
     * @param region Provider-specific region identifier
     * @return Hourly price in USD
     */
    Optional<Double> fetchLivePrice(String sku, String region);
}
