package com.finopsguard.pricing;

import com.finopsguard.domain.model.CloudProvider;

import java.util.Optional;

/**
 * One step of the pricing cascade.
 *
 * Sources are tried in order; the first one returning a quote wins. A source
 * that cannot price the SKU returns empty rather than throwing.
 */
public interface PriceSource {

    PriceSourceType getType();

    Optional<PriceQuote> quote(CloudProvider cloud, String sku, String region);
}
