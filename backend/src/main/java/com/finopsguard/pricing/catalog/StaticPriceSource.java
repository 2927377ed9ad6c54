package com.finopsguard.pricing.catalog;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.pricing.PriceQuote;
import com.finopsguard.pricing.PriceSource;
import com.finopsguard.pricing.PriceSourceType;
import com.finopsguard.pricing.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Second step of the cascade: bundled static catalogs.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class StaticPriceSource implements PriceSource {

    private final Map<CloudProvider, StaticPriceCatalog> staticPriceCatalogs;
    private final PricingProperties properties;
    private final Clock clock;

    @Override
    public PriceSourceType getType() {
        return PriceSourceType.STATIC;
    }

    @Override
    public Optional<PriceQuote> quote(CloudProvider cloud, String sku, String region) {
        if (!properties.isStaticFallbackEnabled()) {
            return Optional.empty();
        }
        StaticPriceCatalog catalog = staticPriceCatalogs.get(cloud);
        if (catalog == null) {
            return Optional.empty();
        }
        return catalog.lookup(sku, region)
                .map(price -> new PriceQuote(cloud, sku, region, price,
                        PriceSourceType.STATIC.getConfidence(), PriceSourceType.STATIC, clock.instant()));
    }
}
