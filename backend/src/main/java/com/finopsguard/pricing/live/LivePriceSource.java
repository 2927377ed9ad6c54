package com.finopsguard.pricing.live;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.pricing.PriceQuote;
import com.finopsguard.pricing.PriceSource;
import com.finopsguard.pricing.PriceSourceType;
import com.finopsguard.pricing.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * First step of the cascade: provider pricing APIs.
 *
 * Failures are logged and reported as "no quote" so the resolver moves on
 * to the static catalog.
 */
@Component
@Order(1)
@Slf4j
public class LivePriceSource implements PriceSource {

    private final Map<CloudProvider, LivePricingClient> clients;
    private final PricingProperties properties;
    private final Clock clock;

    public LivePriceSource(
            Map<CloudProvider, LivePricingClient> livePricingClients,
            PricingProperties properties,
            Clock clock
    ) {
        this.clients = livePricingClients;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public PriceSourceType getType() {
        return PriceSourceType.LIVE;
    }

    @Override
    public Optional<PriceQuote> quote(CloudProvider cloud, String sku, String region) {
        if (!properties.isLiveEnabled()) {
            return Optional.empty();
        }
        LivePricingClient client = clients.get(cloud);
        if (client == null || !client.supports(sku)) {
            return Optional.empty();
        }
        try {
            return client.fetchLivePrice(sku, region)
                    .map(price -> new PriceQuote(cloud, sku, region, price,
                            PriceSourceType.LIVE.getConfidence(), PriceSourceType.LIVE, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Live pricing failed for {} {} in {}: {}", cloud, sku, region, e.getMessage());
            return Optional.empty();
        }
    }
}
