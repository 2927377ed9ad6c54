package com.finopsguard.scheduler;

import com.finopsguard.pricing.PricingResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that removes expired price quotes.
 *
 * Lookups already ignore stale entries; this keeps quotes for SKUs that are
 * never asked for again from piling up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PricingCacheSweepJob {

    private final PricingResolver pricingResolver;

    @Scheduled(fixedDelayString = "${finopsguard.pricing.cache-sweep-interval:PT15M}")
    public void sweepExpiredQuotes() {
        int removed = pricingResolver.evictExpired();
        if (removed > 0) {
            log.info("Removed {} expired price quotes, {} remain", removed, pricingResolver.cacheSize());
        } else {
            log.debug("No expired price quotes");
        }
    }
}
