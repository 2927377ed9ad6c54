package com.finopsguard.pricing;

import com.finopsguard.domain.model.CloudProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves (cloud, sku, region) to an hourly price quote.
 *
 * CASCADE:
 * 1. Live provider API (when enabled) - high confidence, cached 6h
 * 2. Bundled static catalog (when fallback enabled) - medium confidence, cached 24h
 * 3. Default placeholder price - low confidence, never cached
 *
 * CACHING STRATEGY:
 * - Key: cloud + sku + region
 * - Entries expire lazily on the next lookup past their TTL
 * - {@link #flush()} clears everything, {@link #invalidate(CloudProvider)} one cloud
 * - Concurrent writers race harmlessly: the last write wins
 *
 * Resolution never fails for a valid cloud. Every source error degrades to
 * the next step.
 */
@Service
@Slf4j
public class PricingResolver {

    private final List<PriceSource> sources;
    private final PricingProperties properties;
    private final Clock clock;

    private final Map<PriceKey, CachedQuote> cache = new ConcurrentHashMap<>();

    public PricingResolver(List<PriceSource> sources, PricingProperties properties, Clock clock) {
        this.sources = List.copyOf(sources);
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if {@code cloud} is not a known provider code
     */
    public PriceQuote resolve(String cloud, String sku, String region) {
        return resolve(CloudProvider.fromCode(cloud), sku, region);
    }

    public PriceQuote resolve(CloudProvider cloud, String sku, String region) {
        if (cloud == null) {
            throw new IllegalArgumentException("Cloud provider must not be null");
        }
        Instant now = clock.instant();
        if (sku == null || sku.isBlank()) {
            return defaultQuote(cloud, "unknown", region, now);
        }

        PriceKey key = new PriceKey(cloud, sku, region);
        CachedQuote cached = cache.get(key);
        if (cached != null) {
            if (now.isBefore(cached.expiresAt())) {
                return cached.quote();
            }
            cache.remove(key, cached);
        }

        for (PriceSource source : sources) {
            Optional<PriceQuote> quote = tryQuote(source, cloud, sku, region);
            if (quote.isPresent()) {
                cache.put(key, new CachedQuote(quote.get(), now.plus(ttlFor(source.getType()))));
                return quote.get();
            }
        }

        log.debug("No price found for {} {} in {}, using default", cloud, sku, region);
        return defaultQuote(cloud, sku, region, now);
    }

    public void flush() {
        int size = cache.size();
        cache.clear();
        log.info("Flushed pricing cache ({} entries)", size);
    }

    public void invalidate(CloudProvider cloud) {
        cache.keySet().removeIf(key -> key.cloud() == cloud);
        log.info("Invalidated pricing cache entries for {}", cloud);
    }

    /**
     * Drop entries past their TTL without waiting for the next lookup.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.values().removeIf(cached -> !now.isBefore(cached.expiresAt()));
        return before - cache.size();
    }

    public int cacheSize() {
        return cache.size();
    }

    private Optional<PriceQuote> tryQuote(PriceSource source, CloudProvider cloud, String sku, String region) {
        try {
            return source.quote(cloud, sku, region);
        } catch (RuntimeException e) {
            log.warn("{} pricing source failed for {} {} in {}: {}",
                    source.getType().getValue(), cloud, sku, region, e.getMessage());
            return Optional.empty();
        }
    }

    private Duration ttlFor(PriceSourceType type) {
        return switch (type) {
            case LIVE -> properties.getLiveTtl();
            case STATIC -> properties.getStaticTtl();
            case DEFAULT -> Duration.ZERO;
        };
    }

    private PriceQuote defaultQuote(CloudProvider cloud, String sku, String region, Instant now) {
        return PriceQuote.of(cloud, sku, region, properties.getDefaultHourlyPrice(), PriceSourceType.DEFAULT, now);
    }

    record PriceKey(CloudProvider cloud, String sku, String region) {}

    record CachedQuote(PriceQuote quote, Instant expiresAt) {}
}
