package com.finopsguard.pricing;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.PricingConfidence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PricingResolver.
 *
 * Test strategy:
 * 1. Cascade order and confidence tagging
 * 2. Degradation when sources fail
 * 3. Cache hits, TTL expiry and invalidation
 */
class PricingResolverTest {

    private MutableClock clock;
    private PricingProperties properties;
    private FakeSource live;
    private FakeSource fallback;
    private PricingResolver resolver;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        properties = new PricingProperties();
        live = new FakeSource(PriceSourceType.LIVE);
        fallback = new FakeSource(PriceSourceType.STATIC);
        resolver = new PricingResolver(List.of(live, fallback), properties, clock);
    }

    @Nested
    @DisplayName("Cascade Tests")
    class CascadeTests {

        @Test
        @DisplayName("Should prefer a live quote with high confidence")
        void shouldPreferLiveQuote() {
            // Given
            live.prices.put("t3.medium", 0.0420);
            fallback.prices.put("t3.medium", 0.0416);

            // When
            PriceQuote quote = resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");

            // Then
            assertThat(quote.hourlyPrice()).isEqualTo(0.0420);
            assertThat(quote.source()).isEqualTo(PriceSourceType.LIVE);
            assertThat(quote.confidence()).isEqualTo(PricingConfidence.HIGH);
            assertThat(fallback.calls).isZero();
        }

        @Test
        @DisplayName("Should fall back to the static catalog when live has no price")
        void shouldFallBackToStatic() {
            // Given
            fallback.prices.put("t3.medium", 0.0416);

            // When
            PriceQuote quote = resolver.resolve("aws", "t3.medium", "us-east-1");

            // Then
            assertThat(quote.hourlyPrice()).isEqualTo(0.0416);
            assertThat(quote.confidence()).isEqualTo(PricingConfidence.MEDIUM);
        }

        @Test
        @DisplayName("Should fall back when the live source throws")
        void shouldFallBackWhenLiveFails() {
            // Given
            live.failure = new IllegalStateException("connection refused");
            fallback.prices.put("t3.medium", 0.0416);

            // When
            PriceQuote quote = resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");

            // Then
            assertThat(quote.source()).isEqualTo(PriceSourceType.STATIC);
        }

        @Test
        @DisplayName("Should use the default price with low confidence when nothing matches")
        void shouldUseDefaultPrice() {
            // When
            PriceQuote quote = resolver.resolve(CloudProvider.GCP, "x9-mystery-64", "us-central1");

            // Then
            assertThat(quote.hourlyPrice()).isEqualTo(0.10);
            assertThat(quote.confidence()).isEqualTo(PricingConfidence.LOW);
            assertThat(quote.source()).isEqualTo(PriceSourceType.DEFAULT);
            assertThat(resolver.cacheSize()).isZero();
        }

        @Test
        @DisplayName("Should price a blank SKU at the default without asking any source")
        void shouldDefaultBlankSku() {
            // When
            PriceQuote quote = resolver.resolve(CloudProvider.AWS, " ", "us-east-1");

            // Then
            assertThat(quote.sku()).isEqualTo("unknown");
            assertThat(quote.source()).isEqualTo(PriceSourceType.DEFAULT);
            assertThat(live.calls).isZero();
        }

        @Test
        @DisplayName("Should reject unknown cloud codes")
        void shouldRejectUnknownCloud() {
            assertThatThrownBy(() -> resolver.resolve("oracle", "vm", "x"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("oracle");
        }
    }

    @Nested
    @DisplayName("Cache Tests")
    class CacheTests {

        @Test
        @DisplayName("Should serve repeated lookups from cache")
        void shouldServeFromCache() {
            // Given
            fallback.prices.put("t3.medium", 0.0416);

            // When
            PriceQuote first = resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");
            PriceQuote second = resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");

            // Then
            assertThat(second).isEqualTo(first);
            assertThat(fallback.calls).isEqualTo(1);
            assertThat(resolver.cacheSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should key the cache by region")
        void shouldKeyByRegion() {
            // Given
            fallback.prices.put("t3.medium", 0.0416);

            // When
            resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");
            resolver.resolve(CloudProvider.AWS, "t3.medium", "eu-west-1");

            // Then
            assertThat(fallback.calls).isEqualTo(2);
        }

        @Test
        @DisplayName("Should refetch a static quote after its TTL")
        void shouldRefetchAfterTtl() {
            // Given
            fallback.prices.put("t3.medium", 0.0416);
            resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");

            // When
            clock.advance(Duration.ofHours(23));
            resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");
            clock.advance(Duration.ofHours(2));
            fallback.prices.put("t3.medium", 0.0500);
            PriceQuote refreshed = resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");

            // Then
            assertThat(fallback.calls).isEqualTo(2);
            assertThat(refreshed.hourlyPrice()).isEqualTo(0.0500);
        }

        @Test
        @DisplayName("Should expire live quotes sooner than static ones")
        void shouldExpireLiveQuotesSooner() {
            // Given
            live.prices.put("t3.medium", 0.0420);
            fallback.prices.put("m5.large", 0.096);
            resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");
            resolver.resolve(CloudProvider.AWS, "m5.large", "us-east-1");

            // When
            clock.advance(Duration.ofHours(7));
            int removed = resolver.evictExpired();

            // Then
            assertThat(removed).isEqualTo(1);
            assertThat(resolver.cacheSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should flush every entry")
        void shouldFlush() {
            // Given
            fallback.prices.put("t3.medium", 0.0416);
            resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");

            // When
            resolver.flush();
            resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");

            // Then
            assertThat(fallback.calls).isEqualTo(2);
        }

        @Test
        @DisplayName("Should invalidate only the given cloud")
        void shouldInvalidateOneCloud() {
            // Given
            fallback.prices.put("t3.medium", 0.0416);
            fallback.prices.put("e2-medium", 0.0335);
            resolver.resolve(CloudProvider.AWS, "t3.medium", "us-east-1");
            resolver.resolve(CloudProvider.GCP, "e2-medium", "us-central1");

            // When
            resolver.invalidate(CloudProvider.AWS);

            // Then
            assertThat(resolver.cacheSize()).isEqualTo(1);
        }
    }

    private static final class FakeSource implements PriceSource {

        private final PriceSourceType type;
        private final Map<String, Double> prices = new HashMap<>();
        private RuntimeException failure;
        private int calls;

        private FakeSource(PriceSourceType type) {
            this.type = type;
        }

        @Override
        public PriceSourceType getType() {
            return type;
        }

        @Override
        public Optional<PriceQuote> quote(CloudProvider cloud, String sku, String region) {
            calls++;
            if (failure != null) {
                throw failure;
            }
            return Optional.ofNullable(prices.get(sku))
                    .map(price -> PriceQuote.of(cloud, sku, region, price, type, Instant.EPOCH));
        }
    }
}
