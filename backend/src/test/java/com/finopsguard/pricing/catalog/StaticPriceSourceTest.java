package com.finopsguard.pricing.catalog;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.PricingConfidence;
import com.finopsguard.pricing.PriceQuote;
import com.finopsguard.pricing.PriceSourceType;
import com.finopsguard.pricing.PricingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class StaticPriceSourceTest {

    private PricingProperties properties;
    private StaticPriceSource source;

    @BeforeEach
    void setUp() {
        properties = new PricingProperties();
        source = new StaticPriceSource(
                Map.of(
                        CloudProvider.AWS, new AwsStaticPriceCatalog(),
                        CloudProvider.GCP, new GcpStaticPriceCatalog(),
                        CloudProvider.AZURE, new AzureStaticPriceCatalog()
                ),
                properties,
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC)
        );
    }

    @Test
    @DisplayName("Should quote the reference price with medium confidence")
    void shouldQuoteReferencePrice() {
        // When
        Optional<PriceQuote> quote = source.quote(CloudProvider.AWS, "t3.medium", "us-east-1");

        // Then
        assertThat(quote).isPresent();
        assertThat(quote.get().hourlyPrice()).isEqualTo(0.0416);
        assertThat(quote.get().confidence()).isEqualTo(PricingConfidence.MEDIUM);
        assertThat(quote.get().source()).isEqualTo(PriceSourceType.STATIC);
    }

    @Test
    @DisplayName("Should apply region overrides")
    void shouldApplyRegionOverride() {
        assertThat(source.quote(CloudProvider.AWS, "t3.medium", "eu-west-1"))
                .map(PriceQuote::hourlyPrice)
                .contains(0.0456);
        assertThat(source.quote(CloudProvider.AZURE, "Standard_B2s", "westeurope"))
                .map(PriceQuote::hourlyPrice)
                .contains(0.048);
    }

    @Test
    @DisplayName("Should use the reference price in regions without an override")
    void shouldUseReferencePriceElsewhere() {
        assertThat(source.quote(CloudProvider.GCP, "e2-medium", "us-west1"))
                .map(PriceQuote::hourlyPrice)
                .contains(0.024);
    }

    @Test
    @DisplayName("Should quote service-level SKUs")
    void shouldQuoteServiceSkus() {
        assertThat(source.quote(CloudProvider.AWS, "aws_load_balancer:application", "us-east-1"))
                .map(PriceQuote::hourlyPrice)
                .contains(0.0225);
        assertThat(source.quote(CloudProvider.AWS, "aws_eks_cluster", "us-east-1"))
                .map(PriceQuote::hourlyPrice)
                .contains(0.10);
    }

    @Test
    @DisplayName("Should return empty for unknown SKUs")
    void shouldReturnEmptyForUnknownSku() {
        assertThat(source.quote(CloudProvider.AWS, "z9.colossal", "us-east-1")).isEmpty();
    }

    @Test
    @DisplayName("Should return empty when the static fallback is disabled")
    void shouldHonorDisabledFallback() {
        // Given
        properties.setStaticFallbackEnabled(false);

        // When / Then
        assertThat(source.quote(CloudProvider.AWS, "t3.medium", "us-east-1")).isEmpty();
    }
}
