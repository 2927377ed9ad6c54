package com.finopsguard.pricing.live;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.domain.model.PricingConfidence;
import com.finopsguard.pricing.PriceQuote;
import com.finopsguard.pricing.PricingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LivePriceSourceTest {

    @Mock
    private LivePricingClient awsClient;

    private PricingProperties properties;
    private LivePriceSource source;

    @BeforeEach
    void setUp() {
        properties = new PricingProperties();
        properties.setLiveEnabled(true);
        source = new LivePriceSource(
                Map.of(CloudProvider.AWS, awsClient),
                properties,
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC)
        );
    }

    @Test
    @DisplayName("Should tag live prices with high confidence")
    void shouldTagHighConfidence() {
        // Given
        when(awsClient.supports("t3.medium")).thenReturn(true);
        when(awsClient.fetchLivePrice("t3.medium", "us-east-1")).thenReturn(Optional.of(0.0418));

        // When
        Optional<PriceQuote> quote = source.quote(CloudProvider.AWS, "t3.medium", "us-east-1");

        // Then
        assertThat(quote).isPresent();
        assertThat(quote.get().hourlyPrice()).isEqualTo(0.0418);
        assertThat(quote.get().confidence()).isEqualTo(PricingConfidence.HIGH);
    }

    @Test
    @DisplayName("Should absorb client failures")
    void shouldAbsorbFailures() {
        // Given
        when(awsClient.supports("t3.medium")).thenReturn(true);
        when(awsClient.fetchLivePrice("t3.medium", "us-east-1"))
                .thenThrow(new LivePricingException("timeout"));

        // When / Then
        assertThat(source.quote(CloudProvider.AWS, "t3.medium", "us-east-1")).isEmpty();
    }

    @Test
    @DisplayName("Should not call clients when live pricing is disabled")
    void shouldSkipWhenDisabled() {
        // Given
        properties.setLiveEnabled(false);

        // When / Then
        assertThat(source.quote(CloudProvider.AWS, "t3.medium", "us-east-1")).isEmpty();
        verify(awsClient, never()).fetchLivePrice("t3.medium", "us-east-1");
    }

    @Test
    @DisplayName("Should skip clouds without a client and unsupported SKUs")
    void shouldSkipUnsupported() {
        // Given
        when(awsClient.supports("aws_eks_cluster")).thenReturn(false);

        // When / Then
        assertThat(source.quote(CloudProvider.GCP, "e2-medium", "us-central1")).isEmpty();
        assertThat(source.quote(CloudProvider.AWS, "aws_eks_cluster", "us-east-1")).isEmpty();
    }
}
