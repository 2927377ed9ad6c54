package com.finopsguard.pricing;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.pricing.catalog.AwsStaticPriceCatalog;
import com.finopsguard.pricing.catalog.AzureStaticPriceCatalog;
import com.finopsguard.pricing.catalog.GcpStaticPriceCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class PriceCatalogServiceTest {

    private final PriceCatalogService service = new PriceCatalogService(Map.of(
            CloudProvider.AWS, new AwsStaticPriceCatalog(),
            CloudProvider.GCP, new GcpStaticPriceCatalog(),
            CloudProvider.AZURE, new AzureStaticPriceCatalog()
    ));

    @Test
    @DisplayName("Should list one provider in its reference region")
    void shouldListOneProvider() {
        // When
        List<PriceCatalogItem> items = service.listCatalog("aws", null);

        // Then
        assertThat(items).isNotEmpty().allMatch(item -> item.cloud().equals("aws"));
        assertThat(items).allMatch(item -> item.region().equals("us-east-1"));
        PriceCatalogItem t3 = items.stream().filter(item -> item.sku().equals("t3.medium")).findFirst().orElseThrow();
        assertThat(t3.hourlyPrice()).isEqualTo(0.0416);
        assertThat(t3.monthlyPrice()).isCloseTo(30.368, offset(1e-9));
        assertThat(t3.confidence()).isEqualTo("medium");
    }

    @Test
    @DisplayName("Should apply region overrides to the listing")
    void shouldApplyRegionOverrides() {
        // When
        List<PriceCatalogItem> items = service.listCatalog("aws", "eu-west-1");

        // Then
        assertThat(items)
                .filteredOn(item -> item.sku().equals("t3.medium"))
                .extracting(PriceCatalogItem::hourlyPrice)
                .containsExactly(0.0456);
    }

    @Test
    @DisplayName("Should list every provider sorted by cloud and SKU")
    void shouldListAllProvidersSorted() {
        // When
        List<PriceCatalogItem> items = service.listCatalog(null, null);

        // Then
        assertThat(items).extracting(PriceCatalogItem::cloud).contains("aws", "gcp", "azure");
        assertThat(items).isSortedAccordingTo((a, b) -> a.cloud().equals(b.cloud())
                ? a.sku().compareTo(b.sku())
                : a.cloud().compareTo(b.cloud()));
    }

    @Test
    @DisplayName("Should reject unknown clouds")
    void shouldRejectUnknownCloud() {
        assertThatThrownBy(() -> service.listCatalog("ibm", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
