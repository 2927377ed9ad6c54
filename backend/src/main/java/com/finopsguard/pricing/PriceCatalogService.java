package com.finopsguard.pricing;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.pricing.catalog.StaticPriceCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Publishes the bundled static price catalogs.
 *
 * Without a region each provider's reference region is used, so the listing
 * shows baseline prices. With a region, region overrides apply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceCatalogService {

    public static final double HOURS_PER_MONTH = 730.0;

    private final Map<CloudProvider, StaticPriceCatalog> staticPriceCatalogs;

    /**
     * @param cloud provider code, or null for every provider
     * @param region region to price, or null for each provider's reference region
     * @throws IllegalArgumentException if {@code cloud} is not a known provider code
     */
    @Cacheable(value = "price-catalog", key = "#cloud + ':' + #region")
    public List<PriceCatalogItem> listCatalog(String cloud, String region) {
        List<StaticPriceCatalog> catalogs = cloud == null || cloud.isBlank()
                ? List.copyOf(staticPriceCatalogs.values())
                : List.of(catalogFor(CloudProvider.fromCode(cloud)));

        List<PriceCatalogItem> items = new ArrayList<>();
        for (StaticPriceCatalog catalog : catalogs) {
            CloudProvider provider = catalog.getProvider();
            String effectiveRegion = region == null || region.isBlank() ? provider.getFallbackRegion() : region;
            for (String sku : catalog.getHourlyPrices().keySet()) {
                catalog.lookup(sku, effectiveRegion).ifPresent(price -> items.add(new PriceCatalogItem(
                        provider.getCode(),
                        sku,
                        effectiveRegion,
                        price,
                        price * HOURS_PER_MONTH,
                        PriceSourceType.STATIC.getConfidence().getValue()
                )));
            }
        }
        items.sort(Comparator.comparing(PriceCatalogItem::cloud).thenComparing(PriceCatalogItem::sku));
        log.debug("Listed {} catalog items for cloud={} region={}", items.size(), cloud, region);
        return items;
    }

    @CacheEvict(value = "price-catalog", allEntries = true)
    public void evictCatalog() {
        log.info("Evicted price catalog listings");
    }

    private StaticPriceCatalog catalogFor(CloudProvider provider) {
        StaticPriceCatalog catalog = staticPriceCatalogs.get(provider);
        if (catalog == null) {
            throw new IllegalArgumentException("No static catalog for " + provider.getCode());
        }
        return catalog;
    }
}
