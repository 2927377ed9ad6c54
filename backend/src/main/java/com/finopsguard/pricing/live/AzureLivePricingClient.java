package com.finopsguard.pricing.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.pricing.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Azure Retail Prices API client for virtual machine sizes.
 *
 * The API is anonymous. Consumption prices are filtered by ARM SKU name and
 * ARM region; Spot and Low Priority meters are skipped.
 */
@Component
@Slf4j
public class AzureLivePricingClient implements LivePricingClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PricingProperties properties;

    public AzureLivePricingClient(
            @Qualifier("pricingRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            PricingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.AZURE;
    }

    @Override
    public boolean supports(String sku) {
        return sku != null && (sku.startsWith("Standard_") || sku.startsWith("Basic_A"));
    }

    @Override
    public Optional<Double> fetchLivePrice(String sku, String region) {
        String filter = String.format(
                "serviceName eq 'Virtual Machines' and armSkuName eq '%s' and armRegionName eq '%s' and priceType eq 'Consumption'",
                sku, region);
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getAzure().getEndpoint())
                .queryParam("$filter", filter)
                .encode()
                .build()
                .toUri();

        String response;
        try {
            response = restTemplate.getForObject(uri, String.class);
        } catch (RestClientException e) {
            throw new LivePricingException("Azure retail prices request failed for " + sku, e);
        }
        return parsePrice(response);
    }

    Optional<Double> parsePrice(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        try {
            for (JsonNode item : objectMapper.readTree(response).path("Items")) {
                String meter = item.path("meterName").asText("") + " " + item.path("skuName").asText("");
                if (meter.contains("Spot") || meter.contains("Low Priority")) {
                    continue;
                }
                // Windows meters are priced with the license included
                if (item.path("productName").asText("").contains("Windows")) {
                    continue;
                }
                JsonNode price = item.path("retailPrice");
                if (price.isNumber()) {
                    return Optional.of(price.asDouble());
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new LivePricingException("Unreadable Azure retail prices response", e);
        }
    }
}
