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
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Google Cloud Billing Catalog client for Compute Engine prices.
 *
 * Lists SKUs of the Compute Engine service and picks the first on-demand
 * entry whose description mentions the machine family and which is offered
 * in the requested region. Prices are {@code units + nanos / 1e9}.
 *
 * Requires an API key. Without one the client supports nothing, so the
 * resolver goes straight to the static catalog.
 */
@Component
@Slf4j
public class GcpLivePricingClient implements LivePricingClient {

    private static final Pattern MACHINE_TYPE = Pattern.compile("^[a-z]\\d[a-z]?-[a-z]+(-\\d+[a-z]?)?$");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PricingProperties properties;

    public GcpLivePricingClient(
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
        return CloudProvider.GCP;
    }

    @Override
    public boolean supports(String sku) {
        String apiKey = properties.getGcp().getApiKey();
        return apiKey != null && !apiKey.isBlank()
                && sku != null && MACHINE_TYPE.matcher(sku).matches();
    }

    @Override
    public Optional<Double> fetchLivePrice(String sku, String region) {
        PricingProperties.Gcp gcp = properties.getGcp();
        String url = UriComponentsBuilder.fromHttpUrl(gcp.getEndpoint())
                .pathSegment("v1", "services", gcp.getComputeServiceId(), "skus")
                .queryParam("key", gcp.getApiKey())
                .toUriString();

        String response;
        try {
            response = restTemplate.getForObject(url, String.class);
        } catch (RestClientException e) {
            throw new LivePricingException("GCP billing catalog request failed for " + sku, e);
        }
        return parsePrice(response, sku, region);
    }

    Optional<Double> parsePrice(String response, String sku, String region) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String family = sku.substring(0, sku.indexOf('-')).toUpperCase(Locale.ROOT);
        try {
            for (JsonNode item : objectMapper.readTree(response).path("skus")) {
                if (!matches(item, family, region)) {
                    continue;
                }
                JsonNode tiers = item.path("pricingInfo").path(0).path("pricingExpression").path("tieredRates");
                if (tiers.isArray() && !tiers.isEmpty()) {
                    JsonNode unitPrice = tiers.get(tiers.size() - 1).path("unitPrice");
                    double price = unitPrice.path("units").asDouble(0) + unitPrice.path("nanos").asDouble(0) / 1e9;
                    return Optional.of(price);
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new LivePricingException("Unreadable GCP billing catalog response", e);
        }
    }

    private static boolean matches(JsonNode item, String family, String region) {
        String description = item.path("description").asText("");
        if (!description.contains(family) || description.contains("Preemptible") || description.contains("Spot")) {
            return false;
        }
        if (!"OnDemand".equals(item.path("category").path("usageType").asText())) {
            return false;
        }
        for (JsonNode serviceRegion : item.path("serviceRegions")) {
            if (region.equals(serviceRegion.asText())) {
                return true;
            }
        }
        return false;
    }
}
