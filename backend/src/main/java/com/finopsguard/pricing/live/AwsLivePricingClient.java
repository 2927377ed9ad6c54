package com.finopsguard.pricing.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finopsguard.domain.model.CloudProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.pricing.PricingClient;
import software.amazon.awssdk.services.pricing.model.Filter;
import software.amazon.awssdk.services.pricing.model.FilterType;
import software.amazon.awssdk.services.pricing.model.GetProductsRequest;
import software.amazon.awssdk.services.pricing.model.GetProductsResponse;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * AWS Price List Query API client for EC2 on-demand prices.
 *
 * REQUEST:
 * {@code GetProducts} through the SDK {@link PricingClient}, signed with the
 * default credentials chain. Products are filtered on instance type, location
 * display name, Linux, shared tenancy, no pre-installed software and used capacity.
 *
 * RESPONSE:
 * Each price list entry is a JSON document encoded as a string. The first
 * on-demand price dimension carries {@code pricePerUnit.USD}.
 */
@Component
@Slf4j
public class AwsLivePricingClient implements LivePricingClient {

    private static final String SERVICE_CODE = "AmazonEC2";

    // EC2 instance types only: family + generation, dot, size (t3.medium, m6i.2xlarge)
    private static final Pattern EC2_INSTANCE_TYPE = Pattern.compile("^[a-z][a-z0-9-]*\\d[a-z0-9-]*\\.[a-z0-9]+$");

    private static final Map<String, String> LOCATIONS = Map.ofEntries(
            Map.entry("us-east-1", "US East (N. Virginia)"),
            Map.entry("us-east-2", "US East (Ohio)"),
            Map.entry("us-west-1", "US West (N. California)"),
            Map.entry("us-west-2", "US West (Oregon)"),
            Map.entry("ca-central-1", "Canada (Central)"),
            Map.entry("eu-west-1", "EU (Ireland)"),
            Map.entry("eu-west-2", "EU (London)"),
            Map.entry("eu-west-3", "EU (Paris)"),
            Map.entry("eu-central-1", "EU (Frankfurt)"),
            Map.entry("eu-north-1", "EU (Stockholm)"),
            Map.entry("ap-south-1", "Asia Pacific (Mumbai)"),
            Map.entry("ap-southeast-1", "Asia Pacific (Singapore)"),
            Map.entry("ap-southeast-2", "Asia Pacific (Sydney)"),
            Map.entry("ap-northeast-1", "Asia Pacific (Tokyo)"),
            Map.entry("ap-northeast-2", "Asia Pacific (Seoul)"),
            Map.entry("sa-east-1", "South America (Sao Paulo)")
    );

    private final PricingClient pricingClient;
    private final ObjectMapper objectMapper;

    public AwsLivePricingClient(PricingClient pricingClient, ObjectMapper objectMapper) {
        this.pricingClient = pricingClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public CloudProvider getProvider() {
        return CloudProvider.AWS;
    }

    @Override
    public boolean supports(String sku) {
        return sku != null
                && EC2_INSTANCE_TYPE.matcher(sku).matches()
                && !sku.startsWith("db.")
                && !sku.startsWith("cache.")
                && !sku.startsWith("kafka.")
                && !sku.endsWith(".search");
    }

    @Override
    public Optional<Double> fetchLivePrice(String sku, String region) {
        String location = LOCATIONS.get(region);
        if (location == null) {
            log.debug("No AWS pricing location for region {}", region);
            return Optional.empty();
        }

        GetProductsRequest request = GetProductsRequest.builder()
                .serviceCode(SERVICE_CODE)
                .filters(filters(sku, location))
                .formatVersion("aws_v1")
                .maxResults(1)
                .build();

        GetProductsResponse response;
        try {
            response = pricingClient.getProducts(request);
        } catch (SdkException e) {
            throw new LivePricingException("AWS pricing request failed for " + sku, e);
        }
        return parsePrice(response.priceList());
    }

    private static List<Filter> filters(String sku, String location) {
        return List.of(
                termMatch("instanceType", sku),
                termMatch("location", location),
                termMatch("operatingSystem", "Linux"),
                termMatch("tenancy", "Shared"),
                termMatch("preInstalledSw", "NA"),
                termMatch("capacitystatus", "Used"));
    }

    private static Filter termMatch(String field, String value) {
        return Filter.builder().type(FilterType.TERM_MATCH).field(field).value(value).build();
    }

    Optional<Double> parsePrice(List<String> priceList) {
        if (priceList == null || priceList.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode product = objectMapper.readTree(priceList.get(0));
            Iterator<JsonNode> terms = product.path("terms").path("OnDemand").elements();
            while (terms.hasNext()) {
                Iterator<JsonNode> dimensions = terms.next().path("priceDimensions").elements();
                while (dimensions.hasNext()) {
                    JsonNode usd = dimensions.next().path("pricePerUnit").path("USD");
                    if (!usd.isMissingNode()) {
                        return Optional.of(Double.parseDouble(usd.asText()));
                    }
                }
            }
            return Optional.empty();
        } catch (IOException | NumberFormatException e) {
            throw new LivePricingException("Unreadable AWS pricing response", e);
        }
    }
}
