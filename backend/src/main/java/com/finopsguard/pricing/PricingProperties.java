package com.finopsguard.pricing;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Pricing cascade configuration bound from {@code finopsguard.pricing.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "finopsguard.pricing")
public class PricingProperties {

    /** Query provider pricing APIs before the bundled catalogs. */
    private boolean liveEnabled = false;

    /** Fall back to the bundled static catalogs when live pricing is off or fails. */
    private boolean staticFallbackEnabled = true;

    /** Hourly price used when no source knows the SKU. */
    private double defaultHourlyPrice = 0.10;

    private Duration liveTtl = Duration.ofHours(6);

    private Duration staticTtl = Duration.ofHours(24);

    /** Timeout for each pricing API call. */
    private Duration liveTimeout = Duration.ofSeconds(10);

    private final Aws aws = new Aws();

    private final Gcp gcp = new Gcp();

    private final Azure azure = new Azure();

    @Getter
    @Setter
    public static class Aws {
        /** Region hosting the Price List API. */
        private String region = "us-east-1";
        /** Optional endpoint override, e.g. for a local stub. */
        private String endpoint;
    }

    @Getter
    @Setter
    public static class Gcp {
        private String endpoint = "https://cloudbilling.googleapis.com";
        /** Compute Engine service id in the Cloud Billing catalog. */
        private String computeServiceId = "6F81-5844-456A";
        private String apiKey;
    }

    @Getter
    @Setter
    public static class Azure {
        private String endpoint = "https://prices.azure.com/api/retail/prices";
    }
}
