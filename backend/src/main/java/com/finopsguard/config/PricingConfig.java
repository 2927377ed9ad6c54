package com.finopsguard.config;

import com.finopsguard.domain.model.CloudProvider;
import com.finopsguard.policy.PolicyProperties;
import com.finopsguard.pricing.PricingProperties;
import com.finopsguard.pricing.catalog.StaticPriceCatalog;
import com.finopsguard.pricing.live.LivePricingClient;
import com.finopsguard.simulation.SimulationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.pricing.PricingClient;
import software.amazon.awssdk.services.pricing.PricingClientBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for pricing clients and catalogs.
 */
@Configuration
@EnableConfigurationProperties({PricingProperties.class, SimulationProperties.class, PolicyProperties.class})
public class PricingConfig {

    @Bean
    public Map<CloudProvider, LivePricingClient> livePricingClients(List<LivePricingClient> clients) {
        return clients.stream()
                .collect(Collectors.toMap(
                        LivePricingClient::getProvider,
                        Function.identity()
                ));
    }

    @Bean
    public Map<CloudProvider, StaticPriceCatalog> staticPriceCatalogs(List<StaticPriceCatalog> catalogs) {
        return catalogs.stream()
                .collect(Collectors.toMap(
                        StaticPriceCatalog::getProvider,
                        Function.identity()
                ));
    }

    /**
     * Price List API client. Requests are signed with the default credentials
     * chain (environment, profile, instance role), resolved on first call.
     */
    @Bean(destroyMethod = "close")
    public PricingClient awsPricingClient(PricingProperties properties) {
        PricingClientBuilder builder = PricingClient.builder()
                .region(Region.of(properties.getAws().getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(properties.getLiveTimeout())
                        .build());
        if (StringUtils.hasText(properties.getAws().getEndpoint())) {
            builder.endpointOverride(URI.create(properties.getAws().getEndpoint()));
        }
        return builder.build();
    }

    /**
     * Shared by the GCP and Azure pricing clients. Both timeouts follow
     * {@code finopsguard.pricing.live-timeout}.
     */
    @Bean
    public RestTemplate pricingRestTemplate(RestTemplateBuilder builder, PricingProperties properties) {
        return builder
                .setConnectTimeout(properties.getLiveTimeout())
                .setReadTimeout(properties.getLiveTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
